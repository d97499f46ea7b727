package com.eli.beamline.shotlog.domain;

import java.util.Locale;

/**
 * File name rule for a camera folder. An empty keyword or extension matches anything.
 */
public record FileSpec(String keyword, String extension) {

    public static final FileSpec MATCH_ALL = new FileSpec("", "");

    public FileSpec {
        keyword = keyword != null ? keyword.trim().toLowerCase(Locale.ROOT) : "";
        extension = normalizeExtension(extension);
    }

    /**
     * @param fileNameLower the file name, already lower-cased
     */
    public boolean matches(String fileNameLower) {
        if (!keyword.isEmpty() && !fileNameLower.contains(keyword)) {
            return false;
        }
        return extension.isEmpty() || fileNameLower.endsWith(extension);
    }

    static String normalizeExtension(String ext) {
        if (ext == null) {
            return "";
        }
        String normalized = ext.trim().toLowerCase(Locale.ROOT);
        if (!normalized.isEmpty() && !normalized.startsWith(".")) {
            normalized = "." + normalized;
        }
        return normalized;
    }
}
