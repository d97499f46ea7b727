package com.eli.beamline.shotlog.domain;

import java.util.List;

/**
 * Configuration of one camera folder.
 */
public record FolderRule(
        String name,
        boolean expected,
        boolean trigger,
        List<FileSpec> fileSpecs
) {
    public FolderRule {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Folder name cannot be blank");
        }
        fileSpecs = fileSpecs != null && !fileSpecs.isEmpty() ? List.copyOf(fileSpecs) : List.of(FileSpec.MATCH_ALL);
    }

    public boolean matchesAnySpec(String fileNameLower) {
        return fileSpecs.stream().anyMatch(spec -> spec.matches(fileNameLower));
    }
}
