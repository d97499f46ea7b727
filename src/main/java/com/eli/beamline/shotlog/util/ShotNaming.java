package com.eli.beamline.shotlog.util;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Canonical archive names: {@code <camera>_<YYYYMMDD_HHMMSS>_shot<NNN>.<ext>}.
 */
public final class ShotNaming {

    public static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd");
    public static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HHmmss");

    private static final String DEFAULT_EXTENSION = ".dat";
    private static final Pattern SHOT_NUMBER = Pattern.compile("_shot(\\d+)(?:_\\d+)?\\.");

    private ShotNaming() {
        // Utility class
    }

    public static String canonicalName(String camera, LocalDateTime timestamp, int shotNumber, String sourceFileName) {
        return baseName(camera, timestamp, shotNumber) + extensionOf(sourceFileName);
    }

    /**
     * Canonical name with a {@code _<n>} disambiguator, used when the plain name is taken.
     */
    public static String disambiguatedName(String camera, LocalDateTime timestamp, int shotNumber,
                                           String sourceFileName, int n) {
        return baseName(camera, timestamp, shotNumber) + "_" + n + extensionOf(sourceFileName);
    }

    public static String dateFolder(LocalDate date) {
        return DATE_FORMAT.format(date);
    }

    /**
     * Lower-cased extension including the dot; {@code .dat} when the name has none.
     */
    public static String extensionOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) {
            return DEFAULT_EXTENSION;
        }
        return fileName.substring(dot).toLowerCase(Locale.ROOT);
    }

    /**
     * Parses the shot number out of an archived file name such as {@code Lanex1_20240101_101500_shot007.tif}.
     */
    public static OptionalInt shotNumberOf(String fileName) {
        Matcher m = SHOT_NUMBER.matcher(fileName);
        if (!m.find()) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(m.group(1)));
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }

    private static String baseName(String camera, LocalDateTime timestamp, int shotNumber) {
        return String.format("%s_%s_%s_shot%03d",
                camera, DATE_FORMAT.format(timestamp), TIME_FORMAT.format(timestamp), shotNumber);
    }
}
