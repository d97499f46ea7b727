package com.eli.beamline.shotlog.domain;

import java.nio.file.Path;

/**
 * Result of archiving a single camera image at shot closure.
 */
public record ArchiveResult(
        String camera,
        Path sourcePath,
        Path archivedPath,
        int attempts,
        Status status,
        String errorMessage
) {
    public enum Status {
        ARCHIVED,
        FAILED
    }

    public static ArchiveResult archived(String camera, Path sourcePath, Path archivedPath, int attempts) {
        return new ArchiveResult(camera, sourcePath, archivedPath, attempts, Status.ARCHIVED, null);
    }

    public static ArchiveResult failed(String camera, Path sourcePath, int attempts, String error) {
        return new ArchiveResult(camera, sourcePath, null, attempts, Status.FAILED, error);
    }
}
