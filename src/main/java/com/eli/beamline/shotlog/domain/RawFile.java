package com.eli.beamline.shotlog.domain;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A file found under the RAW root, before classification.
 */
public record RawFile(
        Path path,
        String camera,
        long sizeBytes,
        Instant mtime
) {
    public RawFile {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        if (camera == null || camera.isBlank()) {
            throw new IllegalArgumentException("camera cannot be blank");
        }
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("sizeBytes cannot be negative");
        }
        if (mtime == null) {
            throw new IllegalArgumentException("mtime cannot be null");
        }
    }
}
