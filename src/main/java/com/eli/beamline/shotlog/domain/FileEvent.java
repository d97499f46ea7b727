package com.eli.beamline.shotlog.domain;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * A classified camera file: one observation of a path with its modification time.
 * The calendar date is derived from the modification time.
 */
public record FileEvent(
        Path path,
        String camera,
        LocalDate date,
        LocalDateTime dt,
        boolean trigger
) {
    public FileEvent {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        if (camera == null || camera.isBlank()) {
            throw new IllegalArgumentException("camera cannot be blank");
        }
        if (dt == null) {
            throw new IllegalArgumentException("dt cannot be null");
        }
        if (date == null) {
            date = dt.toLocalDate();
        }
    }

    public static FileEvent of(Path path, String camera, LocalDateTime dt, boolean trigger) {
        return new FileEvent(path, camera, dt.toLocalDate(), dt, trigger);
    }
}
