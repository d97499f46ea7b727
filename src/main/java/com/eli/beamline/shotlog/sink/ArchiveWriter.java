package com.eli.beamline.shotlog.sink;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.OptionalInt;

/**
 * Copies accepted images to the archive under their canonical shot name.
 */
public interface ArchiveWriter {

    /**
     * Archive one image. Never overwrites an existing archived file.
     *
     * @return the path the image was written to
     */
    Path archive(String camera, LocalDateTime timestamp, int shotNumber, Path sourcePath) throws IOException;

    /**
     * Highest shot number already present in the archive for the date, if the writer can tell.
     */
    default OptionalInt lastShotNumber(LocalDate date) {
        return OptionalInt.empty();
    }
}
