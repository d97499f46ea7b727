package com.eli.beamline.shotlog.support;

import com.eli.beamline.shotlog.sink.ArchiveWriter;
import com.eli.beamline.shotlog.util.ShotNaming;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * In-memory archive that records what it was asked to write.
 */
public class RecordingArchiveWriter implements ArchiveWriter {

    private final List<Path> archived = Collections.synchronizedList(new ArrayList<>());
    private final Set<String> failingCameras = Collections.synchronizedSet(new HashSet<>());
    private final Set<String> brokenCameras = Collections.synchronizedSet(new HashSet<>());
    private volatile int calls;

    /** Every archive call for the camera throws an IOException. */
    public void failFor(String camera) {
        failingCameras.add(camera);
    }

    /** Every archive call for the camera throws an unexpected runtime exception. */
    public void breakFor(String camera) {
        brokenCameras.add(camera);
    }

    @Override
    public Path archive(String camera, LocalDateTime timestamp, int shotNumber, Path sourcePath) throws IOException {
        calls++;
        if (brokenCameras.contains(camera)) {
            throw new IllegalStateException("archive broken for " + camera);
        }
        if (failingCameras.contains(camera)) {
            throw new IOException("disk full");
        }
        Path target = Path.of("archive", camera,
                ShotNaming.canonicalName(camera, timestamp, shotNumber, sourcePath.getFileName().toString()));
        archived.add(target);
        return target;
    }

    public List<Path> archived() {
        return List.copyOf(archived);
    }

    public int calls() {
        return calls;
    }
}
