package com.eli.beamline.shotlog.source;

import com.eli.beamline.shotlog.domain.RawFile;

import java.io.IOException;
import java.nio.file.Path;
import java.util.stream.Stream;

public interface SourceProvider {
    /**
     * Files below {@code root}, each attributed to the camera folder it sits in.
     */
    Stream<RawFile> list(Path root) throws IOException;
}
