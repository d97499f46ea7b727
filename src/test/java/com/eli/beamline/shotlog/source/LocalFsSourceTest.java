package com.eli.beamline.shotlog.source;

import com.eli.beamline.shotlog.domain.RawFile;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@QuarkusTest
class LocalFsSourceTest {

    @Inject
    LocalFsSource source;

    private Path rawDir;

    @BeforeEach
    void setup() throws IOException {
        rawDir = Files.createTempDirectory("test-raw-");
    }

    @AfterEach
    void cleanup() throws IOException {
        if (rawDir != null && Files.exists(rawDir)) {
            try (Stream<Path> walk = Files.walk(rawDir)) {
                walk.sorted(Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
            }
        }
    }

    @Test
    void shouldNameCameraAfterTopLevelFolder() throws IOException {
        Path lanex = Files.createDirectories(rawDir.resolve("Lanex1").resolve("run3"));
        Path file = Files.writeString(lanex.resolve("img_shot_01.tif"), "content");
        Instant mtime = Instant.parse("2024-05-06T12:00:00Z");
        Files.setLastModifiedTime(file, FileTime.from(mtime));

        List<RawFile> files;
        try (Stream<RawFile> listed = source.list(rawDir)) {
            files = listed.collect(Collectors.toList());
        }

        assertEquals(1, files.size());
        RawFile raw = files.get(0);
        assertEquals("Lanex1", raw.camera());
        assertEquals(file, raw.path());
        assertEquals(7, raw.sizeBytes());
        assertEquals(mtime, raw.mtime());
    }

    @Test
    void shouldSkipLooseAndTemporaryFiles() throws IOException {
        Files.writeString(rawDir.resolve("loose.tif"), "x");
        Path csi = Files.createDirectories(rawDir.resolve("Csi"));
        Files.writeString(csi.resolve("partial.tif.tmp"), "x");
        Files.writeString(csi.resolve("done.tif"), "x");

        List<String> names;
        try (Stream<RawFile> listed = source.list(rawDir)) {
            names = listed.map(f -> f.path().getFileName().toString()).collect(Collectors.toList());
        }

        assertEquals(List.of("done.tif"), names);
    }

    @Test
    void shouldFailForMissingRoot() {
        assertThrows(IOException.class, () -> source.list(rawDir.resolve("missing")));
    }
}
