package com.eli.beamline.shotlog.sink;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.OptionalInt;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalFsArchiveWriterTest {

    private static final LocalDateTime TS = LocalDateTime.of(2024, 5, 6, 14, 30, 15);

    private Path sourceDir;
    private Path archiveDir;
    private LocalFsArchiveWriter writer;

    @BeforeEach
    void setup() throws IOException {
        sourceDir = Files.createTempDirectory("test-raw-");
        archiveDir = Files.createTempDirectory("test-clean-");
        writer = new LocalFsArchiveWriter(archiveDir.toString(), 4);
    }

    @AfterEach
    void cleanup() throws IOException {
        deleteRecursively(sourceDir);
        deleteRecursively(archiveDir);
    }

    @Test
    void shouldCopyUnderCameraAndDateWithCanonicalName() throws IOException {
        Path source = Files.writeString(sourceDir.resolve("Lanex1_0001.TIF"), "pixels of lanex one");
        FileTime mtime = FileTime.from(Instant.parse("2024-05-06T12:30:15Z"));
        Files.setLastModifiedTime(source, mtime);

        Path archived = writer.archive("Lanex1", TS, 7, source);

        assertEquals(archiveDir.resolve("Lanex1").resolve("20240506").resolve("Lanex1_20240506_143015_shot007.tif"),
                archived);
        assertEquals("pixels of lanex one", Files.readString(archived));
        assertEquals(mtime, Files.getLastModifiedTime(archived));
        assertTrue(Files.exists(source), "Source must stay in place");
    }

    @Test
    void shouldNeverOverwriteExistingArchive() throws IOException {
        Path first = Files.writeString(sourceDir.resolve("a.tif"), "first");
        Path second = Files.writeString(sourceDir.resolve("b.tif"), "second");

        Path firstTarget = writer.archive("Lyso", TS, 1, first);
        Path secondTarget = writer.archive("Lyso", TS, 1, second);

        assertEquals("Lyso_20240506_143015_shot001_1.tif", secondTarget.getFileName().toString());
        assertEquals("first", Files.readString(firstTarget));
        assertEquals("second", Files.readString(secondTarget));
    }

    @Test
    void shouldUseDefaultExtensionWhenSourceHasNone() throws IOException {
        Path source = Files.writeString(sourceDir.resolve("frog_trace"), "trace");

        Path archived = writer.archive("FROG", TS, 12, source);

        assertEquals("FROG_20240506_143015_shot012.dat", archived.getFileName().toString());
    }

    @Test
    void shouldLeaveNoTempFilesBehind() throws IOException {
        Path source = Files.writeString(sourceDir.resolve("img.tif"), "x".repeat(100));

        Path archived = writer.archive("Csi", TS, 3, source);

        try (Stream<Path> files = Files.list(archived.getParent())) {
            assertFalse(files.anyMatch(p -> p.getFileName().toString().endsWith(".tmp")));
        }
    }

    @Test
    void shouldFindHighestArchivedShotNumberOfDate() throws IOException {
        Path source = Files.writeString(sourceDir.resolve("img.tif"), "x");
        writer.archive("Lanex1", TS, 4, source);
        writer.archive("Lanex2", TS, 9, source);
        writer.archive("Lanex2", TS.plusDays(1), 30, source);

        assertEquals(OptionalInt.of(9), writer.lastShotNumber(LocalDate.of(2024, 5, 6)));
        assertEquals(OptionalInt.of(30), writer.lastShotNumber(LocalDate.of(2024, 5, 7)));
        assertEquals(OptionalInt.empty(), writer.lastShotNumber(LocalDate.of(2024, 5, 8)));
    }

    @Test
    void shouldReportNothingWhenArchiveRootIsMissing() {
        LocalFsArchiveWriter missing = new LocalFsArchiveWriter(archiveDir.resolve("nope").toString(), 8192);

        assertEquals(OptionalInt.empty(), missing.lastShotNumber(LocalDate.of(2024, 5, 6)));
    }

    private void deleteRecursively(Path path) throws IOException {
        if (path == null || !Files.exists(path)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(path)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
        }
    }
}
