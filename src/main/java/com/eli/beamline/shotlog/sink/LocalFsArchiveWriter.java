package com.eli.beamline.shotlog.sink;

import com.eli.beamline.shotlog.util.ShotNaming;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.OptionalInt;

/**
 * Archive on the local filesystem: {@code <sink.local.path>/<camera>/<YYYYMMDD>/<canonical name>}.
 * Copies go through a temp file and an atomic rename.
 */
@ApplicationScoped
public class LocalFsArchiveWriter implements ArchiveWriter {

    private static final Logger LOG = Logger.getLogger(LocalFsArchiveWriter.class);

    private static final int MAX_DISAMBIGUATION = 999;

    private final Path basePath;
    private final int bufferSize;

    public LocalFsArchiveWriter(
            @ConfigProperty(name = "sink.local.path", defaultValue = "CLEAN_DATA") String path,
            @ConfigProperty(name = "sink.buffer.size", defaultValue = "8192") int bufferSize
    ) {
        this.basePath = Paths.get(path);
        this.bufferSize = bufferSize;
    }

    public Path basePath() {
        return basePath;
    }

    @Override
    public Path archive(String camera, LocalDateTime timestamp, int shotNumber, Path sourcePath) throws IOException {
        String sourceName = sourcePath.getFileName().toString();
        Path dir = basePath.resolve(camera).resolve(ShotNaming.dateFolder(timestamp.toLocalDate()));
        Files.createDirectories(dir);

        Path target = freeTarget(dir, camera, timestamp, shotNumber, sourceName);
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");

        try {
            try (InputStream in = Files.newInputStream(sourcePath)) {
                writeToFile(temp, in);
            }
            Files.setLastModifiedTime(temp, Files.getLastModifiedTime(sourcePath));
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
        return target;
    }

    @Override
    public OptionalInt lastShotNumber(LocalDate date) {
        if (!Files.isDirectory(basePath)) {
            return OptionalInt.empty();
        }
        String dateFolder = ShotNaming.dateFolder(date);
        int highest = 0;
        try (DirectoryStream<Path> cameras = Files.newDirectoryStream(basePath, Files::isDirectory)) {
            for (Path cameraDir : cameras) {
                Path dayDir = cameraDir.resolve(dateFolder);
                if (!Files.isDirectory(dayDir)) {
                    continue;
                }
                try (DirectoryStream<Path> files = Files.newDirectoryStream(dayDir)) {
                    for (Path file : files) {
                        OptionalInt n = ShotNaming.shotNumberOf(file.getFileName().toString());
                        if (n.isPresent()) {
                            highest = Math.max(highest, n.getAsInt());
                        }
                    }
                }
            }
        } catch (IOException e) {
            LOG.warnf(e, "Could not scan archive %s for shots of %s", basePath, dateFolder);
            return OptionalInt.empty();
        }
        return highest > 0 ? OptionalInt.of(highest) : OptionalInt.empty();
    }

    private Path freeTarget(Path dir, String camera, LocalDateTime timestamp, int shotNumber, String sourceName)
            throws IOException {
        Path target = dir.resolve(ShotNaming.canonicalName(camera, timestamp, shotNumber, sourceName));
        if (!Files.exists(target)) {
            return target;
        }
        for (int n = 1; n <= MAX_DISAMBIGUATION; n++) {
            Path candidate = dir.resolve(ShotNaming.disambiguatedName(camera, timestamp, shotNumber, sourceName, n));
            if (!Files.exists(candidate)) {
                LOG.warnf("Archive name %s already taken, writing %s instead", target.getFileName(), candidate.getFileName());
                return candidate;
            }
        }
        throw new IOException("No free archive name left for " + target);
    }

    private long writeToFile(Path target, InputStream in) throws IOException {
        try (OutputStream out = Files.newOutputStream(target,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            byte[] buffer = new byte[bufferSize];
            long totalWritten = 0;
            int bytesRead;

            while ((bytesRead = in.read(buffer)) != -1) {
                out.write(buffer, 0, bytesRead);
                totalWritten += bytesRead;
            }

            return totalWritten;
        }
    }
}
