package com.eli.beamline.shotlog.source;

import com.eli.beamline.shotlog.domain.RawFile;
import jakarta.enterprise.context.ApplicationScoped;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

/**
 * Source provider for the local RAW tree: {@code <root>/<camera>/**}.
 * The first path component below the root names the camera; files directly under the root are skipped.
 * Modification time is the only timestamp read, creation times are unreliable on synced folders.
 */
@ApplicationScoped
public class LocalFsSource implements SourceProvider {

    @Override
    public Stream<RawFile> list(Path root) throws IOException {
        if (!Files.exists(root)) {
            throw new IOException("Source path does not exist: " + root);
        }

        return Files.walk(root)
                .filter(Files::isRegularFile)
                .filter(p -> root.relativize(p).getNameCount() >= 2)
                .filter(p -> !p.getFileName().toString().endsWith(".tmp"))
                .map(p -> toRawFile(root, p));
    }

    private RawFile toRawFile(Path root, Path file) {
        String camera = root.relativize(file).getName(0).toString();
        try {
            return new RawFile(
                    file,
                    camera,
                    Files.size(file),
                    Files.getLastModifiedTime(file).toInstant()
            );
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read file attributes: " + file, e);
        }
    }
}
