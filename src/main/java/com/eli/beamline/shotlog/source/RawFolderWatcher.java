package com.eli.beamline.shotlog.source;

import com.eli.beamline.shotlog.domain.Disposition;
import com.eli.beamline.shotlog.domain.RawFile;
import com.eli.beamline.shotlog.service.ShotLogService;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Polls the RAW tree and submits every new or modified file to the shot log.
 * Polling rather than native watch events, which are unreliable on cloud-synced and network folders.
 */
@ApplicationScoped
public class RawFolderWatcher {

    private static final Logger LOG = Logger.getLogger(RawFolderWatcher.class);

    private final SourceProvider sourceProvider;
    private final ShotLogService service;
    private final Path rawRoot;
    private final boolean enabled;

    private final Map<Path, Instant> submitted = new ConcurrentHashMap<>();
    private volatile boolean missingRootReported;

    public RawFolderWatcher(
            SourceProvider sourceProvider,
            ShotLogService service,
            @ConfigProperty(name = "source.local.path", defaultValue = "RAW_DATA") String rawRoot,
            @ConfigProperty(name = "source.poll.enabled", defaultValue = "true") boolean enabled
    ) {
        this.sourceProvider = sourceProvider;
        this.service = service;
        this.rawRoot = Paths.get(rawRoot);
        this.enabled = enabled;
    }

    @Scheduled(every = "${shotlog.check-interval:0.5s}",
            identity = "raw-folder-watcher",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void scheduledPoll() {
        if (enabled) {
            poll();
        }
    }

    /**
     * One scan of the RAW tree.
     *
     * @return number of files handed to the shot log
     */
    public int poll() {
        if (!service.isActive()) {
            return 0;
        }
        if (!Files.isDirectory(rawRoot)) {
            if (!missingRootReported) {
                LOG.warnf("RAW root does not exist yet: %s", rawRoot.toAbsolutePath());
                missingRootReported = true;
            }
            return 0;
        }
        missingRootReported = false;

        int count = 0;
        try (var files = sourceProvider.list(rawRoot)) {
            Iterator<RawFile> it = files.iterator();
            while (it.hasNext()) {
                RawFile file = it.next();
                if (file.mtime().equals(submitted.get(file.path()))) {
                    continue;
                }
                Disposition disposition = service.submit(file.path(), file.camera(), file.mtime());
                // dropped while paused: leave it for the next poll
                if (service.isActive()) {
                    submitted.put(file.path(), file.mtime());
                }
                LOG.debugf("Submitted %s (camera %s): %s", file.path(), file.camera(), disposition);
                count++;
            }
        } catch (IOException | UncheckedIOException e) {
            LOG.errorf(e, "Failed to scan RAW root %s", rawRoot);
        }
        return count;
    }
}
