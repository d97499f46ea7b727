package com.eli.beamline.shotlog.orchestration;

import com.eli.beamline.shotlog.classify.FileClassifier;
import com.eli.beamline.shotlog.config.CorrelationSettingsFactory;
import com.eli.beamline.shotlog.config.ShotLogConfig;
import com.eli.beamline.shotlog.domain.ArchiveResult;
import com.eli.beamline.shotlog.domain.CloseReason;
import com.eli.beamline.shotlog.domain.ClosedShot;
import com.eli.beamline.shotlog.domain.CorrelationSettings;
import com.eli.beamline.shotlog.domain.Disposition;
import com.eli.beamline.shotlog.domain.FileEvent;
import com.eli.beamline.shotlog.domain.Shot;
import com.eli.beamline.shotlog.domain.ShotLogStatus;
import com.eli.beamline.shotlog.domain.ShotLogStatus.CollectingShot;
import com.eli.beamline.shotlog.domain.ShotLogStatus.LastShot;
import com.eli.beamline.shotlog.domain.ShotLogStatus.SystemState;
import com.eli.beamline.shotlog.domain.Window;
import com.eli.beamline.shotlog.index.ShotIndex;
import com.eli.beamline.shotlog.notify.ShotClosureNotifier;
import com.eli.beamline.shotlog.sink.ArchiveWriter;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Correlates camera files into shots.
 * Handles the main flow: classify → dedupe → match or open shot → close → archive → notify.
 * <p>
 * Ingestion and the timeout worker both go through one lock around the {@link ShotIndex}.
 * Archiving and listener notification run outside the lock, after the shot has already
 * left the open set, so a slow copy never stalls other shots.
 */
@ApplicationScoped
public class ShotCorrelator {

    private static final Logger LOG = Logger.getLogger(ShotCorrelator.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final ShotIndex index = new ShotIndex();

    private final FileClassifier classifier;
    private final ArchiveWriter archiveWriter;
    private final ShotClosureNotifier notifier;
    private final Clock clock;
    private final int maxArchiveAttempts;

    private volatile CorrelationSettings settings;
    private volatile boolean shutdown;

    @Inject
    public ShotCorrelator(
            ShotLogConfig config,
            FileClassifier classifier,
            ArchiveWriter archiveWriter,
            ShotClosureNotifier notifier,
            Clock clock,
            @ConfigProperty(name = "sink.max-attempts", defaultValue = "3") int maxArchiveAttempts
    ) {
        this(CorrelationSettingsFactory.fromConfig(config), classifier, archiveWriter, notifier, clock,
                maxArchiveAttempts);
    }

    public ShotCorrelator(
            CorrelationSettings settings,
            FileClassifier classifier,
            ArchiveWriter archiveWriter,
            ShotClosureNotifier notifier,
            Clock clock,
            int maxArchiveAttempts
    ) {
        if (maxArchiveAttempts < 1) {
            throw new IllegalArgumentException("maxArchiveAttempts must be at least 1");
        }
        this.settings = settings;
        this.classifier = classifier;
        this.archiveWriter = archiveWriter;
        this.notifier = notifier;
        this.clock = clock;
        this.maxArchiveAttempts = maxArchiveAttempts;
    }

    /**
     * Entry point for the watcher. Re-delivering the same path is harmless.
     */
    public Disposition submit(Path path, String camera, Instant mtime) {
        if (shutdown) {
            LOG.debugf("Correlator shut down, dropping %s", path);
            return Disposition.IGNORED;
        }

        CorrelationSettings current = settings;
        LocalDateTime dt = LocalDateTime.ofInstant(mtime, clock.getZone());
        Optional<FileEvent> classified = classifier.classify(path, camera, dt, current);
        if (classified.isEmpty()) {
            return Disposition.IGNORED;
        }
        FileEvent event = classified.get();

        Outcome outcome;
        PendingClosure closure = null;
        lock.lock();
        try {
            if (!index.markObserved(event)) {
                LOG.debugf("Already observed %s at %s, skipping", event.path(), event.dt());
                return Disposition.REDELIVERED;
            }
            if (index.isAssigned(event.path())) {
                LOG.debugf("Path already assigned to a shot, skipping: %s", event.path());
                return Disposition.ALREADY_ASSIGNED;
            }

            outcome = event.trigger() ? handleTrigger(event, current) : handleNonTrigger(event);
            if (outcome.shot() != null) {
                closure = closeIfComplete(outcome.shot());
            }
        } finally {
            lock.unlock();
        }

        if (closure != null) {
            finishClosure(closure);
        }
        return outcome.disposition();
    }

    private Outcome handleTrigger(FileEvent event, CorrelationSettings current) {
        index.record(event);

        Optional<Shot> open = index.firstCovering(event.date(), event.dt(), shot -> !shot.hasCamera(event.camera()));
        if (open.isPresent()) {
            Shot shot = open.get();
            index.assign(shot, event);
            LOG.infof("Trigger %s joined shot %03d (camera %s)", event.path(), shot.shotNumber(), event.camera());
            return new Outcome(Disposition.TRIGGER_JOINED, shot);
        }

        Window window = Window.centeredOn(event.dt(), current.fullWindow());
        Shot shot = index.openShot(event, window, current.timeout(), clock.instant(), current.expectedCameras());
        index.assign(shot, event);

        // files that arrived before their trigger
        for (FileEvent earlier : index.filesOn(event.date())) {
            if (!window.contains(earlier.dt())
                    || index.isAssigned(earlier.path())
                    || shot.hasCamera(earlier.camera())) {
                continue;
            }
            index.assign(shot, earlier);
            LOG.infof("Recovered %s into shot %03d (camera %s)", earlier.path(), shot.shotNumber(), earlier.camera());
        }

        LOG.infof("*** New shot detected: date=%s, shot=%03d, camera=%s, trigger_time=%s, window=[%s, %s] ***",
                shot.date(), shot.shotNumber(), event.camera(), event.dt().toLocalTime(),
                window.start().toLocalTime(), window.end().toLocalTime());
        return new Outcome(Disposition.SHOT_OPENED, shot);
    }

    private Outcome handleNonTrigger(FileEvent event) {
        index.record(event);

        Optional<Shot> covering = index.firstCovering(event.date(), event.dt(), shot -> true);
        if (covering.isEmpty()) {
            LOG.infof("Orphan image (no open shot window covers %s): %s", event.dt().toLocalTime(), event.path());
            return new Outcome(Disposition.ORPHAN, null);
        }

        Shot shot = covering.get();
        if (!shot.hasCamera(event.camera())) {
            index.assign(shot, event);
            LOG.infof("Image assigned to shot %03d, camera=%s: %s", shot.shotNumber(), event.camera(), event.path());
            return new Outcome(Disposition.ACCEPTED, shot);
        }

        LOG.warnf("Duplicate image for camera=%s in shot %03d, ignoring: %s",
                event.camera(), shot.shotNumber(), event.path());
        return new Outcome(Disposition.DUPLICATE, shot);
    }

    /**
     * Closes every collecting shot whose wall-clock age reached the timeout.
     * A failure closing one shot does not prevent the others from closing.
     */
    public List<ClosedShot> closeTimedOutShots() {
        if (shutdown) {
            return List.of();
        }

        List<PendingClosure> due = new ArrayList<>();
        lock.lock();
        try {
            Instant now = clock.instant();
            for (Shot shot : index.collectingShots()) {
                Duration age = Duration.between(shot.startWallTime(), now);
                if (age.compareTo(shot.timeout()) >= 0) {
                    PendingClosure closure = beginClosure(shot, CloseReason.TIMEOUT);
                    if (closure != null) {
                        LOG.infof("Shot %03d (%s) timed out after %d ms", shot.shotNumber(), shot.date(), age.toMillis());
                        due.add(closure);
                    }
                }
            }
        } finally {
            lock.unlock();
        }

        List<ClosedShot> closed = new ArrayList<>();
        RuntimeException failure = null;
        for (PendingClosure closure : due) {
            try {
                closed.add(finishClosure(closure));
            } catch (RuntimeException e) {
                LOG.errorf(e, "Failed to close shot %03d (%s)", closure.shot().shotNumber(), closure.shot().date());
                if (failure == null) {
                    failure = e;
                }
            }
        }
        if (failure != null) {
            throw new IllegalStateException("Timeout closure failed for at least one shot", failure);
        }
        return closed;
    }

    private PendingClosure closeIfComplete(Shot shot) {
        if (shot.isCollecting() && shot.missingCameras().isEmpty()) {
            return beginClosure(shot, CloseReason.COMPLETE);
        }
        return null;
    }

    /**
     * Moves the shot to CLOSING and out of the open set. Caller holds the lock.
     *
     * @return null when the shot is already closing
     */
    private PendingClosure beginClosure(Shot shot, CloseReason reason) {
        if (!shot.beginClosing()) {
            return null;
        }
        index.removeOpen(shot);
        return new PendingClosure(shot, reason, new LinkedHashMap<>(shot.imagesByCamera()), shot.missingCameras());
    }

    /**
     * Archives the images and completes the closure. The shot is always marked closed, recorded
     * and announced, even when archiving fails unexpectedly.
     */
    private ClosedShot finishClosure(PendingClosure closure) {
        Shot shot = closure.shot();
        LOG.infof("Closing shot %03d (%s, %s) using expected cameras: %s",
                shot.shotNumber(), shot.date(), closure.reason(), shot.expectedCameras());

        List<ArchiveResult> results = new ArrayList<>();
        ClosedShot closed = null;
        try {
            for (FileEvent image : closure.images().values()) {
                results.add(archiveImage(shot.shotNumber(), image));
            }
        } finally {
            closed = completeClosure(closure, results);
        }
        return closed;
    }

    private ClosedShot completeClosure(PendingClosure closure, List<ArchiveResult> results) {
        Shot shot = closure.shot();
        ClosedShot closed = new ClosedShot(
                shot.sequence(),
                shot.shotNumber(),
                shot.date(),
                shot.triggerCamera(),
                shot.triggerTime(),
                shot.window(),
                closure.images(),
                closure.missing(),
                closure.reason(),
                results
        );

        lock.lock();
        try {
            shot.markClosed();
            index.recordClosed(closed);
        } finally {
            lock.unlock();
        }

        notifier.notifyClosed(closed);
        return closed;
    }

    private ArchiveResult archiveImage(int shotNumber, FileEvent image) {
        IOException lastError = null;
        for (int attempt = 1; attempt <= maxArchiveAttempts; attempt++) {
            try {
                Path archived = archiveWriter.archive(image.camera(), image.dt(), shotNumber, image.path());
                LOG.infof("Archived %s → %s", image.path(), archived);
                return ArchiveResult.archived(image.camera(), image.path(), archived, attempt);
            } catch (IOException e) {
                lastError = e;
                LOG.warnf("Archive attempt %d/%d failed for %s: %s",
                        attempt, maxArchiveAttempts, image.path(), e.getMessage());
            } catch (RuntimeException e) {
                // not retried: an unchecked failure is not transient
                LOG.errorf(e, "Unexpected error archiving %s for shot %03d", image.path(), shotNumber);
                return ArchiveResult.failed(image.camera(), image.path(), attempt, String.valueOf(e.getMessage()));
            }
        }
        LOG.errorf(lastError, "Failed to archive %s for shot %03d", image.path(), shotNumber);
        return ArchiveResult.failed(image.camera(), image.path(), maxArchiveAttempts,
                lastError != null ? lastError.getMessage() : "not attempted");
    }

    /**
     * Swap the settings snapshot. Shots already open keep their window, timeout and expected cameras.
     */
    public void updateSettings(CorrelationSettings newSettings) {
        lock.lock();
        try {
            this.settings = newSettings;
        } finally {
            lock.unlock();
        }
        LOG.infof("Updated settings: full_window=%s, timeout=%s, keyword='%s', apply_to_all=%s, expected=%s",
                newSettings.fullWindow(), newSettings.timeout(), newSettings.globalTriggerKeyword(),
                newSettings.applyGlobalKeywordToAll(), newSettings.expectedCameras());
    }

    public CorrelationSettings settings() {
        return settings;
    }

    public void setNextShotNumber(LocalDate date, int next) {
        lock.lock();
        try {
            index.setNextShotNumber(date, next);
        } finally {
            lock.unlock();
        }
        LOG.infof("Next shot for %s set to %03d", date, Math.max(next, 1));
    }

    /**
     * Makes sure numbering for the date continues after {@code lastUsed}. Never lowers the next number.
     */
    public void continueNumberingAfter(LocalDate date, int lastUsed) {
        lock.lock();
        try {
            if (index.nextShotNumber(date) <= lastUsed) {
                index.setNextShotNumber(date, lastUsed + 1);
                LOG.infof("Resumed numbering for %s after shot %03d", date, lastUsed);
            }
        } finally {
            lock.unlock();
        }
    }

    public List<ClosedShot> closedShots() {
        lock.lock();
        try {
            return List.copyOf(index.closedShots());
        } finally {
            lock.unlock();
        }
    }

    public int openShotCount() {
        lock.lock();
        try {
            return index.openShotCount();
        } finally {
            lock.unlock();
        }
    }

    public ShotLogStatus status(SystemState state) {
        CorrelationSettings current = settings;
        lock.lock();
        try {
            LocalDate activeDate = index.lastSeenDate().orElse(LocalDate.now(clock));

            List<CollectingShot> collecting = new ArrayList<>();
            for (Shot shot : index.collectingShots()) {
                collecting.add(new CollectingShot(shot.shotNumber(), shot.date(), shot.triggerTime(),
                        new ArrayList<>(shot.imagesByCamera().keySet()), shot.missingCameras()));
            }

            LastShot last = index.lastClosed()
                    .map(c -> new LastShot(c.shotNumber(), c.date(), c.triggerTime(), c.missingCameras()))
                    .orElse(null);

            return new ShotLogStatus(
                    state,
                    index.openShotCount(),
                    collecting,
                    last,
                    activeDate,
                    index.nextShotNumber(activeDate),
                    current.fullWindow().toMillis(),
                    current.timeout().toMillis(),
                    current.globalTriggerKeyword()
            );
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops accepting files and timeout closures. Shots still collecting stay unclosed.
     */
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        LOG.infof("Correlator shut down, %d shot(s) left open", openShotCount());
    }

    public boolean isShutdown() {
        return shutdown;
    }

    private record Outcome(Disposition disposition, Shot shot) {
    }

    private record PendingClosure(Shot shot, CloseReason reason, Map<String, FileEvent> images, List<String> missing) {
    }
}
