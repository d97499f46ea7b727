package com.eli.beamline.shotlog.service;

import com.eli.beamline.shotlog.domain.CorrelationSettings;
import com.eli.beamline.shotlog.domain.Disposition;
import com.eli.beamline.shotlog.domain.ShotLogStatus;
import com.eli.beamline.shotlog.domain.ShotLogStatus.SystemState;
import com.eli.beamline.shotlog.orchestration.ShotCorrelator;
import com.eli.beamline.shotlog.sink.ArchiveWriter;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Run control around the correlator: start, pause, resume, stop, status and settings reload.
 * Submissions are dropped unless the service is running.
 */
@ApplicationScoped
public class ShotLogService {

    private static final Logger LOG = Logger.getLogger(ShotLogService.class);

    private final ShotCorrelator correlator;
    private final ArchiveWriter archiveWriter;
    private final Clock clock;
    private final boolean autoStart;
    private final AtomicReference<SystemState> state = new AtomicReference<>(SystemState.IDLE);

    public ShotLogService(
            ShotCorrelator correlator,
            ArchiveWriter archiveWriter,
            Clock clock,
            @ConfigProperty(name = "shotlog.auto-start", defaultValue = "true") boolean autoStart
    ) {
        this.correlator = correlator;
        this.archiveWriter = archiveWriter;
        this.clock = clock;
        this.autoStart = autoStart;
    }

    void onStart(@Observes StartupEvent event) {
        if (autoStart) {
            start();
        }
    }

    void onStop(@Observes ShutdownEvent event) {
        stop();
        correlator.shutdown();
    }

    public void start() {
        SystemState previous = state.get();
        if (previous == SystemState.RUNNING || previous == SystemState.PAUSED) {
            return;
        }
        if (!state.compareAndSet(previous, SystemState.RUNNING)) {
            return;
        }

        CorrelationSettings settings = correlator.settings();
        if (!settings.hasExplicitExpectedCameras()) {
            LOG.warn("No expected cameras configured; defaulting to all configured folders.");
        }
        LOG.infof("Expected cameras: %s", settings.expectedCameras());
        LOG.infof("Trigger cameras: %s", settings.triggerCameras());
        for (String line : settings.keywordDescription()) {
            LOG.info(line);
        }

        LocalDate today = LocalDate.now(clock);
        archiveWriter.lastShotNumber(today).ifPresent(last -> correlator.continueNumberingAfter(today, last));

        LOG.info("Shot log started.");
    }

    public void pause() {
        if (state.compareAndSet(SystemState.RUNNING, SystemState.PAUSED)
                || state.compareAndSet(SystemState.ERROR, SystemState.PAUSED)) {
            LOG.info("Shot log paused.");
        }
    }

    public void resume() {
        if (state.compareAndSet(SystemState.PAUSED, SystemState.RUNNING)) {
            LOG.info("Shot log resumed.");
        }
    }

    public void stop() {
        SystemState previous = state.getAndSet(SystemState.IDLE);
        if (previous != SystemState.IDLE) {
            LOG.info("Shot log stopped.");
        }
    }

    /**
     * Running or in error: files are still correlated and timeouts still fire.
     */
    public boolean isActive() {
        SystemState current = state.get();
        return current == SystemState.RUNNING || current == SystemState.ERROR;
    }

    public SystemState state() {
        return state.get();
    }

    /**
     * Flags a background failure; the service keeps running.
     */
    public void markError() {
        state.compareAndSet(SystemState.RUNNING, SystemState.ERROR);
    }

    public Disposition submit(Path path, String camera, Instant mtime) {
        if (!isActive()) {
            LOG.debugf("Shot log is %s, dropping %s", state.get(), path);
            return Disposition.IGNORED;
        }
        return correlator.submit(path, camera, mtime);
    }

    public ShotLogStatus status() {
        return correlator.status(state.get());
    }

    public void updateSettings(CorrelationSettings settings) {
        correlator.updateSettings(settings);
        for (String line : settings.keywordDescription()) {
            LOG.info(line);
        }
    }

    public void updateExpectedCameras(List<String> cameras) {
        updateSettings(correlator.settings().withExpectedCameras(cameras));
    }

    public void setNextShotNumber(LocalDate date, int next) {
        correlator.setNextShotNumber(date, next);
    }

    public int nextShotNumber() {
        return status().nextShotNumber();
    }
}
