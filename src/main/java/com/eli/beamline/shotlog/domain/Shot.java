package com.eli.beamline.shotlog.domain;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One experiment trigger event and the camera images collected for it.
 * <p>
 * Not thread-safe: every access goes through the correlator lock.
 */
public final class Shot {

    private final long sequence;
    private final int shotNumber;
    private final LocalDate date;
    private final Window window;
    private final Duration timeout;
    private final String triggerCamera;
    private final LocalDateTime triggerTime;
    private final Instant startWallTime;
    private final List<String> expectedCameras;
    private final Map<String, FileEvent> imagesByCamera = new LinkedHashMap<>();
    private ShotStatus status = ShotStatus.COLLECTING;

    public Shot(long sequence,
                int shotNumber,
                LocalDate date,
                Window window,
                Duration timeout,
                String triggerCamera,
                LocalDateTime triggerTime,
                Instant startWallTime,
                List<String> expectedCameras) {
        if (shotNumber < 1) {
            throw new IllegalArgumentException("shotNumber must be positive: " + shotNumber);
        }
        this.sequence = sequence;
        this.shotNumber = shotNumber;
        this.date = date;
        this.window = window;
        this.timeout = timeout;
        this.triggerCamera = triggerCamera;
        this.triggerTime = triggerTime;
        this.startWallTime = startWallTime;
        this.expectedCameras = List.copyOf(expectedCameras);
    }

    public long sequence() {
        return sequence;
    }

    public int shotNumber() {
        return shotNumber;
    }

    public LocalDate date() {
        return date;
    }

    public Window window() {
        return window;
    }

    /**
     * Collection time allowed to this shot, fixed when it was opened.
     */
    public Duration timeout() {
        return timeout;
    }

    public String triggerCamera() {
        return triggerCamera;
    }

    public LocalDateTime triggerTime() {
        return triggerTime;
    }

    public Instant startWallTime() {
        return startWallTime;
    }

    public List<String> expectedCameras() {
        return expectedCameras;
    }

    public ShotStatus status() {
        return status;
    }

    public boolean isCollecting() {
        return status == ShotStatus.COLLECTING;
    }

    public boolean hasCamera(String camera) {
        return imagesByCamera.containsKey(camera);
    }

    public boolean covers(LocalDate eventDate, LocalDateTime dt) {
        return date.equals(eventDate) && window.contains(dt);
    }

    /**
     * Stores the image for its camera. A camera already present is never replaced.
     */
    public void accept(FileEvent event) {
        if (status != ShotStatus.COLLECTING) {
            throw new IllegalStateException("Shot " + shotNumber + " is " + status + ", cannot accept " + event.path());
        }
        FileEvent existing = imagesByCamera.putIfAbsent(event.camera(), event);
        if (existing != null) {
            throw new IllegalStateException("Shot " + shotNumber + " already holds camera " + event.camera());
        }
    }

    public Map<String, FileEvent> imagesByCamera() {
        return Collections.unmodifiableMap(imagesByCamera);
    }

    /**
     * Expected cameras with no accepted image, in configuration order.
     */
    public List<String> missingCameras() {
        List<String> missing = new ArrayList<>();
        for (String camera : expectedCameras) {
            if (!imagesByCamera.containsKey(camera)) {
                missing.add(camera);
            }
        }
        return missing;
    }

    /**
     * COLLECTING to CLOSING. Returns false when another path already started closing this shot.
     */
    public boolean beginClosing() {
        if (status != ShotStatus.COLLECTING) {
            return false;
        }
        status = ShotStatus.CLOSING;
        return true;
    }

    public void markClosed() {
        if (status != ShotStatus.CLOSING) {
            throw new IllegalStateException("Shot " + shotNumber + " is " + status + ", expected CLOSING");
        }
        status = ShotStatus.CLOSED;
    }

    @Override
    public String toString() {
        return String.format("Shot[%03d %s seq=%d %s cameras=%s]",
                shotNumber, date, sequence, status, imagesByCamera.keySet());
    }
}
