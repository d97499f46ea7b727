package com.eli.beamline.shotlog.index;

import com.eli.beamline.shotlog.domain.ClosedShot;
import com.eli.beamline.shotlog.domain.FileEvent;
import com.eli.beamline.shotlog.domain.Shot;
import com.eli.beamline.shotlog.domain.Window;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * In-memory state shared by ingestion and the timeout worker: open shots in creation order,
 * every file seen per date, and the set of paths already claimed by a shot.
 * <p>
 * Not thread-safe. Owned by {@code ShotCorrelator}, which guards every call with its lock.
 * Nothing is persisted; state is lost on restart.
 */
public class ShotIndex {

    private final List<Shot> openShots = new ArrayList<>();
    private final Map<LocalDate, List<FileEvent>> filesByDate = new HashMap<>();
    private final Set<Path> assignedPaths = new HashSet<>();
    private final Map<Path, LocalDateTime> observed = new HashMap<>();
    private final Map<Path, FileEvent> recordedByPath = new HashMap<>();
    private final Map<LocalDate, Integer> lastShotNumberByDate = new HashMap<>();
    private final List<ClosedShot> closedShots = new ArrayList<>();
    private long nextSequence = 1;
    private LocalDate lastSeenDate;

    /**
     * Remembers the (path, mtime) pair.
     *
     * @return false if exactly this observation was already made
     */
    public boolean markObserved(FileEvent event) {
        LocalDateTime previous = observed.put(event.path(), event.dt());
        return !event.dt().equals(previous);
    }

    /**
     * Adds the event to the files seen on its date. An earlier observation of the same path
     * is dropped, so backfill only ever sees the current modification time.
     */
    public void record(FileEvent event) {
        FileEvent previous = recordedByPath.put(event.path(), event);
        if (previous != null) {
            List<FileEvent> sameDay = filesByDate.get(previous.date());
            if (sameDay != null) {
                sameDay.remove(previous);
            }
        }
        filesByDate.computeIfAbsent(event.date(), d -> new ArrayList<>()).add(event);
        lastSeenDate = event.date();
    }

    public List<FileEvent> filesOn(LocalDate date) {
        return Collections.unmodifiableList(filesByDate.getOrDefault(date, List.of()));
    }

    public boolean isAssigned(Path path) {
        return assignedPaths.contains(path);
    }

    /**
     * Accepts the event into the shot and claims its path for good.
     */
    public void assign(Shot shot, FileEvent event) {
        if (!assignedPaths.add(event.path())) {
            throw new IllegalStateException("Path already assigned: " + event.path());
        }
        shot.accept(event);
    }

    /**
     * Creates a collecting shot with the next number for its date and appends it to the open shots.
     */
    public Shot openShot(FileEvent trigger, Window window, Duration timeout, Instant startWallTime,
                         List<String> expectedCameras) {
        LocalDate date = trigger.date();
        int shotNumber = lastShotNumberByDate.getOrDefault(date, 0) + 1;
        lastShotNumberByDate.put(date, shotNumber);

        Shot shot = new Shot(nextSequence++, shotNumber, date, window, timeout, trigger.camera(),
                trigger.dt(), startWallTime, expectedCameras);
        openShots.add(shot);
        return shot;
    }

    /**
     * First collecting shot, in creation order, whose date and window cover the timestamp
     * and which satisfies the filter.
     */
    public Optional<Shot> firstCovering(LocalDate date, LocalDateTime dt, Predicate<Shot> filter) {
        for (Shot shot : openShots) {
            if (shot.isCollecting() && shot.covers(date, dt) && filter.test(shot)) {
                return Optional.of(shot);
            }
        }
        return Optional.empty();
    }

    public List<Shot> collectingShots() {
        List<Shot> collecting = new ArrayList<>();
        for (Shot shot : openShots) {
            if (shot.isCollecting()) {
                collecting.add(shot);
            }
        }
        return collecting;
    }

    public int openShotCount() {
        return openShots.size();
    }

    public void removeOpen(Shot shot) {
        openShots.remove(shot);
    }

    public void recordClosed(ClosedShot closed) {
        closedShots.add(closed);
    }

    public List<ClosedShot> closedShots() {
        return Collections.unmodifiableList(closedShots);
    }

    public Optional<ClosedShot> lastClosed() {
        return closedShots.isEmpty() ? Optional.empty() : Optional.of(closedShots.get(closedShots.size() - 1));
    }

    public int nextShotNumber(LocalDate date) {
        return lastShotNumberByDate.getOrDefault(date, 0) + 1;
    }

    /**
     * Overrides the number the next shot of the date receives. Values below 1 are clamped to 1.
     */
    public void setNextShotNumber(LocalDate date, int next) {
        lastShotNumberByDate.put(date, Math.max(next, 1) - 1);
    }

    public Optional<LocalDate> lastSeenDate() {
        return Optional.ofNullable(lastSeenDate);
    }
}
