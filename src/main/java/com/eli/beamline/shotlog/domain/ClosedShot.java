package com.eli.beamline.shotlog.domain;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Archived form of a shot, delivered once to closure listeners.
 * A shot with missing cameras is a valid outcome, not a failure.
 */
public record ClosedShot(
        long sequence,
        int shotNumber,
        LocalDate date,
        String triggerCamera,
        LocalDateTime triggerTime,
        Window window,
        Map<String, FileEvent> imagesByCamera,
        List<String> missingCameras,
        CloseReason reason,
        List<ArchiveResult> archiveResults
) {
    public enum Outcome {
        COMPLETE,
        PARTIAL
    }

    public ClosedShot {
        imagesByCamera = imagesByCamera != null ? Map.copyOf(imagesByCamera) : Map.of();
        missingCameras = missingCameras != null ? List.copyOf(missingCameras) : List.of();
        archiveResults = archiveResults != null ? List.copyOf(archiveResults) : List.of();
    }

    public Outcome outcome() {
        return missingCameras.isEmpty() ? Outcome.COMPLETE : Outcome.PARTIAL;
    }

    public boolean isComplete() {
        return outcome() == Outcome.COMPLETE;
    }

    public boolean hasArchiveFailures() {
        return archiveResults.stream().anyMatch(r -> r.status() == ArchiveResult.Status.FAILED);
    }
}
