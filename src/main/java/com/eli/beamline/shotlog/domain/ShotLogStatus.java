package com.eli.beamline.shotlog.domain;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Point-in-time view of the correlator for operators.
 */
public record ShotLogStatus(
        SystemState systemState,
        int openShots,
        List<CollectingShot> collecting,
        LastShot lastCompleted,
        LocalDate activeDate,
        int nextShotNumber,
        long fullWindowMs,
        long timeoutMs,
        String triggerKeyword
) {
    public enum SystemState {
        IDLE,
        RUNNING,
        PAUSED,
        ERROR
    }

    public ShotLogStatus {
        collecting = collecting != null ? List.copyOf(collecting) : List.of();
    }

    public record CollectingShot(
            int shotNumber,
            LocalDate date,
            LocalDateTime triggerTime,
            List<String> present,
            List<String> waitingFor
    ) {
        public CollectingShot {
            present = List.copyOf(present);
            waitingFor = List.copyOf(waitingFor);
        }
    }

    public record LastShot(
            int shotNumber,
            LocalDate date,
            LocalDateTime triggerTime,
            List<String> missingCameras
    ) {
        public LastShot {
            missingCameras = List.copyOf(missingCameras);
        }
    }
}
