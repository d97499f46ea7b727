package com.eli.beamline.shotlog.domain;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Closed time interval around a trigger timestamp. Both bounds are inclusive.
 */
public record Window(LocalDateTime start, LocalDateTime end) {

    public Window {
        if (start == null || end == null) {
            throw new IllegalArgumentException("window bounds cannot be null");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("window end " + end + " is before start " + start);
        }
    }

    /**
     * {@code [dt - fullWindow/2, dt + fullWindow/2]}.
     */
    public static Window centeredOn(LocalDateTime dt, Duration fullWindow) {
        if (fullWindow.isNegative()) {
            throw new IllegalArgumentException("full window cannot be negative: " + fullWindow);
        }
        Duration half = fullWindow.dividedBy(2);
        return new Window(dt.minus(half), dt.plus(half));
    }

    public boolean contains(LocalDateTime t) {
        return !t.isBefore(start) && !t.isAfter(end);
    }
}
