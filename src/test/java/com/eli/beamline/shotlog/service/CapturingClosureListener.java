package com.eli.beamline.shotlog.service;

import com.eli.beamline.shotlog.domain.ClosedShot;
import com.eli.beamline.shotlog.notify.ShotClosureListener;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Test bean picked up by the closure notifier alongside the logging listener.
 */
@ApplicationScoped
public class CapturingClosureListener implements ShotClosureListener {

    private final List<ClosedShot> closed = new CopyOnWriteArrayList<>();

    @Override
    public void onShotClosed(ClosedShot shot) {
        closed.add(shot);
    }

    public List<ClosedShot> closedOn(LocalDate date) {
        return closed.stream().filter(s -> s.date().equals(date)).collect(Collectors.toList());
    }
}
