package com.eli.beamline.shotlog.notify;

import com.eli.beamline.shotlog.domain.ClosedShot;

/**
 * Downstream consumer of shot closures (motor positions, manual parameters, shot logs).
 * Called exactly once per shot, after its images were archived.
 */
public interface ShotClosureListener {

    void onShotClosed(ClosedShot shot);
}
