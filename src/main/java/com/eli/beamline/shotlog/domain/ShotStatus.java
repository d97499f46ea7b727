package com.eli.beamline.shotlog.domain;

/**
 * Shot lifecycle. Transitions only move forward.
 */
public enum ShotStatus {
    COLLECTING,
    CLOSING,
    CLOSED
}
