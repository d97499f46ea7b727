package com.eli.beamline.shotlog.domain;

/**
 * What the correlator did with one submitted file.
 */
public enum Disposition {
    /** Failed classification, matched a test keyword or came from an unknown folder. */
    IGNORED,
    /** Same path and modification time seen before. */
    REDELIVERED,
    /** Path already claimed by a shot. */
    ALREADY_ASSIGNED,
    /** Trigger opened a new shot. */
    SHOT_OPENED,
    /** Trigger folded into an open shot that lacked its camera. */
    TRIGGER_JOINED,
    /** Non-trigger image accepted into an open shot. */
    ACCEPTED,
    /** Camera already present in the covering shot. */
    DUPLICATE,
    /** No open shot covers the timestamp yet. */
    ORPHAN
}
