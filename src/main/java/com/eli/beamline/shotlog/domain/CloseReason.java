package com.eli.beamline.shotlog.domain;

public enum CloseReason {
    /** Every expected camera reported before the timeout. */
    COMPLETE,
    /** The collection timeout elapsed. */
    TIMEOUT
}
