package com.eli.beamline.shotlog.config;

import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import java.time.Clock;

@Singleton
public class ClockProducer {

    /**
     * Local system clock. Its zone turns file modification instants into shot dates and times.
     */
    @Produces
    @Singleton
    Clock clock() {
        return Clock.systemDefaultZone();
    }
}
