package com.eli.beamline.shotlog.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Correlation parameters and camera folder definitions, under {@code shotlog.*}.
 */
@ConfigMapping(prefix = "shotlog")
public interface ShotLogConfig {

    /** Full width of the window centered on a trigger's modification time. */
    @WithDefault("10s")
    Duration fullWindow();

    /** Wall-clock collection time after which a shot is closed with whatever it has. */
    @WithDefault("20s")
    Duration timeout();

    @WithDefault("shot")
    Optional<String> globalTriggerKeyword();

    @WithDefault("false")
    boolean applyGlobalKeywordToAll();

    /** File names containing any of these are treated as non-existent. */
    @WithDefault("test,align")
    List<String> testKeywords();

    /** Period of the timeout worker and of the RAW folder poll. */
    @WithDefault("0.5s")
    Duration checkInterval();

    @WithDefault("true")
    boolean autoStart();

    List<Folder> folders();

    interface Folder {
        String name();

        @WithDefault("true")
        boolean expected();

        @WithDefault("false")
        boolean trigger();

        Optional<List<Spec>> fileSpecs();
    }

    interface Spec {
        Optional<String> keyword();

        Optional<String> extension();
    }
}
