package com.sleepfactor.levels.application.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for substance level estimation.
 * Habit-specific values (half-life, threshold) are not part of this mapping;
 * they are read from the habit record on every estimation.
 */
@ConfigMapping(prefix = "level-estimation")
public interface LevelEstimationConfig {

    /**
     * Habitual reference clock time used when the user has none configured.
     * @return clock time as HH:mm[:ss]
     */
    @WithDefault("22:00:00")
    String defaultReferenceTime();

    /**
     * Clock time at which a logged day begins. A reference clock time earlier
     * than this belongs to the following calendar date (the night of a logged
     * day spans midnight).
     * @return clock time as HH:mm[:ss]
     */
    @WithDefault("04:00:00")
    String dayStartTime();

    /**
     * Zone used to combine a logged date with a clock time.
     * @return zone id
     */
    @WithDefault("UTC")
    String zoneId();

    Lookback lookback();

    Timeline timeline();

    Indicator indicator();

    interface Lookback {

        /**
         * Lower bound of the event query window in days.
         * @return minimum days, at least 3
         */
        @WithDefault("3")
        int minimumDays();

        /**
         * Number of half-lives the event query window must cover.
         * @return half-lives
         */
        @WithDefault("3")
        double halfLives();
    }

    interface Timeline {

        /**
         * Spacing between generated level points.
         * @return interval in minutes
         */
        @WithDefault("30")
        int intervalMinutes();
    }

    interface Indicator {

        /**
         * Fraction of the expected maximum level up to which a level is reported as low.
         * @return ratio in (0, 1]
         */
        @WithDefault("0.3")
        double moderateRatio();
    }
}
