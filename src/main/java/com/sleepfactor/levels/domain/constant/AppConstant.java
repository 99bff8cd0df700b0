package com.sleepfactor.levels.domain.constant;

public class AppConstant {
    private AppConstant() {
    }
    public static final String DEFAULT_REFERENCE_TIME = "22:00:00";
    public static final String DEFAULT_DAY_START_TIME = "04:00:00";

    public static final double DEFAULT_THRESHOLD_PERCENT = 5.0;
    public static final double HOURS_PER_DAY = 24.0;
    public static final double SECONDS_PER_HOUR = 3600.0;

    public static final int MIN_LOOKBACK_DAYS = 3;
    public static final double LOOKBACK_HALF_LIVES = 3.0;

    public static final int MAX_TIMELINE_POINTS = 10_000;

    public static final int MAX_PATTERN_DAYS = 92;

    public static final int CONSUMPTION_EVENTS_INITIAL_CAPACITY = 32;
}
