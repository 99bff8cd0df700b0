package com.sleepfactor.levels.domain.model;

/**
 * Coarse classification of a level against the maximum expected for the substance.
 */
public enum LevelIndicator {
    NONE,
    LOW,
    HIGH;

    public static LevelIndicator classify(double level, double maxLevel, double moderateRatio) {
        if (level <= 0) {
            return NONE;
        }
        if (level <= maxLevel * moderateRatio) {
            return LOW;
        }
        return HIGH;
    }

    /**
     * Level as a percentage of {@code maxLevel}, capped at 100. Zero when no maximum is known.
     */
    public static double percentOfMax(double level, double maxLevel) {
        if (maxLevel <= 0 || level <= 0) {
            return 0.0;
        }
        return Math.min(100.0, level / maxLevel * 100.0);
    }
}
