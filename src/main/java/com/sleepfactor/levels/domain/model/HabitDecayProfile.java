package com.sleepfactor.levels.domain.model;

import com.sleepfactor.levels.domain.constant.AppConstant;
import com.sleepfactor.levels.exception.InvalidConfigurationException;

/**
 * Per-habit decay configuration, captured at call time.
 *
 * @param halfLifeHours    time for a dose's contribution to halve, strictly positive
 * @param thresholdPercent fraction of an initial dose, in (0, 100], below which a single
 *                         event's remaining contribution is negligible; informs lookback
 *                         sizing only, never removes anything from a level
 * @param unit             unit string inherited from the habit, may be null
 */
public record HabitDecayProfile(double halfLifeHours, double thresholdPercent, String unit) {

    public HabitDecayProfile {
        if (Double.isNaN(halfLifeHours) || Double.isInfinite(halfLifeHours) || halfLifeHours <= 0) {
            throw new InvalidConfigurationException(
                    "halfLifeHours must be a finite positive number but was " + halfLifeHours);
        }
        if (Double.isNaN(thresholdPercent) || thresholdPercent <= 0 || thresholdPercent > 100) {
            throw new InvalidConfigurationException(
                    "thresholdPercent must be in (0, 100] but was " + thresholdPercent);
        }
    }

    /**
     * Builds a profile from nullable stored values. A missing half-life is rejected;
     * a missing threshold takes the stored column default.
     */
    public static HabitDecayProfile of(Double halfLifeHours, Double thresholdPercent, String unit) {
        if (halfLifeHours == null) {
            throw new InvalidConfigurationException("halfLifeHours is not configured");
        }
        double threshold = thresholdPercent != null ? thresholdPercent : AppConstant.DEFAULT_THRESHOLD_PERCENT;
        return new HabitDecayProfile(halfLifeHours, threshold, unit);
    }

    public static HabitDecayProfile fromHabit(HabitConfig habit) {
        if (habit.getType() == null || !habit.getType().isDecaying()) {
            throw new InvalidConfigurationException(
                    "Habit " + habit.getId() + " of type " + habit.getType() + " has no decay semantics");
        }
        if (habit.getHalfLifeHours() == null) {
            throw new InvalidConfigurationException(
                    "Habit " + habit.getId() + " (" + habit.getName() + ") has no configured half-life");
        }
        return of(habit.getHalfLifeHours(), habit.getDrugThresholdPercent(), habit.getUnit());
    }

    /**
     * Hours after which a single dose falls below {@code thresholdPercent} of its initial amount.
     */
    public double negligibleAfterHours() {
        return halfLifeHours * (Math.log(100.0 / thresholdPercent) / Math.log(2.0));
    }
}
