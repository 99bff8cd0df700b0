package com.sleepfactor.levels.domain.model;

import com.sleepfactor.levels.exception.InvalidEventException;

import java.time.Instant;

/**
 * One validated intake of a substance. An amount of zero is an explicit
 * "none consumed" log; it contributes nothing to a level but still proves
 * the user logged the habit.
 */
public record ConsumptionEvent(
        String id,
        String habitId,
        Instant consumedAt,
        double amount,
        String drinkType) {

    public ConsumptionEvent {
        if (consumedAt == null) {
            throw new InvalidEventException(id, "consumedAt is required");
        }
        if (Double.isNaN(amount) || Double.isInfinite(amount)) {
            throw new InvalidEventException(id, "amount must be a finite number but was " + amount);
        }
        if (amount < 0) {
            throw new InvalidEventException(id, "amount must not be negative but was " + amount);
        }
    }

    public static ConsumptionEvent of(String habitId, Instant consumedAt, double amount) {
        return new ConsumptionEvent(null, habitId, consumedAt, amount, null);
    }
}
