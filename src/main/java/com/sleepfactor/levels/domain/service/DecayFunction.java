package com.sleepfactor.levels.domain.service;

import com.sleepfactor.levels.exception.InvalidConfigurationException;

/**
 * First-order (exponential) elimination: the fraction of a dose remaining
 * after {@code elapsedHours} is {@code 2^(-elapsedHours / halfLifeHours)}.
 */
public final class DecayFunction {

    private DecayFunction() {
        // Private constructor to prevent instantiation
    }

    /**
     * Fraction in [0, 1] of an initial dose still present after the elapsed time.
     *
     * @param elapsedHours  non-negative elapsed time; events after the reference
     *                      instant must be excluded by the caller
     * @param halfLifeHours strictly positive half-life
     * @return remaining fraction, 1 at zero elapsed time and 0.5 after one half-life
     * @throws InvalidConfigurationException if the half-life is not a finite positive number
     * @throws IllegalArgumentException      if the elapsed time is negative or NaN
     */
    public static double remainingFraction(double elapsedHours, double halfLifeHours) {
        requireValidHalfLife(halfLifeHours);
        if (Double.isNaN(elapsedHours) || elapsedHours < 0) {
            throw new IllegalArgumentException("elapsedHours must be non-negative but was " + elapsedHours);
        }
        return Math.pow(2.0, -elapsedHours / halfLifeHours);
    }

    public static void requireValidHalfLife(double halfLifeHours) {
        if (Double.isNaN(halfLifeHours) || Double.isInfinite(halfLifeHours) || halfLifeHours <= 0) {
            throw new InvalidConfigurationException(
                    "halfLifeHours must be a finite positive number but was " + halfLifeHours);
        }
    }
}
