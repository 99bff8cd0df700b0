package com.sleepfactor.levels.domain.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Resolved reference instant for a logged day.
 *
 * @param loggedDate the day the reference belongs to
 * @param clockTime  clock time actually used
 * @param instant    concrete instant
 * @param defaulted  true when the configured clock time was missing or unparsable
 * @param projected  true when the instant is still in the future relative to "now"
 */
public record ReferenceInstant(
        LocalDate loggedDate,
        LocalTime clockTime,
        Instant instant,
        boolean defaulted,
        boolean projected) {
}
