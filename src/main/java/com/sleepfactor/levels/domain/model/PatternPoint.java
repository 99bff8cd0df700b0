package com.sleepfactor.levels.domain.model;

import java.time.LocalTime;

/**
 * Average level at a clock time across several days.
 */
public record PatternPoint(LocalTime clockTime, double averageLevel) {
}
