package com.sleepfactor.levels.domain.model;

import java.time.Instant;

/**
 * A timeline level with its classification against the peak of the same timeline.
 */
public record TimelinePoint(Instant time, double level, LevelIndicator indicator, double percentOfMax) {
}
