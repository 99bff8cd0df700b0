package com.sleepfactor.levels.domain.model;

import java.time.Instant;

public record LevelPoint(Instant time, double level) {
}
