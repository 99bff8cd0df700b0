package com.sleepfactor.levels.domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Level series over a time range. Each point is classified against the highest
 * level of the series.
 */
public record LevelTimeline(List<TimelinePoint> points, double maxLevel) {

    public LevelTimeline {
        points = points != null ? List.copyOf(points) : List.of();
    }

    public static LevelTimeline of(List<LevelPoint> levels, double max, double moderateRatio) {
        List<TimelinePoint> points = new ArrayList<>(levels.size());
        for (LevelPoint level : levels) {
            points.add(new TimelinePoint(level.time(), level.level(),
                    LevelIndicator.classify(level.level(), max, moderateRatio),
                    LevelIndicator.percentOfMax(level.level(), max)));
        }
        return new LevelTimeline(points, max);
    }
}
