package com.sleepfactor.levels.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Habit configuration as stored for the user. Decay fields are nullable
 * because most habit types have none.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class HabitConfig {

    private String id;

    private String userId;

    private String name;

    private HabitType type;

    /**
     * Display unit (mg, drinks, cups...)
     */
    private String unit;

    private Double halfLifeHours;

    private Double drugThresholdPercent;
}
