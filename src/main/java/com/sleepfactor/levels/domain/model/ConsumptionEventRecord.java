package com.sleepfactor.levels.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Consumption event as delivered by the persistence layer, before validation.
 * Timestamp is kept as text so that a malformed row can be reported instead of
 * failing the whole query.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConsumptionEventRecord {

    private String id;

    private String userId;

    private String habitId;

    /**
     * ISO-8601 timestamp with offset (e.g. 2025-01-05T08:00:00Z or 2025-01-05 08:00:00+00)
     */
    private String consumedAt;

    /**
     * Quantity in the habit's unit, zero for an explicit "none consumed" log
     */
    private BigDecimal amount;

    /**
     * Optional preset identifier (coffee, espresso, beer...)
     */
    private String drinkType;
}
