package com.sleepfactor.levels.domain.model;

import java.util.List;

public record ValidatedEvents(List<ConsumptionEvent> valid, List<RejectedEvent> rejected) {

    public ValidatedEvents {
        valid = List.copyOf(valid);
        rejected = List.copyOf(rejected);
    }
}
