package com.sleepfactor.levels.domain.model;

import com.sleepfactor.levels.domain.constant.ResponseCodeEnum;

public record EstimationOutcome(
        boolean success,
        SubstanceLevelReport report,
        ResponseCodeEnum errorCode,
        String errorMessage) {

    public static EstimationOutcome success(SubstanceLevelReport report) {
        return new EstimationOutcome(true, report, null, null);
    }

    public static EstimationOutcome failure(ResponseCodeEnum errorCode, String errorMessage) {
        return new EstimationOutcome(false, null, errorCode, errorMessage);
    }
}
