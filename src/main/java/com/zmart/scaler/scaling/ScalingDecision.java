package com.zmart.scaler.scaling;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

@Data
@Builder
public class ScalingDecision {

    private final boolean shouldScale;
    private final ScalingTrigger trigger;
    private final int nextStageNumber;
    private final ScalePlanStage plannedStage;   // null when not scaling
    private final BigDecimal liquidationDistance;
    private final String reason;

    public static ScalingDecision hold(ScalingTrigger trigger, BigDecimal liquidationDistance, String reason) {
        return ScalingDecision.builder()
                .shouldScale(false)
                .trigger(trigger)
                .liquidationDistance(liquidationDistance)
                .reason(reason)
                .build();
    }
}
