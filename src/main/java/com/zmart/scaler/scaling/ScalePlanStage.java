package com.zmart.scaler.scaling;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

/**
 * Sizing rule for one stage of the scaling plan.
 */
@Data
@Builder
public class ScalePlanStage {

    private final int stageNumber;
    private final BigDecimal bankrollFraction; // 0.01 = 1% of bankroll
    private final BigDecimal leverage;
    private final String description;
}
