package com.zmart.scaler.position;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * One capital commitment into a position.
 */
@Data
@Builder
public class Stage {

    private final int stageNumber;      // 1-based
    private final BigDecimal investment; // quote currency
    private final BigDecimal leverage;
    private final BigDecimal entryPrice;
    private final LocalDateTime openedAt;

    /**
     * Notional value of the stage: investment x leverage.
     */
    public BigDecimal getPositionValue() {
        return investment.multiply(leverage);
    }
}
