package com.zmart.scaler.position;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

/**
 * A follow-up partial take returned by a {@link SubsequentTakeProfitPolicy}.
 */
@Data
@Builder
public class SubsequentTake {

    // Fraction of total position value to close, capped at what remains open
    private final BigDecimal closeFraction;

    // Trailing distance re-armed from the take price
    private final BigDecimal nextTrailFraction;

    private final String reason;
}
