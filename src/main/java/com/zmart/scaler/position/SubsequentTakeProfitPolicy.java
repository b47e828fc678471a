package com.zmart.scaler.position;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Decides follow-up takes after the first take-profit.
 *
 * Consulted by {@link TakeProfitStateMachine} on every tick while the position is TRAILING,
 * after the stop has been ratcheted. Returning a take keeps the position open with the
 * re-armed stop; returning empty leaves the plain trailing-stop behavior in place.
 */
@FunctionalInterface
public interface SubsequentTakeProfitPolicy {

    Optional<SubsequentTake> evaluate(Position position, BigDecimal currentPrice);

    /**
     * No follow-up takes: the first stop hit closes the remainder.
     */
    static SubsequentTakeProfitPolicy none() {
        return (position, price) -> Optional.empty();
    }
}
