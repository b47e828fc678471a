package com.zmart.scaler.position;

import com.zmart.scaler.config.EngineSettings;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * 30 / 25 / 45 exit ladder.
 *
 * After the first take, the first stop hit realizes the second split and re-arms a tight
 * stop; the next hit closes the final split through the regular trailing-stop path.
 */
@RequiredArgsConstructor
public class TieredTakeProfitPolicy implements SubsequentTakeProfitPolicy {

    private final EngineSettings settings;

    @Override
    public Optional<SubsequentTake> evaluate(Position position, BigDecimal currentPrice) {
        if (position.getTakeProfitCount() != 1 || !position.isStopCrossed(currentPrice)) {
            return Optional.empty();
        }
        return Optional.of(SubsequentTake.builder()
                .closeFraction(settings.getSecondTakeFraction())
                .nextTrailFraction(settings.getFinalTrailFraction())
                .reason("Second take on first stop hit")
                .build());
    }
}
