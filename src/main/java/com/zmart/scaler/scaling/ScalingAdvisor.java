package com.zmart.scaler.scaling;

import com.zmart.scaler.config.EngineSettings;
import com.zmart.scaler.exception.InvalidStageException;
import com.zmart.scaler.position.LiquidationPriceCalculator;
import com.zmart.scaler.position.Position;
import com.zmart.scaler.position.Stage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;

/**
 * Decides when the next planned stage should be added and appends it.
 *
 * Trigger priority: EMERGENCY, then LIQUIDATION_PROXIMITY, then BETTER_SCORE.
 * Nothing is recommended once the position has left ACCUMULATING or the ledger is full.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScalingAdvisor {

    private final EngineSettings settings;
    private final ScalingPlan plan;
    private final LiquidationPriceCalculator liquidation;

    public ScalingDecision evaluate(Position position, BigDecimal currentPrice,
                                    BigDecimal signalScore, BigDecimal initialSignalScore) {
        BigDecimal distance = liquidation.distanceFraction(position, currentPrice);

        if (!position.canAddStage()) {
            return ScalingDecision.hold(ScalingTrigger.NONE, distance,
                    "No stage can be added (" + position.getStatus() + ", "
                            + position.getStageCount() + "/" + position.getMaxStages() + " stages)");
        }

        int nextStage = position.getStageCount() + 1;
        Optional<ScalePlanStage> planned = plan.stageFor(nextStage);
        if (planned.isEmpty()) {
            return ScalingDecision.hold(ScalingTrigger.NONE, distance, "Scaling plan has no stage " + nextStage);
        }

        ScalingTrigger trigger = selectTrigger(distance, signalScore, initialSignalScore);
        if (trigger == ScalingTrigger.NONE) {
            return ScalingDecision.hold(ScalingTrigger.NONE, distance, "No scaling condition met");
        }

        String reason = String.format("%s: liquidation distance %s%%, score %s vs initial %s",
                trigger.getDisplayName(),
                distance.multiply(BigDecimal.valueOf(100)).setScale(2, RoundingMode.HALF_UP),
                signalScore, initialSignalScore);

        log.info("Scaling recommended for {} to stage {}: {}", position.getSymbol(), nextStage, reason);

        return ScalingDecision.builder()
                .shouldScale(true)
                .trigger(trigger)
                .nextStageNumber(nextStage)
                .plannedStage(planned.get())
                .liquidationDistance(distance)
                .reason(reason)
                .build();
    }

    /**
     * Append the planned stage at the given price.
     *
     * @return the new stage, or empty when the decision does not recommend scaling
     * @throws InvalidStageException if the decision was made for a different stage count,
     *                               or the planned investment exceeds the per-scale bankroll cap
     */
    public Optional<Stage> applyScaling(Position position, ScalingDecision decision,
                                        BigDecimal price, BigDecimal bankroll) {
        if (decision == null || !decision.isShouldScale()) {
            return Optional.empty();
        }

        int expectedStage = position.getStageCount() + 1;
        if (decision.getNextStageNumber() != expectedStage) {
            log.warn("Stale scaling decision for {}: planned stage {}, next stage is {}",
                    position.getSymbol(), decision.getNextStageNumber(), expectedStage);
            throw new InvalidStageException("Decision was for stage " + decision.getNextStageNumber()
                    + " but " + position.getSymbol() + " is at stage " + position.getStageCount());
        }

        BigDecimal investment = plan.investmentFor(decision.getNextStageNumber(), bankroll);
        BigDecimal cap = bankroll.multiply(settings.getMaxBankrollFraction());
        if (investment.compareTo(cap) > 0) {
            log.warn("Refusing stage {} for {}: investment {} above cap {}",
                    decision.getNextStageNumber(), position.getSymbol(), investment, cap);
            throw new InvalidStageException("Investment " + investment + " exceeds "
                    + settings.getMaxBankrollFraction() + " of bankroll " + bankroll);
        }

        position.addStage(investment, decision.getPlannedStage().getLeverage(), price);
        List<Stage> stages = position.getStages();
        Stage added = stages.get(stages.size() - 1);

        log.info("Scaled {} into stage {}: investment={}, leverage={}x, entry={}, new avg entry={}",
                position.getSymbol(), added.getStageNumber(), investment, added.getLeverage(), price,
                position.weightedAverageEntryPrice().setScale(2, RoundingMode.HALF_UP));
        return Optional.of(added);
    }

    /**
     * Post margin when the price is within the emergency buffer of liquidation.
     * The top-up equals the total invested, capped at the configured share of the bankroll.
     *
     * @return the margin added, or empty when liquidation is not close enough
     */
    public Optional<BigDecimal> addMargin(Position position, BigDecimal price, BigDecimal bankroll) {
        BigDecimal distance = liquidation.distanceFraction(position, price);
        if (distance.compareTo(settings.getEmergencyBuffer()) > 0) {
            log.debug("No margin needed for {}: liquidation distance {}", position.getSymbol(), distance);
            return Optional.empty();
        }

        BigDecimal cap = bankroll.multiply(settings.getMaxMarginFraction());
        BigDecimal margin = position.totalInvested().min(cap);
        position.addMargin(margin, "Liquidation prevention");

        log.info("Added {} margin to {} at {} (liquidation distance {}%), new liquidation estimate {}",
                margin, position.getSymbol(), price,
                distance.multiply(BigDecimal.valueOf(100)).setScale(2, RoundingMode.HALF_UP),
                liquidation.estimate(position).setScale(2, RoundingMode.HALF_UP));
        return Optional.of(margin);
    }

    private ScalingTrigger selectTrigger(BigDecimal distance, BigDecimal signalScore, BigDecimal initialSignalScore) {
        if (distance.compareTo(settings.getEmergencyBuffer()) < 0) {
            return ScalingTrigger.EMERGENCY;
        }
        if (distance.compareTo(settings.getLiquidationBuffer()) < 0) {
            return ScalingTrigger.LIQUIDATION_PROXIMITY;
        }
        if (signalScore != null && initialSignalScore != null
                && signalScore.compareTo(initialSignalScore.multiply(settings.getBetterScoreRatio())) > 0) {
            return ScalingTrigger.BETTER_SCORE;
        }
        return ScalingTrigger.NONE;
    }
}
