package com.zmart.scaler.scaling;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Bankroll fraction and leverage for each stage, in stage order.
 * Leverage steps down as the committed fraction grows.
 */
public class ScalingPlan {

    private final List<ScalePlanStage> stages;

    public ScalingPlan(List<ScalePlanStage> stages) {
        if (stages == null || stages.isEmpty()) {
            throw new IllegalArgumentException("Scaling plan needs at least one stage");
        }
        for (int i = 0; i < stages.size(); i++) {
            if (stages.get(i).getStageNumber() != i + 1) {
                throw new IllegalArgumentException("Plan stages must be numbered 1.." + stages.size());
            }
        }
        this.stages = Collections.unmodifiableList(new ArrayList<>(stages));
    }

    /**
     * 1% @ 20x, 2% @ 10x, 4% @ 5x, 8% @ 2x.
     */
    public static ScalingPlan defaults() {
        return new ScalingPlan(List.of(
                stage(1, "0.01", "20", "Initial entry"),
                stage(2, "0.02", "10", "First scale"),
                stage(3, "0.04", "5", "Second scale"),
                stage(4, "0.08", "2", "Final scale")
        ));
    }

    private static ScalePlanStage stage(int number, String fraction, String leverage, String description) {
        return ScalePlanStage.builder()
                .stageNumber(number)
                .bankrollFraction(new BigDecimal(fraction))
                .leverage(new BigDecimal(leverage))
                .description(description)
                .build();
    }

    public Optional<ScalePlanStage> stageFor(int stageNumber) {
        if (stageNumber < 1 || stageNumber > stages.size()) {
            return Optional.empty();
        }
        return Optional.of(stages.get(stageNumber - 1));
    }

    /**
     * Investment for a planned stage: bankroll x stage fraction.
     *
     * @throws IllegalArgumentException if the plan has no such stage
     */
    public BigDecimal investmentFor(int stageNumber, BigDecimal bankroll) {
        ScalePlanStage stage = stageFor(stageNumber)
                .orElseThrow(() -> new IllegalArgumentException("No plan for stage " + stageNumber));
        return bankroll.multiply(stage.getBankrollFraction());
    }

    /**
     * Check that every stage a position may hold has a planned size.
     *
     * @throws IllegalArgumentException if maxStages exceeds the plan
     */
    public ScalingPlan requireCovers(int maxStages) {
        if (maxStages > stages.size()) {
            throw new IllegalArgumentException("maxStages " + maxStages
                    + " exceeds the " + stages.size() + " planned stages");
        }
        return this;
    }

    public List<ScalePlanStage> getStages() {
        return stages;
    }

    public int size() {
        return stages.size();
    }
}
