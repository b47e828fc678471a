package com.zmart.scaler.config;

import com.zmart.scaler.position.SubsequentTakeProfitPolicy;
import com.zmart.scaler.position.TieredTakeProfitPolicy;
import com.zmart.scaler.scaling.ScalingPlan;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;

/**
 * Builds the engine settings from {@code engine.*} properties.
 */
@Configuration
@Slf4j
public class EngineConfig {

    @Value("${engine.profit-fraction:0.75}")
    private BigDecimal profitFraction;

    @Value("${engine.max-stages:4}")
    private int maxStages;

    @Value("${engine.take-profit.first-fraction:0.30}")
    private BigDecimal firstTakeFraction;

    @Value("${engine.take-profit.second-fraction:0.25}")
    private BigDecimal secondTakeFraction;

    @Value("${engine.take-profit.final-fraction:0.45}")
    private BigDecimal finalTakeFraction;

    @Value("${engine.take-profit.trail-fraction:0.30}")
    private BigDecimal trailFraction;

    @Value("${engine.take-profit.final-trail-fraction:0.03}")
    private BigDecimal finalTrailFraction;

    @Value("${engine.take-profit.tiered:false}")
    private boolean tieredTakeProfit;

    @Value("${engine.winrate.neutral-threshold:5.0}")
    private BigDecimal neutralThreshold;

    @Value("${engine.scaling.better-score-ratio:1.2}")
    private BigDecimal betterScoreRatio;

    @Value("${engine.scaling.liquidation-buffer:0.10}")
    private BigDecimal liquidationBuffer;

    @Value("${engine.scaling.emergency-buffer:0.05}")
    private BigDecimal emergencyBuffer;

    @Value("${engine.scaling.max-bankroll-fraction:0.5}")
    private BigDecimal maxBankrollFraction;

    @Value("${engine.scaling.max-margin-fraction:0.3}")
    private BigDecimal maxMarginFraction;

    @Value("${engine.archive-size:100}")
    private int archiveSize;

    @Bean
    public EngineSettings engineSettings() {
        EngineSettings settings = EngineSettings.builder()
                .profitFraction(profitFraction)
                .maxStages(maxStages)
                .firstTakeFraction(firstTakeFraction)
                .secondTakeFraction(secondTakeFraction)
                .finalTakeFraction(finalTakeFraction)
                .trailFraction(trailFraction)
                .finalTrailFraction(finalTrailFraction)
                .tieredTakeProfit(tieredTakeProfit)
                .neutralThreshold(neutralThreshold)
                .betterScoreRatio(betterScoreRatio)
                .liquidationBuffer(liquidationBuffer)
                .emergencyBuffer(emergencyBuffer)
                .maxBankrollFraction(maxBankrollFraction)
                .maxMarginFraction(maxMarginFraction)
                .archiveSize(archiveSize)
                .build()
                .validate();

        log.info("Engine settings: profit={}, stages={}, takes={}/{}/{}, trail={}, tiered={}",
                profitFraction, maxStages, firstTakeFraction, secondTakeFraction, finalTakeFraction,
                trailFraction, tieredTakeProfit);
        return settings;
    }

    @Bean
    public SubsequentTakeProfitPolicy subsequentTakeProfitPolicy(EngineSettings engineSettings) {
        return engineSettings.isTieredTakeProfit()
                ? new TieredTakeProfitPolicy(engineSettings)
                : SubsequentTakeProfitPolicy.none();
    }

    @Bean
    public ScalingPlan scalingPlan(EngineSettings engineSettings) {
        return ScalingPlan.defaults().requireCovers(engineSettings.getMaxStages());
    }
}
