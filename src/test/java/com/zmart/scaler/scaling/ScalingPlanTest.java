package com.zmart.scaler.scaling;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ScalingPlan.
 */
@DisplayName("ScalingPlan Tests")
class ScalingPlanTest {

    private final ScalingPlan plan = ScalingPlan.defaults();

    @Test
    @DisplayName("Should size default stages from the bankroll")
    void shouldSizeDefaultStages() {
        BigDecimal bankroll = new BigDecimal("10000");

        assertEquals(4, plan.size());
        assertThat(plan.investmentFor(1, bankroll)).isEqualByComparingTo("100");
        assertThat(plan.investmentFor(2, bankroll)).isEqualByComparingTo("200");
        assertThat(plan.investmentFor(3, bankroll)).isEqualByComparingTo("400");
        assertThat(plan.investmentFor(4, bankroll)).isEqualByComparingTo("800");
    }

    @Test
    @DisplayName("Should step leverage down from 20x to 2x")
    void shouldStepLeverageDown() {
        assertThat(plan.getStages())
                .extracting(ScalePlanStage::getLeverage)
                .usingElementComparator(BigDecimal::compareTo)
                .containsExactly(new BigDecimal("20"), new BigDecimal("10"), new BigDecimal("5"), new BigDecimal("2"));
    }

    @Test
    @DisplayName("Should not plan beyond its last stage")
    void shouldNotPlanBeyondLastStage() {
        assertTrue(plan.stageFor(5).isEmpty());
        assertTrue(plan.stageFor(0).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> plan.investmentFor(5, BigDecimal.TEN));
    }

    @Test
    @DisplayName("Should reject stages out of order")
    void shouldRejectMisnumberedStages() {
        ScalePlanStage second = ScalePlanStage.builder()
                .stageNumber(2)
                .bankrollFraction(new BigDecimal("0.02"))
                .leverage(BigDecimal.TEN)
                .build();

        assertThrows(IllegalArgumentException.class, () -> new ScalingPlan(List.of(second)));
        assertThrows(IllegalArgumentException.class, () -> new ScalingPlan(List.of()));
    }

    @Test
    @DisplayName("Should require a planned size for every allowed stage")
    void shouldRequireCoverageOfMaxStages() {
        assertSame(plan, plan.requireCovers(4));
        assertSame(plan, plan.requireCovers(3));
        assertThrows(IllegalArgumentException.class, () -> plan.requireCovers(5));
    }
}
