package com.polymarket.stoploss.core;

import com.polymarket.stoploss.domain.Position;
import com.polymarket.stoploss.domain.StopLossConfig;
import com.polymarket.stoploss.domain.TriggerDecision;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TriggerEvaluatorTest {

    private final TriggerEvaluator evaluator = new TriggerEvaluator();
    private final StopLossConfig config = StopLossConfig.builder().build(); // 20% threshold

    @Test
    void lossJustAboveThresholdDoesNotTrigger() {
        // P&L% = -19.9
        TriggerDecision decision = evaluator.evaluate(position("100", "80.1", "0.40"), config);

        assertFalse(decision.isTriggered());
        assertTrue(decision.getReasons().isEmpty());
    }

    @Test
    void lossExactlyAtThresholdTriggers() {
        // P&L% = -20.0, boundary is inclusive
        TriggerDecision decision = evaluator.evaluate(position("100", "80", "0.40"), config);

        assertTrue(decision.isTriggered());
        assertEquals(List.of("Loss: -20.00%"), decision.getReasons());
    }

    @Test
    void priceFloorTriggersIndependentlyOfLoss() {
        StopLossConfig withPrice = config.withStopLossPrice(new BigDecimal("0.15"));

        TriggerDecision decision = evaluator.evaluate(position("10", "10", "0.10"), withPrice);

        assertTrue(decision.isTriggered());
        assertEquals(List.of("Price: $0.100 <= $0.150"), decision.getReasons());
    }

    @Test
    void bothReasonsAreReportedWhenBothHold() {
        StopLossConfig withPrice = config.withStopLossPrice(new BigDecimal("0.15"));

        TriggerDecision decision = evaluator.evaluate(position("100", "25", "0.10"), withPrice);

        assertTrue(decision.isTriggered());
        assertEquals(2, decision.getReasons().size());
        assertTrue(decision.getReasons().get(0).startsWith("Loss: -75.00%"));
        assertTrue(decision.getReasons().get(1).startsWith("Price:"));
    }

    @Test
    void priceAboveFloorDoesNotTrigger() {
        StopLossConfig withPrice = config.withStopLossPrice(new BigDecimal("0.15"));

        assertFalse(evaluator.evaluate(position("10", "10", "0.16"), withPrice).isTriggered());
    }

    @Test
    void zeroInitialValueCanOnlyBePriceTriggered() {
        Position free = position("0", "5", "0.05");
        assertEquals(0, free.getPnlPercentage().signum());

        assertFalse(evaluator.evaluate(free, config).isTriggered());
        assertTrue(evaluator.evaluate(free, config.withStopLossPrice(new BigDecimal("0.10"))).isTriggered());
    }

    private static Position position(String initialValue, String currentValue, String price) {
        return Position.builder()
                .tokenId("123")
                .marketName("Fed cuts rates in December?")
                .outcome("No")
                .size(new BigDecimal("100"))
                .currentPrice(new BigDecimal(price))
                .currentValue(new BigDecimal(currentValue))
                .initialValue(new BigDecimal(initialValue))
                .build();
    }
}
