package com.polymarket.stoploss.core;

import com.polymarket.stoploss.domain.Position;
import com.polymarket.stoploss.domain.StopLossConfig;
import com.polymarket.stoploss.domain.TriggerDecision;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Decides whether a monitored position must be liquidated. Percentage and price conditions are checked
 * independently and both reasons are reported when both hold. Boundaries are inclusive.
 */
@Component
public class TriggerEvaluator {

    public TriggerDecision evaluate(Position position, StopLossConfig config) {
        List<String> reasons = new ArrayList<>(2);

        BigDecimal pnlPercentage = position.getPnlPercentage();
        if (pnlPercentage.compareTo(config.getStopLossPercentage().negate()) <= 0) {
            reasons.add(String.format(Locale.ROOT, "Loss: %.2f%%", pnlPercentage));
        }

        BigDecimal stopLossPrice = config.getStopLossPrice();
        if (stopLossPrice != null && position.getCurrentPrice().compareTo(stopLossPrice) <= 0) {
            reasons.add(String.format(Locale.ROOT, "Price: $%.3f <= $%.3f", position.getCurrentPrice(), stopLossPrice));
        }

        return reasons.isEmpty() ? TriggerDecision.notTriggered() : TriggerDecision.triggered(reasons);
    }
}
