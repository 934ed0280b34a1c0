package com.polymarket.stoploss.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * One row of a position snapshot. Refreshed wholesale every monitoring cycle;
 * only {@link #tokenId} carries identity across cycles.
 */
@Value
@Builder
public class Position {

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private String tokenId; // CLOB asset id of the outcome token
    private String marketName;
    private String outcome;
    private BigDecimal size; // Units held
    private BigDecimal currentPrice;
    private BigDecimal currentValue;
    private BigDecimal initialValue;

    public BigDecimal getPnl() {
        return currentValue.subtract(initialValue);
    }

    /**
     * P&L relative to the initial value, in percent. Zero when the initial value is not positive.
     */
    public BigDecimal getPnlPercentage() {
        if (initialValue.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return getPnl().multiply(HUNDRED).divide(initialValue, 8, RoundingMode.HALF_UP);
    }

    public String displayId() {
        if (marketName.length() > 30) {
            return marketName.substring(0, 30) + "..." + outcome;
        }
        return marketName + " - " + outcome;
    }
}
