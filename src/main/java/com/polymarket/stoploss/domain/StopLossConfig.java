package com.polymarket.stoploss.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Set;

/**
 * Immutable stop-loss settings. Every {@code with*} method validates its argument and returns a new value;
 * callers swap the result into {@code StopLossConfigHolder} instead of mutating shared state.
 */
@Value
@Builder(toBuilder = true)
public class StopLossConfig {

    public static final int MIN_CHECK_INTERVAL_SECONDS = 10;

    @Builder.Default
    private BigDecimal stopLossPercentage = new BigDecimal("20");
    private BigDecimal stopLossPrice; // Optional absolute floor
    @Builder.Default
    private int checkIntervalSeconds = 60;
    @Builder.Default
    private BigDecimal minPositionValue = new BigDecimal("0.1");
    @Builder.Default
    private BigDecimal maxSlippage = new BigDecimal("0.05"); // Advisory only
    @Builder.Default
    private boolean dryRun = true;
    @Builder.Default
    private SelectionMode selectionMode = SelectionMode.NONE;
    @Builder.Default
    private Set<String> selectedTokenIds = Set.of();

    /**
     * SELECTED with an empty id set monitors nothing, never everything.
     */
    public SelectionMode effectiveSelectionMode() {
        if (selectionMode == SelectionMode.SELECTED && (selectedTokenIds == null || selectedTokenIds.isEmpty())) {
            return SelectionMode.NONE;
        }
        return selectionMode;
    }

    public StopLossConfig withSelection(Set<String> tokenIds) {
        if (tokenIds == null || tokenIds.isEmpty()) {
            return monitorNone();
        }
        return toBuilder()
                .selectionMode(SelectionMode.SELECTED)
                .selectedTokenIds(Set.copyOf(tokenIds))
                .build();
    }

    public StopLossConfig monitorAll() {
        return toBuilder()
                .selectionMode(SelectionMode.ALL)
                .selectedTokenIds(Set.of())
                .build();
    }

    public StopLossConfig monitorNone() {
        return toBuilder()
                .selectionMode(SelectionMode.NONE)
                .selectedTokenIds(Set.of())
                .build();
    }

    public StopLossConfig withStopLossPercentage(BigDecimal percentage) {
        if (percentage == null || percentage.signum() <= 0 || percentage.compareTo(new BigDecimal("100")) > 0) {
            throw new IllegalArgumentException("Stop loss percentage must be in (0, 100]: " + percentage);
        }
        return toBuilder().stopLossPercentage(percentage).build();
    }

    public StopLossConfig withStopLossPrice(BigDecimal price) {
        if (price != null && price.signum() <= 0) {
            throw new IllegalArgumentException("Stop loss price must be positive: " + price);
        }
        return toBuilder().stopLossPrice(price).build();
    }

    public StopLossConfig withCheckIntervalSeconds(int seconds) {
        if (seconds < MIN_CHECK_INTERVAL_SECONDS) {
            throw new IllegalArgumentException(
                    "Check interval must be at least " + MIN_CHECK_INTERVAL_SECONDS + "s: " + seconds);
        }
        return toBuilder().checkIntervalSeconds(seconds).build();
    }

    public StopLossConfig withMinPositionValue(BigDecimal value) {
        if (value == null || value.signum() < 0) {
            throw new IllegalArgumentException("Minimum position value must not be negative: " + value);
        }
        return toBuilder().minPositionValue(value).build();
    }

    public StopLossConfig withDryRun(boolean dryRun) {
        return toBuilder().dryRun(dryRun).build();
    }
}
