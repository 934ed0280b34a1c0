package com.polymarket.stoploss.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Outcome of one liquidation attempt. {@code success} means at least one order was accepted,
 * not that the whole position was sold.
 */
@Value
@Builder
public class ExecutionResult {
    private boolean success;
    private int ordersPlaced;
    private BigDecimal attemptedSize;
    private BigDecimal totalSizeOrdered;
    private BigDecimal remainingSize;
    private List<OrderReceipt> receipts;
    private String error;

    public static ExecutionResult refused(BigDecimal attemptedSize, String reason) {
        return ExecutionResult.builder()
                .success(false)
                .ordersPlaced(0)
                .attemptedSize(attemptedSize)
                .totalSizeOrdered(BigDecimal.ZERO)
                .remainingSize(attemptedSize)
                .receipts(List.of())
                .error(reason)
                .build();
    }
}
