package com.polymarket.stoploss.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Venue answer to a single order submission.
 */
@Value
@Builder
public class OrderPlacement {
    private boolean accepted;
    private String orderId;
    private String status;
    private String errorMessage;

    public static OrderPlacement rejected(String errorMessage) {
        return OrderPlacement.builder()
                .accepted(false)
                .errorMessage(errorMessage)
                .build();
    }
}
