package com.polymarket.stoploss.domain;

import java.util.Locale;

/**
 * Fill state reported by the CLOB for a resting order.
 */
public enum OrderStatus {
    LIVE,
    MATCHED,
    DELAYED,
    UNMATCHED,
    CANCELED,
    UNKNOWN;

    public static OrderStatus fromVenue(String status) {
        if (status == null || status.isBlank()) {
            return UNKNOWN;
        }
        String normalized = status.trim().toUpperCase(Locale.ROOT);
        if (normalized.equals("FILLED")) {
            return MATCHED;
        }
        if (normalized.equals("CANCELLED")) {
            return CANCELED;
        }
        try {
            return OrderStatus.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
