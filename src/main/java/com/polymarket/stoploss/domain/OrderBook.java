package com.polymarket.stoploss.domain;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

@Data
@Builder
public class OrderBook {
    private String tokenId;

    // The CLOB does not guarantee level ordering, so best prices are computed, not indexed.
    private List<OrderLevel> bids;
    private List<OrderLevel> asks;

    @Data
    @Builder
    public static class OrderLevel {
        private BigDecimal price;
        private BigDecimal size;
    }

    /**
     * Highest price any counterparty is currently willing to pay.
     */
    public Optional<BigDecimal> bestBid() {
        if (bids == null || bids.isEmpty()) {
            return Optional.empty();
        }
        return bids.stream()
                .map(OrderLevel::getPrice)
                .filter(p -> p != null && p.signum() > 0)
                .max(Comparator.naturalOrder());
    }
}
