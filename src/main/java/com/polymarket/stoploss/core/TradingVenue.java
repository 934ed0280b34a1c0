package com.polymarket.stoploss.core;

import com.polymarket.stoploss.domain.OrderBook;
import com.polymarket.stoploss.domain.OrderPlacement;
import com.polymarket.stoploss.domain.OrderStatus;

import java.math.BigDecimal;

/**
 * Everything the liquidation algorithm needs from the exchange. Transport failures surface as
 * {@link com.polymarket.stoploss.exception.VenueException}.
 */
public interface TradingVenue {

    OrderBook getOrderBook(String tokenId);

    /**
     * Submits a resting (GTC) sell order. A clean refusal by the venue is a non-accepted placement,
     * not an exception.
     */
    OrderPlacement placeSellOrder(String tokenId, BigDecimal price, BigDecimal size);

    OrderStatus getOrderStatus(String orderId);
}
