package com.polymarket.stoploss.event;

import com.polymarket.stoploss.domain.Position;

import java.time.Instant;

/**
 * A liquidation attempt threw instead of returning a result.
 */
public record ExecutionError(Instant timestamp, Position position, String message) implements StopLossEvent {
}
