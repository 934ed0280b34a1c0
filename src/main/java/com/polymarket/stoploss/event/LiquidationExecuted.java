package com.polymarket.stoploss.event;

import com.polymarket.stoploss.domain.ExecutionResult;
import com.polymarket.stoploss.domain.Position;

import java.time.Instant;

public record LiquidationExecuted(Instant timestamp, Position position, ExecutionResult result)
        implements StopLossEvent {
}
