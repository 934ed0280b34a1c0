package com.polymarket.stoploss.event;

import java.time.Instant;

public record CycleError(Instant timestamp, String message, long failedCycles) implements StopLossEvent {
}
