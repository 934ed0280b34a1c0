package com.polymarket.stoploss.event;

import com.polymarket.stoploss.domain.StopLossConfig;

import java.time.Instant;

public record BotStarted(Instant timestamp, String userAddress, StopLossConfig config) implements StopLossEvent {
}
