package com.polymarket.stoploss.event;

import java.time.Instant;

/**
 * Structured notification emitted by the monitoring loop. Subscribers decide how to render it.
 */
public interface StopLossEvent {

    Instant timestamp();
}
