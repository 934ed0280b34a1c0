package com.polymarket.stoploss.event;

import com.polymarket.stoploss.domain.Position;

import java.time.Instant;
import java.util.List;

public record TriggerFired(Instant timestamp, Position position, List<String> reasons, boolean dryRun)
        implements StopLossEvent {

    public TriggerFired {
        reasons = List.copyOf(reasons);
    }
}
