package com.polymarket.stoploss.domain;

import lombok.Value;

import java.util.List;

@Value
public class TriggerDecision {

    private static final TriggerDecision NOT_TRIGGERED = new TriggerDecision(false, List.of());

    private boolean triggered;
    private List<String> reasons;

    public static TriggerDecision notTriggered() {
        return NOT_TRIGGERED;
    }

    public static TriggerDecision triggered(List<String> reasons) {
        return new TriggerDecision(true, List.copyOf(reasons));
    }
}
