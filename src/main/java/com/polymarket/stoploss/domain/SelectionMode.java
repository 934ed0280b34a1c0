package com.polymarket.stoploss.domain;

public enum SelectionMode {
    NONE, // Nothing is monitored
    ALL,
    SELECTED // Only the configured token ids
}
