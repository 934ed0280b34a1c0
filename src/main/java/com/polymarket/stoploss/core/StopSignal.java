package com.polymarket.stoploss.core;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag. Checked between monitoring cycles and between chunk attempts,
 * never in the middle of a network call.
 */
@Slf4j
@Component
public class StopSignal {

    private final AtomicBoolean requested = new AtomicBoolean(false);

    public void request() {
        if (requested.compareAndSet(false, true)) {
            log.info("Stop requested, monitoring will end after the current step");
        }
    }

    public boolean isRequested() {
        return requested.get();
    }

    @EventListener(ContextClosedEvent.class)
    public void onContextClosed() {
        request();
    }
}
