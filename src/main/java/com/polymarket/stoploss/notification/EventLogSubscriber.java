package com.polymarket.stoploss.notification;

import com.polymarket.stoploss.domain.ExecutionResult;
import com.polymarket.stoploss.domain.Position;
import com.polymarket.stoploss.event.BotStarted;
import com.polymarket.stoploss.event.CycleError;
import com.polymarket.stoploss.event.ExecutionError;
import com.polymarket.stoploss.event.LiquidationExecuted;
import com.polymarket.stoploss.event.TriggerFired;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Renders stop-loss events to the application log (console and rolling file).
 */
@Slf4j
@Component
public class EventLogSubscriber {

    @EventListener
    public void onTriggerFired(TriggerFired event) {
        Position p = event.position();
        log.warn("STOP LOSS TRIGGERED{}: {} ({}) - {} | P&L: {}% (${})",
                event.dryRun() ? " [DRY RUN]" : "", p.getMarketName(), p.getOutcome(),
                String.join(", ", event.reasons()), p.getPnlPercentage().stripTrailingZeros().toPlainString(),
                p.getPnl().toPlainString());
    }

    @EventListener
    public void onLiquidationExecuted(LiquidationExecuted event) {
        Position p = event.position();
        ExecutionResult r = event.result();
        if (r.isSuccess()) {
            log.info("Liquidation recorded for {} ({}): orders={} ordered={} remaining={}{}",
                    p.getMarketName(), p.getOutcome(), r.getOrdersPlaced(), r.getTotalSizeOrdered(),
                    r.getRemainingSize(), r.getError() != null ? " error=" + r.getError() : "");
        } else {
            log.error("Liquidation failed for {} ({}): {} (remaining {})",
                    p.getMarketName(), p.getOutcome(), r.getError(), r.getRemainingSize());
        }
    }

    @EventListener
    public void onExecutionError(ExecutionError event) {
        log.error("Execution error for {}: {}", event.position().displayId(), event.message());
    }

    @EventListener
    public void onCycleError(CycleError event) {
        log.error("Monitoring cycle failed ({} failed so far): {}", event.failedCycles(), event.message());
    }

    @EventListener
    public void onBotStarted(BotStarted event) {
        log.info("Stop loss bot started for {} at {}", event.userAddress(), event.timestamp());
    }
}
