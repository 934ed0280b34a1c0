package com.polymarket.stoploss.core;

import com.polymarket.stoploss.config.StopLossProperties;
import com.polymarket.stoploss.domain.ExecutionResult;
import com.polymarket.stoploss.domain.Position;
import com.polymarket.stoploss.domain.StopLossConfig;
import com.polymarket.stoploss.domain.TriggerDecision;
import com.polymarket.stoploss.event.BotStarted;
import com.polymarket.stoploss.event.CycleError;
import com.polymarket.stoploss.event.ExecutionError;
import com.polymarket.stoploss.event.LiquidationExecuted;
import com.polymarket.stoploss.event.TriggerFired;
import com.polymarket.stoploss.ledger.ExecutionLedger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TriggerContext;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Outer control loop: snapshot, filter, evaluate, liquidate, record. Runs on Spring's single scheduler
 * thread; the delay between cycles is read from the current configuration before every wait.
 */
@Slf4j
@Service
public class MonitoringScheduler implements SchedulingConfigurer {

    private final String userAddress;
    private final StopLossConfigHolder configHolder;
    private final PositionSnapshotProvider snapshotProvider;
    private final SelectionFilter selectionFilter;
    private final TriggerEvaluator triggerEvaluator;
    private final OrderExecutor orderExecutor;
    private final ExecutionLedger ledger;
    private final ApplicationEventPublisher events;
    private final StopSignal stopSignal;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicLong completedCycles = new AtomicLong();
    private final AtomicLong failedCycles = new AtomicLong();

    @Autowired
    public MonitoringScheduler(StopLossProperties properties, StopLossConfigHolder configHolder,
                               PositionSnapshotProvider snapshotProvider, SelectionFilter selectionFilter,
                               TriggerEvaluator triggerEvaluator, OrderExecutor orderExecutor,
                               ExecutionLedger ledger, ApplicationEventPublisher events, StopSignal stopSignal) {
        this(properties.userAddress(), configHolder, snapshotProvider, selectionFilter, triggerEvaluator,
                orderExecutor, ledger, events, stopSignal, Clock.systemUTC());
    }

    MonitoringScheduler(String userAddress, StopLossConfigHolder configHolder,
                        PositionSnapshotProvider snapshotProvider, SelectionFilter selectionFilter,
                        TriggerEvaluator triggerEvaluator, OrderExecutor orderExecutor, ExecutionLedger ledger,
                        ApplicationEventPublisher events, StopSignal stopSignal, Clock clock) {
        this.userAddress = userAddress;
        this.configHolder = configHolder;
        this.snapshotProvider = snapshotProvider;
        this.selectionFilter = selectionFilter;
        this.triggerEvaluator = triggerEvaluator;
        this.orderExecutor = orderExecutor;
        this.ledger = ledger;
        this.events = events;
        this.stopSignal = stopSignal;
        this.clock = clock;
    }

    public record CycleReport(int positions, int monitored, int triggered, int liquidated) {

        static CycleReport failed() {
            return new CycleReport(0, 0, 0, 0);
        }
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        registrar.addTriggerTask(this::runCycle, this::nextExecution);
    }

    /**
     * First run is immediate. Returning null ends the schedule once a stop was requested.
     */
    Instant nextExecution(TriggerContext context) {
        if (stopSignal.isRequested()) {
            log.info("Stop requested, no further monitoring cycles will be scheduled");
            return null;
        }
        Instant lastCompletion = context.lastCompletion();
        if (lastCompletion == null) {
            return clock.instant();
        }
        return lastCompletion.plusSeconds(configHolder.current().getCheckIntervalSeconds());
    }

    public CycleReport runCycle() {
        if (stopSignal.isRequested()) {
            return CycleReport.failed();
        }
        announceStart();

        StopLossConfig config = configHolder.current();
        long cycle = completedCycles.get() + failedCycles.get() + 1;
        log.debug("Monitoring cycle {} starting", cycle);
        try {
            List<Position> positions = snapshotProvider.fetchPositions(config);
            SelectionFilter.SelectionResult selection = selectionFilter.filter(positions, config);

            List<Position> triggered = new ArrayList<>();
            List<TriggerDecision> decisions = new ArrayList<>();
            for (Position position : selection.monitored()) {
                TriggerDecision decision = triggerEvaluator.evaluate(position, config);
                if (decision.isTriggered()) {
                    triggered.add(position);
                    decisions.add(decision);
                }
            }

            logSummary(positions, selection.monitored(), triggered, config);

            int liquidated = 0;
            for (int i = 0; i < triggered.size(); i++) {
                if (stopSignal.isRequested()) {
                    log.warn("Stop requested, skipping {} remaining triggered positions", triggered.size() - i);
                    break;
                }
                if (handleTrigger(triggered.get(i), decisions.get(i), config)) {
                    liquidated++;
                }
            }

            completedCycles.incrementAndGet();
            return new CycleReport(positions.size(), selection.monitored().size(), triggered.size(), liquidated);
        } catch (RuntimeException e) {
            long failed = failedCycles.incrementAndGet();
            log.error("Error in monitoring cycle {} ({} failed so far): {}", cycle, failed, e.getMessage(), e);
            events.publishEvent(new CycleError(clock.instant(), describe(e), failed));
            return CycleReport.failed();
        }
    }

    public long getFailedCycles() {
        return failedCycles.get();
    }

    public long getCompletedCycles() {
        return completedCycles.get();
    }

    private boolean handleTrigger(Position position, TriggerDecision decision, StopLossConfig config) {
        events.publishEvent(new TriggerFired(clock.instant(), position, decision.getReasons(), config.isDryRun()));

        if (config.isDryRun()) {
            log.info("DRY RUN: Would sell {} of {} ({}) at ~${}", position.getSize(), position.getMarketName(),
                    position.getOutcome(), position.getCurrentPrice());
            return false;
        }

        ExecutionResult result;
        try {
            result = orderExecutor.execute(position);
        } catch (RuntimeException e) {
            log.error("Failed to execute stop loss for {} (size {}, price {}): {}", position.displayId(),
                    position.getSize(), position.getCurrentPrice(), e.getMessage(), e);
            events.publishEvent(new ExecutionError(clock.instant(), position, describe(e)));
            return false;
        }

        if (OrderExecutor.IN_FLIGHT_ERROR.equals(result.getError())) {
            return false;
        }
        ledger.record(position, result);
        events.publishEvent(new LiquidationExecuted(clock.instant(), position, result));
        return result.isSuccess();
    }

    private void announceStart() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        StopLossConfig config = configHolder.current();
        log.info("Starting Polymarket stop loss monitor for {}", userAddress);
        log.info("Stop loss: {}%{} | check interval: {}s | min position value: ${} | max slippage: {}",
                config.getStopLossPercentage().toPlainString(),
                config.getStopLossPrice() != null ? " or price <= $" + config.getStopLossPrice().toPlainString() : "",
                config.getCheckIntervalSeconds(), config.getMinPositionValue().toPlainString(),
                config.getMaxSlippage().toPlainString());
        log.info("Monitoring mode: {} ({} selected)", config.effectiveSelectionMode(),
                config.getSelectedTokenIds().size());
        if (config.isDryRun()) {
            log.warn("DRY RUN MODE - No actual trades will be executed");
        }
        events.publishEvent(new BotStarted(clock.instant(), userAddress, config));
    }

    private void logSummary(List<Position> positions, List<Position> monitored, List<Position> triggered,
                            StopLossConfig config) {
        if (positions.isEmpty()) {
            log.info("No positions found above minimum threshold");
            return;
        }
        Set<String> monitoredIds = new HashSet<>();
        monitored.forEach(p -> monitoredIds.add(p.getTokenId()));
        Set<String> triggeredIds = new HashSet<>();
        triggered.forEach(p -> triggeredIds.add(p.getTokenId()));

        log.info("POSITIONS SUMMARY ({} total, {} monitored, stop loss {}%)", positions.size(), monitored.size(),
                config.getStopLossPercentage().toPlainString());

        BigDecimal totalValue = BigDecimal.ZERO;
        BigDecimal totalPnl = BigDecimal.ZERO;
        for (Position p : positions) {
            boolean isMonitored = monitoredIds.contains(p.getTokenId());
            String status = !isMonitored ? "-" : (triggeredIds.contains(p.getTokenId()) ? "TRIGGER" : "OK");
            log.info("  [{}] {} | price ${} | size {} | value ${} | P&L ${} ({}%) | {}",
                    isMonitored ? "M" : " ", p.displayId(), p.getCurrentPrice(), p.getSize(), p.getCurrentValue(),
                    p.getPnl(), p.getPnlPercentage().setScale(2, RoundingMode.HALF_UP), status);
            totalValue = totalValue.add(p.getCurrentValue());
            totalPnl = totalPnl.add(p.getPnl());
        }
        log.info("TOTAL value ${} | P&L ${} | triggered {}", totalValue, totalPnl, triggered.size());
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
