package com.polymarket.stoploss.core;

import com.polymarket.stoploss.config.StopLossProperties;
import com.polymarket.stoploss.domain.SelectionMode;
import com.polymarket.stoploss.domain.StopLossConfig;
import com.polymarket.stoploss.infra.SelectionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Owns the current {@link StopLossConfig}. Readers take a snapshot with {@link #current()} and keep it for
 * the whole operation; writers go through {@link #update(UnaryOperator)}.
 */
@Slf4j
@Component
public class StopLossConfigHolder {

    private final SelectionStore selectionStore;
    private volatile StopLossConfig current;

    @Autowired
    public StopLossConfigHolder(StopLossProperties properties, SelectionStore selectionStore) {
        this(initialConfig(properties.toStopLossConfig(), selectionStore.load()), selectionStore);
    }

    StopLossConfigHolder(StopLossConfig initial, SelectionStore selectionStore) {
        this.current = initial;
        this.selectionStore = selectionStore;
    }

    /**
     * A saved selection wins over the configured mode unless the operator asked for ALL explicitly.
     */
    static StopLossConfig initialConfig(StopLossConfig configured, Set<String> savedSelection) {
        if (configured.getSelectionMode() == SelectionMode.ALL) {
            return configured.monitorAll();
        }
        if (!savedSelection.isEmpty()) {
            log.info("Loaded {} previously selected positions", savedSelection.size());
            return configured.withSelection(savedSelection);
        }
        if (configured.getSelectionMode() == SelectionMode.SELECTED) {
            log.warn("Selection mode is SELECTED but no positions are saved; nothing will be monitored");
        }
        return configured.monitorNone();
    }

    public StopLossConfig current() {
        return current;
    }

    public synchronized StopLossConfig update(UnaryOperator<StopLossConfig> change) {
        StopLossConfig before = current;
        StopLossConfig after = change.apply(before);
        if (!after.getSelectedTokenIds().equals(before.getSelectedTokenIds())) {
            selectionStore.save(after.getSelectedTokenIds());
        }
        current = after;
        log.info("Configuration updated: mode={} selected={} stopLoss={}% stopLossPrice={} interval={}s dryRun={}",
                after.effectiveSelectionMode(), after.getSelectedTokenIds().size(), after.getStopLossPercentage(),
                after.getStopLossPrice(), after.getCheckIntervalSeconds(), after.isDryRun());
        return after;
    }
}
