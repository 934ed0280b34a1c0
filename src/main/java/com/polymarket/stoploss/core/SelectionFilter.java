package com.polymarket.stoploss.core;

import com.polymarket.stoploss.domain.Position;
import com.polymarket.stoploss.domain.StopLossConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
@Component
public class SelectionFilter {

    public record SelectionResult(List<Position> monitored, Set<String> missingTokenIds) {

        static SelectionResult empty() {
            return new SelectionResult(List.of(), Set.of());
        }
    }

    public SelectionResult filter(List<Position> positions, StopLossConfig config) {
        switch (config.effectiveSelectionMode()) {
            case ALL:
                return new SelectionResult(List.copyOf(positions), Set.of());
            case SELECTED:
                return filterSelected(positions, config.getSelectedTokenIds());
            case NONE:
            default:
                log.debug("Monitoring mode is NONE - no positions will be monitored");
                return SelectionResult.empty();
        }
    }

    private SelectionResult filterSelected(List<Position> positions, Set<String> selected) {
        List<Position> monitored = positions.stream()
                .filter(p -> selected.contains(p.getTokenId()))
                .toList();

        Set<String> present = monitored.stream()
                .map(Position::getTokenId)
                .collect(Collectors.toSet());

        Set<String> missing = new LinkedHashSet<>();
        for (String tokenId : selected) {
            if (!present.contains(tokenId)) {
                missing.add(tokenId);
                log.warn("Selected position {} not found in current portfolio (closed or no longer returned)", tokenId);
            }
        }
        return new SelectionResult(monitored, Collections.unmodifiableSet(missing));
    }
}
