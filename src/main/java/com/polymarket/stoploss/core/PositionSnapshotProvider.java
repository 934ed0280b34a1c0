package com.polymarket.stoploss.core;

import com.polymarket.stoploss.domain.Position;
import com.polymarket.stoploss.domain.StopLossConfig;

import java.util.List;

public interface PositionSnapshotProvider {

    /**
     * Current positions worth at least {@code config.minPositionValue}. Individual malformed records are
     * skipped; a failed fetch throws {@link com.polymarket.stoploss.exception.SnapshotFetchException}.
     */
    List<Position> fetchPositions(StopLossConfig config);
}
