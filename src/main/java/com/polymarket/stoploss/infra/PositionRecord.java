package com.polymarket.stoploss.infra;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.polymarket.stoploss.domain.Position;
import com.polymarket.stoploss.exception.MalformedPositionException;

import java.math.BigDecimal;

/**
 * Wire schema of one {@code /positions} element of the Data API. Every field is optional on the wire;
 * {@link #toPosition()} applies the defaults and rejects records that cannot be traded.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PositionRecord(
        String asset,
        String conditionId,
        String title,
        String outcome,
        BigDecimal size,
        BigDecimal avgPrice,
        BigDecimal currentValue,
        BigDecimal curPrice,
        BigDecimal initialValue
) {

    static final String DEFAULT_TITLE = "Unknown Market";
    static final String DEFAULT_OUTCOME = "Unknown";

    public Position toPosition() {
        if (asset == null || asset.isBlank()) {
            throw new MalformedPositionException("missing asset id");
        }
        BigDecimal resolvedSize = size != null ? size : BigDecimal.ZERO;
        BigDecimal resolvedPrice = curPrice != null ? curPrice : BigDecimal.ZERO;
        BigDecimal resolvedValue = currentValue != null ? currentValue : BigDecimal.ZERO;
        if (resolvedSize.signum() < 0) {
            throw new MalformedPositionException("negative size " + resolvedSize + " for " + asset);
        }
        if (resolvedPrice.signum() < 0) {
            throw new MalformedPositionException("negative price " + resolvedPrice + " for " + asset);
        }

        return Position.builder()
                .tokenId(asset.trim())
                .marketName(title == null || title.isBlank() ? DEFAULT_TITLE : title)
                .outcome(outcome == null || outcome.isBlank() ? DEFAULT_OUTCOME : outcome)
                .size(resolvedSize)
                .currentPrice(resolvedPrice)
                .currentValue(resolvedValue)
                .initialValue(initialValue != null ? initialValue : resolvedValue)
                .build();
    }
}
