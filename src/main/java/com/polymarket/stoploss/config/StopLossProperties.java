package com.polymarket.stoploss.config;

import com.polymarket.stoploss.domain.SelectionMode;
import com.polymarket.stoploss.domain.StopLossConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "stoploss")
public record StopLossProperties(
        @NotBlank(message = "stoploss.user-address (POLYMARKET_USER_ADDRESS) must be set") String userAddress,
        String dataApiUrl,
        @Positive @DecimalMax("100") BigDecimal stopLossPercentage,
        @Positive BigDecimal stopLossPrice,
        @Min(StopLossConfig.MIN_CHECK_INTERVAL_SECONDS) Integer checkIntervalSeconds,
        @PositiveOrZero BigDecimal minPositionValue,
        @PositiveOrZero BigDecimal maxSlippage,
        Boolean dryRun,
        SelectionMode selectionMode,
        String selectionFile,
        @Valid Execution execution,
        @Valid Clob clob,
        @Valid Ledger ledger,
        @Valid Telegram telegram
) {

    public StopLossProperties {
        if (dataApiUrl == null || dataApiUrl.isBlank()) {
            dataApiUrl = "https://data-api.polymarket.com";
        }
        if (stopLossPercentage == null) {
            stopLossPercentage = new BigDecimal("20");
        }
        if (checkIntervalSeconds == null) {
            checkIntervalSeconds = 60;
        }
        if (minPositionValue == null) {
            minPositionValue = new BigDecimal("0.1");
        }
        if (maxSlippage == null) {
            maxSlippage = new BigDecimal("0.05");
        }
        if (dryRun == null) {
            dryRun = true;
        }
        if (selectionMode == null) {
            selectionMode = SelectionMode.NONE;
        }
        if (selectionFile == null || selectionFile.isBlank()) {
            selectionFile = "selected_positions.json";
        }
        if (execution == null) {
            execution = Execution.defaults();
        }
        if (clob == null) {
            clob = new Clob(null, null, null, null, null, null);
        }
        if (ledger == null) {
            ledger = new Ledger(null);
        }
        if (telegram == null) {
            telegram = new Telegram(null, null, null);
        }
    }

    /**
     * Initial runtime configuration. The selection set is filled in later from the selection file.
     */
    public StopLossConfig toStopLossConfig() {
        return StopLossConfig.builder()
                .stopLossPercentage(stopLossPercentage)
                .stopLossPrice(stopLossPrice)
                .checkIntervalSeconds(checkIntervalSeconds)
                .minPositionValue(minPositionValue)
                .maxSlippage(maxSlippage)
                .dryRun(dryRun)
                .selectionMode(selectionMode)
                .build();
    }

    /**
     * Policy constants of the chunked sell algorithm.
     */
    public record Execution(
            @Positive BigDecimal maxChunkSize,
            @PositiveOrZero BigDecimal dustThreshold,
            @Min(0) Integer maxRetriesPerChunk,
            Duration settleDelay,
            @Positive BigDecimal priceFloor,
            @Positive BigDecimal noBidDiscount,
            @Positive BigDecimal bookErrorDiscount,
            @Positive BigDecimal rejectionDiscount,
            @Positive BigDecimal exceptionDiscount,
            @Positive BigDecimal finalSweepDiscount
    ) {
        public Execution {
            if (maxChunkSize == null) {
                maxChunkSize = new BigDecimal("50");
            }
            if (dustThreshold == null) {
                dustThreshold = new BigDecimal("0.1");
            }
            if (maxRetriesPerChunk == null) {
                maxRetriesPerChunk = 5;
            }
            if (settleDelay == null || settleDelay.isNegative()) {
                settleDelay = Duration.ofSeconds(2);
            }
            if (priceFloor == null) {
                priceFloor = new BigDecimal("0.001");
            }
            if (noBidDiscount == null) {
                noBidDiscount = new BigDecimal("0.95");
            }
            if (bookErrorDiscount == null) {
                bookErrorDiscount = new BigDecimal("0.90");
            }
            if (rejectionDiscount == null) {
                rejectionDiscount = new BigDecimal("0.95");
            }
            if (exceptionDiscount == null) {
                exceptionDiscount = new BigDecimal("0.90");
            }
            if (finalSweepDiscount == null) {
                finalSweepDiscount = new BigDecimal("0.50");
            }
        }

        public static Execution defaults() {
            return new Execution(null, null, null, null, null, null, null, null, null, null);
        }
    }

    public record Clob(
            String url,
            String privateKey,
            String funderAddress, // Proxy wallet holding the positions; empty for plain EOA trading
            @Min(0) Integer signatureType,
            @Positive Long chainId,
            @Min(2) Integer priceDecimals
    ) {
        public Clob {
            if (url == null || url.isBlank()) {
                url = "https://clob.polymarket.com";
            }
            if (signatureType == null) {
                signatureType = 1;
            }
            if (chainId == null) {
                chainId = 137L;
            }
            if (priceDecimals == null) {
                priceDecimals = 3;
            }
        }

        public boolean hasPrivateKey() {
            return privateKey != null && !privateKey.isBlank();
        }
    }

    public record Ledger(String path) {
        public Ledger {
            if (path == null || path.isBlank()) {
                path = "stop_loss_executions.jsonl";
            }
        }
    }

    public record Telegram(String botToken, String chatId, String apiUrl) {
        public Telegram {
            if (apiUrl == null || apiUrl.isBlank()) {
                apiUrl = "https://api.telegram.org";
            }
        }

        public boolean enabled() {
            return botToken != null && !botToken.isBlank() && chatId != null && !chatId.isBlank();
        }
    }
}
