package com.polymarket.stoploss;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class PolymarketStopLossApplicationTest {

    @TempDir
    Path dir;

    @Test
    void readsPrefixedArguments() {
        String[] args = {"--spring.profiles.active=prod", "--export-ledger=out.csv", "--ledger="};

        assertThat(PolymarketStopLossApplication.argument(args, PolymarketStopLossApplication.EXPORT_LEDGER_ARG))
                .isEqualTo("out.csv");
        assertThat(PolymarketStopLossApplication.argument(args, PolymarketStopLossApplication.LEDGER_ARG)).isNull();
    }

    @Test
    void exportModeWritesCsvWithoutStartingTheMonitor() throws Exception {
        Path ledger = dir.resolve("ledger.jsonl");
        Files.writeString(ledger, "{\"timestamp\":\"t\",\"position\":{\"market\":\"M\"},\"order_result\":{}}\n");
        Path csv = dir.resolve("summary.csv");

        int exitCode = PolymarketStopLossApplication.exportLedger(ledger, csv);

        assertThat(exitCode).isZero();
        assertThat(Files.readAllLines(csv)).hasSize(2);
    }

    @Test
    void exportOfMissingLedgerFails() {
        assertThat(PolymarketStopLossApplication.exportLedger(dir.resolve("none.jsonl"), dir.resolve("x.csv")))
                .isEqualTo(1);
    }
}
