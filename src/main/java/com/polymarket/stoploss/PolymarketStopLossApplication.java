package com.polymarket.stoploss;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polymarket.stoploss.ledger.LedgerCsvExporter;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.io.IOException;
import java.nio.file.Path;

@SpringBootApplication
@EnableScheduling
public class PolymarketStopLossApplication {

    static final String EXPORT_LEDGER_ARG = "--export-ledger=";
    static final String LEDGER_ARG = "--ledger=";
    static final String DEFAULT_LEDGER = "stop_loss_executions.jsonl";

    public static void main(String[] args) {
        System.setProperty("java.net.preferIPv4Stack", "true"); // Often helpful for OkHttp

        String exportTarget = argument(args, EXPORT_LEDGER_ARG);
        if (exportTarget != null) {
            String ledger = argument(args, LEDGER_ARG);
            System.exit(exportLedger(Path.of(ledger != null ? ledger : DEFAULT_LEDGER), Path.of(exportTarget)));
        }

        SpringApplication.run(PolymarketStopLossApplication.class, args);
    }

    static int exportLedger(Path ledger, Path csv) {
        try {
            int rows = new LedgerCsvExporter(new ObjectMapper()).export(ledger, csv);
            System.out.println("Exported " + rows + " executions to " + csv);
            return 0;
        } catch (IOException e) {
            System.err.println("Ledger export failed: " + e.getMessage());
            return 1;
        }
    }

    static String argument(String[] args, String prefix) {
        for (String arg : args) {
            if (arg.startsWith(prefix) && arg.length() > prefix.length()) {
                return arg.substring(prefix.length());
            }
        }
        return null;
    }
}
