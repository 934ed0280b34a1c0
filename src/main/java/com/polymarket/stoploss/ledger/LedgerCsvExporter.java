package com.polymarket.stoploss.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Flattens a JSON Lines execution ledger into one CSV row per liquidation attempt.
 */
@Slf4j
public class LedgerCsvExporter {

    public static final String HEADER = "timestamp,market,outcome,size,value,pnl,pnl_percentage,orders_placed,"
            + "total_size_ordered,remaining_size,order_success,avg_sale_price,min_sale_price,max_sale_price";

    private static final int PRICE_SCALE = 6;

    private final ObjectMapper objectMapper;

    public LedgerCsvExporter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @return number of data rows written
     */
    public int export(Path ledger, Path csv) throws IOException {
        if (!Files.exists(ledger)) {
            throw new IOException("Ledger file not found: " + ledger);
        }
        Path parent = csv.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        int rows = 0;
        int lineNumber = 0;
        try (BufferedReader reader = Files.newBufferedReader(ledger, StandardCharsets.UTF_8);
             BufferedWriter writer = Files.newBufferedWriter(csv, StandardCharsets.UTF_8)) {
            writer.write(HEADER);
            writer.newLine();

            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                JsonNode entry;
                try {
                    entry = objectMapper.readTree(line);
                } catch (JsonProcessingException e) {
                    log.warn("Skipping malformed ledger line {} in {}: {}", lineNumber, ledger, e.getOriginalMessage());
                    continue;
                }
                if (!entry.isObject()) {
                    log.warn("Skipping ledger line {} in {}: not a JSON object", lineNumber, ledger);
                    continue;
                }
                writer.write(toRow(entry));
                writer.newLine();
                rows++;
            }
        }
        log.info("Exported {} ledger entries from {} to {}", rows, ledger, csv);
        return rows;
    }

    String toRow(JsonNode entry) {
        JsonNode position = entry.path("position");
        JsonNode result = entry.path("order_result");

        StringJoiner row = new StringJoiner(",");
        row.add(text(entry, "timestamp"));
        row.add(text(position, "market"));
        row.add(text(position, "outcome"));
        row.add(number(position, "size"));
        row.add(number(position, "value"));
        row.add(number(position, "pnl"));
        row.add(number(position, "pnl_percentage"));
        row.add(number(result, "orders_placed"));
        row.add(number(result, "total_size_ordered"));
        row.add(number(result, "remaining_size"));
        row.add(Boolean.toString(result.path("success").asBoolean(false)));

        PriceStats stats = PriceStats.of(result.path("order_details"));
        row.add(stats == null ? "" : format(stats.average()));
        row.add(stats == null ? "" : format(stats.min()));
        row.add(stats == null ? "" : format(stats.max()));
        return row.toString();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return "";
        }
        return value.asText().replace(',', ';').replace('\n', ' ');
    }

    private static String number(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return "0";
        }
        return value.isNumber() ? value.decimalValue().toPlainString() : value.asText();
    }

    private static String format(BigDecimal value) {
        return value.setScale(PRICE_SCALE, RoundingMode.HALF_UP).toPlainString();
    }

    record PriceStats(BigDecimal average, BigDecimal min, BigDecimal max) {

        static PriceStats of(JsonNode details) {
            if (!details.isArray()) {
                return null;
            }
            List<BigDecimal> prices = new ArrayList<>();
            List<BigDecimal> sizes = new ArrayList<>();
            for (JsonNode order : details) {
                JsonNode price = order.path("price");
                if (!price.isNumber()) {
                    continue;
                }
                prices.add(price.decimalValue());
                JsonNode size = order.path("size");
                if (size.isNumber()) {
                    sizes.add(size.decimalValue());
                }
            }
            if (prices.isEmpty()) {
                return null;
            }

            BigDecimal min = prices.stream().reduce(BigDecimal::min).orElseThrow();
            BigDecimal max = prices.stream().reduce(BigDecimal::max).orElseThrow();
            BigDecimal totalSize = sizes.stream().reduce(BigDecimal.ZERO, BigDecimal::add);

            BigDecimal average;
            if (sizes.size() == prices.size() && totalSize.signum() > 0) {
                BigDecimal notional = BigDecimal.ZERO;
                for (int i = 0; i < prices.size(); i++) {
                    notional = notional.add(prices.get(i).multiply(sizes.get(i)));
                }
                average = notional.divide(totalSize, PRICE_SCALE, RoundingMode.HALF_UP);
            } else {
                average = prices.stream().reduce(BigDecimal.ZERO, BigDecimal::add)
                        .divide(BigDecimal.valueOf(prices.size()), PRICE_SCALE, RoundingMode.HALF_UP);
            }
            return new PriceStats(average, min, max);
        }
    }
}
