package com.polymarket.stoploss.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.polymarket.stoploss.config.StopLossProperties;
import com.polymarket.stoploss.domain.ExecutionResult;
import com.polymarket.stoploss.domain.OrderReceipt;
import com.polymarket.stoploss.domain.Position;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only JSON Lines record of liquidation attempts. Never read back by the monitoring loop.
 */
@Slf4j
@Component
public class ExecutionLedger {

    private final ObjectMapper objectMapper;
    private final Path file;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    @Autowired
    public ExecutionLedger(ObjectMapper objectMapper, StopLossProperties properties) {
        this(objectMapper, Path.of(properties.ledger().path()), Clock.systemDefaultZone());
    }

    public ExecutionLedger(ObjectMapper objectMapper, Path file, Clock clock) {
        this.objectMapper = objectMapper;
        this.file = file;
        this.clock = clock;
    }

    public Path getFile() {
        return file;
    }

    /**
     * Appends one line. Failures are logged and swallowed so that a full disk never aborts a cycle.
     */
    public boolean record(Position position, ExecutionResult result) {
        String line;
        try {
            line = objectMapper.writeValueAsString(toEntry(clock.instant(), position, result));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize ledger entry for {}: {}", position.displayId(), e.getMessage());
            return false;
        }

        lock.lock();
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                writer.write(line);
                writer.newLine();
            }
            log.info("Stop loss execution logged to {}", file);
            return true;
        } catch (IOException e) {
            log.error("Failed to write ledger entry for {} to {}: {}", position.displayId(), file, e.getMessage());
            return false;
        } finally {
            lock.unlock();
        }
    }

    ObjectNode toEntry(Instant timestamp, Position position, ExecutionResult result) {
        ObjectNode entry = objectMapper.createObjectNode();
        entry.put("timestamp", timestamp.toString());

        ObjectNode pos = entry.putObject("position");
        pos.put("token_id", position.getTokenId());
        pos.put("market", position.getMarketName());
        pos.put("outcome", position.getOutcome());
        pos.put("size", position.getSize());
        pos.put("value", position.getCurrentValue());
        pos.put("pnl", position.getPnl());
        pos.put("pnl_percentage", position.getPnlPercentage());

        ObjectNode order = entry.putObject("order_result");
        order.put("success", result.isSuccess());
        order.put("orders_placed", result.getOrdersPlaced());
        order.put("attempted_size", result.getAttemptedSize());
        order.put("total_size_ordered", result.getTotalSizeOrdered());
        order.put("remaining_size", result.getRemainingSize());
        if (result.getError() != null) {
            order.put("error", result.getError());
        } else {
            order.putNull("error");
        }

        ArrayNode details = order.putArray("order_details");
        for (OrderReceipt receipt : result.getReceipts()) {
            ObjectNode d = details.addObject();
            d.put("order_id", receipt.getOrderId());
            d.put("price", receipt.getPrice());
            d.put("size", receipt.getSize());
            d.put("status", receipt.getStatus());
            d.put("final_sweep", receipt.isFinalSweep());
        }
        return entry;
    }
}
