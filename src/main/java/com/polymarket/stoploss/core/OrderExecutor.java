package com.polymarket.stoploss.core;

import com.polymarket.stoploss.config.StopLossProperties;
import com.polymarket.stoploss.domain.ExecutionResult;
import com.polymarket.stoploss.domain.OrderBook;
import com.polymarket.stoploss.domain.OrderPlacement;
import com.polymarket.stoploss.domain.OrderReceipt;
import com.polymarket.stoploss.domain.OrderStatus;
import com.polymarket.stoploss.domain.Position;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Liquidity-seeking chunked sell of one position.
 *
 * <p>The working price starts at the best bid (or a discount to the indicative price when the book is empty or
 * unavailable) and is lowered after every rejection. Chunks are capped at {@code maxChunkSize}. When one chunk
 * collects more than {@code maxRetriesPerChunk} consecutive rejections, a single final order for everything that
 * is left goes out at a deep discount.
 *
 * <p>Accepted size counts as sold. Fill status is polled after each acceptance but only logged.
 */
@Slf4j
@Service
public class OrderExecutor {

    public static final String NO_ORDERS_ERROR = "No orders could be placed";
    public static final String IN_FLIGHT_ERROR = "liquidation already in progress";
    public static final String CANCELLED_ERROR = "cancelled";

    private static final int PRICE_SCALE = 6;

    public enum ExecutionState {
        PRICE_DISCOVERY,
        CHUNK_ATTEMPT,
        FINAL_SWEEP,
        DONE,
        PARTIALLY_FILLED,
        FAILED
    }

    private final TradingVenue venue;
    private final StopLossProperties.Execution policy;
    private final StopSignal stopSignal;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    @Autowired
    public OrderExecutor(TradingVenue venue, StopLossProperties properties, StopSignal stopSignal) {
        this(venue, properties.execution(), stopSignal);
    }

    public OrderExecutor(TradingVenue venue, StopLossProperties.Execution policy, StopSignal stopSignal) {
        this.venue = venue;
        this.policy = policy;
        this.stopSignal = stopSignal;
    }

    // Mutable per-attempt state; never escapes execute()
    private static final class OrderChunk {
        private BigDecimal remaining;
        private BigDecimal workingPrice;
        private int consecutiveRejections;

        private OrderChunk(BigDecimal remaining, BigDecimal workingPrice) {
            this.remaining = remaining;
            this.workingPrice = workingPrice;
        }
    }

    public ExecutionResult execute(Position position) {
        String tokenId = position.getTokenId();
        if (!inFlight.add(tokenId)) {
            log.warn("[EXECUTION] Liquidation of {} ({}) already in progress, refusing a second attempt",
                    position.displayId(), tokenId);
            return ExecutionResult.refused(position.getSize(), IN_FLIGHT_ERROR);
        }
        try {
            return liquidate(position);
        } finally {
            inFlight.remove(tokenId);
        }
    }

    public boolean isInFlight(String tokenId) {
        return inFlight.contains(tokenId);
    }

    private ExecutionResult liquidate(Position position) {
        String tokenId = position.getTokenId();
        BigDecimal originalSize = position.getSize();
        log.info("--- START LIQUIDATION: {} | token={} size={} currentPrice={} ---",
                position.displayId(), tokenId, originalSize, position.getCurrentPrice());

        ExecutionState state = ExecutionState.PRICE_DISCOVERY;
        OrderChunk chunk = new OrderChunk(originalSize, discoverPrice(position));

        List<OrderReceipt> receipts = new ArrayList<>();
        BigDecimal totalOrdered = BigDecimal.ZERO;
        boolean cancelled = false;
        int attempt = 0;

        state = ExecutionState.CHUNK_ATTEMPT;
        while (chunk.remaining.compareTo(policy.dustThreshold()) > 0) {
            if (stopSignal.isRequested() || Thread.currentThread().isInterrupted()) {
                log.warn("[EXECUTION] Stop requested during {} with {} of {} left", state, chunk.remaining, tokenId);
                cancelled = true;
                break;
            }
            if (chunk.consecutiveRejections > policy.maxRetriesPerChunk()) {
                log.warn("[EXECUTION] {} consecutive rejections for {} at {}, giving up on chunking",
                        chunk.consecutiveRejections, tokenId, chunk.workingPrice);
                break;
            }

            BigDecimal size = chunk.remaining.min(policy.maxChunkSize());
            attempt++;
            log.info("[EXECUTION] State: {} | Attempt {}: SELL {} of {} @ {}",
                    state, attempt, size, tokenId, chunk.workingPrice);

            OrderPlacement placement;
            try {
                placement = venue.placeSellOrder(tokenId, chunk.workingPrice, size);
            } catch (RuntimeException e) {
                chunk.consecutiveRejections++;
                BigDecimal previous = chunk.workingPrice;
                chunk.workingPrice = discount(previous, policy.exceptionDiscount());
                log.warn("[EXECUTION] Exception placing order for {} @ {} (attempt {}, rejection {}): {}. Repricing to {}",
                        tokenId, previous, attempt, chunk.consecutiveRejections, e.getMessage(), chunk.workingPrice);
                continue;
            }

            if (!placement.isAccepted()) {
                chunk.consecutiveRejections++;
                BigDecimal previous = chunk.workingPrice;
                chunk.workingPrice = discount(previous, policy.rejectionDiscount());
                log.warn("[EXECUTION] Order rejected for {} @ {} (attempt {}, rejection {}): {}. Repricing to {}",
                        tokenId, previous, attempt, chunk.consecutiveRejections, placement.getErrorMessage(),
                        chunk.workingPrice);
                continue;
            }

            receipts.add(receipt(placement, chunk.workingPrice, size, false));
            totalOrdered = totalOrdered.add(size);
            chunk.remaining = chunk.remaining.subtract(size);
            chunk.consecutiveRejections = 0;
            log.info("[EXECUTION] Order {} placed: {} @ {} | ordered={} remaining={}",
                    placement.getOrderId(), size, chunk.workingPrice, totalOrdered, chunk.remaining);

            awaitSettleAndPoll(placement.getOrderId());
        }

        if (!cancelled && chunk.remaining.compareTo(policy.dustThreshold()) > 0) {
            state = ExecutionState.FINAL_SWEEP;
            BigDecimal finalPrice = discount(position.getCurrentPrice(), policy.finalSweepDiscount());
            log.warn("[EXECUTION] State: {} | {} of {} remaining, placing final low-price order @ {}",
                    state, chunk.remaining, tokenId, finalPrice);
            try {
                OrderPlacement placement = venue.placeSellOrder(tokenId, finalPrice, chunk.remaining);
                if (placement.isAccepted()) {
                    receipts.add(receipt(placement, finalPrice, chunk.remaining, true));
                    totalOrdered = totalOrdered.add(chunk.remaining);
                    chunk.remaining = BigDecimal.ZERO;
                    log.info("[EXECUTION] Final order {} placed for the remaining size @ {}",
                            placement.getOrderId(), finalPrice);
                } else {
                    log.error("[EXECUTION] Final order rejected for {} @ {}: {}",
                            tokenId, finalPrice, placement.getErrorMessage());
                }
            } catch (RuntimeException e) {
                log.error("[EXECUTION] Final order failed for {} @ {}: {}", tokenId, finalPrice, e.getMessage());
            }
        }

        boolean success = !receipts.isEmpty();
        if (!success) {
            state = ExecutionState.FAILED;
        } else if (chunk.remaining.compareTo(policy.dustThreshold()) > 0) {
            state = ExecutionState.PARTIALLY_FILLED;
        } else {
            state = ExecutionState.DONE;
        }

        if (success) {
            log.info("--- STOP LOSS EXECUTED [{}]: Placed {} orders for {} ({}). Target: {}, Ordered: {} ---",
                    state, receipts.size(), position.getMarketName(), position.getOutcome(), originalSize, totalOrdered);
        } else {
            log.error("--- STOP LOSS FAILED [{}]: no order accepted for {} ({}), size {} ---",
                    state, position.getMarketName(), position.getOutcome(), originalSize);
        }

        String error = cancelled ? CANCELLED_ERROR : (success ? null : NO_ORDERS_ERROR);
        return ExecutionResult.builder()
                .success(success)
                .ordersPlaced(receipts.size())
                .attemptedSize(originalSize)
                .totalSizeOrdered(totalOrdered)
                .remainingSize(originalSize.subtract(totalOrdered))
                .receipts(List.copyOf(receipts))
                .error(error)
                .build();
    }

    BigDecimal discoverPrice(Position position) {
        String tokenId = position.getTokenId();
        try {
            OrderBook book = venue.getOrderBook(tokenId);
            Optional<BigDecimal> bestBid = book != null ? book.bestBid() : Optional.empty();
            if (bestBid.isPresent()) {
                BigDecimal price = bestBid.get().max(policy.priceFloor());
                log.info("[EXECUTION] Using best bid price {} for {}", price, tokenId);
                return price;
            }
            BigDecimal price = discount(position.getCurrentPrice(), policy.noBidDiscount());
            log.info("[EXECUTION] No bids for {}, using discounted price {}", tokenId, price);
            return price;
        } catch (RuntimeException e) {
            BigDecimal price = discount(position.getCurrentPrice(), policy.bookErrorDiscount());
            log.warn("[EXECUTION] Could not get order book for {}: {}. Using fallback aggressive price {}",
                    tokenId, e.getMessage(), price);
            return price;
        }
    }

    private BigDecimal discount(BigDecimal price, BigDecimal factor) {
        return price.multiply(factor).setScale(PRICE_SCALE, RoundingMode.HALF_UP).max(policy.priceFloor());
    }

    private void awaitSettleAndPoll(String orderId) {
        if (!sleep(policy.settleDelay())) {
            return;
        }
        if (orderId == null) {
            return;
        }
        try {
            OrderStatus status = venue.getOrderStatus(orderId);
            if (status == OrderStatus.MATCHED) {
                log.info("[EXECUTION] Order {} filled completely", orderId);
            } else {
                log.info("[EXECUTION] Order {} status: {}", orderId, status);
            }
        } catch (RuntimeException e) {
            log.warn("[EXECUTION] Could not check order status for {}: {}", orderId, e.getMessage());
        }
    }

    private static boolean sleep(Duration delay) {
        if (delay.isZero()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static OrderReceipt receipt(OrderPlacement placement, BigDecimal price, BigDecimal size, boolean finalSweep) {
        return OrderReceipt.builder()
                .orderId(placement.getOrderId())
                .price(price)
                .size(size)
                .status(placement.getStatus())
                .finalSweep(finalSweep)
                .build();
    }
}
