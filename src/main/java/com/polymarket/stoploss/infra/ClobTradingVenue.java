package com.polymarket.stoploss.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.polymarket.stoploss.config.StopLossProperties;
import com.polymarket.stoploss.core.TradingVenue;
import com.polymarket.stoploss.domain.OrderBook;
import com.polymarket.stoploss.domain.OrderPlacement;
import com.polymarket.stoploss.domain.OrderStatus;
import com.polymarket.stoploss.exception.AuthenticationException;
import com.polymarket.stoploss.exception.VenueException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.web3j.crypto.Credentials;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;

@Slf4j
@Service
public class ClobTradingVenue implements TradingVenue {

    private static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";
    private static final BigDecimal TOKEN_UNIT = new BigDecimal("1000000"); // USDC and outcome tokens: 6 decimals
    private static final int SIDE_SELL = 1;
    private static final int EOA_SIGNATURE_TYPE = 0;

    private final ClobApiClient apiClient;
    private final OrderSigner orderSigner;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Credentials credentials;
    private final String makerAddress;
    private final int signatureType;
    private final int priceDecimals;
    private final Map<String, Boolean> negRiskByToken = new ConcurrentHashMap<>();

    private volatile ApiCredentials apiCredentials;

    @Autowired
    public ClobTradingVenue(StopLossProperties properties, ClobApiClient apiClient, OrderSigner orderSigner,
                            ObjectMapper objectMapper) {
        this(properties.clob(), properties.dryRun(), apiClient, orderSigner, objectMapper, Clock.systemUTC());
    }

    ClobTradingVenue(StopLossProperties.Clob clob, boolean dryRun, ClobApiClient apiClient, OrderSigner orderSigner,
                     ObjectMapper objectMapper, Clock clock) {
        this.apiClient = apiClient;
        this.orderSigner = orderSigner;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.signatureType = clob.signatureType();
        this.priceDecimals = clob.priceDecimals();

        if (!clob.hasPrivateKey()) {
            if (!dryRun) {
                throw new AuthenticationException("PRIVATE_KEY is not configured; live trading cannot start");
            }
            this.credentials = null;
            this.makerAddress = null;
            log.warn("No private key provided. Venue is in WATCH-ONLY mode.");
            return;
        }

        try {
            this.credentials = Credentials.create(clob.privateKey().trim());
        } catch (RuntimeException e) {
            throw new AuthenticationException("PRIVATE_KEY is not a valid secp256k1 key", e);
        }
        String funder = clob.funderAddress();
        boolean hasFunder = funder != null && !funder.isBlank();
        if (!hasFunder && signatureType != EOA_SIGNATURE_TYPE) {
            if (!dryRun) {
                throw new AuthenticationException("Signature type " + signatureType
                        + " requires FUNDER_ADDRESS (the proxy wallet); use signature type 0 for EOA trading");
            }
            log.warn("Signature type {} without FUNDER_ADDRESS: orders would be rejected in live mode", signatureType);
        }
        this.makerAddress = hasFunder ? funder.trim() : credentials.getAddress();
        log.info("Wallet loaded: signer={} maker={}", credentials.getAddress(), makerAddress);

        if (!dryRun) {
            this.apiCredentials = deriveApiCredentials();
            log.info("CLOB API credentials ready for {}", credentials.getAddress());
        }
    }

    @Override
    public OrderBook getOrderBook(String tokenId) {
        JsonNode bookNode = apiClient.getOrderBook(tokenId);
        return OrderBook.builder()
                .tokenId(tokenId)
                .bids(parseLevels(bookNode.path("bids")))
                .asks(parseLevels(bookNode.path("asks")))
                .build();
    }

    @Override
    public OrderPlacement placeSellOrder(String tokenId, BigDecimal price, BigDecimal size) {
        ApiCredentials auth = requireApiCredentials();

        BigDecimal roundedSize = size.setScale(2, RoundingMode.DOWN);
        BigDecimal minPrice = BigDecimal.ONE.movePointLeft(priceDecimals);
        BigDecimal roundedPrice = price.setScale(priceDecimals, RoundingMode.HALF_UP).max(minPrice);

        // SELL: we give tokens (maker) and want USDC (taker)
        BigInteger makerAmount = roundedSize.multiply(TOKEN_UNIT).toBigInteger();
        BigInteger takerAmount = roundedSize.multiply(roundedPrice).multiply(TOKEN_UNIT)
                .setScale(0, RoundingMode.DOWN).toBigInteger();

        if (makerAmount.signum() <= 0 || takerAmount.signum() <= 0) {
            log.warn("Skipping INVALID order for {}: Maker={}, Taker={}", tokenId, makerAmount, takerAmount);
            return OrderPlacement.rejected("Order amounts round to zero");
        }

        OrderSigner.Order order = OrderSigner.Order.builder()
                .salt(BigInteger.valueOf(ThreadLocalRandom.current().nextLong(1, Integer.MAX_VALUE)))
                .maker(makerAddress)
                .signer(credentials.getAddress())
                .taker(ZERO_ADDRESS)
                .tokenId(parseTokenId(tokenId))
                .makerAmount(makerAmount)
                .takerAmount(takerAmount)
                .expiration(BigInteger.ZERO) // GTC orders never expire
                .nonce(BigInteger.ZERO)
                .feeRateBps(BigInteger.ZERO)
                .side(SIDE_SELL)
                .signatureType(signatureType)
                .build();

        String signature = orderSigner.signOrder(order, isNegRisk(tokenId), credentials);
        String payload = orderPayload(order, signature, auth.apiKey());
        Map<String, String> headers = ClobAuthHeaders.level2(credentials.getAddress(), auth, epochSeconds(),
                "POST", ClobApiClient.ORDER_PATH, payload);

        log.info("[REAL-EXECUTION] Submitting SELL order: {} tokens of {} @ {}", roundedSize, tokenId, roundedPrice);
        ClobApiClient.ClobResponse response = apiClient.postOrder(payload, headers);
        JsonNode body = response.body();

        if (response.isSuccessful() && body.path("success").asBoolean(false)) {
            return OrderPlacement.builder()
                    .accepted(true)
                    .orderId(textOrNull(body, "orderID"))
                    .status(textOrNull(body, "status"))
                    .build();
        }

        String error = textOrNull(body, "errorMsg");
        if (error == null) {
            error = textOrNull(body, "error");
        }
        return OrderPlacement.rejected(error != null ? error : "HTTP " + response.code());
    }

    @Override
    public OrderStatus getOrderStatus(String orderId) {
        ApiCredentials auth = requireApiCredentials();
        String path = "/data/order/" + orderId;
        Map<String, String> headers = ClobAuthHeaders.level2(credentials.getAddress(), auth, epochSeconds(),
                "GET", path, "");
        JsonNode node = apiClient.getOrder(orderId, headers);
        return OrderStatus.fromVenue(node.path("status").asText(null));
    }

    private ApiCredentials requireApiCredentials() {
        if (credentials == null) {
            throw new AuthenticationException("Venue is in WATCH-ONLY mode: no private key configured");
        }
        ApiCredentials current = apiCredentials;
        if (current == null) {
            synchronized (this) {
                if (apiCredentials == null) {
                    apiCredentials = deriveApiCredentials();
                }
                current = apiCredentials;
            }
        }
        return current;
    }

    private ApiCredentials deriveApiCredentials() {
        try {
            return ApiCredentials.fromJson(apiClient.deriveApiKey(
                    ClobAuthHeaders.level1(orderSigner, credentials, epochSeconds(), 0)));
        } catch (VenueException | AuthenticationException e) {
            log.info("No API key to derive ({}), creating one", e.getMessage());
        }

        try {
            ClobApiClient.ClobResponse created = apiClient.createApiKey(
                    ClobAuthHeaders.level1(orderSigner, credentials, epochSeconds(), 0));
            if (!created.isSuccessful()) {
                throw new AuthenticationException("CLOB refused API key creation: HTTP " + created.code());
            }
            return ApiCredentials.fromJson(created.body());
        } catch (VenueException e) {
            throw new AuthenticationException("Unable to obtain CLOB API credentials", e);
        }
    }

    private boolean isNegRisk(String tokenId) {
        Boolean cached = negRiskByToken.get(tokenId);
        if (cached != null) {
            return cached;
        }
        try {
            boolean negRisk = apiClient.getNegRisk(tokenId).path("neg_risk").asBoolean(false);
            negRiskByToken.put(tokenId, negRisk);
            return negRisk;
        } catch (VenueException e) {
            log.warn("Could not resolve neg-risk flag for {}, signing for the standard exchange: {}",
                    tokenId, e.getMessage());
            return false;
        }
    }

    private String orderPayload(OrderSigner.Order order, String signature, String owner) {
        ObjectNode orderNode = objectMapper.createObjectNode();
        orderNode.put("salt", order.getSalt().longValue());
        orderNode.put("maker", order.getMaker());
        orderNode.put("signer", order.getSigner());
        orderNode.put("taker", order.getTaker());
        orderNode.put("tokenId", order.getTokenId().toString());
        orderNode.put("makerAmount", order.getMakerAmount().toString());
        orderNode.put("takerAmount", order.getTakerAmount().toString());
        orderNode.put("expiration", order.getExpiration().toString());
        orderNode.put("nonce", order.getNonce().toString());
        orderNode.put("feeRateBps", order.getFeeRateBps().toString());
        orderNode.put("side", order.getSide() == 0 ? "BUY" : "SELL");
        orderNode.put("signatureType", order.getSignatureType());
        orderNode.put("signature", signature);

        ObjectNode payload = objectMapper.createObjectNode();
        payload.set("order", orderNode);
        payload.put("owner", owner);
        payload.put("orderType", "GTC");

        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new VenueException("Unable to serialize order payload", e);
        }
    }

    private static BigInteger parseTokenId(String tokenId) {
        try {
            return new BigInteger(tokenId);
        } catch (NumberFormatException e) {
            throw new VenueException("Token id is not a CLOB asset id: " + tokenId, e);
        }
    }

    private List<OrderBook.OrderLevel> parseLevels(JsonNode levelsNode) {
        List<OrderBook.OrderLevel> list = new ArrayList<>();
        if (levelsNode.isArray()) {
            for (JsonNode l : levelsNode) {
                list.add(OrderBook.OrderLevel.builder()
                        .price(new BigDecimal(l.path("price").asText("0")))
                        .size(new BigDecimal(l.path("size").asText("0")))
                        .build());
            }
        }
        return list;
    }

    private long epochSeconds() {
        return clock.instant().getEpochSecond();
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
