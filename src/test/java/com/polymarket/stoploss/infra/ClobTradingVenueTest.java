package com.polymarket.stoploss.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polymarket.stoploss.config.StopLossProperties;
import com.polymarket.stoploss.domain.OrderBook;
import com.polymarket.stoploss.domain.OrderPlacement;
import com.polymarket.stoploss.domain.OrderStatus;
import com.polymarket.stoploss.exception.AuthenticationException;
import okhttp3.Request;
import org.junit.jupiter.api.Test;
import org.web3j.crypto.Credentials;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClobTradingVenueTest {

    private static final String BASE_URL = "https://clob.test";
    private static final String PRIVATE_KEY = "0x4c0883a69102937d6231471b5dbb6204fe5129617082792ae468d01a3f362318";
    private static final String SECRET = "c2VjcmV0LXNlY3JldA==";
    private static final String CREDS = "{\"apiKey\":\"key-1\",\"secret\":\"" + SECRET + "\",\"passphrase\":\"pp\"}";
    private static final Instant NOW = Instant.ofEpochSecond(1_735_000_000L);

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void submitsSignedSellOrderWithL2Headers() throws Exception {
        CannedResponses http = new CannedResponses()
                .on("/auth/derive-api-key", 200, CREDS)
                .on("/neg-risk", 200, "{\"neg_risk\": true}")
                .on("/order", 200, "{\"success\": true, \"orderID\": \"0xabc\", \"status\": \"live\", \"errorMsg\": \"\"}");
        ClobTradingVenue venue = venue(http, PRIVATE_KEY, true);

        OrderPlacement placement = venue.placeSellOrder("123456", new BigDecimal("0.38"), new BigDecimal("50"));

        assertThat(placement.isAccepted()).isTrue();
        assertThat(placement.getOrderId()).isEqualTo("0xabc");
        assertThat(placement.getStatus()).isEqualTo("live");

        CannedResponses.Recorded sent = http.last("/order");
        JsonNode payload = objectMapper.readTree(sent.body());
        JsonNode order = payload.path("order");
        String signer = Credentials.create(PRIVATE_KEY).getAddress();
        assertThat(payload.path("owner").asText()).isEqualTo("key-1");
        assertThat(payload.path("orderType").asText()).isEqualTo("GTC");
        assertThat(order.path("tokenId").asText()).isEqualTo("123456");
        assertThat(order.path("makerAmount").asText()).isEqualTo("50000000");
        assertThat(order.path("takerAmount").asText()).isEqualTo("19000000");
        assertThat(order.path("side").asText()).isEqualTo("SELL");
        assertThat(order.path("signer").asText()).isEqualTo(signer);
        assertThat(order.path("maker").asText()).isEqualTo(signer);
        assertThat(order.path("signature").asText()).startsWith("0x").hasSize(132);

        Request request = sent.request();
        assertThat(request.header(ClobAuthHeaders.POLY_API_KEY)).isEqualTo("key-1");
        assertThat(request.header(ClobAuthHeaders.POLY_PASSPHRASE)).isEqualTo("pp");
        assertThat(request.header(ClobAuthHeaders.POLY_TIMESTAMP)).isEqualTo(Long.toString(NOW.getEpochSecond()));
        assertThat(request.header(ClobAuthHeaders.POLY_SIGNATURE)).isEqualTo(
                ClobAuthHeaders.hmacSignature(SECRET, NOW.getEpochSecond(), "POST", "/order", sent.body()));
    }

    @Test
    void roundsSizeDownAndPriceToTick() throws Exception {
        CannedResponses http = new CannedResponses()
                .on("/auth/derive-api-key", 200, CREDS)
                .on("/neg-risk", 200, "{\"neg_risk\": false}")
                .on("/order", 200, "{\"success\": true, \"orderID\": \"0xdef\", \"status\": \"matched\"}");
        ClobTradingVenue venue = venue(http, PRIVATE_KEY, true);

        venue.placeSellOrder("123456", new BigDecimal("0.3846"), new BigDecimal("10.129"));

        JsonNode order = objectMapper.readTree(http.last("/order").body()).path("order");
        // 10.12 tokens at 0.385
        assertThat(order.path("makerAmount").asText()).isEqualTo("10120000");
        assertThat(order.path("takerAmount").asText()).isEqualTo("3896200");
    }

    @Test
    void venueRejectionCarriesErrorMessage() {
        CannedResponses http = new CannedResponses()
                .on("/auth/derive-api-key", 200, CREDS)
                .on("/neg-risk", 200, "{\"neg_risk\": false}")
                .on("/order", 400, "{\"success\": false, \"errorMsg\": \"not enough balance / allowance\"}");
        ClobTradingVenue venue = venue(http, PRIVATE_KEY, true);

        OrderPlacement placement = venue.placeSellOrder("123456", new BigDecimal("0.38"), new BigDecimal("5"));

        assertThat(placement.isAccepted()).isFalse();
        assertThat(placement.getErrorMessage()).isEqualTo("not enough balance / allowance");
    }

    @Test
    void sizeThatRoundsToZeroIsRejectedLocally() {
        CannedResponses http = new CannedResponses().on("/auth/derive-api-key", 200, CREDS);
        ClobTradingVenue venue = venue(http, PRIVATE_KEY, true);

        OrderPlacement placement = venue.placeSellOrder("123456", new BigDecimal("0.38"), new BigDecimal("0.004"));

        assertThat(placement.isAccepted()).isFalse();
        assertThat(http.requests()).noneMatch(r -> r.request().url().encodedPath().equals("/order"));
    }

    @Test
    void createsApiKeyWhenNoneCanBeDerived() {
        CannedResponses http = new CannedResponses()
                .on("/auth/derive-api-key", 404, "{\"error\": \"not found\"}")
                .on("/auth/api-key", 200, CREDS);

        venue(http, PRIVATE_KEY, null, 0, false);

        CannedResponses.Recorded created = http.last("/auth/api-key");
        assertThat(created.request().method()).isEqualTo("POST");
        assertThat(created.request().header(ClobAuthHeaders.POLY_ADDRESS))
                .isEqualTo(Credentials.create(PRIVATE_KEY).getAddress());
        assertThat(created.request().header(ClobAuthHeaders.POLY_NONCE)).isEqualTo("0");
    }

    @Test
    void liveTradingWithoutKeyFailsAtStartup() {
        CannedResponses http = new CannedResponses();

        assertThatThrownBy(() -> venue(http, null, false))
                .isInstanceOf(AuthenticationException.class)
                .hasMessageContaining("PRIVATE_KEY");
    }

    @Test
    void proxySignatureWithoutFunderFailsLiveStartup() {
        CannedResponses http = new CannedResponses().on("/auth/derive-api-key", 200, CREDS);

        assertThatThrownBy(() -> venue(http, PRIVATE_KEY, null, 1, false))
                .isInstanceOf(AuthenticationException.class)
                .hasMessageContaining("FUNDER_ADDRESS");
        assertThat(http.requests()).isEmpty();
    }

    @Test
    void proxySignatureSignsWithFunderAsMaker() throws Exception {
        String funder = "0x1111111111111111111111111111111111111111";
        CannedResponses http = new CannedResponses()
                .on("/auth/derive-api-key", 200, CREDS)
                .on("/neg-risk", 200, "{\"neg_risk\": false}")
                .on("/order", 200, "{\"success\": true, \"orderID\": \"0xabc\", \"status\": \"live\"}");
        ClobTradingVenue venue = venue(http, PRIVATE_KEY, funder, 1, false);

        venue.placeSellOrder("123456", new BigDecimal("0.38"), new BigDecimal("5"));

        JsonNode order = objectMapper.readTree(http.last("/order").body()).path("order");
        assertThat(order.path("maker").asText()).isEqualTo(funder);
        assertThat(order.path("signer").asText()).isEqualTo(Credentials.create(PRIVATE_KEY).getAddress());
        assertThat(order.path("signatureType").asInt()).isEqualTo(1);
    }

    @Test
    void watchOnlyVenueReadsBooksButCannotTrade() {
        CannedResponses http = new CannedResponses().on("/book", 200,
                "{\"bids\": [{\"price\": \"0.35\", \"size\": \"100\"}, {\"price\": \"0.38\", \"size\": \"20\"}], \"asks\": []}");
        ClobTradingVenue venue = venue(http, null, true);

        OrderBook book = venue.getOrderBook("123456");

        assertThat(book.bestBid()).hasValueSatisfying(p -> assertThat(p).isEqualByComparingTo("0.38"));
        assertThat(http.last("/book").request().url().queryParameter("token_id")).isEqualTo("123456");
        assertThatThrownBy(() -> venue.placeSellOrder("123456", BigDecimal.ONE, BigDecimal.ONE))
                .isInstanceOf(AuthenticationException.class);
    }

    @Test
    void orderStatusIsMappedFromVenueString() {
        CannedResponses http = new CannedResponses()
                .on("/auth/derive-api-key", 200, CREDS)
                .on("/data/order/0xabc", 200, "{\"id\": \"0xabc\", \"status\": \"MATCHED\"}");
        ClobTradingVenue venue = venue(http, PRIVATE_KEY, true);

        assertThat(venue.getOrderStatus("0xabc")).isEqualTo(OrderStatus.MATCHED);
        assertThat(http.last("/data/order/0xabc").request().header(ClobAuthHeaders.POLY_API_KEY)).isEqualTo("key-1");
    }

    private ClobTradingVenue venue(CannedResponses http, String privateKey, boolean dryRun) {
        return venue(http, privateKey, null, 1, dryRun);
    }

    private ClobTradingVenue venue(CannedResponses http, String privateKey, String funder, int signatureType,
                                   boolean dryRun) {
        StopLossProperties.Clob clob = new StopLossProperties.Clob(BASE_URL, privateKey, funder, signatureType,
                137L, 3);
        ClobApiClient apiClient = new ClobApiClient(http.client(), objectMapper, BASE_URL);
        return new ClobTradingVenue(clob, dryRun, apiClient, new OrderSigner(137L), objectMapper,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }
}
