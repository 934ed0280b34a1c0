package com.polymarket.stoploss.notification;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polymarket.stoploss.config.StopLossProperties;
import com.polymarket.stoploss.domain.ExecutionResult;
import com.polymarket.stoploss.domain.Position;
import com.polymarket.stoploss.event.CycleError;
import com.polymarket.stoploss.event.LiquidationExecuted;
import com.polymarket.stoploss.event.TriggerFired;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TelegramNotifierTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<Request> requests = new ArrayList<>();
    private final List<String> bodies = new ArrayList<>();
    private int responseCode = 200;

    private final OkHttpClient httpClient = new OkHttpClient.Builder()
            .addInterceptor(chain -> {
                Request request = chain.request();
                Buffer buffer = new Buffer();
                request.body().writeTo(buffer);
                requests.add(request);
                bodies.add(buffer.readUtf8());
                return new Response.Builder()
                        .request(request)
                        .protocol(Protocol.HTTP_1_1)
                        .code(responseCode)
                        .message("status")
                        .body(ResponseBody.create("{\"ok\":true}", MediaType.get("application/json")))
                        .build();
            })
            .build();

    @Test
    void disabledNotifierSendsNothing() {
        TelegramNotifier notifier = notifier(new StopLossProperties.Telegram(null, null, null));

        notifier.onEvent(new CycleError(NOW, "HTTP 503", 1));

        assertThat(requests).isEmpty();
    }

    @Test
    void triggerIsSentAsHtmlMessage() throws Exception {
        TelegramNotifier notifier = notifier(new StopLossProperties.Telegram("123:abc", "42", "https://telegram.test"));

        notifier.onEvent(new TriggerFired(NOW, position("Over <5> goals & more"), List.of("Loss: -30.00%"), false));

        assertThat(requests).hasSize(1);
        assertThat(requests.get(0).url().encodedPath()).isEqualTo("/bot123:abc/sendMessage");
        JsonNode payload = objectMapper.readTree(bodies.get(0));
        assertThat(payload.path("chat_id").asText()).isEqualTo("42");
        assertThat(payload.path("parse_mode").asText()).isEqualTo("HTML");
        assertThat(payload.path("text").asText())
                .contains("<b>STOP LOSS TRIGGERED</b>")
                .contains("Over &lt;5&gt; goals &amp; more")
                .contains("-30.00% ($-30.00)")
                .contains("2025-03-01 12:00:00");
    }

    @Test
    void failedSendIsDroppedQuietly() {
        responseCode = 502;
        TelegramNotifier notifier = notifier(new StopLossProperties.Telegram("t", "c", "https://telegram.test"));

        assertThat(notifier.send("hello")).isFalse();
        assertThat(requests).hasSize(1);
    }

    @Test
    void executionMessageSummarisesOrders() {
        TelegramNotifier notifier = notifier(new StopLossProperties.Telegram("t", "c", "https://telegram.test"));
        ExecutionResult result = ExecutionResult.builder()
                .success(true)
                .ordersPlaced(2)
                .attemptedSize(new BigDecimal("100"))
                .totalSizeOrdered(new BigDecimal("100"))
                .remainingSize(BigDecimal.ZERO)
                .receipts(List.of())
                .build();

        String text = notifier.render(new LiquidationExecuted(NOW, position("Rain"), result));

        assertThat(text).contains("STOP LOSS EXECUTED").contains("Orders Placed:</b> 2")
                .contains("Ordered Size:</b> 100").doesNotContain("Error");
    }

    private TelegramNotifier notifier(StopLossProperties.Telegram telegram) {
        return new TelegramNotifier(httpClient, objectMapper, telegram, ZoneOffset.UTC);
    }

    private static Position position(String market) {
        return Position.builder()
                .tokenId("9")
                .marketName(market)
                .outcome("Yes")
                .size(new BigDecimal("100"))
                .currentPrice(new BigDecimal("0.7"))
                .currentValue(new BigDecimal("70"))
                .initialValue(new BigDecimal("100"))
                .build();
    }
}
