package com.polymarket.stoploss.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.polymarket.stoploss.config.AsyncConfig;
import com.polymarket.stoploss.config.StopLossProperties;
import com.polymarket.stoploss.domain.ExecutionResult;
import com.polymarket.stoploss.domain.Position;
import com.polymarket.stoploss.domain.StopLossConfig;
import com.polymarket.stoploss.event.BotStarted;
import com.polymarket.stoploss.event.CycleError;
import com.polymarket.stoploss.event.ExecutionError;
import com.polymarket.stoploss.event.LiquidationExecuted;
import com.polymarket.stoploss.event.StopLossEvent;
import com.polymarket.stoploss.event.TriggerFired;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Pushes stop-loss events to a Telegram chat through the Bot API. Best effort: a failed send is logged
 * and dropped.
 */
@Slf4j
@Component
public class TelegramNotifier {

    private static final MediaType JSON = MediaType.get("application/json");
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final StopLossProperties.Telegram telegram;
    private final ZoneId zone;

    @Autowired
    public TelegramNotifier(OkHttpClient httpClient, ObjectMapper objectMapper, StopLossProperties properties) {
        this(httpClient, objectMapper, properties.telegram(), ZoneId.systemDefault());
    }

    TelegramNotifier(OkHttpClient httpClient, ObjectMapper objectMapper, StopLossProperties.Telegram telegram,
                     ZoneId zone) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.telegram = telegram;
        this.zone = zone;
        if (telegram.enabled()) {
            log.info("Telegram notifications enabled for chat {}", telegram.chatId());
        } else {
            log.info("Telegram notifications disabled (bot token or chat id not set)");
        }
    }

    @Async(AsyncConfig.NOTIFICATION_EXECUTOR)
    @EventListener
    public void onEvent(StopLossEvent event) {
        if (!telegram.enabled()) {
            return;
        }
        send(render(event));
    }

    boolean send(String text) {
        HttpUrl url = HttpUrl.get(telegram.apiUrl()).newBuilder()
                .addPathSegment("bot" + telegram.botToken())
                .addPathSegment("sendMessage")
                .build();

        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("chat_id", telegram.chatId());
        payload.put("text", text);
        payload.put("parse_mode", "HTML");
        payload.put("disable_web_page_preview", true);

        String body;
        try {
            body = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize Telegram message: {}", e.getMessage());
            return false;
        }

        Request request = new Request.Builder()
                .url(url)
                .post(RequestBody.create(body, JSON))
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                log.warn("Telegram API error: HTTP {}", response.code());
                return false;
            }
            log.debug("Telegram message sent");
            return true;
        } catch (IOException e) {
            log.warn("Failed to send Telegram message: {}", e.getMessage());
            return false;
        }
    }

    String render(StopLossEvent event) {
        String time = TIME_FORMAT.format(event.timestamp().atZone(zone));

        if (event instanceof TriggerFired fired) {
            Position p = fired.position();
            return "🚨 <b>STOP LOSS TRIGGERED</b>" + (fired.dryRun() ? " (DRY RUN)" : "") + "\n\n"
                    + "📊 <b>Market:</b> " + escape(p.getMarketName()) + "\n"
                    + "🎯 <b>Outcome:</b> " + escape(p.getOutcome()) + "\n"
                    + "📉 <b>Loss:</b> " + pct(p.getPnlPercentage()) + "% ($" + money(p.getPnl()) + ")\n"
                    + "📝 <b>Reason:</b> " + escape(String.join(", ", fired.reasons())) + "\n\n"
                    + "⏰ <b>Time:</b> " + time;
        }
        if (event instanceof LiquidationExecuted executed) {
            Position p = executed.position();
            ExecutionResult r = executed.result();
            String title = r.isSuccess() ? "✅ <b>STOP LOSS EXECUTED</b>" : "❌ <b>STOP LOSS FAILED</b>";
            String text = title + "\n\n"
                    + "📊 <b>Market:</b> " + escape(p.getMarketName()) + "\n"
                    + "🎯 <b>Outcome:</b> " + escape(p.getOutcome()) + "\n"
                    + "🔄 <b>Orders Placed:</b> " + r.getOrdersPlaced() + "\n"
                    + "📦 <b>Target Size:</b> " + r.getAttemptedSize().toPlainString() + "\n"
                    + "📦 <b>Ordered Size:</b> " + r.getTotalSizeOrdered().toPlainString() + "\n";
            if (r.getError() != null) {
                text += "⚠️ <b>Error:</b> " + escape(r.getError()) + "\n";
            }
            return text + "\n⏰ <b>Time:</b> " + time;
        }
        if (event instanceof ExecutionError error) {
            return "❌ <b>EXECUTION ERROR</b>\n\n"
                    + "📊 <b>Position:</b> " + escape(error.position().displayId()) + "\n"
                    + "⚠️ <b>Error:</b> " + escape(error.message()) + "\n\n"
                    + "⏰ <b>Time:</b> " + time;
        }
        if (event instanceof CycleError error) {
            return "⚠️ <b>MONITORING ERROR</b>\n\n"
                    + "❌ <b>Details:</b> " + escape(error.message()) + "\n"
                    + "🔁 <b>Failed cycles:</b> " + error.failedCycles() + "\n\n"
                    + "⏰ <b>Time:</b> " + time;
        }
        if (event instanceof BotStarted started) {
            StopLossConfig c = started.config();
            return "🚀 <b>BOT STARTED</b>\n\n"
                    + "👤 <b>User:</b> " + escape(started.userAddress()) + "\n"
                    + "🎯 <b>Stop Loss:</b> " + c.getStopLossPercentage().toPlainString() + "%"
                    + (c.getStopLossPrice() != null ? " / $" + c.getStopLossPrice().toPlainString() : "") + "\n"
                    + "👁 <b>Monitoring:</b> " + c.effectiveSelectionMode()
                    + " (" + c.getSelectedTokenIds().size() + " selected)\n"
                    + "🧪 <b>Dry Run:</b> " + c.isDryRun() + "\n\n"
                    + "⏰ <b>Started:</b> " + time;
        }
        return escape(event.toString()) + "\n\n⏰ " + time;
    }

    private static String pct(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    private static String money(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    static String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }
}
