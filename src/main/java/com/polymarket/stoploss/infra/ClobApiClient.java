package com.polymarket.stoploss.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polymarket.stoploss.config.StopLossProperties;
import com.polymarket.stoploss.exception.VenueException;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Thin REST binding to the Polymarket CLOB. Authentication headers are computed by the caller,
 * because the L2 signature covers the exact path and body sent here.
 */
@Slf4j
@Service
public class ClobApiClient {

    private static final MediaType JSON = MediaType.get("application/json");
    private static final int GET_RETRIES = 3;

    public static final String ORDER_PATH = "/order";

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final HttpUrl baseUrl;

    // Shared by every CLOB call: 4 requests per second
    private final RequestPacer pacer = new RequestPacer(4.0);

    @Autowired
    public ClobApiClient(OkHttpClient httpClient, ObjectMapper objectMapper, StopLossProperties properties) {
        this(httpClient, objectMapper, properties.clob().url());
    }

    ClobApiClient(OkHttpClient httpClient, ObjectMapper objectMapper, String baseUrl) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = HttpUrl.get(baseUrl);
    }

    /**
     * Raw venue answer. Non-2xx answers with a JSON body are returned rather than thrown,
     * since the CLOB reports order rejections that way.
     */
    public record ClobResponse(int code, JsonNode body) {
        public boolean isSuccessful() {
            return code >= 200 && code < 300;
        }
    }

    public JsonNode getOrderBook(String tokenId) {
        HttpUrl url = baseUrl.newBuilder()
                .addPathSegment("book")
                .addQueryParameter("token_id", tokenId)
                .build();
        return executeGet(url, Map.of());
    }

    public JsonNode getNegRisk(String tokenId) {
        HttpUrl url = baseUrl.newBuilder()
                .addPathSegment("neg-risk")
                .addQueryParameter("token_id", tokenId)
                .build();
        return executeGet(url, Map.of());
    }

    public JsonNode getOrder(String orderId, Map<String, String> authHeaders) {
        HttpUrl url = baseUrl.newBuilder()
                .addPathSegments("data/order")
                .addPathSegment(orderId)
                .build();
        return executeGet(url, authHeaders);
    }

    public JsonNode deriveApiKey(Map<String, String> l1Headers) {
        HttpUrl url = baseUrl.newBuilder().addPathSegments("auth/derive-api-key").build();
        return executeGet(url, l1Headers);
    }

    public ClobResponse createApiKey(Map<String, String> l1Headers) {
        return post("/auth/api-key", "", l1Headers);
    }

    public ClobResponse postOrder(String jsonPayload, Map<String, String> l2Headers) {
        return post(ORDER_PATH, jsonPayload, l2Headers);
    }

    private ClobResponse post(String path, String jsonPayload, Map<String, String> headers) {
        pacer.acquire();

        Request.Builder builder = new Request.Builder()
                .url(baseUrl.newBuilder().addPathSegments(path.substring(1)).build())
                .post(RequestBody.create(jsonPayload, JSON))
                .header("Accept", "application/json");
        headers.forEach(builder::header);

        try (Response response = httpClient.newCall(builder.build()).execute()) {
            String body = readBody(response);
            try {
                JsonNode node = body.isBlank() ? objectMapper.createObjectNode() : objectMapper.readTree(body);
                return new ClobResponse(response.code(), node);
            } catch (JsonProcessingException e) {
                throw new VenueException("POST " + path + " failed: " + response.code() + " " + body, e);
            }
        } catch (IOException e) {
            throw new VenueException("POST " + path + " failed", e);
        }
    }

    private JsonNode executeGet(HttpUrl url, Map<String, String> headers) {
        Request.Builder builder = new Request.Builder()
                .url(url)
                .header("Accept", "application/json");
        headers.forEach(builder::header);
        Request request = builder.build();

        for (int attempt = 1; attempt <= GET_RETRIES; attempt++) {
            pacer.acquire();
            try (Response response = httpClient.newCall(request).execute()) {
                if (response.code() == 429 && attempt < GET_RETRIES) {
                    backoff(1000L * attempt);
                    continue;
                }
                String body = readBody(response);
                if (!response.isSuccessful()) {
                    throw new VenueException("GET " + url.encodedPath() + " failed: " + response.code() + " " + body);
                }
                return objectMapper.readTree(body);
            } catch (JsonProcessingException e) {
                throw new VenueException("GET " + url.encodedPath() + " returned malformed JSON", e);
            } catch (IOException e) {
                if (attempt == GET_RETRIES) {
                    throw new VenueException("GET " + url.encodedPath() + " failed after " + GET_RETRIES + " attempts", e);
                }
                log.debug("Transient error on GET {} (attempt {}): {}", url.encodedPath(), attempt, e.getMessage());
                backoff(500L);
            }
        }
        throw new VenueException("GET " + url.encodedPath() + " exhausted retries");
    }

    private static String readBody(Response response) throws IOException {
        ResponseBody body = response.body();
        return body != null ? body.string() : "";
    }

    private static void backoff(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new VenueException("Interrupted while backing off", e);
        }
    }

    /**
     * Simple token bucket, burst of one.
     */
    /**
     * Spaces calls at least {@code 1 / requestsPerSecond} apart by handing out consecutive time slots.
     */
    private static final class RequestPacer {
        private final long intervalNanos;
        private long nextSlot = System.nanoTime();

        RequestPacer(double requestsPerSecond) {
            this.intervalNanos = (long) (TimeUnit.SECONDS.toNanos(1) / requestsPerSecond);
        }

        void acquire() {
            long slot;
            synchronized (this) {
                slot = Math.max(nextSlot, System.nanoTime());
                nextSlot = slot + intervalNanos;
            }
            long wait = slot - System.nanoTime();
            if (wait <= 0) {
                return;
            }
            try {
                TimeUnit.NANOSECONDS.sleep(wait);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
