package com.polymarket.stoploss.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polymarket.stoploss.config.StopLossProperties;
import com.polymarket.stoploss.core.PositionSnapshotProvider;
import com.polymarket.stoploss.domain.Position;
import com.polymarket.stoploss.domain.StopLossConfig;
import com.polymarket.stoploss.exception.MalformedPositionException;
import com.polymarket.stoploss.exception.SnapshotFetchException;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the account's open positions from the public Polymarket Data API (no authentication).
 */
@Slf4j
@Service
public class DataApiPositionProvider implements PositionSnapshotProvider {

    static final int RESULT_LIMIT = 100;

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final HttpUrl baseUrl;
    private final String userAddress;

    @Autowired
    public DataApiPositionProvider(OkHttpClient httpClient, ObjectMapper objectMapper, StopLossProperties properties) {
        this(httpClient, objectMapper, properties.dataApiUrl(), properties.userAddress());
    }

    DataApiPositionProvider(OkHttpClient httpClient, ObjectMapper objectMapper, String baseUrl, String userAddress) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = HttpUrl.get(baseUrl);
        this.userAddress = userAddress;
    }

    @Override
    public List<Position> fetchPositions(StopLossConfig config) {
        HttpUrl url = baseUrl.newBuilder()
                .addPathSegment("positions")
                .addQueryParameter("sizeThreshold", config.getMinPositionValue().toPlainString())
                .addQueryParameter("limit", String.valueOf(RESULT_LIMIT))
                .addQueryParameter("sortDirection", "DESC")
                .addQueryParameter("user", userAddress)
                .build();

        Request request = new Request.Builder()
                .url(url)
                .header("Accept", "application/json")
                .build();

        JsonNode rawPositions;
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new SnapshotFetchException("Failed to fetch positions: HTTP " + response.code());
            }
            ResponseBody body = response.body();
            rawPositions = objectMapper.readTree(body != null ? body.string() : "");
        } catch (IOException e) {
            throw new SnapshotFetchException("Failed to fetch positions: " + e.getMessage(), e);
        }

        if (rawPositions == null || !rawPositions.isArray()) {
            throw new SnapshotFetchException("Data API returned a non-array positions payload");
        }

        List<Position> positions = new ArrayList<>();
        int index = 0;
        for (JsonNode raw : rawPositions) {
            try {
                Position position = objectMapper.treeToValue(raw, PositionRecord.class).toPosition();
                if (position.getCurrentValue().compareTo(config.getMinPositionValue()) >= 0) {
                    positions.add(position);
                }
            } catch (JsonProcessingException | MalformedPositionException e) {
                log.warn("Skipping malformed position record #{}: {}", index, e.getMessage());
            }
            index++;
        }
        log.debug("Fetched {} positions ({} raw records) for {}", positions.size(), rawPositions.size(), userAddress);
        return positions;
    }
}
