package com.polymarket.stoploss.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.polymarket.stoploss.exception.AuthenticationException;

/**
 * L2 API key triple issued by the CLOB for a wallet.
 */
public record ApiCredentials(String apiKey, String secret, String passphrase) {

    public static ApiCredentials fromJson(JsonNode node) {
        String apiKey = node.path("apiKey").asText("");
        String secret = node.path("secret").asText("");
        String passphrase = node.path("passphrase").asText("");
        if (apiKey.isEmpty() || secret.isEmpty() || passphrase.isEmpty()) {
            throw new AuthenticationException("CLOB returned incomplete API credentials");
        }
        return new ApiCredentials(apiKey, secret, passphrase);
    }

    @Override
    public String toString() {
        return "ApiCredentials[apiKey=" + apiKey + "]";
    }
}
