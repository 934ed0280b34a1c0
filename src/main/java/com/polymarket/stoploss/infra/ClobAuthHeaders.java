package com.polymarket.stoploss.infra;

import com.polymarket.stoploss.exception.AuthenticationException;
import org.web3j.crypto.Credentials;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the CLOB authentication headers.
 * L1 proves wallet ownership with an EIP-712 signature; L2 signs each request with the API secret.
 */
public final class ClobAuthHeaders {

    public static final String POLY_ADDRESS = "POLY_ADDRESS";
    public static final String POLY_SIGNATURE = "POLY_SIGNATURE";
    public static final String POLY_TIMESTAMP = "POLY_TIMESTAMP";
    public static final String POLY_NONCE = "POLY_NONCE";
    public static final String POLY_API_KEY = "POLY_API_KEY";
    public static final String POLY_PASSPHRASE = "POLY_PASSPHRASE";

    private ClobAuthHeaders() {
    }

    public static Map<String, String> level1(OrderSigner signer, Credentials credentials, long timestamp, long nonce) {
        String address = credentials.getAddress();
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(POLY_ADDRESS, address);
        headers.put(POLY_SIGNATURE, signer.signClobAuth(address, timestamp, nonce, credentials));
        headers.put(POLY_TIMESTAMP, Long.toString(timestamp));
        headers.put(POLY_NONCE, Long.toString(nonce));
        return headers;
    }

    public static Map<String, String> level2(String address, ApiCredentials apiCredentials, long timestamp,
                                             String method, String requestPath, String body) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(POLY_ADDRESS, address);
        headers.put(POLY_SIGNATURE, hmacSignature(apiCredentials.secret(), timestamp, method, requestPath, body));
        headers.put(POLY_TIMESTAMP, Long.toString(timestamp));
        headers.put(POLY_API_KEY, apiCredentials.apiKey());
        headers.put(POLY_PASSPHRASE, apiCredentials.passphrase());
        return headers;
    }

    // url-safe base64 of HMAC-SHA256(base64url-decoded secret, timestamp + method + path + body)
    static String hmacSignature(String secret, long timestamp, String method, String requestPath, String body) {
        String message = timestamp + method + requestPath + (body != null ? body : "");
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(Base64.getUrlDecoder().decode(secret), "HmacSHA256"));
            byte[] digest = mac.doFinal(message.getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().encodeToString(digest);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new AuthenticationException("Unable to sign CLOB request with the configured API secret", e);
        }
    }
}
