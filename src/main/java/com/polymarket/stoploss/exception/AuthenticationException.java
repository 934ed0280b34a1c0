package com.polymarket.stoploss.exception;

/**
 * Trading credentials are missing or were refused. Fatal at startup.
 */
public class AuthenticationException extends RuntimeException {

    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
