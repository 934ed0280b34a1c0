package com.polymarket.stoploss.exception;

/**
 * A single CLOB call (book query, order submission, status poll) failed at the transport level.
 * Recoverable: callers reprice or fall back.
 */
public class VenueException extends RuntimeException {

    public VenueException(String message) {
        super(message);
    }

    public VenueException(String message, Throwable cause) {
        super(message, cause);
    }
}
