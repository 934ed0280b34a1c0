package com.polymarket.stoploss.exception;

/**
 * A single Data API record failed boundary validation. The record is skipped, the fetch continues.
 */
public class MalformedPositionException extends RuntimeException {

    public MalformedPositionException(String message) {
        super(message);
    }
}
