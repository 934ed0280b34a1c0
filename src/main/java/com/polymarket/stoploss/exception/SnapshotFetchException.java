package com.polymarket.stoploss.exception;

public class SnapshotFetchException extends RuntimeException {

    public SnapshotFetchException(String message) {
        super(message);
    }

    public SnapshotFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
