package com.example.autoheal.alert;

/**
 * Raised for a malformed alert. Batch ingestion skips the alert and carries on.
 */
public class IngestionException extends RuntimeException {

    public IngestionException(String message) {
        super(message);
    }
}
