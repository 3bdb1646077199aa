package com.slotmonitor.api.dto;

import java.time.Instant;

/**
 * Error response body: error code, message, timestamp (ISO 8601). Used for 400 and 500 responses.
 */
public record ErrorBody(String error, String message, Instant timestamp) {

    public static ErrorBody of(String error, String message) {
        return new ErrorBody(error, message, Instant.now());
    }
}
