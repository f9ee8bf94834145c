package com.z254.agora.api;

import lombok.Value;

import java.time.Instant;

/**
 * Error body returned by every API failure.
 */
@Value
public class ApiError {
    String error;
    String message;
    String details;
    Instant timestamp;
}
