package com.z254.agora.deliberation;

/**
 * Deliberation input that is not a thesis plus exactly three backends.
 */
public class InvalidDeliberationRequestException extends IllegalArgumentException {

    public InvalidDeliberationRequestException(String message) {
        super(message);
    }
}
