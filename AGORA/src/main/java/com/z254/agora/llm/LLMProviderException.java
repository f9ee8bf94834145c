package com.z254.agora.llm;

import lombok.Getter;

/**
 * Failure of a single backend chat-completion call.
 */
@Getter
public class LLMProviderException extends RuntimeException {

    /** HTTP status returned by the backend, null for transport failures. */
    private final Integer statusCode;

    /** Whether the failure is eligible for the bounded retry policy. */
    private final boolean retryable;

    public LLMProviderException(String message, Integer statusCode, boolean retryable) {
        super(message);
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    public LLMProviderException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.statusCode = null;
        this.retryable = retryable;
    }

    public static LLMProviderException rateLimited(String body) {
        return new LLMProviderException("Rate limited: " + body, 429, true);
    }

    public static LLMProviderException httpStatus(int status, String body) {
        return new LLMProviderException("Chat completion failed: " + body, status, false);
    }

    public static LLMProviderException emptyChoices() {
        return new LLMProviderException("No response choices returned", null, false);
    }

    public static LLMProviderException timeout(Throwable cause) {
        return new LLMProviderException("Request timed out", true, cause);
    }

    public static LLMProviderException transport(Throwable cause) {
        return new LLMProviderException("HTTP error: " + cause.getMessage(), true, cause);
    }
}
