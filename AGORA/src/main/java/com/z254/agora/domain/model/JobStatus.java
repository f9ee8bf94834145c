package com.z254.agora.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of a deliberation job.
 */
public enum JobStatus {
    /**
     * Accepted, not yet picked up.
     */
    PENDING("pending"),

    /**
     * Rounds are executing.
     */
    RUNNING("running"),

    /**
     * A result is available.
     */
    COMPLETED("completed"),

    /**
     * The deliberation could not produce a result.
     */
    FAILED("failed");

    private final String value;

    JobStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
