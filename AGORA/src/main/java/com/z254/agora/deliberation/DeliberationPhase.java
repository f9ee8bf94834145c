package com.z254.agora.deliberation;

/**
 * States of the deliberation protocol. Each is entered at most once, in declaration order.
 */
public enum DeliberationPhase {
    R1_RUNNING(1, "Running independent analysis..."),
    R2_RUNNING(2, "Running cross-reading..."),
    R3_RUNNING(3, "Synthesizing results..."),
    DONE(3, "Deliberation complete");

    private final int round;
    private final String statusMessage;

    DeliberationPhase(int round, String statusMessage) {
        this.round = round;
        this.statusMessage = statusMessage;
    }

    public int getRound() {
        return round;
    }

    public String getStatusMessage() {
        return statusMessage;
    }
}
