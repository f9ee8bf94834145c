package com.z254.agora.deliberation;

/**
 * Notified once before each round starts, with rounds 1, 2 and 3 in order.
 * Implementations must not throw; the engine does not guard against it.
 */
@FunctionalInterface
public interface DeliberationProgressListener {

    DeliberationProgressListener NOOP = (round, statusMessage) -> { };

    void onProgress(int round, String statusMessage);
}
