package com.z254.agora.deliberation;

/**
 * The backend provider cannot be used at all, e.g. its credential is missing.
 * Raised before any round runs.
 */
public class ProviderConfigurationException extends RuntimeException {

    public ProviderConfigurationException(String message) {
        super(message);
    }
}
