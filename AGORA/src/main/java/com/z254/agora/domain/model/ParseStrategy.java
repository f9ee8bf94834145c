package com.z254.agora.domain.model;

/**
 * Which extraction tier produced a {@link DeliberationResult}.
 */
public enum ParseStrategy {
    /** JSON found inside a fenced {@code json} code block. */
    FENCED,
    /** Unfenced JSON object found by its opening key. */
    RAW,
    /** No decodable JSON; verdict taken from the first paragraph. */
    FALLBACK
}
