package com.z254.agora.llm;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response object from chat completions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LLMResponse {

    /**
     * Unique ID for this response, when the backend reports one.
     */
    private String id;

    /**
     * Model used for generation.
     */
    private String model;

    /**
     * Provider ID.
     */
    private String providerId;

    /**
     * Generated content. Never null; an absent message body is the empty string.
     */
    @Builder.Default
    private String content = "";

    /**
     * Token usage statistics.
     */
    private Usage usage;

    /**
     * Generation latency in milliseconds, across all attempts.
     */
    private Long latencyMs;

    /**
     * Token usage statistics.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Usage {
        private int promptTokens;
        private int completionTokens;
        private int totalTokens;
    }

    /**
     * Total tokens consumed by the call, zero when the backend reported no usage.
     */
    public int getTotalTokens() {
        return usage != null ? usage.getTotalTokens() : 0;
    }
}
