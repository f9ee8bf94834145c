package com.z254.agora.llm;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Request object for chat completions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LLMRequest {

    /**
     * Backend model identifier, e.g. {@code anthropic/claude-haiku-4.5}.
     */
    private String model;

    /**
     * Messages for the conversation.
     */
    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    /**
     * Temperature for sampling (0.0 - 2.0).
     */
    @Builder.Default
    private Double temperature = 0.7;

    /**
     * Maximum tokens to generate.
     */
    private Integer maxTokens;

    /**
     * A chat message.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Message {
        private String role;
        private String content;
    }

    public static Message userMessage(String content) {
        return Message.builder().role("user").content(content).build();
    }

    /**
     * Single-prompt request, the shape every deliberation call uses.
     */
    public static LLMRequest forPrompt(String model, String prompt, int maxTokens, double temperature) {
        return LLMRequest.builder()
                .model(model)
                .messages(new ArrayList<>(List.of(userMessage(prompt))))
                .maxTokens(maxTokens)
                .temperature(temperature)
                .build();
    }
}
