package com.z254.agora.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for AGORA service.
 */
@Data
@Component
@ConfigurationProperties(prefix = "agora")
public class AgoraProperties {

    private LLMProperties llm = new LLMProperties();
    private DeliberationProperties deliberation = new DeliberationProperties();
    private JobProperties jobs = new JobProperties();

    @Data
    public static class LLMProperties {
        private OpenRouterProperties openrouter = new OpenRouterProperties();

        @Data
        public static class OpenRouterProperties {
            private String apiKey;
            private String baseUrl = "https://openrouter.ai/api/v1";
            private String referer = "https://github.com/deliberate-api";
            private String title = "Deliberate API";
            /** Upper bound for a single attempt. */
            private Duration timeout = Duration.ofSeconds(300);
            /** Total attempts, including the first one. */
            private int maxAttempts = 3;
            private Duration initialBackoff = Duration.ofSeconds(2);
            private double backoffMultiplier = 2.0;
        }
    }

    @Data
    public static class DeliberationProperties {
        private List<String> defaultBackends = new ArrayList<>(List.of(
                "anthropic/claude-haiku-4.5",
                "liquid/lfm-2.5-1.2b-thinking:free",
                "google/gemini-3-flash-preview"));
        private List<String> agentLabels = new ArrayList<>(List.of(
                "Agent Alpha", "Agent Beta", "Agent Gamma"));
        private int maxOutputTokens = 4096;
        private double analysisTemperature = 0.7;
        private double synthesisTemperature = 0.5;
        private int fallbackVerdictMaxLength = 500;
    }

    @Data
    public static class JobProperties {
        private String idPrefix = "dlb_";
        private int defaultListLimit = 20;
        private int maxListLimit = 100;
    }
}
