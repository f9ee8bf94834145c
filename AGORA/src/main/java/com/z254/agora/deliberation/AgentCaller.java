package com.z254.agora.deliberation;

import com.z254.agora.config.AgoraProperties;
import com.z254.agora.domain.model.AgentOutput;
import com.z254.agora.llm.LLMProvider;
import com.z254.agora.llm.LLMProviderException;
import com.z254.agora.llm.LLMRequest;
import com.z254.agora.observability.StructuredLogger;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Invokes a single backend with a single prompt.
 *
 * <p>The returned Mono never errors and never completes empty: any failure of the backend
 * call, after the provider's own retries, becomes a degraded {@link AgentOutput} so sibling
 * calls and later rounds carry on.
 */
@Component
@Slf4j
public class AgentCaller {

    private final LLMProvider llmProvider;
    private final AgoraProperties.DeliberationProperties config;
    private final StructuredLogger structuredLogger;
    private final Counter degradedCounter;

    public AgentCaller(
            LLMProvider llmProvider,
            StructuredLogger structuredLogger,
            AgoraProperties agoraProperties,
            MeterRegistry meterRegistry) {
        this.llmProvider = llmProvider;
        this.structuredLogger = structuredLogger;
        this.config = agoraProperties.getDeliberation();
        this.degradedCounter = Counter.builder("agora.agent.calls.degraded")
                .description("Agent calls replaced by an error placeholder")
                .register(meterRegistry);
    }

    public Mono<AgentOutput> call(AgentCall call) {
        LLMRequest request = LLMRequest.forPrompt(
                call.getBackend(), call.getPrompt(), config.getMaxOutputTokens(), call.getTemperature());

        return Mono.deferContextual(context -> callWithContext(call, request, StructuredLogger.jobId(context)));
    }

    private Mono<AgentOutput> callWithContext(AgentCall call, LLMRequest request, String jobId) {
        return Mono.defer(() -> llmProvider.complete(request))
                .switchIfEmpty(Mono.error(() -> new LLMProviderException("No response returned", null, false)))
                .map(response -> AgentOutput.builder()
                        .agentId(call.getAgentId())
                        .backend(call.getBackend())
                        .content(response.getContent() != null ? response.getContent() : "")
                        .tokensUsed(response.getTotalTokens())
                        .degraded(false)
                        .build())
                .onErrorResume(e -> {
                    degradedCounter.increment();
                    structuredLogger.withContext(
                            StructuredLogger.context(jobId, call.getRound() > 0 ? call.getRound() : null,
                                    call.getAgentId(), call.getBackend()),
                            () -> log.warn("Agent {} ({}) failed: {}", call.getAgentId(), call.getBackend(), describe(e)));
                    return Mono.just(AgentOutput.degraded(call.getAgentId(), call.getBackend(), describe(e)));
                });
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
