package com.z254.agora.llm.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.z254.agora.config.AgoraProperties;
import com.z254.agora.llm.LLMProvider;
import com.z254.agora.llm.LLMProviderException;
import com.z254.agora.llm.LLMRequest;
import com.z254.agora.llm.LLMResponse;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.reactor.retry.RetryOperator;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * OpenRouter chat-completion provider.
 * Speaks the OpenAI-compatible {@code /chat/completions} protocol, so any model id
 * OpenRouter routes (anthropic/..., google/..., etc.) can be used as a backend.
 *
 * <p>Every attempt is bounded by the configured timeout. Timeouts, transport errors and
 * HTTP 429 share one attempt counter with exponential backoff between attempts; any other
 * non-success status fails immediately.
 */
@Component
@Slf4j
public class OpenRouterProvider implements LLMProvider {

    private static final String PROVIDER_ID = "openrouter";
    private static final String CHAT_COMPLETIONS_PATH = "/chat/completions";
    private static final int TOO_MANY_REQUESTS = 429;

    private final WebClient webClient;
    private final AgoraProperties.LLMProperties.OpenRouterProperties config;
    private final Retry retry;
    private final Timer llmCallTimer;
    private final Counter llmCallCounter;
    private final Counter llmErrorCounter;
    private final Counter llmRetryCounter;

    public OpenRouterProvider(
            AgoraProperties agoraProperties,
            WebClient.Builder webClientBuilder,
            MeterRegistry meterRegistry) {
        this.config = agoraProperties.getLlm().getOpenrouter();

        WebClient.Builder builder = webClientBuilder
                .baseUrl(config.getBaseUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader("HTTP-Referer", config.getReferer())
                .defaultHeader("X-Title", config.getTitle());
        if (isConfigured()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey());
        }
        this.webClient = builder.build();

        this.retry = Retry.of(PROVIDER_ID, RetryConfig.custom()
                .maxAttempts(config.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        config.getInitialBackoff(), config.getBackoffMultiplier()))
                .retryOnException(OpenRouterProvider::isRetryable)
                .build());

        this.llmCallTimer = Timer.builder("agora.llm.call.latency")
                .tag("provider", PROVIDER_ID)
                .register(meterRegistry);
        this.llmCallCounter = Counter.builder("agora.llm.calls")
                .tag("provider", PROVIDER_ID)
                .register(meterRegistry);
        this.llmErrorCounter = Counter.builder("agora.llm.errors")
                .tag("provider", PROVIDER_ID)
                .register(meterRegistry);
        this.llmRetryCounter = Counter.builder("agora.llm.retries")
                .tag("provider", PROVIDER_ID)
                .register(meterRegistry);

        retry.getEventPublisher().onRetry(event -> {
            llmRetryCounter.increment();
            log.warn("OpenRouter attempt {}/{} failed ({}), waiting {}ms",
                    event.getNumberOfRetryAttempts(), config.getMaxAttempts(),
                    event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown",
                    event.getWaitInterval().toMillis());
        });
    }

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public boolean isConfigured() {
        return StringUtils.hasText(config.getApiKey());
    }

    @Override
    public Mono<LLMResponse> complete(LLMRequest request) {
        Map<String, Object> body = buildRequestBody(request);

        return Mono.defer(() -> {
            llmCallCounter.increment();
            long startTime = System.currentTimeMillis();
            log.info("OpenRouter request: model={}, messages={}",
                    request.getModel(), request.getMessages().size());

            return Mono.defer(() -> exchange(body))
                    .transformDeferred(RetryOperator.of(retry))
                    .map(json -> parseResponse(json, request.getModel(), startTime))
                    .doOnSuccess(response -> {
                        llmCallTimer.record(Duration.ofMillis(response.getLatencyMs()));
                        log.info("OpenRouter success: model={}, {} tokens, {}ms",
                                request.getModel(), response.getTotalTokens(), response.getLatencyMs());
                    })
                    .doOnError(e -> {
                        llmErrorCounter.increment();
                        log.error("OpenRouter completion error: model={}, {}", request.getModel(), e.getMessage());
                    });
        });
    }

    /**
     * One attempt: POST, status classification and per-attempt timeout.
     */
    private Mono<JsonNode> exchange(Map<String, Object> body) {
        return webClient.post()
                .uri(CHAT_COMPLETIONS_PATH)
                .bodyValue(body)
                .retrieve()
                .onStatus(status -> status.value() == TOO_MANY_REQUESTS,
                        response -> response.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .map(LLMProviderException::rateLimited))
                .onStatus(HttpStatusCode::isError,
                        response -> response.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .map(text -> LLMProviderException.httpStatus(response.statusCode().value(), text)))
                .bodyToMono(JsonNode.class)
                .timeout(config.getTimeout())
                .onErrorMap(e -> !(e instanceof LLMProviderException), this::classify);
    }

    private LLMProviderException classify(Throwable e) {
        if (e instanceof TimeoutException) {
            return LLMProviderException.timeout(e);
        }
        if (e instanceof WebClientRequestException) {
            return LLMProviderException.transport(e);
        }
        return new LLMProviderException("Unreadable response: " + e.getMessage(), false, e);
    }

    private static boolean isRetryable(Throwable e) {
        return e instanceof LLMProviderException && ((LLMProviderException) e).isRetryable();
    }

    private Map<String, Object> buildRequestBody(LLMRequest request) {
        Map<String, Object> body = new HashMap<>();
        body.put("model", request.getModel());

        List<Map<String, Object>> messages = request.getMessages().stream()
                .map(this::convertMessage)
                .collect(Collectors.toList());
        body.put("messages", messages);

        if (request.getTemperature() != null) {
            body.put("temperature", request.getTemperature());
        }
        if (request.getMaxTokens() != null) {
            body.put("max_tokens", request.getMaxTokens());
        }
        return body;
    }

    private Map<String, Object> convertMessage(LLMRequest.Message message) {
        Map<String, Object> msg = new HashMap<>();
        msg.put("role", message.getRole());
        msg.put("content", message.getContent() != null ? message.getContent() : "");
        return msg;
    }

    private LLMResponse parseResponse(JsonNode json, String model, long startTime) {
        JsonNode choices = json.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw LLMProviderException.emptyChoices();
        }

        JsonNode message = choices.get(0).path("message");
        JsonNode contentNode = message.path("content");
        String content = contentNode.isMissingNode() || contentNode.isNull() ? "" : contentNode.asText();

        LLMResponse.Usage usage = null;
        JsonNode usageNode = json.path("usage");
        if (usageNode.isObject()) {
            usage = LLMResponse.Usage.builder()
                    .promptTokens(usageNode.path("prompt_tokens").asInt(0))
                    .completionTokens(usageNode.path("completion_tokens").asInt(0))
                    .totalTokens(usageNode.path("total_tokens").asInt(0))
                    .build();
        }

        return LLMResponse.builder()
                .id(json.path("id").asText(null))
                .model(json.hasNonNull("model") ? json.get("model").asText() : model)
                .providerId(PROVIDER_ID)
                .content(content)
                .usage(usage)
                .latencyMs(System.currentTimeMillis() - startTime)
                .build();
    }
}
