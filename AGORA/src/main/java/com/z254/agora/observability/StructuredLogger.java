package com.z254.agora.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import reactor.util.context.Context;
import reactor.util.context.ContextView;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured logging utility for AGORA.
 * Provides consistent, machine-parseable log entries for the deliberation lifecycle.
 *
 * <p>A deliberation hops between scheduler and network threads, so the job id travels in the
 * Reactor {@link Context} rather than in a thread-local. MDC keys are only populated for the
 * duration of a single log call, on the thread making it.
 */
@Component
@Slf4j
public class StructuredLogger {

    // MDC keys for context
    public static final String MDC_JOB_ID = "jobId";
    public static final String MDC_ROUND = "round";
    public static final String MDC_AGENT_ID = "agentId";
    public static final String MDC_BACKEND = "backend";

    /**
     * Reactor context key carrying the job id.
     */
    public static final String CONTEXT_JOB_ID = "agora.jobId";

    private final ObjectMapper objectMapper;

    public StructuredLogger(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public static Context jobContext(String jobId) {
        return jobId != null ? Context.of(CONTEXT_JOB_ID, jobId) : Context.empty();
    }

    /**
     * Job id carried by the subscriber context, or null outside a job.
     */
    public static String jobId(ContextView context) {
        return context.getOrDefault(CONTEXT_JOB_ID, null);
    }

    /**
     * Run {@code action} with the given MDC entries set, restoring the previous values afterwards.
     * Null values are skipped.
     */
    public void withContext(Map<String, String> entries, Runnable action) {
        Map<String, String> previous = new HashMap<>();
        entries.forEach((key, value) -> {
            if (value != null) {
                previous.put(key, MDC.get(key));
                MDC.put(key, value);
            }
        });
        try {
            action.run();
        } finally {
            previous.forEach((key, value) -> {
                if (value != null) {
                    MDC.put(key, value);
                } else {
                    MDC.remove(key);
                }
            });
        }
    }

    public static Map<String, String> context(String jobId, Integer round, String agentId, String backend) {
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put(MDC_JOB_ID, jobId);
        entries.put(MDC_ROUND, round != null ? String.valueOf(round) : null);
        entries.put(MDC_AGENT_ID, agentId);
        entries.put(MDC_BACKEND, backend);
        return entries;
    }

    public void logDeliberationStarted(String jobId, int thesisLength, boolean hasContext, List<String> backends) {
        Map<String, Object> data = new HashMap<>();
        data.put("thesisLength", thesisLength);
        data.put("hasContext", hasContext);
        data.put("backends", backends);
        logEvent("deliberation_started", context(jobId, null, null, null), data);
    }

    public void logRoundCompleted(String jobId, int round, int outputs, int tokens, long degraded, long durationMs) {
        Map<String, Object> data = new HashMap<>();
        data.put("outputs", outputs);
        data.put("tokens", tokens);
        data.put("degraded", degraded);
        data.put("durationMs", durationMs);
        logEvent("round_completed", context(jobId, round, null, null), data);
    }

    public void logSynthesisParsed(String jobId, String strategy, String confidence, int divergences) {
        Map<String, Object> data = new HashMap<>();
        data.put("strategy", strategy);
        data.put("confidence", confidence);
        data.put("divergences", divergences);
        logEvent("synthesis_parsed", context(jobId, null, null, null), data);
    }

    public void logDeliberationCompleted(String jobId, int tokensUsed, int roundsCompleted, long durationMs) {
        Map<String, Object> data = new HashMap<>();
        data.put("tokensUsed", tokensUsed);
        data.put("roundsCompleted", roundsCompleted);
        data.put("durationMs", durationMs);
        logEvent("deliberation_completed", context(jobId, null, null, null), data);
    }

    public void logDeliberationFailed(String jobId, String errorType, String errorMessage) {
        Map<String, Object> data = new HashMap<>();
        data.put("errorType", errorType);
        data.put("errorMessage", errorMessage != null ? errorMessage : "Unknown error");
        logEvent("deliberation_failed", context(jobId, null, null, null), data);
    }

    private void logEvent(String eventType, Map<String, String> mdc, Map<String, Object> data) {
        Map<String, Object> event = new HashMap<>(data);
        event.put("timestamp", Instant.now().toString());
        event.put("service", "agora");
        mdc.forEach((key, value) -> {
            if (value != null) event.put(key, value);
        });

        withContext(mdc, () -> {
            try {
                log.info("event={} {}", eventType, objectMapper.writeValueAsString(event));
            } catch (JsonProcessingException e) {
                log.info("event={} {}", eventType, event);
            }
        });
    }
}
