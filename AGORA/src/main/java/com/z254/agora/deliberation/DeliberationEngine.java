package com.z254.agora.deliberation;

import com.z254.agora.config.AgoraProperties;
import com.z254.agora.domain.model.AgentOutput;
import com.z254.agora.domain.model.DeliberationRequest;
import com.z254.agora.domain.model.DeliberationResult;
import com.z254.agora.domain.model.Round;
import com.z254.agora.llm.LLMProvider;
import com.z254.agora.observability.StructuredLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the three-round deliberation protocol.
 *
 * <p>{@code R1_RUNNING -> R2_RUNNING -> R3_RUNNING -> DONE}. Rounds 1 and 2 call every
 * backend concurrently; round 3 is a single synthesis call to the first backend. A round
 * starts only after the previous round's barrier, and no round is repeated.
 *
 * <p>Once round 1 has started the returned Mono always emits a {@link DeliberationResult}:
 * failed calls degrade to placeholders and the synthesis parser never fails. The only error
 * signalled is a {@link ProviderConfigurationException} (or a malformed request) before
 * any round runs.
 */
@Service
@Slf4j
public class DeliberationEngine {

    private final LLMProvider llmProvider;
    private final RoundOrchestrator roundOrchestrator;
    private final DeliberationPrompts prompts;
    private final SynthesisParser synthesisParser;
    private final StructuredLogger structuredLogger;
    private final AgoraProperties.DeliberationProperties config;

    public DeliberationEngine(
            LLMProvider llmProvider,
            RoundOrchestrator roundOrchestrator,
            DeliberationPrompts prompts,
            SynthesisParser synthesisParser,
            StructuredLogger structuredLogger,
            AgoraProperties agoraProperties) {
        this.llmProvider = llmProvider;
        this.roundOrchestrator = roundOrchestrator;
        this.prompts = prompts;
        this.synthesisParser = synthesisParser;
        this.structuredLogger = structuredLogger;
        this.config = agoraProperties.getDeliberation();
    }

    public Mono<DeliberationResult> deliberate(DeliberationRequest request) {
        return deliberate(request, DeliberationProgressListener.NOOP);
    }

    public Mono<DeliberationResult> deliberate(DeliberationRequest request, DeliberationProgressListener listener) {
        DeliberationProgressListener progress = listener != null ? listener : DeliberationProgressListener.NOOP;

        return Mono.deferContextual(context -> {
            String jobId = StructuredLogger.jobId(context);
            if (!llmProvider.isConfigured()) {
                return Mono.error(new ProviderConfigurationException(
                        "Provider '" + llmProvider.getProviderId() + "' is not configured: API key not set"));
            }
            validate(request);

            long startTime = System.currentTimeMillis();
            structuredLogger.logDeliberationStarted(jobId,
                    request.getThesis().length(), request.hasContext(), request.getBackends());

            return independentAnalysis(jobId, request, progress)
                    .flatMap(round1 -> crossReading(jobId, request, round1, progress)
                            .flatMap(round2 -> synthesis(jobId, request, round2, progress)
                                    .map(round3 -> assemble(jobId, List.of(round1, round2, round3)))))
                    .doOnNext(result -> log.info("{} in {}ms: verdict={}", DeliberationPhase.DONE.getStatusMessage(),
                            System.currentTimeMillis() - startTime, abbreviate(result.getVerdict())));
        });
    }

    private Mono<Round> independentAnalysis(
            String jobId, DeliberationRequest request, DeliberationProgressListener progress) {
        return Mono.defer(() -> {
            enter(jobId, DeliberationPhase.R1_RUNNING, progress);
            List<String> backends = request.getBackends();
            List<AgentCall> calls = new ArrayList<>(backends.size());
            for (int i = 0; i < backends.size(); i++) {
                calls.add(AgentCall.builder()
                        .round(DeliberationPhase.R1_RUNNING.getRound())
                        .agentId(AgentCall.agentId(i))
                        .backend(backends.get(i))
                        .prompt(prompts.independentAnalysis(request.getThesis(), request.getContext(), i))
                        .temperature(config.getAnalysisTemperature())
                        .build());
            }
            return runRound(jobId, DeliberationPhase.R1_RUNNING.getRound(), calls);
        });
    }

    private Mono<Round> crossReading(
            String jobId, DeliberationRequest request, Round round1, DeliberationProgressListener progress) {
        return Mono.defer(() -> {
            enter(jobId, DeliberationPhase.R2_RUNNING, progress);
            List<AgentOutput> previous = round1.getOutputs();
            List<AgentCall> calls = new ArrayList<>(previous.size());
            for (int i = 0; i < previous.size(); i++) {
                calls.add(AgentCall.builder()
                        .round(DeliberationPhase.R2_RUNNING.getRound())
                        .agentId(AgentCall.agentId(i))
                        .backend(request.getBackends().get(i))
                        .prompt(prompts.crossReading(request.getThesis(), i, previous))
                        .temperature(config.getAnalysisTemperature())
                        .build());
            }
            return runRound(jobId, DeliberationPhase.R2_RUNNING.getRound(), calls);
        });
    }

    private Mono<Round> synthesis(
            String jobId, DeliberationRequest request, Round round2, DeliberationProgressListener progress) {
        return Mono.defer(() -> {
            enter(jobId, DeliberationPhase.R3_RUNNING, progress);
            AgentCall call = AgentCall.builder()
                    .round(DeliberationPhase.R3_RUNNING.getRound())
                    .agentId(AgentCall.agentId(0))
                    .backend(request.getBackends().get(0))
                    .prompt(prompts.synthesis(request.getThesis(), round2.getOutputs()))
                    .temperature(config.getSynthesisTemperature())
                    .build();
            return runRound(jobId, DeliberationPhase.R3_RUNNING.getRound(), List.of(call));
        });
    }

    private Mono<Round> runRound(String jobId, int number, List<AgentCall> calls) {
        return Mono.defer(() -> {
            long startTime = System.currentTimeMillis();
            return roundOrchestrator.run(number, calls)
                    .doOnNext(round -> structuredLogger.logRoundCompleted(jobId,
                            number, round.getOutputs().size(), round.getTotalTokens(),
                            round.getDegradedCount(), System.currentTimeMillis() - startTime));
        });
    }

    private DeliberationResult assemble(String jobId, List<Round> rounds) {
        Round synthesisRound = rounds.get(rounds.size() - 1);
        AgentOutput synthesis = synthesisRound.getOutputs().get(0);
        if (synthesis.isDegraded()) {
            log.warn("Synthesis call degraded, verdict will carry the error placeholder");
        }

        DeliberationResult parsed = synthesisParser.parse(synthesis.getContent());
        int tokensUsed = rounds.stream().mapToInt(Round::getTotalTokens).sum();

        structuredLogger.logSynthesisParsed(jobId, parsed.getParseStrategy().name(),
                parsed.getConfidence().getValue(), parsed.getDivergences().size());

        return parsed.toBuilder()
                .tokensUsed(tokensUsed)
                .roundsCompleted(rounds.size())
                .build();
    }

    private void enter(String jobId, DeliberationPhase phase, DeliberationProgressListener progress) {
        structuredLogger.withContext(StructuredLogger.context(jobId, phase.getRound(), null, null),
                () -> log.info("Round {}: {}", phase.getRound(), phase.getStatusMessage()));
        progress.onProgress(phase.getRound(), phase.getStatusMessage());
    }

    private void validate(DeliberationRequest request) {
        if (request == null || request.getThesis() == null || request.getThesis().isBlank()) {
            throw new InvalidDeliberationRequestException("thesis is required");
        }
        List<String> backends = request.getBackends();
        if (backends == null || backends.size() != DeliberationRequest.REQUIRED_BACKENDS) {
            throw new InvalidDeliberationRequestException(
                    "exactly " + DeliberationRequest.REQUIRED_BACKENDS + " backends are required, got "
                            + (backends == null ? 0 : backends.size()));
        }
        if (backends.stream().anyMatch(b -> b == null || b.isBlank())) {
            throw new InvalidDeliberationRequestException("backend identifiers must not be blank");
        }
    }

    private static String abbreviate(String s) {
        return s.length() > 50 ? s.substring(0, 50) + "..." : s;
    }
}
