package com.z254.agora.deliberation;

import com.z254.agora.domain.model.Round;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Fans one round's calls out concurrently and joins them at a barrier.
 *
 * <p>All calls are in flight at once; the resulting {@link Round} is emitted only after
 * every call has terminated, with outputs in input order whatever the completion order.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RoundOrchestrator {

    private final AgentCaller agentCaller;

    public Mono<Round> run(int roundNumber, List<AgentCall> calls) {
        return Flux.fromIterable(calls)
                .flatMapSequential(agentCaller::call, Math.max(1, calls.size()))
                .collectList()
                .map(outputs -> Round.builder()
                        .number(roundNumber)
                        .outputs(outputs)
                        .build())
                .doOnNext(round -> log.info("R{} complete: {} agents, {} degraded, {} tokens",
                        roundNumber, round.getOutputs().size(), round.getDegradedCount(), round.getTotalTokens()));
    }
}
