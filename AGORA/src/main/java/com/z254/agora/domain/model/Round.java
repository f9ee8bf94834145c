package com.z254.agora.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * The outputs of one protocol round, in agent-index order.
 */
@Value
@Builder
public class Round {

    /** Round ordinal: 1, 2 or 3. */
    int number;

    @Singular
    List<AgentOutput> outputs;

    public int getTotalTokens() {
        return outputs.stream().mapToInt(AgentOutput::getTokensUsed).sum();
    }

    public long getDegradedCount() {
        return outputs.stream().filter(AgentOutput::isDegraded).count();
    }
}
