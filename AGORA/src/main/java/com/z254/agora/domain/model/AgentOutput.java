package com.z254.agora.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Result of one backend call made on behalf of one agent.
 * A failed call is still an output: {@link #isDegraded()} is set, the content is a
 * visible {@code [Error: ...]} placeholder and no tokens are counted.
 */
@Value
@Builder
public class AgentOutput {

    /** Positional agent identifier, stable for the whole deliberation ({@code agent_0}, ...). */
    String agentId;

    /** Backend model identifier that produced the content. */
    String backend;

    String content;

    int tokensUsed;

    boolean degraded;

    public static AgentOutput degraded(String agentId, String backend, String reason) {
        return AgentOutput.builder()
                .agentId(agentId)
                .backend(backend)
                .content("[Error: " + reason + "]")
                .tokensUsed(0)
                .degraded(true)
                .build();
    }
}
