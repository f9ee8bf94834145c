package com.z254.agora.deliberation;

import lombok.Builder;
import lombok.Value;

/**
 * One scheduled backend call: which agent, which backend, what prompt.
 */
@Value
@Builder(toBuilder = true)
public class AgentCall {

    /**
     * Round the call belongs to, 0 when not part of a deliberation round.
     */
    int round;

    String agentId;

    String backend;

    String prompt;

    double temperature;

    public static String agentId(int index) {
        return "agent_" + index;
    }
}
