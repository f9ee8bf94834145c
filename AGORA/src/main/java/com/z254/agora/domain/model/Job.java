package com.z254.agora.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A deliberation job: one request bound to its lifecycle and, once completed, its result.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Job {

    /**
     * Unique identifier, e.g. {@code dlb_Xq3...}.
     */
    private String id;

    @Builder.Default
    private JobStatus status = JobStatus.PENDING;

    private String thesis;

    private String context;

    /**
     * Exactly three backend identifiers, in agent order.
     */
    @Builder.Default
    private List<String> backends = new ArrayList<>();

    /**
     * Round currently executing, null until round 1 starts.
     */
    private Integer currentRound;

    private DeliberationResult result;

    private String error;

    private int tokensUsed;

    @Builder.Default
    private Instant createdAt = Instant.now();

    private Instant completedAt;

    public DeliberationRequest toRequest() {
        return DeliberationRequest.builder()
                .thesis(thesis)
                .context(context)
                .backends(new ArrayList<>(backends))
                .build();
    }

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }
}
