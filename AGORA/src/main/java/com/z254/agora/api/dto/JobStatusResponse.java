package com.z254.agora.api.dto;

import com.z254.agora.domain.model.DeliberationResult;
import com.z254.agora.domain.model.Job;
import com.z254.agora.domain.model.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response DTO for polling a deliberation job.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobStatusResponse {

    private String jobId;

    private JobStatus status;

    private Integer currentRound;

    private DeliberationResult result;

    private String error;

    private int tokensUsed;

    private Instant createdAt;

    private Instant completedAt;

    public static JobStatusResponse from(Job job) {
        return JobStatusResponse.builder()
                .jobId(job.getId())
                .status(job.getStatus())
                .currentRound(job.getCurrentRound())
                .result(job.getResult())
                .error(job.getError())
                .tokensUsed(job.getTokensUsed())
                .createdAt(job.getCreatedAt())
                .completedAt(job.getCompletedAt())
                .build();
    }
}
