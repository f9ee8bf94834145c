package com.z254.agora.api.dto;

import com.z254.agora.domain.model.Job;
import com.z254.agora.domain.model.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO returned when a deliberation job is accepted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobCreatedResponse {

    private String jobId;

    private JobStatus status;

    /**
     * Relative URL to poll for the job's status.
     */
    private String pollUrl;

    public static JobCreatedResponse from(Job job) {
        return JobCreatedResponse.builder()
                .jobId(job.getId())
                .status(job.getStatus())
                .pollUrl("/v1/jobs/" + job.getId())
                .build();
    }
}
