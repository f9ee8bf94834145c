package com.z254.agora.job;

import lombok.Getter;

/**
 * No job is stored under the requested id.
 */
@Getter
public class JobNotFoundException extends RuntimeException {

    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("Job not found: " + jobId);
        this.jobId = jobId;
    }
}
