package com.z254.agora.domain.repository;

import com.z254.agora.domain.model.Job;
import com.z254.agora.domain.model.JobStatus;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.function.Consumer;

/**
 * Repository interface for deliberation jobs.
 */
public interface JobRepository {

    /**
     * Save a job.
     */
    Mono<Job> save(Job job);

    /**
     * Find a job by ID.
     */
    Mono<Job> findById(String jobId);

    /**
     * Most recently created jobs first.
     */
    Flux<Job> findRecent(int limit);

    /**
     * Apply a mutation to a stored job atomically. Empty if the job does not exist.
     */
    Mono<Job> update(String jobId, Consumer<Job> mutation);

    /**
     * Count jobs in a given status.
     */
    Mono<Long> countByStatus(JobStatus status);

    /**
     * Count all jobs.
     */
    Mono<Long> count();
}
