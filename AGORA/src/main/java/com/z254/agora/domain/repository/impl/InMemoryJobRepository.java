package com.z254.agora.domain.repository.impl;

import com.z254.agora.domain.model.Job;
import com.z254.agora.domain.model.JobStatus;
import com.z254.agora.domain.repository.JobRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * In-memory implementation of JobRepository. Jobs do not survive a restart.
 */
@Repository
public class InMemoryJobRepository implements JobRepository {

    private final Map<String, Job> jobs = new ConcurrentHashMap<>();

    @Override
    public Mono<Job> save(Job job) {
        if (job.getCreatedAt() == null) {
            job.setCreatedAt(Instant.now());
        }
        jobs.put(job.getId(), job);
        return Mono.just(job);
    }

    @Override
    public Mono<Job> findById(String jobId) {
        return Mono.justOrEmpty(jobs.get(jobId));
    }

    @Override
    public Flux<Job> findRecent(int limit) {
        return Flux.fromStream(jobs.values().stream()
                .sorted(Comparator.comparing(Job::getCreatedAt).reversed())
                .limit(Math.max(0, limit)));
    }

    @Override
    public Mono<Job> update(String jobId, Consumer<Job> mutation) {
        return Mono.fromCallable(() -> jobs.computeIfPresent(jobId, (id, job) -> {
            mutation.accept(job);
            return job;
        }));
    }

    @Override
    public Mono<Long> countByStatus(JobStatus status) {
        return Mono.just(jobs.values().stream()
                .filter(job -> status == job.getStatus())
                .count());
    }

    @Override
    public Mono<Long> count() {
        return Mono.just((long) jobs.size());
    }
}
