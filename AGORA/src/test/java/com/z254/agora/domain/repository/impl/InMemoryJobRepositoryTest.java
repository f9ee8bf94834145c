package com.z254.agora.domain.repository.impl;

import com.z254.agora.domain.model.Job;
import com.z254.agora.domain.model.JobStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for InMemoryJobRepository.
 */
class InMemoryJobRepositoryTest {

    private InMemoryJobRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryJobRepository();
    }

    @Test
    void shouldSaveAndFindJob() {
        Job job = job("dlb_1", Instant.parse("2025-01-01T00:00:00Z"));

        StepVerifier.create(repository.save(job).then(repository.findById("dlb_1")))
                .assertNext(found -> assertThat(found.getThesis()).isEqualTo("thesis dlb_1"))
                .verifyComplete();
    }

    @Test
    void shouldReturnEmptyForMissingJob() {
        StepVerifier.create(repository.findById("nope"))
                .verifyComplete();
    }

    @Test
    void shouldListMostRecentFirst() {
        repository.save(job("old", Instant.parse("2025-01-01T00:00:00Z"))).block();
        repository.save(job("new", Instant.parse("2025-01-03T00:00:00Z"))).block();
        repository.save(job("mid", Instant.parse("2025-01-02T00:00:00Z"))).block();

        List<Job> recent = repository.findRecent(2).collectList().block();

        assertThat(recent).extracting(Job::getId).containsExactly("new", "mid");
    }

    @Test
    void shouldUpdateExistingJob() {
        repository.save(job("dlb_1", Instant.now())).block();

        StepVerifier.create(repository.update("dlb_1", j -> j.setStatus(JobStatus.RUNNING)))
                .assertNext(updated -> assertThat(updated.getStatus()).isEqualTo(JobStatus.RUNNING))
                .verifyComplete();
    }

    @Test
    void shouldNotCreateJobOnUpdate() {
        StepVerifier.create(repository.update("missing", j -> j.setStatus(JobStatus.RUNNING)))
                .verifyComplete();

        assertThat(repository.count().block()).isZero();
    }

    @Test
    void shouldCountByStatus() {
        repository.save(job("a", Instant.now())).block();
        repository.save(job("b", Instant.now())).block();
        repository.update("b", j -> j.setStatus(JobStatus.FAILED)).block();

        assertThat(repository.countByStatus(JobStatus.PENDING).block()).isEqualTo(1L);
        assertThat(repository.countByStatus(JobStatus.FAILED).block()).isEqualTo(1L);
        assertThat(repository.count().block()).isEqualTo(2L);
    }

    private static Job job(String id, Instant createdAt) {
        return Job.builder()
                .id(id)
                .thesis("thesis " + id)
                .backends(List.of("a", "b", "c"))
                .createdAt(createdAt)
                .build();
    }
}
