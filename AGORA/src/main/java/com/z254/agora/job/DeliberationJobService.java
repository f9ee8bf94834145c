package com.z254.agora.job;

import com.z254.agora.config.AgoraProperties;
import com.z254.agora.deliberation.DeliberationEngine;
import com.z254.agora.deliberation.InvalidDeliberationRequestException;
import com.z254.agora.domain.model.DeliberationRequest;
import com.z254.agora.domain.model.Job;
import com.z254.agora.domain.model.JobStatus;
import com.z254.agora.domain.repository.JobRepository;
import com.z254.agora.observability.StructuredLogger;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Owns the job lifecycle around the deliberation engine.
 *
 * <p>Submitted jobs are stored as PENDING and run in the background. Progress updates the
 * job's current round; the engine's result completes it, and any error the engine signals
 * marks it FAILED with the error message.
 */
@Service
@Slf4j
public class DeliberationJobService {

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final int ID_RANDOM_BYTES = 12;

    private final JobRepository jobRepository;
    private final DeliberationEngine deliberationEngine;
    private final StructuredLogger structuredLogger;
    private final AgoraProperties agoraProperties;
    private final Scheduler scheduler;
    private final Counter completedCounter;
    private final Counter failedCounter;

    @Autowired
    public DeliberationJobService(
            JobRepository jobRepository,
            DeliberationEngine deliberationEngine,
            StructuredLogger structuredLogger,
            AgoraProperties agoraProperties,
            MeterRegistry meterRegistry) {
        this(jobRepository, deliberationEngine, structuredLogger, agoraProperties, meterRegistry,
                Schedulers.boundedElastic());
    }

    DeliberationJobService(
            JobRepository jobRepository,
            DeliberationEngine deliberationEngine,
            StructuredLogger structuredLogger,
            AgoraProperties agoraProperties,
            MeterRegistry meterRegistry,
            Scheduler scheduler) {
        this.jobRepository = jobRepository;
        this.deliberationEngine = deliberationEngine;
        this.structuredLogger = structuredLogger;
        this.agoraProperties = agoraProperties;
        this.scheduler = scheduler;
        this.completedCounter = Counter.builder("agora.deliberations.completed")
                .description("Deliberation jobs completed with a result")
                .register(meterRegistry);
        this.failedCounter = Counter.builder("agora.deliberations.failed")
                .description("Deliberation jobs that failed")
                .register(meterRegistry);
    }

    /**
     * Store a new PENDING job and start it in the background.
     * Missing backends are replaced by the configured defaults. The returned job is a
     * snapshot taken at acceptance, so it always reads PENDING.
     */
    public Mono<Job> submit(DeliberationRequest request) {
        List<String> backends = request.getBackends() == null || request.getBackends().isEmpty()
                ? agoraProperties.getDeliberation().getDefaultBackends()
                : request.getBackends();
        if (request.getThesis() == null || request.getThesis().isBlank()) {
            return Mono.error(new InvalidDeliberationRequestException("thesis is required"));
        }
        if (backends.size() != DeliberationRequest.REQUIRED_BACKENDS) {
            return Mono.error(new InvalidDeliberationRequestException(
                    "exactly " + DeliberationRequest.REQUIRED_BACKENDS + " backends are required, got " + backends.size()));
        }

        Job job = Job.builder()
                .id(newJobId())
                .status(JobStatus.PENDING)
                .thesis(request.getThesis())
                .context(request.getContext())
                .backends(new ArrayList<>(backends))
                .createdAt(Instant.now())
                .build();

        return jobRepository.save(job)
                .map(saved -> {
                    log.info("Created job {}: {}", saved.getId(), abbreviate(saved.getThesis()));
                    Job accepted = saved.toBuilder().build();
                    execute(saved.getId())
                            .subscribeOn(scheduler)
                            .subscribe();
                    return accepted;
                });
    }

    /**
     * Signals {@link JobNotFoundException} for an unknown id.
     */
    public Mono<Job> get(String jobId) {
        return jobRepository.findById(jobId)
                .switchIfEmpty(Mono.error(() -> new JobNotFoundException(jobId)));
    }

    /**
     * Most recent jobs first. The limit is clamped to {@code [1, agora.jobs.max-list-limit]}.
     */
    public Flux<Job> listRecent(Integer limit) {
        AgoraProperties.JobProperties config = agoraProperties.getJobs();
        int requested = limit != null ? limit : config.getDefaultListLimit();
        return jobRepository.findRecent(Math.min(Math.max(requested, 1), config.getMaxListLimit()));
    }

    /**
     * Run one stored job to a terminal state. Never signals an error.
     */
    Mono<Job> execute(String jobId) {
        return jobRepository.update(jobId, job -> job.setStatus(JobStatus.RUNNING))
                .flatMap(job -> {
                    long startTime = System.currentTimeMillis();
                    return deliberationEngine.deliberate(job.toRequest(), (round, message) -> {
                                structuredLogger.withContext(StructuredLogger.context(jobId, round, null, null),
                                        () -> log.info("Job {}: Round {} - {}", jobId, round, message));
                                jobRepository.update(jobId, j -> j.setCurrentRound(round)).subscribe();
                            })
                            .flatMap(result -> jobRepository.update(jobId, j -> {
                                j.setResult(result);
                                j.setTokensUsed(result.getTokensUsed());
                                j.setCompletedAt(Instant.now());
                                j.setStatus(JobStatus.COMPLETED);
                            }))
                            .doOnNext(completed -> {
                                completedCounter.increment();
                                structuredLogger.logDeliberationCompleted(jobId, completed.getTokensUsed(),
                                        completed.getResult().getRoundsCompleted(),
                                        System.currentTimeMillis() - startTime);
                            });
                })
                .onErrorResume(e -> {
                    structuredLogger.withContext(StructuredLogger.context(jobId, null, null, null),
                            () -> log.error("Job {} failed: {}", jobId, e.getMessage(), e));
                    failedCounter.increment();
                    structuredLogger.logDeliberationFailed(jobId, e.getClass().getSimpleName(), e.getMessage());
                    return jobRepository.update(jobId, j -> {
                        j.setError(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
                        j.setCompletedAt(Instant.now());
                        j.setStatus(JobStatus.FAILED);
                    });
                })
                .contextWrite(StructuredLogger.jobContext(jobId));
    }

    private String newJobId() {
        byte[] bytes = new byte[ID_RANDOM_BYTES];
        RANDOM.nextBytes(bytes);
        return agoraProperties.getJobs().getIdPrefix()
                + Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    private static String abbreviate(String s) {
        return s != null && s.length() > 50 ? s.substring(0, 50) + "..." : s;
    }
}
