package com.z254.agora.health;

import com.z254.agora.config.AgoraProperties;
import com.z254.agora.domain.model.JobStatus;
import com.z254.agora.domain.repository.JobRepository;
import com.z254.agora.llm.LLMProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Health indicator for AGORA service.
 * Down when the backend provider has no credentials, since every deliberation would fail.
 */
@Component
@Slf4j
public class AgoraHealthIndicator implements ReactiveHealthIndicator {

    private final LLMProvider llmProvider;
    private final JobRepository jobRepository;
    private final AgoraProperties agoraProperties;

    public AgoraHealthIndicator(
            LLMProvider llmProvider,
            JobRepository jobRepository,
            AgoraProperties agoraProperties) {
        this.llmProvider = llmProvider;
        this.jobRepository = jobRepository;
        this.agoraProperties = agoraProperties;
    }

    @Override
    public Mono<Health> health() {
        return Mono.zip(
                        jobRepository.count(),
                        jobRepository.countByStatus(JobStatus.RUNNING),
                        jobRepository.countByStatus(JobStatus.FAILED))
                .map(counts -> {
                    boolean configured = llmProvider.isConfigured();
                    Health.Builder builder = configured ? Health.up() : Health.down();

                    builder.withDetail("provider", llmProvider.getProviderId());
                    builder.withDetail("providerConfigured", configured);
                    builder.withDetail("defaultBackends", agoraProperties.getDeliberation().getDefaultBackends());
                    builder.withDetail("totalJobs", counts.getT1());
                    builder.withDetail("runningJobs", counts.getT2());
                    builder.withDetail("failedJobs", counts.getT3());

                    return builder.build();
                })
                .onErrorResume(e -> {
                    log.error("Health check failed", e);
                    return Mono.just(Health.down()
                            .withDetail("error", e.getMessage())
                            .build());
                });
    }
}
