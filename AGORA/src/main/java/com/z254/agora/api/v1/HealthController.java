package com.z254.agora.api.v1;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Liveness endpoint for load balancers. Detailed health is under {@code /actuator/health}.
 */
@RestController
@Tag(name = "Health")
public class HealthController {

    @GetMapping("/health")
    @Operation(summary = "Health check")
    public Mono<Map<String, String>> health() {
        return Mono.just(Map.of("status", "healthy"));
    }
}
