package com.z254.agora;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * AGORA - Multi-agent deliberation service.
 *
 * <p>AGORA stress-tests a thesis by running it through three fixed rounds:
 * <ul>
 *   <li>Independent Analysis - every backend model analyses the thesis from its own role</li>
 *   <li>Cross-Reading - every model reads the anonymized analyses of the others</li>
 *   <li>Synthesis - one model reduces the debate into a structured verdict</li>
 * </ul>
 *
 * <p>Deliberations run as background jobs submitted and polled over the {@code /v1} API.
 */
@SpringBootApplication
@EnableConfigurationProperties
public class AgoraApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgoraApplication.class, args);
    }
}
