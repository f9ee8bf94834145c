package com.z254.agora.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Input to one deliberation: thesis, optional context and three ordered backends.
 * The first backend also performs the synthesis.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeliberationRequest {

    public static final int REQUIRED_BACKENDS = 3;

    private String thesis;

    private String context;

    @Builder.Default
    private List<String> backends = new ArrayList<>();

    public boolean hasContext() {
        return context != null && !context.isBlank();
    }
}
