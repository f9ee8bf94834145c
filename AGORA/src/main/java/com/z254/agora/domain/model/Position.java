package com.z254.agora.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One labeled viewpoint inside a {@link Divergence}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    private String view;

    @Builder.Default
    private Confidence confidence = Confidence.MEDIUM;
}
