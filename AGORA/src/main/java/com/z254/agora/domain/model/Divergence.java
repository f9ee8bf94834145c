package com.z254.agora.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A topic on which the agents' synthesized positions disagree.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Divergence {

    private String topic;

    private String description;

    /**
     * Usually two or more; fewer are kept as-is.
     */
    @Builder.Default
    private List<Position> positions = new ArrayList<>();
}
