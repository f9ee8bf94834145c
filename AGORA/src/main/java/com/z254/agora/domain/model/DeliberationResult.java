package com.z254.agora.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Final structured artifact of a deliberation.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DeliberationResult {

    public static final String NO_VERDICT = "No verdict provided";

    /**
     * Short, direct verdict on the thesis.
     */
    @Builder.Default
    private String verdict = NO_VERDICT;

    @Builder.Default
    private Confidence confidence = Confidence.MEDIUM;

    /**
     * Narrative justification of the verdict.
     */
    @Builder.Default
    private String reasoning = "";

    @Builder.Default
    private List<String> supportingPoints = new ArrayList<>();

    /**
     * Risks and limitations.
     */
    @Builder.Default
    private List<String> concerns = new ArrayList<>();

    @Builder.Default
    private List<String> keyAgreements = new ArrayList<>();

    /**
     * What the agents most strongly agreed on.
     */
    @Builder.Default
    private String strongestAgreement = "";

    @Builder.Default
    private List<String> openQuestions = new ArrayList<>();

    @Builder.Default
    private List<Divergence> divergences = new ArrayList<>();

    /**
     * Sum of every call's token usage across all rounds.
     */
    private int tokensUsed;

    /**
     * Rounds that actually executed.
     */
    private int roundsCompleted;

    private ParseStrategy parseStrategy;
}
