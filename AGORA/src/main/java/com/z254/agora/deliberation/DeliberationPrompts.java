package com.z254.agora.deliberation;

import com.z254.agora.config.AgoraProperties;
import com.z254.agora.domain.model.AgentOutput;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Prompt text for the three rounds.
 *
 * <p>Cross-reading and synthesis prompts refer to agents only by positional label
 * (Agent Alpha, Agent Beta, ...); backend identifiers never reach a prompt.
 */
@Component
public class DeliberationPrompts {

    static final String MARKDOWN_INSTRUCTION = """

            **Format your response using Markdown:**
            - Use ## headings to organize sections
            - Use **bold** for key points
            - Use bullet points for clarity""";

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("MMMM dd, yyyy", Locale.ENGLISH);

    private final List<String> agentLabels;
    private final Clock clock;

    @Autowired
    public DeliberationPrompts(AgoraProperties agoraProperties) {
        this(agoraProperties, Clock.systemDefaultZone());
    }

    DeliberationPrompts(AgoraProperties agoraProperties, Clock clock) {
        this.agentLabels = List.copyOf(agoraProperties.getDeliberation().getAgentLabels());
        this.clock = clock;
    }

    /**
     * Positional pseudonym for an agent index.
     */
    public String label(int index) {
        return index < agentLabels.size() ? agentLabels.get(index) : "Agent " + (index + 1);
    }

    /**
     * Round 1: independent analysis, framed by the role assigned to the agent's position.
     */
    public String independentAnalysis(String thesis, String context, int agentIndex) {
        Role role = Role.values()[agentIndex % Role.values().length];

        String contextSection = "";
        if (context != null && !context.isBlank()) {
            contextSection = """
                    ---
                    **CONTEXT**
                    %s
                    ---
                    """.formatted(context);
        }

        return """
                You are the %s in a structured deliberation. %s

                You are analyzing the following thesis:
                ---
                %s
                ---
                %s
                Today's date: %s

                Provide your independent analysis. Consider:
                - Strengths and weaknesses of the argument
                - Missing considerations
                - Potential risks and opportunities
                - Evidence that would strengthen or weaken the thesis
                - Key assumptions and dependencies

                Be thorough but concise. Focus on your highest-conviction insights.
                %s""".formatted(role.title, role.framing, thesis, contextSection,
                LocalDate.now(clock).format(DATE_FORMAT), MARKDOWN_INSTRUCTION);
    }

    /**
     * Round 2: the agent's own round-1 analysis plus every other agent's, under labels.
     */
    public String crossReading(String thesis, int agentIndex, List<AgentOutput> round1) {
        StringBuilder others = new StringBuilder();
        for (int i = 0; i < round1.size(); i++) {
            if (i != agentIndex) {
                appendLabeled(others, label(i), round1.get(i).getContent());
            }
        }

        return """
                Original thesis:
                ---
                %s
                ---

                Your R1 analysis:
                ---
                %s
                ---

                Other agents' analyses:
                %s

                Review the other analyses and identify:
                1. **Points of agreement** - Where do all analyses converge?
                2. **Points of disagreement** - Where do analyses diverge? Why?
                3. **New considerations** - What did others raise that you find compelling?
                4. **Rebuttals** - What do you disagree with and why?
                %s""".formatted(thesis, round1.get(agentIndex).getContent(), others, MARKDOWN_INSTRUCTION);
    }

    /**
     * Round 3: all round-2 outputs under labels, ending in the structured verdict block.
     */
    public String synthesis(String thesis, List<AgentOutput> round2) {
        StringBuilder outputs = new StringBuilder();
        for (int i = 0; i < round2.size(); i++) {
            appendLabeled(outputs, label(i), round2.get(i).getContent());
        }

        return """
                Original thesis:
                ---
                %s
                ---

                All R2 outputs (after cross-reading):
                %s

                Synthesize the deliberation into a comprehensive final verdict.

                IMPORTANT: Provide DETAILED, SUBSTANTIVE responses. Do not summarize or abbreviate.

                Your response MUST end with a structured JSON block in exactly this format:

                ```json
                {
                  "verdict": "Your clear, actionable verdict on the thesis, with its key qualifications (3-4 sentences).",
                  "confidence": "high" | "medium" | "low",
                  "reasoning": "Substantial paragraph synthesizing the key arguments, the strongest counterarguments and why the confidence level is justified. Do NOT say 'see above'.",
                  "supporting_points": ["Specific point supporting the verdict", "..."],
                  "concerns": ["Specific risk or limitation of the verdict", "..."],
                  "key_agreements": ["Substantive point all agents agreed on and why it matters", "..."],
                  "strongest_agreement": "The single point the agents agreed on most strongly",
                  "open_questions": ["Unresolved issue that matters most", "..."],
                  "divergences": [
                    {
                      "topic": "Specific topic of disagreement",
                      "description": "What the disagreement is about, why it matters and what is at stake",
                      "positions": [
                        {"view": "One agent's position with its reasoning", "confidence": "high|medium|low"},
                        {"view": "Another agent's position with its reasoning", "confidence": "high|medium|low"}
                      ]
                    }
                  ]
                }
                ```

                Include at least 3-5 divergences if they exist, each with two or more positions.

                First, write your synthesis narrative, then end with the JSON block.
                %s""".formatted(thesis, outputs, MARKDOWN_INSTRUCTION);
    }

    private static void appendLabeled(StringBuilder sb, String label, String content) {
        sb.append("\n**").append(label).append(":**\n---\n").append(content).append("\n---\n");
    }

    /**
     * Round-1 framings, assigned by agent position and wrapping past the last one.
     */
    private enum Role {
        ADVOCATE("Advocate", """
                Build the strongest honest case FOR the thesis. Identify the evidence and \
                mechanisms that make it hold, and the conditions under which it is most true."""),
        SKEPTIC("Skeptic", """
                Stress-test the thesis. Look for weak evidence, hidden assumptions, \
                counterexamples and the conditions under which it fails."""),
        PRAGMATIST("Pragmatist", """
                Judge the thesis by its practical consequences. Focus on real-world trade-offs, \
                implementation constraints and what a decision-maker should actually do.""");

        private final String title;
        private final String framing;

        Role(String title, String framing) {
            this.title = title;
            this.framing = framing;
        }
    }
}
