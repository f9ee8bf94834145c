package com.z254.agora.deliberation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.agora.config.AgoraProperties;
import com.z254.agora.domain.model.Confidence;
import com.z254.agora.domain.model.DeliberationResult;
import com.z254.agora.domain.model.Divergence;
import com.z254.agora.domain.model.ParseStrategy;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for SynthesisParser.
 */
class SynthesisParserTest {

    private SynthesisParser parser;
    private SimpleMeterRegistry meterRegistry;

    private static final String FULL_JSON = """
            {
              "verdict": "Remote work raises productivity for focused tasks but not for onboarding.",
              "confidence": "high",
              "reasoning": "Evidence converges on deep-work gains.",
              "supporting_points": ["Fewer interruptions", "No commute"],
              "concerns": ["Weaker mentoring"],
              "key_agreements": ["Task type matters"],
              "strongest_agreement": "Hybrid beats both extremes",
              "open_questions": ["Long-term culture effects?"],
              "divergences": [
                {
                  "topic": "Measurement",
                  "description": "Whether output metrics capture collaboration",
                  "positions": [
                    {"view": "Metrics are adequate", "confidence": "medium"},
                    {"view": "Metrics miss tacit work", "confidence": "low"}
                  ]
                }
              ]
            }""";

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        parser = new SynthesisParser(new ObjectMapper(), new AgoraProperties(), meterRegistry);
    }

    @Nested
    @DisplayName("Fenced JSON")
    class FencedJson {

        @Test
        @DisplayName("should decode every field of a well-formed fenced block")
        void shouldDecodeAllFields() {
            String content = "## Synthesis\n\nThe agents mostly agree.\n\n```json\n" + FULL_JSON + "\n```\n";

            DeliberationResult result = parser.parse(content);

            assertThat(result.getParseStrategy()).isEqualTo(ParseStrategy.FENCED);
            assertThat(result.getVerdict())
                    .isEqualTo("Remote work raises productivity for focused tasks but not for onboarding.");
            assertThat(result.getConfidence()).isEqualTo(Confidence.HIGH);
            assertThat(result.getReasoning()).isEqualTo("Evidence converges on deep-work gains.");
            assertThat(result.getSupportingPoints()).containsExactly("Fewer interruptions", "No commute");
            assertThat(result.getConcerns()).containsExactly("Weaker mentoring");
            assertThat(result.getKeyAgreements()).containsExactly("Task type matters");
            assertThat(result.getStrongestAgreement()).isEqualTo("Hybrid beats both extremes");
            assertThat(result.getOpenQuestions()).containsExactly("Long-term culture effects?");
            assertThat(result.getDivergences()).hasSize(1);

            Divergence divergence = result.getDivergences().get(0);
            assertThat(divergence.getTopic()).isEqualTo("Measurement");
            assertThat(divergence.getDescription()).isEqualTo("Whether output metrics capture collaboration");
            assertThat(divergence.getPositions()).hasSize(2);
            assertThat(divergence.getPositions().get(0).getView()).isEqualTo("Metrics are adequate");
            assertThat(divergence.getPositions().get(0).getConfidence()).isEqualTo(Confidence.MEDIUM);
            assertThat(divergence.getPositions().get(1).getConfidence()).isEqualTo(Confidence.LOW);
        }

        @Test
        @DisplayName("should keep braces that appear inside string values")
        void shouldHandleBracesInsideStrings() {
            String content = """
                    Narrative first.

                    ```json
                    {
                      "verdict": "Adopt it",
                      "confidence": "low",
                      "divergences": [
                        {
                          "topic": "Config",
                          "description": "Whether {nested} blocks like {a: {b}} matter",
                          "positions": [{"view": "yes", "confidence": "high"}]
                        }
                      ]
                    }
                    ```
                    """;

            DeliberationResult result = parser.parse(content);

            assertThat(result.getParseStrategy()).isEqualTo(ParseStrategy.FENCED);
            assertThat(result.getVerdict()).isEqualTo("Adopt it");
            assertThat(result.getDivergences()).hasSize(1);
            assertThat(result.getDivergences().get(0).getDescription())
                    .isEqualTo("Whether {nested} blocks like {a: {b}} matter");
            assertThat(result.getDivergences().get(0).getPositions()).hasSize(1);
        }

        @Test
        @DisplayName("should not cut the object at the first inner closing brace")
        void shouldNotStopAtFirstInnerBrace() {
            String content = "```json\n{\"verdict\": \"v\", \"divergences\": [{\"topic\": \"t\", "
                    + "\"positions\": [{\"view\": \"a\"}, {\"view\": \"b\"}]}], \"concerns\": [\"late key\"]}\n```";

            DeliberationResult result = parser.parse(content);

            assertThat(result.getConcerns()).containsExactly("late key");
            assertThat(result.getDivergences().get(0).getPositions()).hasSize(2);
        }

        @Test
        @DisplayName("should skip a malformed fenced block and use a later valid one")
        void shouldSkipMalformedFence() {
            String content = "```json\n{\"verdict\": oops}\n```\n\nRevised:\n\n```json\n{\"verdict\": \"second\"}\n```";

            DeliberationResult result = parser.parse(content);

            assertThat(result.getParseStrategy()).isEqualTo(ParseStrategy.FENCED);
            assertThat(result.getVerdict()).isEqualTo("second");
        }

        @Test
        @DisplayName("should tolerate trailing commas")
        void shouldTolerateTrailingCommas() {
            String content = "```json\n{\"verdict\": \"ok\", \"concerns\": [\"a\", \"b\",],}\n```";

            DeliberationResult result = parser.parse(content);

            assertThat(result.getParseStrategy()).isEqualTo(ParseStrategy.FENCED);
            assertThat(result.getConcerns()).containsExactly("a", "b");
        }

        @Test
        @DisplayName("should count the strategy used")
        void shouldRecordStrategyMetric() {
            parser.parse("```json\n{\"verdict\": \"ok\"}\n```");

            assertThat(meterRegistry.counter("agora.synthesis.parse", "strategy", "fenced").count())
                    .isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Field defaults and normalization")
    class Defaults {

        @Test
        @DisplayName("should default every missing key")
        void shouldDefaultMissingKeys() {
            DeliberationResult result = parser.parse("```json\n{}\n```");

            assertThat(result.getParseStrategy()).isEqualTo(ParseStrategy.FENCED);
            assertThat(result.getVerdict()).isEqualTo(DeliberationResult.NO_VERDICT);
            assertThat(result.getConfidence()).isEqualTo(Confidence.MEDIUM);
            assertThat(result.getReasoning()).isEmpty();
            assertThat(result.getSupportingPoints()).isEmpty();
            assertThat(result.getConcerns()).isEmpty();
            assertThat(result.getKeyAgreements()).isEmpty();
            assertThat(result.getStrongestAgreement()).isEmpty();
            assertThat(result.getOpenQuestions()).isEmpty();
            assertThat(result.getDivergences()).isEmpty();
        }

        @ParameterizedTest
        @ValueSource(strings = {"very high", "certain", "", "HIGHISH"})
        @DisplayName("should coerce unknown confidence to medium")
        void shouldCoerceUnknownConfidence(String confidence) {
            DeliberationResult result = parser.parse(
                    "```json\n{\"verdict\": \"v\", \"confidence\": \"" + confidence + "\"}\n```");

            assertThat(result.getConfidence()).isEqualTo(Confidence.MEDIUM);
        }

        @Test
        @DisplayName("should accept confidence in any case")
        void shouldNormalizeConfidenceCase() {
            DeliberationResult result = parser.parse("```json\n{\"verdict\": \"v\", \"confidence\": \" Low \"}\n```");

            assertThat(result.getConfidence()).isEqualTo(Confidence.LOW);
        }

        @Test
        @DisplayName("should read answer-centric keys as aliases")
        void shouldReadLegacySchema() {
            String content = """
                    ```json
                    {
                      "answer": "Yes, with caveats",
                      "confidence": "medium",
                      "support": ["s1", "s2"],
                      "concerns": ["c1"],
                      "conviction": "All agreed on s1",
                      "open_questions": ["q1"]
                    }
                    ```""";

            DeliberationResult result = parser.parse(content);

            assertThat(result.getVerdict()).isEqualTo("Yes, with caveats");
            assertThat(result.getSupportingPoints()).containsExactly("s1", "s2");
            assertThat(result.getStrongestAgreement()).isEqualTo("All agreed on s1");
            assertThat(result.getOpenQuestions()).containsExactly("q1");
        }

        @Test
        @DisplayName("should accept a divergence with a single position")
        void shouldAcceptSinglePositionDivergence() {
            DeliberationResult result = parser.parse("```json\n{\"verdict\": \"v\", \"divergences\": "
                    + "[{\"topic\": \"t\", \"positions\": [{\"view\": \"only\", \"confidence\": \"sure\"}]}]}\n```");

            assertThat(result.getDivergences()).hasSize(1);
            assertThat(result.getDivergences().get(0).getDescription()).isEmpty();
            assertThat(result.getDivergences().get(0).getPositions().get(0).getConfidence())
                    .isEqualTo(Confidence.MEDIUM);
        }

        @Test
        @DisplayName("should treat a string where a list is expected as one element")
        void shouldWrapScalarList() {
            DeliberationResult result = parser.parse("```json\n{\"verdict\": \"v\", \"concerns\": \"only one\"}\n```");

            assertThat(result.getConcerns()).containsExactly("only one");
        }
    }

    @Nested
    @DisplayName("Raw JSON")
    class RawJson {

        @Test
        @DisplayName("should find an unfenced verdict object")
        void shouldFindUnfencedVerdict() {
            String content = "My synthesis follows. {\"verdict\": \"Proceed\", \"confidence\": \"high\", "
                    + "\"concerns\": [\"cost {est.}\"]} That is all.";

            DeliberationResult result = parser.parse(content);

            assertThat(result.getParseStrategy()).isEqualTo(ParseStrategy.RAW);
            assertThat(result.getVerdict()).isEqualTo("Proceed");
            assertThat(result.getConfidence()).isEqualTo(Confidence.HIGH);
            assertThat(result.getConcerns()).containsExactly("cost {est.}");
        }

        @Test
        @DisplayName("should find an unfenced answer object")
        void shouldFindUnfencedAnswer() {
            DeliberationResult result = parser.parse("Result:\n{ \"answer\": \"No\", \"support\": [\"x\"] }");

            assertThat(result.getParseStrategy()).isEqualTo(ParseStrategy.RAW);
            assertThat(result.getVerdict()).isEqualTo("No");
            assertThat(result.getSupportingPoints()).containsExactly("x");
        }

        @Test
        @DisplayName("should fall through to raw search when the fenced block is broken")
        void shouldFallThroughFromBrokenFence() {
            String content = "```json\n{\"verdict\": \"broken\",,}\n```\n\n{\"verdict\": \"raw\"}";

            DeliberationResult result = parser.parse(content);

            assertThat(result.getParseStrategy()).isEqualTo(ParseStrategy.RAW);
            assertThat(result.getVerdict()).isEqualTo("raw");
        }
    }

    @Nested
    @DisplayName("Fallback")
    class Fallback {

        @Test
        @DisplayName("should take the first paragraph of plain prose")
        void shouldUseFirstParagraph() {
            String content = "Remote work helps focused individual work.\n\nIt hurts mentoring and onboarding.";

            DeliberationResult result = parser.parse(content);

            assertThat(result.getParseStrategy()).isEqualTo(ParseStrategy.FALLBACK);
            assertThat(result.getVerdict()).isEqualTo("Remote work helps focused individual work.");
            assertThat(result.getConfidence()).isEqualTo(Confidence.MEDIUM);
            assertThat(result.getSupportingPoints()).isEmpty();
            assertThat(result.getConcerns()).isEmpty();
            assertThat(result.getKeyAgreements()).isEmpty();
            assertThat(result.getOpenQuestions()).isEmpty();
            assertThat(result.getDivergences()).isEmpty();
        }

        @Test
        @DisplayName("should truncate the first paragraph to 500 characters")
        void shouldTruncateLongParagraph() {
            String paragraph = "x".repeat(800);

            DeliberationResult result = parser.parse(paragraph + "\n\nsecond paragraph");

            assertThat(result.getVerdict()).hasSize(500).isEqualTo("x".repeat(500));
        }

        @Test
        @DisplayName("should not split a surrogate pair at the truncation point")
        void shouldKeepSurrogatePairsWhole() {
            String paragraph = "a".repeat(499) + "\uD83D\uDE00tail";

            DeliberationResult result = parser.parse(paragraph);

            assertThat(result.getVerdict()).isEqualTo("a".repeat(499));
            assertThat(Character.isHighSurrogate(result.getVerdict().charAt(result.getVerdict().length() - 1)))
                    .isFalse();
        }

        @Test
        @DisplayName("should skip leading blank paragraphs")
        void shouldSkipBlankParagraphs() {
            DeliberationResult result = parser.parse("\n\n   \n\n  First real one  \n\nSecond");

            assertThat(result.getVerdict()).isEqualTo("First real one");
        }

        @Test
        @DisplayName("should use a placeholder verdict for null input")
        void shouldHandleNull() {
            DeliberationResult result = parser.parse(null);

            assertThat(result.getParseStrategy()).isEqualTo(ParseStrategy.FALLBACK);
            assertThat(result.getVerdict()).isEqualTo(SynthesisParser.EMPTY_FALLBACK_VERDICT);
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "",
                "   ",
                "{{{{",
                "}}}{",
                "```json\n{\"verdict\": \"never closed\"",
                "```json\n```",
                "{\"verdict\": [1, 2",
                "\"\"\"\\\\\"{",
                "```json\n[1, 2, 3]\n```"
        })
        @DisplayName("should never throw for malformed input")
        void shouldBeTotal(String content) {
            DeliberationResult result = parser.parse(content);

            assertThat(result).isNotNull();
            assertThat(result.getVerdict()).isNotNull();
            assertThat(result.getConfidence()).isEqualTo(Confidence.MEDIUM);
        }
    }

    @Nested
    @DisplayName("Balanced extraction")
    class BalancedExtraction {

        @Test
        @DisplayName("should ignore escaped quotes inside strings")
        void shouldHandleEscapedQuotes() {
            String text = "{\"a\": \"say \\\"}\\\" ok\", \"b\": {\"c\": 1}} trailing";

            assertThat(SynthesisParser.extractBalanced(text, 0))
                    .contains("{\"a\": \"say \\\"}\\\" ok\", \"b\": {\"c\": 1}}");
        }

        @Test
        @DisplayName("should be empty for an unbalanced object")
        void shouldBeEmptyWhenUnbalanced() {
            assertThat(SynthesisParser.extractBalanced("{\"a\": {\"b\": 1}", 0)).isEmpty();
        }
    }
}
