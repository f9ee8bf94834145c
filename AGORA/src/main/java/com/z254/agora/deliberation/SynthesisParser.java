package com.z254.agora.deliberation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.z254.agora.config.AgoraProperties;
import com.z254.agora.domain.model.Confidence;
import com.z254.agora.domain.model.DeliberationResult;
import com.z254.agora.domain.model.Divergence;
import com.z254.agora.domain.model.ParseStrategy;
import com.z254.agora.domain.model.Position;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a {@link DeliberationResult} from the free-form synthesis response.
 *
 * <p>Tiers, first success wins:
 * <ol>
 *   <li>a {@code ```json} fenced block, object cut out by balanced-brace scanning</li>
 *   <li>an unfenced object opening with {@code "verdict"} or {@code "answer"}</li>
 *   <li>the first non-blank paragraph as verdict, medium confidence, empty lists</li>
 * </ol>
 *
 * <p>{@link #parse(String)} is total: it returns a result for every input, including null.
 *
 * <p>The verdict-centric keys are canonical. The older answer-centric keys are read as
 * aliases: {@code answer} for {@code verdict}, {@code support} for {@code supporting_points}
 * and {@code conviction} for {@code strongest_agreement}.
 */
@Component
@Slf4j
public class SynthesisParser {

    static final String EMPTY_FALLBACK_VERDICT = "Analysis complete - see full content";

    private static final Pattern JSON_FENCE = Pattern.compile("```json", Pattern.CASE_INSENSITIVE);
    private static final String FENCE = "```";
    private static final Pattern RAW_OPENING = Pattern.compile("\\{\\s*\"(?:verdict|answer)\"");
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");
    private static final int DEBUG_EXCERPT = 500;

    private final ObjectReader jsonReader;
    private final int fallbackVerdictMaxLength;
    private final MeterRegistry meterRegistry;

    public SynthesisParser(ObjectMapper objectMapper, AgoraProperties agoraProperties, MeterRegistry meterRegistry) {
        // Models routinely leave trailing commas and raw newlines inside strings.
        this.jsonReader = objectMapper.reader()
                .with(JsonReadFeature.ALLOW_TRAILING_COMMA.mappedFeature())
                .with(JsonReadFeature.ALLOW_UNESCAPED_CONTROL_CHARS.mappedFeature());
        this.fallbackVerdictMaxLength = agoraProperties.getDeliberation().getFallbackVerdictMaxLength();
        this.meterRegistry = meterRegistry;
    }

    public DeliberationResult parse(String content) {
        String text = content != null ? content.replace("\r\n", "\n") : "";

        Optional<DeliberationResult> result = parseFenced(text);
        if (result.isEmpty()) {
            result = parseRaw(text);
        }
        if (result.isEmpty()) {
            log.warn("Could not parse synthesis JSON, using fallback extraction");
            result = Optional.of(fallback(text));
        }

        DeliberationResult parsed = result.get();
        meterRegistry.counter("agora.synthesis.parse",
                "strategy", parsed.getParseStrategy().name().toLowerCase(Locale.ROOT)).increment();
        return parsed;
    }

    private Optional<DeliberationResult> parseFenced(String text) {
        Matcher fence = JSON_FENCE.matcher(text);
        while (fence.find()) {
            int blockStart = fence.end();
            int blockEnd = text.indexOf(FENCE, blockStart);
            int open = text.indexOf('{', blockStart);
            if (open < 0 || (blockEnd >= 0 && open > blockEnd)) {
                continue;
            }
            Optional<DeliberationResult> decoded = extractBalanced(text, open)
                    .flatMap(json -> decode(json, ParseStrategy.FENCED));
            if (decoded.isPresent()) {
                return decoded;
            }
        }
        return Optional.empty();
    }

    private Optional<DeliberationResult> parseRaw(String text) {
        Matcher opening = RAW_OPENING.matcher(text);
        while (opening.find()) {
            Optional<DeliberationResult> decoded = extractBalanced(text, opening.start())
                    .flatMap(json -> decode(json, ParseStrategy.RAW));
            if (decoded.isPresent()) {
                return decoded;
            }
        }
        return Optional.empty();
    }

    /**
     * Cut out the object starting at {@code open} by tracking brace depth. Braces inside
     * string literals do not count. Empty when the object never closes.
     */
    static Optional<String> extractBalanced(String text, int open) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return Optional.of(text.substring(open, i + 1));
                }
            }
        }
        return Optional.empty();
    }

    private Optional<DeliberationResult> decode(String json, ParseStrategy strategy) {
        try {
            JsonNode node = jsonReader.readTree(json);
            if (node == null || !node.isObject()) {
                return Optional.empty();
            }
            return Optional.of(fromJson(node, strategy));
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse synthesis JSON ({}): {}", strategy, e.getOriginalMessage());
            log.debug("JSON string was: {}", excerpt(json));
            return Optional.empty();
        }
    }

    private DeliberationResult fromJson(JsonNode node, ParseStrategy strategy) {
        return DeliberationResult.builder()
                .verdict(text(node, "verdict", "answer").orElse(DeliberationResult.NO_VERDICT))
                .confidence(Confidence.from(text(node, "confidence").orElse(null)))
                .reasoning(text(node, "reasoning").orElse(""))
                .supportingPoints(list(node, "supporting_points", "support"))
                .concerns(list(node, "concerns"))
                .keyAgreements(list(node, "key_agreements"))
                .strongestAgreement(text(node, "strongest_agreement", "conviction").orElse(""))
                .openQuestions(list(node, "open_questions"))
                .divergences(divergences(node.path("divergences")))
                .parseStrategy(strategy)
                .build();
    }

    private List<Divergence> divergences(JsonNode array) {
        List<Divergence> divergences = new ArrayList<>();
        if (!array.isArray()) {
            return divergences;
        }
        for (JsonNode item : array) {
            if (!item.isObject()) {
                continue;
            }
            List<Position> positions = new ArrayList<>();
            for (JsonNode position : item.path("positions")) {
                if (position.isObject()) {
                    positions.add(Position.builder()
                            .view(text(position, "view").orElse(""))
                            .confidence(Confidence.from(text(position, "confidence").orElse(null)))
                            .build());
                } else if (!position.isNull()) {
                    positions.add(Position.builder().view(position.asText()).build());
                }
            }
            divergences.add(Divergence.builder()
                    .topic(text(item, "topic").orElse(""))
                    .description(text(item, "description").orElse(""))
                    .positions(positions)
                    .build());
        }
        return divergences;
    }

    /**
     * First present, non-null key among the aliases. Non-string values are rendered as JSON.
     */
    private static Optional<String> text(JsonNode node, String... keys) {
        for (String key : keys) {
            JsonNode value = node.get(key);
            if (value != null && !value.isNull()) {
                return Optional.of(value.isValueNode() ? value.asText() : value.toString());
            }
        }
        return Optional.empty();
    }

    /**
     * First present list among the aliases. A bare string counts as a one-element list.
     */
    private static List<String> list(JsonNode node, String... keys) {
        List<String> values = new ArrayList<>();
        for (String key : keys) {
            JsonNode value = node.get(key);
            if (value == null || value.isNull()) {
                continue;
            }
            if (value.isArray()) {
                for (JsonNode element : value) {
                    if (!element.isNull()) {
                        values.add(element.isValueNode() ? element.asText() : element.toString());
                    }
                }
            } else if (value.isValueNode()) {
                values.add(value.asText());
            }
            return values;
        }
        return values;
    }

    private DeliberationResult fallback(String text) {
        String verdict = EMPTY_FALLBACK_VERDICT;
        for (String paragraph : PARAGRAPH_BREAK.split(text)) {
            String trimmed = paragraph.trim();
            if (!trimmed.isEmpty()) {
                verdict = trimmed;
                break;
            }
        }
        if (verdict.length() > fallbackVerdictMaxLength) {
            int end = fallbackVerdictMaxLength;
            // keep surrogate pairs whole
            if (end > 0 && Character.isHighSurrogate(verdict.charAt(end - 1))) {
                end--;
            }
            verdict = verdict.substring(0, end);
        }
        return DeliberationResult.builder()
                .verdict(verdict)
                .confidence(Confidence.MEDIUM)
                .parseStrategy(ParseStrategy.FALLBACK)
                .build();
    }

    private static String excerpt(String s) {
        return s.length() > DEBUG_EXCERPT ? s.substring(0, DEBUG_EXCERPT) + "..." : s;
    }
}
