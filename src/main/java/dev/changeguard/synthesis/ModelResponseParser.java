package dev.changeguard.synthesis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import dev.changeguard.domain.enums.OverallStatus;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a {@link ModelAssessment} from free-form model output.
 *
 * <p>Candidates are tried in order: the whole answer, each fenced code block, then the first
 * balanced {@code {...}} object. Each candidate is read strictly first and then leniently
 * (single quotes, unquoted names, trailing commas, comments). The first candidate that yields
 * an object with a recognised {@code overall_status} wins.
 *
 * <p>Stateless and thread-safe.
 */
public final class ModelResponseParser {

    private static final Pattern FENCED_BLOCK = Pattern.compile("```(?:json|JSON)?\\s*([\\s\\S]*?)```");

    private final ObjectMapper strict = JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();
    private final ObjectMapper lenient = JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_YAML_COMMENTS)
            .build();

    public record Result(ModelAssessment assessment, String error) {
        static Result success(ModelAssessment assessment) {
            return new Result(assessment, null);
        }

        static Result failure(String error) {
            return new Result(null, error);
        }

        public boolean isSuccess() {
            return assessment != null;
        }
    }

    public Result parse(String answer) {
        if (answer == null || answer.isBlank()) return Result.failure("empty answer");

        String lastError = "no JSON object found";
        for (String candidate : candidates(answer)) {
            for (ObjectMapper mapper : List.of(strict, lenient)) {
                try {
                    JsonNode node = mapper.readTree(candidate);
                    Optional<ModelAssessment> assessment = toAssessment(node);
                    if (assessment.isPresent()) return Result.success(assessment.get());
                    lastError = "JSON has no recognised overall_status";
                } catch (JsonProcessingException e) {
                    lastError = e.getOriginalMessage();
                }
            }
        }
        return Result.failure(lastError);
    }

    static List<String> candidates(String answer) {
        Set<String> candidates = new LinkedHashSet<>();
        candidates.add(answer.trim());
        Matcher fenced = FENCED_BLOCK.matcher(answer);
        while (fenced.find()) {
            String block = fenced.group(1).trim();
            if (!block.isEmpty()) candidates.add(block);
        }
        firstBalancedObject(answer).ifPresent(candidates::add);
        return new ArrayList<>(candidates);
    }

    /** First {@code {...}} span whose braces balance, ignoring braces inside string literals. */
    static Optional<String> firstBalancedObject(String text) {
        int start = text.indexOf('{');
        while (start >= 0) {
            int depth = 0;
            char quote = 0;
            boolean escaped = false;
            for (int i = start; i < text.length(); i++) {
                char c = text.charAt(i);
                if (quote != 0) {
                    if (escaped) escaped = false;
                    else if (c == '\\') escaped = true;
                    else if (c == quote) quote = 0;
                    continue;
                }
                if (c == '"' || c == '\'') quote = c;
                else if (c == '{') depth++;
                else if (c == '}' && --depth == 0) return Optional.of(text.substring(start, i + 1));
            }
            start = text.indexOf('{', start + 1);
        }
        return Optional.empty();
    }

    private static Optional<ModelAssessment> toAssessment(JsonNode node) {
        if (node == null || !node.isObject()) return Optional.empty();
        JsonNode status = node.get("overall_status");
        if (status == null || !status.isTextual()) return Optional.empty();
        return OverallStatus.parse(status.asText()).map(overall -> new ModelAssessment(
                overall,
                textOrNull(node.get("documentation_assessment")),
                texts(node.get("risks")),
                texts(node.has("required_actions") ? node.get("required_actions") : node.get("remediation_steps")),
                textOrNull(node.get("synthesis"))));
    }

    private static List<String> texts(JsonNode node) {
        if (node == null || node.isNull()) return List.of();
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(item -> {
                String text = item.isObject() ? firstText(item, "description", "action", "risk", "title") : textOrNull(item);
                if (text != null) values.add(text);
            });
        } else {
            String single = textOrNull(node);
            if (single != null) values.add(single);
        }
        return values;
    }

    private static String firstText(JsonNode object, String... names) {
        for (String name : names) {
            String value = textOrNull(object.get(name));
            if (value != null) return value;
        }
        return object.toString();
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) return null;
        String text = node.asText().trim();
        return text.isEmpty() ? null : text;
    }
}
