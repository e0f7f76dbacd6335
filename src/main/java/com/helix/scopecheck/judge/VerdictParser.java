package com.helix.scopecheck.judge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.helix.scopecheck.exception.MalformedModelOutputException;
import com.helix.scopecheck.model.verdict.AlignmentVerdict;
import com.helix.scopecheck.model.verdict.Severity;
import com.helix.scopecheck.model.verdict.Violation;
import com.helix.scopecheck.model.verdict.ViolationKind;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw model text into a validated {@link AlignmentVerdict}.
 *
 * <p>Extraction is lenient (markdown fences, prose around the object, trailing commas, comments,
 * single quotes); validation is not. Every problem found is reported so the repair prompt can
 * name them all at once.
 */
@Component
public class VerdictParser {

    private static final ObjectMapper LENIENT_MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .build();

    private static final Pattern FENCE = Pattern.compile("```(?:json|JSON)?\\s*\\n?(.*?)```", Pattern.DOTALL);
    private static final Set<String> PROJECT_WIDE = Set.of("", "project-wide", "project wide", "n/a", "none", "null");

    public AlignmentVerdict parse(String raw, Set<String> fileInventory) {
        JsonNode root = extract(raw);
        List<String> problems = new ArrayList<>();

        Double score = null;
        JsonNode scoreNode = field(root, "alignment_score", "alignmentScore", "score");
        if (scoreNode == null) {
            problems.add("alignment_score is required");
        } else if (!scoreNode.isNumber() && !isNumeric(scoreNode)) {
            problems.add("alignment_score must be a number, got " + scoreNode);
        } else {
            score = scoreNode.asDouble();
            if (score.isNaN() || score < 0.0 || score > 1.0) {
                problems.add("alignment_score must be between 0.0 and 1.0, got " + scoreNode.asText());
            }
        }

        List<Violation> violations = new ArrayList<>();
        JsonNode violationsNode = field(root, "violations");
        if (violationsNode == null) {
            problems.add("violations is required (use [] when there are none)");
        } else if (!violationsNode.isArray()) {
            problems.add("violations must be an array");
        } else {
            for (int i = 0; i < violationsNode.size(); i++) {
                parseViolation(violationsNode.get(i), i, fileInventory, problems).ifPresent(violations::add);
            }
        }

        JsonNode summaryNode = field(root, "summary");
        String summary = summaryNode == null || summaryNode.isNull() ? "" : summaryNode.asText();

        boolean approval = false;
        JsonNode approvalNode = field(root, "approval_required", "approvalRequired", "requires_tpm_approval");
        if (approvalNode != null) {
            approval = approvalNode.isBoolean()
                    ? approvalNode.booleanValue()
                    : Set.of("true", "yes").contains(approvalNode.asText().trim().toLowerCase(Locale.ROOT));
        }

        if (!problems.isEmpty()) {
            throw new MalformedModelOutputException(problems);
        }
        return new AlignmentVerdict(score, violations, summary, approval);
    }

    /**
     * Locates and parses the JSON object in the response.
     */
    JsonNode extract(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new MalformedModelOutputException(List.of("Response is empty"));
        }
        String text = raw.strip();
        Matcher fence = FENCE.matcher(text);
        if (fence.find()) {
            text = fence.group(1).strip();
        }

        JsonNode root = tryParse(text);
        if (root == null || !root.isObject()) {
            // a leading scalar such as "2 issues found:" parses on its own and hides the object
            String block = firstObject(text);
            JsonNode object = block == null ? null : tryParse(block);
            if (object != null && object.isObject()) {
                root = object;
            }
        }
        if (root == null) {
            throw new MalformedModelOutputException(List.of("Response is not valid JSON; return exactly one JSON object"));
        }
        if (!root.isObject()) {
            throw new MalformedModelOutputException(List.of("Top-level JSON value must be an object"));
        }
        return root;
    }

    private Optional<Violation> parseViolation(JsonNode node, int index, Set<String> fileInventory, List<String> problems) {
        String at = "violations[" + index + "]";
        if (node == null || !node.isObject()) {
            problems.add(at + " must be an object");
            return Optional.empty();
        }
        int before = problems.size();

        JsonNode kindNode = field(node, "kind", "violation_type", "type");
        Optional<ViolationKind> kind = kindNode == null ? Optional.empty() : ViolationKind.fromWire(kindNode.asText());
        if (kind.isEmpty()) {
            problems.add(at + ".kind must be one of scope_creep, missing_feature_flag, undocumented_dependency, "
                    + "missing_test_coverage, other" + (kindNode == null ? "" : "; got '" + kindNode.asText() + "'"));
        }

        JsonNode severityNode = field(node, "severity");
        Optional<Severity> severity = severityNode == null ? Optional.empty() : Severity.fromWire(severityNode.asText());
        if (severity.isEmpty()) {
            problems.add(at + ".severity must be one of critical, warning, info"
                    + (severityNode == null ? "" : "; got '" + severityNode.asText() + "'"));
        }

        String filePath = null;
        JsonNode pathNode = field(node, "file_path", "filePath", "file");
        if (pathNode != null && !pathNode.isNull()) {
            String candidate = normalizePath(pathNode.asText());
            if (!PROJECT_WIDE.contains(candidate.toLowerCase(Locale.ROOT))) {
                if (fileInventory.contains(candidate)) {
                    filePath = candidate;
                } else {
                    problems.add(at + ".file_path '" + pathNode.asText()
                            + "' is not one of the changed files; use a listed path or null for project-wide findings");
                }
            }
        }

        JsonNode descriptionNode = field(node, "description");
        if (descriptionNode == null || descriptionNode.isNull() || descriptionNode.asText().isBlank()) {
            problems.add(at + ".description is required");
        }
        JsonNode recommendationNode = field(node, "recommendation");

        if (problems.size() > before) {
            return Optional.empty();
        }
        return Optional.of(new Violation(kind.get(), severity.get(), filePath, descriptionNode.asText(),
                recommendationNode == null || recommendationNode.isNull() ? "" : recommendationNode.asText()));
    }

    private static JsonNode field(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static boolean isNumeric(JsonNode node) {
        if (!node.isTextual()) {
            return false;
        }
        try {
            Double.parseDouble(node.asText().trim());
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static String normalizePath(String path) {
        String p = path.trim();
        if (p.startsWith("`") && p.endsWith("`") && p.length() > 1) {
            p = p.substring(1, p.length() - 1);
        }
        while (p.startsWith("./")) {
            p = p.substring(2);
        }
        return p;
    }

    private static JsonNode tryParse(String text) {
        try {
            return LENIENT_MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    /**
     * First balanced {@code {...}} block, ignoring braces inside string literals.
     */
    private static String firstObject(String text) {
        int start = text.indexOf('{');
        if (start < 0) {
            return null;
        }
        int depth = 0;
        boolean inString = false;
        char quote = 0;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    inString = false;
                }
            } else if (c == '"' || c == '\'') {
                inString = true;
                quote = c;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return text.substring(start, i + 1);
                }
            }
        }
        return null;
    }
}
