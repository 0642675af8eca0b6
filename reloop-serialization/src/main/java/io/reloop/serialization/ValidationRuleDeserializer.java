package io.reloop.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.reloop.core.validation.rule.CommandRule;
import io.reloop.core.validation.rule.ContentPatternRule;
import io.reloop.core.validation.rule.ContentTarget;
import io.reloop.core.validation.rule.CoverageFormat;
import io.reloop.core.validation.rule.CoverageRule;
import io.reloop.core.validation.rule.CoverageScope;
import io.reloop.core.validation.rule.CustomRule;
import io.reloop.core.validation.rule.FileExistenceRule;
import io.reloop.core.validation.rule.RuleType;
import io.reloop.core.validation.rule.ValidationRule;
import java.io.IOException;
import java.io.Serial;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/// Deserializes the `ValidationRule` hierarchy using its `"type"` discriminator field.
///
/// Absent optional fields take the rule defaults: `enabled` true, `expectedExitCode` 0,
/// `target` agent_output, `mustMatch` true, `reportFormat` lcov, `scope` lines,
/// `allMustExist` true. A missing required field or an unknown type or enum value is
/// reported as a {@link JsonMappingException}.
///
/// @implNote Package-private. Registered by {@link ReloopJacksonModule}.
/// @see ValidationRuleSerializer for the inverse operation
class ValidationRuleDeserializer extends StdDeserializer<ValidationRule> {

    @Serial private static final long serialVersionUID = -6391822403174957610L;

    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {};
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    ValidationRuleDeserializer() {
        super(ValidationRule.class);
    }

    @Override
    public ValidationRule deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        // Codec is an ObjectReader when bound through a reader, not always an ObjectMapper
        ObjectCodec codec = p.getCodec();
        JsonNode root = codec.readTree(p);

        RuleType type;
        try {
            type = RuleType.fromWireName(required(p, root, "type"));
        } catch (IllegalArgumentException e) {
            throw JsonMappingException.from(p, e.getMessage(), e);
        }
        String name = required(p, root, "name");
        String description = optional(root, "description");
        boolean enabled = !root.has("enabled") || root.get("enabled").asBoolean();

        try {
            return switch (type) {
                case COMMAND ->
                        new CommandRule(
                                name,
                                description,
                                enabled,
                                required(p, root, "command"),
                                root.path("expectedExitCode").asInt(0),
                                root.hasNonNull("timeoutMs")
                                        ? Duration.ofMillis(root.get("timeoutMs").asLong())
                                        : null,
                                optional(root, "workingDirectory"),
                                root.hasNonNull("env")
                                        ? convert(codec, root.get("env"), STRING_MAP)
                                        : Map.of());
                case CONTENT_PATTERN ->
                        new ContentPatternRule(
                                name,
                                description,
                                enabled,
                                required(p, root, "pattern"),
                                optional(root, "flags"),
                                root.hasNonNull("target")
                                        ? ContentTarget.fromWireName(root.get("target").asText())
                                        : ContentTarget.AGENT_OUTPUT,
                                !root.has("mustMatch") || root.get("mustMatch").asBoolean());
                case COVERAGE ->
                        new CoverageRule(
                                name,
                                description,
                                enabled,
                                required(p, root, "reportPath"),
                                root.hasNonNull("reportFormat")
                                        ? CoverageFormat.fromWireName(
                                                root.get("reportFormat").asText())
                                        : CoverageFormat.LCOV,
                                root.path("minCoverage").asDouble(0),
                                root.hasNonNull("scope")
                                        ? CoverageScope.fromWireName(root.get("scope").asText())
                                        : CoverageScope.LINES);
                case FILE_EXISTENCE ->
                        new FileExistenceRule(
                                name,
                                description,
                                enabled,
                                root.hasNonNull("paths")
                                        ? convert(codec, root.get("paths"), STRING_LIST)
                                        : List.of(),
                                !root.has("allMustExist") || root.get("allMustExist").asBoolean());
                case CUSTOM ->
                        new CustomRule(
                                name,
                                description,
                                enabled,
                                required(p, root, "validatorId"),
                                root.hasNonNull("config")
                                        ? convert(codec, root.get("config"), OBJECT_MAP)
                                        : Map.of());
            };
        } catch (IllegalArgumentException e) {
            throw JsonMappingException.from(
                    p, "Invalid validation rule '" + name + "': " + e.getMessage(), e);
        }
    }

    private static <T> T convert(ObjectCodec codec, JsonNode node, TypeReference<T> type)
            throws IOException {
        try (JsonParser parser = node.traverse(codec)) {
            parser.nextToken();
            return codec.readValue(parser, type);
        }
    }

    private static String required(JsonParser p, JsonNode root, String field)
            throws JsonMappingException {
        JsonNode value = root.get(field);
        if (value == null || value.isNull()) {
            throw JsonMappingException.from(p, "Validation rule is missing '" + field + "'");
        }
        return value.asText();
    }

    private static String optional(JsonNode root, String field) {
        JsonNode value = root.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
