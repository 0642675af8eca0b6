package io.reloop.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.reloop.core.validation.rule.CommandRule;
import io.reloop.core.validation.rule.ContentPatternRule;
import io.reloop.core.validation.rule.ContentTarget;
import io.reloop.core.validation.rule.CoverageFormat;
import io.reloop.core.validation.rule.CoverageRule;
import io.reloop.core.validation.rule.CoverageScope;
import io.reloop.core.validation.rule.CustomRule;
import io.reloop.core.validation.rule.FileExistenceRule;
import io.reloop.core.validation.rule.ValidationRule;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ValidationRuleSerializationTest {

    private final ObjectMapper mapper = CheckpointSerializer.createMapper();

    private ValidationRule read(String json) throws Exception {
        return mapper.readValue(json, ValidationRule.class);
    }

    @Nested
    class WireFormat {

        @Test
        void shouldWriteTypeDiscriminatorAndWireNames() throws Exception {
            ContentPatternRule rule =
                    ContentPatternRule.builder()
                            .name("done")
                            .pattern("DONE")
                            .target(ContentTarget.WORK_PRODUCT_LATEST)
                            .build();

            JsonNode json = mapper.valueToTree(rule);

            assertThat(json.get("type").asText()).isEqualTo("content_pattern");
            assertThat(json.get("target").asText()).isEqualTo("work_product_latest");
            assertThat(json.get("mustMatch").asBoolean()).isTrue();
            assertThat(json.has("flags")).isFalse();
            assertThat(json.has("description")).isFalse();
        }

        @Test
        void shouldWriteCommandTimeoutInMillis() {
            CommandRule rule =
                    CommandRule.builder()
                            .name("build")
                            .command("make")
                            .timeout(Duration.ofSeconds(90))
                            .build();

            JsonNode json = mapper.valueToTree(rule);

            assertThat(json.get("type").asText()).isEqualTo("command");
            assertThat(json.get("timeoutMs").asLong()).isEqualTo(90_000);
            assertThat(json.has("env")).isFalse();
        }

        @Test
        void shouldWriteCoverageEnumsByWireName() {
            CoverageRule rule =
                    CoverageRule.builder()
                            .name("cov")
                            .reportPath("coverage/coverage-summary.json")
                            .reportFormat(CoverageFormat.JSON)
                            .minCoverage(75.5)
                            .scope(CoverageScope.FUNCTIONS)
                            .build();

            JsonNode json = mapper.valueToTree(rule);

            assertThat(json.get("reportFormat").asText()).isEqualTo("json");
            assertThat(json.get("scope").asText()).isEqualTo("functions");
            assertThat(json.get("minCoverage").asDouble()).isEqualTo(75.5);
        }
    }

    @Nested
    class Defaults {

        @Test
        void shouldApplyCommandDefaults() throws Exception {
            ValidationRule rule = read("{\"type\":\"command\",\"name\":\"t\",\"command\":\"true\"}");

            assertThat(rule).isInstanceOf(CommandRule.class);
            CommandRule command = (CommandRule) rule;
            assertThat(command.enabled()).isTrue();
            assertThat(command.expectedExitCode()).isZero();
            assertThat(command.timeout()).isNull();
            assertThat(command.env()).isEmpty();
        }

        @Test
        void shouldApplyContentPatternDefaults() throws Exception {
            ContentPatternRule rule =
                    (ContentPatternRule)
                            read("{\"type\":\"content_pattern\",\"name\":\"p\",\"pattern\":\"x\"}");

            assertThat(rule.target()).isEqualTo(ContentTarget.AGENT_OUTPUT);
            assertThat(rule.mustMatch()).isTrue();
            assertThat(rule.flags()).isEmpty();
        }

        @Test
        void shouldApplyCoverageDefaults() throws Exception {
            CoverageRule rule =
                    (CoverageRule)
                            read(
                                    "{\"type\":\"coverage\",\"name\":\"c\","
                                            + "\"reportPath\":\"lcov.info\",\"minCoverage\":80}");

            assertThat(rule.reportFormat()).isEqualTo(CoverageFormat.LCOV);
            assertThat(rule.scope()).isEqualTo(CoverageScope.LINES);
            assertThat(rule.minCoverage()).isEqualTo(80.0);
        }

        @Test
        void shouldApplyFileExistenceDefaults() throws Exception {
            FileExistenceRule rule =
                    (FileExistenceRule)
                            read("{\"type\":\"file_existence\",\"name\":\"f\",\"paths\":[\"a\",\"b\"]}");

            assertThat(rule.allMustExist()).isTrue();
            assertThat(rule.paths()).containsExactly("a", "b");
        }

        @Test
        void shouldReadCustomConfig() throws Exception {
            CustomRule rule =
                    (CustomRule)
                            read(
                                    "{\"type\":\"custom\",\"name\":\"c\",\"enabled\":false,"
                                            + "\"validatorId\":\"acme.lint\","
                                            + "\"config\":{\"levels\":[\"error\"]}}");

            assertThat(rule.enabled()).isFalse();
            assertThat(rule.validatorId()).isEqualTo("acme.lint");
            assertThat(rule.config()).containsEntry("levels", List.of("error"));
        }
    }

    @Nested
    class Rejection {

        @Test
        void shouldRejectUnknownType() {
            assertThatThrownBy(() -> read("{\"type\":\"telepathy\",\"name\":\"x\"}"))
                    .isInstanceOf(JsonMappingException.class)
                    .hasMessageContaining("Unknown rule type: telepathy");
        }

        @Test
        void shouldRejectMissingDiscriminator() {
            assertThatThrownBy(() -> read("{\"name\":\"x\",\"command\":\"true\"}"))
                    .isInstanceOf(JsonMappingException.class)
                    .hasMessageContaining("missing 'type'");
        }

        @Test
        void shouldRejectMissingRequiredField() {
            assertThatThrownBy(() -> read("{\"type\":\"command\",\"name\":\"x\"}"))
                    .isInstanceOf(JsonMappingException.class)
                    .hasMessageContaining("missing 'command'");
        }

        @Test
        void shouldRejectUnknownEnumValue() {
            assertThatThrownBy(
                            () ->
                                    read(
                                            "{\"type\":\"coverage\",\"name\":\"c\","
                                                    + "\"reportPath\":\"r\",\"scope\":\"everything\"}"))
                    .isInstanceOf(JsonMappingException.class)
                    .hasMessageContaining("Invalid validation rule 'c'");
        }
    }
}
