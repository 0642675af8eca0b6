package io.reloop.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.reloop.core.validation.rule.CommandRule;
import io.reloop.core.validation.rule.ContentPatternRule;
import io.reloop.core.validation.rule.CoverageRule;
import io.reloop.core.validation.rule.CustomRule;
import io.reloop.core.validation.rule.FileExistenceRule;
import io.reloop.core.validation.rule.ValidationRule;
import java.io.IOException;
import java.io.Serial;

/// Serializes the `ValidationRule` hierarchy with a `"type"` discriminator field.
///
/// Common fields `name`, `description` (omitted when null) and `enabled` are written
/// for every rule. Type-specific fields:
/// - **`command`**: `command`, `expectedExitCode`, `timeoutMs`, `workingDirectory`, `env`
/// - **`content_pattern`**: `pattern`, `flags`, `target`, `mustMatch`
/// - **`coverage`**: `reportPath`, `reportFormat`, `minCoverage`, `scope`
/// - **`file_existence`**: `paths`, `allMustExist`
/// - **`custom`**: `validatorId`, `config`
///
/// Enum values are written by their wire names (`agent_output`, `lcov`, `lines`).
///
/// @implNote Package-private. Registered by {@link ReloopJacksonModule}.
/// @see ValidationRuleDeserializer for the inverse operation
class ValidationRuleSerializer extends StdSerializer<ValidationRule> {

    @Serial private static final long serialVersionUID = 2215078640190345781L;

    ValidationRuleSerializer() {
        super(ValidationRule.class);
    }

    @Override
    public void serialize(ValidationRule rule, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("type", rule.type().wireName());
        gen.writeStringField("name", rule.name());
        if (rule.description() != null) {
            gen.writeStringField("description", rule.description());
        }
        gen.writeBooleanField("enabled", rule.enabled());

        switch (rule.type()) {
            case COMMAND -> writeCommand((CommandRule) rule, gen, provider);
            case CONTENT_PATTERN -> {
                ContentPatternRule content = (ContentPatternRule) rule;
                gen.writeStringField("pattern", content.pattern());
                if (!content.flags().isEmpty()) {
                    gen.writeStringField("flags", content.flags());
                }
                gen.writeStringField("target", content.target().wireName());
                gen.writeBooleanField("mustMatch", content.mustMatch());
            }
            case COVERAGE -> {
                CoverageRule coverage = (CoverageRule) rule;
                gen.writeStringField("reportPath", coverage.reportPath());
                gen.writeStringField("reportFormat", coverage.reportFormat().wireName());
                gen.writeNumberField("minCoverage", coverage.minCoverage());
                gen.writeStringField("scope", coverage.scope().wireName());
            }
            case FILE_EXISTENCE -> {
                FileExistenceRule files = (FileExistenceRule) rule;
                provider.defaultSerializeField("paths", files.paths(), gen);
                gen.writeBooleanField("allMustExist", files.allMustExist());
            }
            case CUSTOM -> {
                CustomRule custom = (CustomRule) rule;
                gen.writeStringField("validatorId", custom.validatorId());
                if (!custom.config().isEmpty()) {
                    provider.defaultSerializeField("config", custom.config(), gen);
                }
            }
        }

        gen.writeEndObject();
    }

    private static void writeCommand(CommandRule command, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStringField("command", command.command());
        gen.writeNumberField("expectedExitCode", command.expectedExitCode());
        if (command.timeout() != null) {
            gen.writeNumberField("timeoutMs", command.timeout().toMillis());
        }
        if (command.workingDirectory() != null) {
            gen.writeStringField("workingDirectory", command.workingDirectory());
        }
        if (!command.env().isEmpty()) {
            provider.defaultSerializeField("env", command.env(), gen);
        }
    }
}
