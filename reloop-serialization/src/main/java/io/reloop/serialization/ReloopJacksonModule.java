package io.reloop.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.reloop.core.iteration.IterationConfig;
import io.reloop.core.validation.ValidationResult;
import io.reloop.core.validation.rule.ValidationRule;
import io.reloop.serialization.mixin.IterationConfigBuilderMixin;
import io.reloop.serialization.mixin.IterationConfigMixin;
import io.reloop.serialization.mixin.ValidationResultBuilderMixin;
import io.reloop.serialization.mixin.ValidationResultMixin;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all Reloop serialization configuration.
///
/// **Custom serializer/deserializer pair** for the sealed rule hierarchy:
/// - `ValidationRule`: `ValidationRuleSerializer` / `ValidationRuleDeserializer`,
///   discriminator: `"type"` with wire names such as `content_pattern`
///
/// **Mixin/builder pairs** for immutable builder-based types:
/// - `IterationConfig` + `IterationConfig.Builder`
/// - `ValidationResult` + `ValidationResult.Builder`
///
/// Records (`Checkpoint`, `HistoryEntry`, `ValidationReport`, `CheckpointChain`) bind
/// through their canonical constructors and need no registration.
///
/// @see CheckpointSerializer for the convenience factory API
public class ReloopJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 4127395510742218386L;

    public ReloopJacksonModule() {
        super("ReloopJacksonModule");

        addSerializer(ValidationRule.class, new ValidationRuleSerializer());
        addDeserializer(ValidationRule.class, new ValidationRuleDeserializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(IterationConfig.class, IterationConfigMixin.class);
        context.setMixInAnnotations(IterationConfig.Builder.class, IterationConfigBuilderMixin.class);

        context.setMixInAnnotations(ValidationResult.class, ValidationResultMixin.class);
        context.setMixInAnnotations(
                ValidationResult.Builder.class, ValidationResultBuilderMixin.class);
    }
}
