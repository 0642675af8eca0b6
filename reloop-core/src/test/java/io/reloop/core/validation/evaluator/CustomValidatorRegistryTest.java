package io.reloop.core.validation.evaluator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.reloop.core.validation.RuleOutcome;
import io.reloop.core.validation.ValidationContext;
import io.reloop.core.validation.rule.CustomRule;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CustomValidatorRegistryTest {

    private static CustomValidator validator(String id) {
        CustomValidator validator = mock(CustomValidator.class);
        when(validator.getValidatorId()).thenReturn(id);
        return validator;
    }

    @Test
    void shouldRegisterInitialValidators() {
        CustomValidatorRegistry registry =
                new CustomValidatorRegistry(List.of(validator("lint"), validator("license")));

        assertThat(registry.ids()).containsExactlyInAnyOrder("lint", "license");
        assertThat(registry.contains("lint")).isTrue();
        assertThat(registry.get("other")).isEmpty();
    }

    @Test
    void shouldReplaceValidatorWithSameId() {
        CustomValidatorRegistry registry = new CustomValidatorRegistry();
        CustomValidator first = validator("lint");
        CustomValidator second = validator("lint");

        registry.register(first);
        registry.register(second);

        assertThat(registry.get("lint")).containsSame(second);
    }

    @Test
    void shouldPassRuleConfigToValidator() throws Exception {
        CustomValidator lint = validator("lint");
        ValidationContext context = new ValidationContext(Path.of("."), "out", null, null);
        Map<String, Object> config = Map.of("maxWarnings", 0);
        when(lint.validate(config, context)).thenReturn(RuleOutcome.fail("2 warnings", Map.of()));
        CustomRuleEvaluator evaluator =
                new CustomRuleEvaluator(new CustomValidatorRegistry(List.of(lint)));

        RuleOutcome outcome = evaluator.evaluate(CustomRule.of("lint", "lint", config), context);

        assertThat(outcome.passed()).isFalse();
        verify(lint).validate(config, context);
    }
}
