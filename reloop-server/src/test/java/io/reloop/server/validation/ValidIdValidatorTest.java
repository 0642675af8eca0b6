package io.reloop.server.validation;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class ValidIdValidatorTest {

    private final ValidIdValidator validator = new ValidIdValidator();

    @ParameterizedTest
    @ValueSource(
            strings = {
                "task-1",
                "T42",
                "jira:PROJ-123",
                "a.b_c",
                "0b6f2c1e-7d4a-4c1e-9f8b-2a6d5e3c1b00"
            })
    void shouldAcceptSafeIds(String id) {
        assertThat(validator.isValid(id, null)).isTrue();
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(
            strings = {" ", "-leading", ":leading", "../etc/passwd", "a b", "id;drop", "x\ny"})
    void shouldRejectUnsafeIds(String id) {
        assertThat(validator.isValid(id, null)).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {"tâche-1", "task-١", "ｔask"})
    void shouldRejectNonAsciiAlphanumerics(String id) {
        assertThat(validator.isValid(id, null)).isFalse();
    }

    @Test
    void shouldRejectOverlongIds() {
        assertThat(validator.isValid("a".repeat(ValidIdValidator.MAX_LENGTH + 1), null)).isFalse();
        assertThat(validator.isValid("a".repeat(ValidIdValidator.MAX_LENGTH), null)).isTrue();
    }
}
