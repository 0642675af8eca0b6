package io.reloop.server.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

/// Checks task and checkpoint ids annotated with {@link ValidId}.
///
/// Checkpoint ids are UUIDs. Task ids come from the caller's tracker and are often
/// namespaced, as in `jira:PROJ-12`, so the colon is allowed next to `.`, `_` and
/// `-`. Only ASCII letters and digits count as alphanumeric, and the first
/// character must be one.
public class ValidIdValidator implements ConstraintValidator<ValidId, String> {

    static final int MAX_LENGTH = 255;

    private static final String SEPARATORS = "._:-";

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        if (value == null || value.isEmpty() || value.length() > MAX_LENGTH) {
            return false;
        }
        if (!isAsciiAlphanumeric(value.charAt(0))) {
            return false;
        }
        for (int i = 1; i < value.length(); i++) {
            char c = value.charAt(i);
            if (!isAsciiAlphanumeric(c) && SEPARATORS.indexOf(c) < 0) {
                return false;
            }
        }
        return true;
    }

    private static boolean isAsciiAlphanumeric(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
    }
}
