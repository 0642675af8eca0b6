package io.reloop.core.validation.evaluator;

import java.io.Serial;

/// Thrown when a rule evaluator cannot perform its check.
///
/// Distinct from a failed check: the condition could not be determined at all.
/// Common causes:
/// - Command timed out or could not be spawned
/// - Coverage report missing or unparseable
/// - Invalid regular expression
///
/// The {@link io.reloop.core.validation.ValidationEngine} records the message as the
/// result's error; this exception never escapes a validation pass.
public class EvaluatorException extends Exception {

    @Serial private static final long serialVersionUID = 3120958463301578127L;

    public EvaluatorException(String message) {
        super(message);
    }

    public EvaluatorException(String message, Throwable cause) {
        super(message, cause);
    }
}
