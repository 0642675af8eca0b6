package io.reloop.core.exception;

import java.io.Serial;
import java.util.List;

/// Thrown when a session config violates the configuration limits.
///
/// Carries every violation found, not only the first.
public class InvalidIterationConfigException extends IterationException {

    @Serial private static final long serialVersionUID = 2957714408236691374L;

    private final List<String> violations;

    public InvalidIterationConfigException(String taskId, List<String> violations) {
        super(taskId, "Invalid iteration config: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
