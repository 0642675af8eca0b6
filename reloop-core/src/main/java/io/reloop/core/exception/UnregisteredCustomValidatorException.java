package io.reloop.core.exception;

import java.io.Serial;
import java.util.List;

/// Thrown when a session config references custom validators that are not registered.
public class UnregisteredCustomValidatorException extends IterationException {

    @Serial private static final long serialVersionUID = -1046627795158302218L;

    private final List<String> validatorIds;

    public UnregisteredCustomValidatorException(String taskId, List<String> validatorIds) {
        super(taskId, "Unregistered custom validator(s): " + String.join(", ", validatorIds));
        this.validatorIds = List.copyOf(validatorIds);
    }

    public List<String> getValidatorIds() {
        return validatorIds;
    }
}
