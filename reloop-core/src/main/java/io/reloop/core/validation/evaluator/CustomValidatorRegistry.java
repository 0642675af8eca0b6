package io.reloop.core.validation.evaluator;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/// Thread-safe registry of {@link CustomValidator}s indexed by validator id.
///
/// Populated while the environment is assembled by {@link io.reloop.core.ReloopFactory}.
/// The iteration controller checks every custom rule against this registry when a
/// session starts.
///
/// @implNote Thread-safe. Backed by a ConcurrentHashMap.
public final class CustomValidatorRegistry {

    private static final Logger logger = Logger.getLogger(CustomValidatorRegistry.class.getName());

    private final Map<String, CustomValidator> validators = new ConcurrentHashMap<>();

    public CustomValidatorRegistry() {}

    /// Creates a registry with initial validators.
    ///
    /// @param initial validators to register, not null
    public CustomValidatorRegistry(List<CustomValidator> initial) {
        Objects.requireNonNull(initial, "initial must not be null");
        initial.forEach(this::register);
    }

    /// Registers a validator, replacing any previous one with the same id.
    ///
    /// @param validator the validator, not null
    public void register(CustomValidator validator) {
        Objects.requireNonNull(validator, "validator must not be null");
        String id = Objects.requireNonNull(validator.getValidatorId(), "validatorId");
        CustomValidator previous = validators.put(id, validator);
        if (previous != null && previous != validator) {
            logger.warning("Replaced custom validator: " + id);
        }
    }

    public Optional<CustomValidator> get(String validatorId) {
        Objects.requireNonNull(validatorId, "validatorId must not be null");
        return Optional.ofNullable(validators.get(validatorId));
    }

    public boolean contains(String validatorId) {
        Objects.requireNonNull(validatorId, "validatorId must not be null");
        return validators.containsKey(validatorId);
    }

    public Set<String> ids() {
        return Set.copyOf(validators.keySet());
    }
}
