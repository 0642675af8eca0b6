package io.reloop.core.signal;

import io.reloop.core.validation.ValidationResult;
import java.util.List;
import java.util.Objects;

/// Outcome of scanning agent output for completion and blocked markers.
///
/// @param signal CONTINUE, COMPLETE or BLOCKED, not null
/// @param detectedPattern the pattern that produced the signal, or null for CONTINUE
/// @param results results of the implicit pattern rules, never null
public record SignalDetection(
        CompletionSignal signal, String detectedPattern, List<ValidationResult> results) {

    public SignalDetection {
        Objects.requireNonNull(signal, "signal must not be null");
        results = results != null ? List.copyOf(results) : List.of();
    }

    public static SignalDetection none() {
        return new SignalDetection(CompletionSignal.CONTINUE, null, List.of());
    }
}
