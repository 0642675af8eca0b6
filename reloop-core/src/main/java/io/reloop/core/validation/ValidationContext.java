package io.reloop.core.validation;

import io.reloop.core.validation.rule.ContentTarget;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/// Read-only inputs for one validation pass.
///
/// @param workingDirectory directory commands run in and relative paths resolve against, not null
/// @param agentOutput the caller's latest free-text output, may be null
/// @param taskNotes the caller's task notes, may be null
/// @param latestWorkProduct text of the most recent work product, may be null
public record ValidationContext(
        Path workingDirectory, String agentOutput, String taskNotes, String latestWorkProduct) {

    public ValidationContext {
        Objects.requireNonNull(workingDirectory, "workingDirectory must not be null");
    }

    /// Returns the text a content rule targets.
    ///
    /// @param target the text field, not null
    /// @return the text, or empty if the caller supplied none
    public Optional<String> text(ContentTarget target) {
        return Optional.ofNullable(
                switch (target) {
                    case AGENT_OUTPUT -> agentOutput;
                    case TASK_NOTES -> taskNotes;
                    case WORK_PRODUCT_LATEST -> latestWorkProduct;
                });
    }
}
