package io.reloop.core.iteration;

import java.util.Optional;

/// Read-only access to the free text kept for a task by the surrounding system.
///
/// Supplies the `task_notes` and `work_product_latest` targets of content rules.
/// The engine never writes through this interface.
public interface TaskTextSource {

    /// Returns the task's notes.
    ///
    /// @param taskId the task, not null
    /// @return the notes, or empty if none are stored
    Optional<String> taskNotes(String taskId);

    /// Returns the text of the task's most recent work product.
    ///
    /// @param taskId the task, not null
    /// @return the work product text, or empty if none exists
    Optional<String> latestWorkProduct(String taskId);

    /// Returns a source that has no text for any task.
    ///
    /// @return the empty source, never null
    static TaskTextSource empty() {
        return new TaskTextSource() {
            @Override
            public Optional<String> taskNotes(String taskId) {
                return Optional.empty();
            }

            @Override
            public Optional<String> latestWorkProduct(String taskId) {
                return Optional.empty();
            }
        };
    }
}
