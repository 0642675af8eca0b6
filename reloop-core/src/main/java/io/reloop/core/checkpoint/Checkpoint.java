package io.reloop.core.checkpoint;

import io.reloop.core.iteration.IterationConfig;
import io.reloop.core.validation.ValidationReport;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Immutable snapshot of iteration state, appended once per iteration.
///
/// Checkpoints are never updated. Advancing the loop appends a new checkpoint
/// whose history extends its predecessor's; resuming reads the newest one.
///
/// ### Contracts
/// - `sequence` and `iterationNumber` both start at 1 and grow by exactly 1 per
///   checkpoint within a chain
/// - `iterationConfig` is equal across every checkpoint of a chain
///
/// @param id unique checkpoint id, not null
/// @param chainId id of the session this checkpoint belongs to, not null
/// @param taskId the task being iterated on, not null
/// @param sequence position within the chain, starting at 1
/// @param iterationNumber the iteration this checkpoint opens, starting at 1
/// @param iterationConfig the session config, not null
/// @param iterationHistory validated iterations before this one, never null
/// @param completionPromisesSeen completion or blocked patterns detected so far, never null
/// @param lastValidationReport report of the previous iteration, may be null
/// @param agentContext opaque caller data carried across iterations, never null
/// @param createdAt creation time, not null
/// @param expiresAt time after which the chain counts as abandoned, may be null
public record Checkpoint(
        String id,
        String chainId,
        String taskId,
        long sequence,
        int iterationNumber,
        IterationConfig iterationConfig,
        List<HistoryEntry> iterationHistory,
        List<String> completionPromisesSeen,
        ValidationReport lastValidationReport,
        Map<String, Object> agentContext,
        Instant createdAt,
        Instant expiresAt) {

    public Checkpoint {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(chainId, "chainId must not be null");
        Objects.requireNonNull(taskId, "taskId must not be null");
        Objects.requireNonNull(iterationConfig, "iterationConfig must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        iterationHistory = iterationHistory != null ? List.copyOf(iterationHistory) : List.of();
        completionPromisesSeen =
                completionPromisesSeen != null ? List.copyOf(completionPromisesSeen) : List.of();
        // Caller context may hold null values
        agentContext =
                agentContext != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(agentContext))
                        : Map.of();
    }

    /// Returns whether this checkpoint has expired at the given instant.
    ///
    /// @param now the reference time, not null
    /// @return `true` if an expiry is set and not after `now`
    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }
}
