package io.reloop.core.checkpoint;

import io.reloop.core.iteration.IterationConfig;
import io.reloop.core.iteration.IterationVerdict;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/// Durable, append-only storage for checkpoint chains.
///
/// Each task has at most one live chain: active and not expired. Appending never
/// rewrites a checkpoint; resuming reads the newest one. A process restart
/// therefore only needs {@link #resumeLatest(String)} to continue from the last
/// durable state.
///
/// ### Concurrency
/// Writers on one chain are serialized optimistically. {@link #append} takes the
/// sequence the caller based its work on and fails with
/// {@link io.reloop.core.exception.StaleChainException} if another writer got there
/// first. Writers on different tasks never contend. {@link #resumeLatest} observes
/// every completed {@link #append} (read-your-writes).
///
/// ### Verdicts
/// The latest verdict of a live chain is stored in its header, tagged with the
/// sequence it was computed on. Appending a checkpoint leaves it behind: a verdict
/// is only returned for the sequence it was recorded against.
///
/// @implNote Implementations must be thread-safe.
///
/// @see InMemoryCheckpointStore
public interface CheckpointStore {

    /// Starts a chain with its first checkpoint (sequence 1, iteration 1).
    ///
    /// @param taskId the task, not null
    /// @param config the session config, not null
    /// @param agentContext initial caller context, may be null
    /// @return the first checkpoint, never null
    /// @throws io.reloop.core.exception.DuplicateActiveSessionException if the task has a
    ///     live chain
    Checkpoint create(String taskId, IterationConfig config, Map<String, Object> agentContext);

    /// Returns the newest checkpoint of the task's live chain.
    ///
    /// @param taskId the task, not null
    /// @return the checkpoint, or empty if the task has no live chain
    Optional<Checkpoint> resumeLatest(String taskId);

    /// Looks up any stored checkpoint by id, regardless of chain status.
    ///
    /// @param checkpointId the checkpoint id, not null
    /// @return the checkpoint, or empty if unknown or pruned
    Optional<Checkpoint> findById(String checkpointId);

    /// Returns the header of the task's most recent chain, live or not.
    ///
    /// @param taskId the task, not null
    /// @return the chain, or empty if the task never had one or it was pruned
    Optional<CheckpointChain> findChain(String taskId);

    /// Appends the next checkpoint to the task's live chain.
    ///
    /// @param taskId the task, not null
    /// @param baseSequence sequence of the checkpoint the update was derived from
    /// @param update the new checkpoint's content, not null
    /// @return the appended checkpoint, never null
    /// @throws io.reloop.core.exception.StaleChainException if `baseSequence` is not the latest
    /// @throws io.reloop.core.exception.ChainClosedException if the chain is terminal
    /// @throws io.reloop.core.exception.SessionNotFoundException if there is no live chain
    Checkpoint append(String taskId, long baseSequence, CheckpointUpdate update);

    /// Records the verdict computed on the chain's newest checkpoint, replacing any
    /// earlier verdict.
    ///
    /// @param taskId the task, not null
    /// @param sequence sequence of the checkpoint the verdict was computed on
    /// @param verdict the verdict, not null
    /// @throws io.reloop.core.exception.StaleChainException if `sequence` is not the latest
    /// @throws io.reloop.core.exception.ChainClosedException if the chain is terminal
    /// @throws io.reloop.core.exception.SessionNotFoundException if there is no live chain
    void recordVerdict(String taskId, long sequence, IterationVerdict verdict);

    /// Returns the verdict recorded for a checkpoint of the task's live chain.
    ///
    /// @param taskId the task, not null
    /// @param sequence the checkpoint sequence
    /// @return the verdict, or empty if none was recorded for `sequence` or the chain
    ///     is not live
    Optional<IterationVerdict> findVerdict(String taskId, long sequence);

    /// Marks the task's chain terminal.
    ///
    /// @param taskId the task, not null
    /// @param status terminal status, not {@link ChainStatus#ACTIVE}
    /// @param summary closing summary, may be null
    /// @return the closed chain header, never null
    /// @throws io.reloop.core.exception.ChainClosedException if the chain is already terminal
    /// @throws io.reloop.core.exception.SessionNotFoundException if there is no live chain
    CheckpointChain close(String taskId, ChainStatus status, String summary);

    /// Deletes every chain whose newest checkpoint expired at or before `now`.
    ///
    /// @param now the reference time, not null
    /// @return number of checkpoints removed
    int pruneExpired(Instant now);
}
