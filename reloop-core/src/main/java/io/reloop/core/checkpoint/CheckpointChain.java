package io.reloop.core.checkpoint;

import java.time.Instant;
import java.util.Objects;

/// Header of one task's checkpoint chain.
///
/// @param chainId chain id, not null
/// @param taskId owning task, not null
/// @param status current status, not null
/// @param latestSequence sequence of the newest checkpoint
/// @param latestCheckpointId id of the newest checkpoint, not null
/// @param latestExpiresAt expiry of the newest checkpoint, may be null
/// @param createdAt when the chain was started, not null
/// @param closedAt when the chain reached a terminal status, null while active
/// @param summary closing summary, null while active
public record CheckpointChain(
        String chainId,
        String taskId,
        ChainStatus status,
        long latestSequence,
        String latestCheckpointId,
        Instant latestExpiresAt,
        Instant createdAt,
        Instant closedAt,
        String summary) {

    public CheckpointChain {
        Objects.requireNonNull(chainId, "chainId must not be null");
        Objects.requireNonNull(taskId, "taskId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(latestCheckpointId, "latestCheckpointId must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
    }

    /// Returns whether the chain has been abandoned through expiry.
    ///
    /// @param now the reference time, not null
    /// @return `true` if the newest checkpoint has expired
    public boolean isExpiredAt(Instant now) {
        return latestExpiresAt != null && !latestExpiresAt.isAfter(now);
    }

    /// Returns whether the chain blocks a new session for its task.
    ///
    /// @param now the reference time, not null
    /// @return `true` if active and not expired
    public boolean isLiveAt(Instant now) {
        return status == ChainStatus.ACTIVE && !isExpiredAt(now);
    }
}
