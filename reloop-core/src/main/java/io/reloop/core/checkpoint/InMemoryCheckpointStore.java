package io.reloop.core.checkpoint;

import io.reloop.core.exception.ChainClosedException;
import io.reloop.core.exception.DuplicateActiveSessionException;
import io.reloop.core.exception.SessionNotFoundException;
import io.reloop.core.exception.StaleChainException;
import io.reloop.core.iteration.IterationConfig;
import io.reloop.core.iteration.IterationVerdict;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/// In-memory implementation of {@link CheckpointStore}.
///
/// Keeps the most recent chain of every task in a ConcurrentHashMap keyed by task
/// id. Every mutation of a chain runs inside `compute` on that task's entry, which
/// serializes writers per task while writers on other tasks proceed in parallel.
/// Checkpoints of superseded chains stay readable by id until pruned.
///
/// Suitable for tests, single-process use and as the default when no database is
/// configured. State is lost on restart.
///
/// @implNote Thread-safe.
public final class InMemoryCheckpointStore implements CheckpointStore {

    private static final Logger logger =
            Logger.getLogger(InMemoryCheckpointStore.class.getName());

    private record ChainState(
            CheckpointChain chain,
            List<Checkpoint> checkpoints,
            long verdictSequence,
            IterationVerdict verdict) {

        ChainState(CheckpointChain chain, List<Checkpoint> checkpoints) {
            this(chain, checkpoints, 0, null);
        }

        Checkpoint latest() {
            return checkpoints.get(checkpoints.size() - 1);
        }
    }

    private final Map<String, ChainState> chains = new ConcurrentHashMap<>();
    private final Map<String, Checkpoint> checkpointsById = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;

    /// Creates a store whose checkpoints never expire.
    public InMemoryCheckpointStore() {
        this(Clock.systemUTC(), null);
    }

    /// Creates a store.
    ///
    /// @param clock time source for creation and expiry, not null
    /// @param ttl lifetime of each checkpoint, or null for no expiry
    public InMemoryCheckpointStore(Clock clock, Duration ttl) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.ttl = ttl;
    }

    @Override
    public Checkpoint create(
            String taskId, IterationConfig config, Map<String, Object> agentContext) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Objects.requireNonNull(config, "config must not be null");

        ChainState state =
                chains.compute(
                        taskId,
                        (id, current) -> {
                            Instant now = clock.instant();
                            if (current != null && current.chain().isLiveAt(now)) {
                                throw new DuplicateActiveSessionException(taskId);
                            }
                            Checkpoint first =
                                    new Checkpoint(
                                            UUID.randomUUID().toString(),
                                            UUID.randomUUID().toString(),
                                            taskId,
                                            1,
                                            1,
                                            config,
                                            List.of(),
                                            List.of(),
                                            null,
                                            agentContext,
                                            now,
                                            expiry(now));
                            checkpointsById.put(first.id(), first);
                            return new ChainState(
                                    header(first, ChainStatus.ACTIVE, now, null, null),
                                    List.of(first));
                        });

        logger.info("Started checkpoint chain " + state.chain().chainId() + " for task " + taskId);
        return state.latest();
    }

    @Override
    public Optional<Checkpoint> resumeLatest(String taskId) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        ChainState state = chains.get(taskId);
        if (state == null || !state.chain().isLiveAt(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(state.latest());
    }

    @Override
    public Optional<Checkpoint> findById(String checkpointId) {
        Objects.requireNonNull(checkpointId, "checkpointId must not be null");
        return Optional.ofNullable(checkpointsById.get(checkpointId));
    }

    @Override
    public Optional<CheckpointChain> findChain(String taskId) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        return Optional.ofNullable(chains.get(taskId)).map(ChainState::chain);
    }

    @Override
    public Checkpoint append(String taskId, long baseSequence, CheckpointUpdate update) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Objects.requireNonNull(update, "update must not be null");

        ChainState state =
                chains.compute(
                        taskId,
                        (id, current) -> {
                            Instant now = clock.instant();
                            requireLive(taskId, current, now);
                            Checkpoint latest = current.latest();
                            if (latest.sequence() != baseSequence) {
                                throw new StaleChainException(
                                        taskId, baseSequence, latest.sequence());
                            }
                            if (update.iterationNumber() != latest.iterationNumber() + 1) {
                                throw new IllegalArgumentException(
                                        "Iteration number must advance by one: expected "
                                                + (latest.iterationNumber() + 1)
                                                + " but got "
                                                + update.iterationNumber());
                            }

                            Checkpoint next =
                                    new Checkpoint(
                                            UUID.randomUUID().toString(),
                                            latest.chainId(),
                                            taskId,
                                            latest.sequence() + 1,
                                            update.iterationNumber(),
                                            latest.iterationConfig(),
                                            update.history(),
                                            update.completionPromisesSeen(),
                                            update.report(),
                                            update.agentContext(),
                                            now,
                                            expiry(now));
                            checkpointsById.put(next.id(), next);

                            List<Checkpoint> checkpoints = new ArrayList<>(current.checkpoints());
                            checkpoints.add(next);
                            CheckpointChain chain = current.chain();
                            return new ChainState(
                                    header(next, ChainStatus.ACTIVE, chain.createdAt(), null, null),
                                    List.copyOf(checkpoints));
                        });
        return state.latest();
    }

    @Override
    public void recordVerdict(String taskId, long sequence, IterationVerdict verdict) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Objects.requireNonNull(verdict, "verdict must not be null");

        chains.compute(
                taskId,
                (id, current) -> {
                    requireLive(taskId, current, clock.instant());
                    long latest = current.latest().sequence();
                    if (latest != sequence) {
                        throw new StaleChainException(taskId, sequence, latest);
                    }
                    return new ChainState(current.chain(), current.checkpoints(), sequence, verdict);
                });
    }

    @Override
    public Optional<IterationVerdict> findVerdict(String taskId, long sequence) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        ChainState state = chains.get(taskId);
        if (state == null
                || !state.chain().isLiveAt(clock.instant())
                || state.verdict() == null
                || state.verdictSequence() != sequence) {
            return Optional.empty();
        }
        return Optional.of(state.verdict());
    }

    @Override
    public CheckpointChain close(String taskId, ChainStatus status, String summary) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Closing status must be terminal: " + status);
        }

        ChainState state =
                chains.compute(
                        taskId,
                        (id, current) -> {
                            Instant now = clock.instant();
                            requireLive(taskId, current, now);
                            CheckpointChain chain = current.chain();
                            return new ChainState(
                                    header(
                                            current.latest(),
                                            status,
                                            chain.createdAt(),
                                            now,
                                            summary),
                                    current.checkpoints(),
                                    current.verdictSequence(),
                                    current.verdict());
                        });

        logger.info("Closed checkpoint chain for task " + taskId + " as " + status);
        return state.chain();
    }

    @Override
    public int pruneExpired(Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        AtomicInteger removed = new AtomicInteger();

        for (Map.Entry<String, ChainState> entry : chains.entrySet()) {
            ChainState state = entry.getValue();
            if (state.chain().isExpiredAt(now) && chains.remove(entry.getKey(), state)) {
                state.checkpoints().forEach(cp -> checkpointsById.remove(cp.id()));
                removed.addAndGet(state.checkpoints().size());
            }
        }

        // Leftovers of chains superseded by a newer session
        Set<String> currentChains = new HashSet<>();
        chains.values().forEach(state -> currentChains.add(state.chain().chainId()));
        checkpointsById
                .values()
                .removeIf(
                        cp -> {
                            boolean stale =
                                    !currentChains.contains(cp.chainId()) && cp.isExpiredAt(now);
                            if (stale) {
                                removed.incrementAndGet();
                            }
                            return stale;
                        });

        if (removed.get() > 0) {
            logger.info("Pruned " + removed.get() + " expired checkpoint(s)");
        }
        return removed.get();
    }

    private static void requireLive(String taskId, ChainState current, Instant now) {
        if (current == null) {
            throw new SessionNotFoundException(taskId);
        }
        if (current.chain().status().isTerminal()) {
            throw new ChainClosedException(taskId);
        }
        if (current.chain().isExpiredAt(now)) {
            throw new SessionNotFoundException(taskId);
        }
    }

    private Instant expiry(Instant createdAt) {
        return ttl != null ? createdAt.plus(ttl) : null;
    }

    private static CheckpointChain header(
            Checkpoint latest,
            ChainStatus status,
            Instant createdAt,
            Instant closedAt,
            String summary) {
        return new CheckpointChain(
                latest.chainId(),
                latest.taskId(),
                status,
                latest.sequence(),
                latest.id(),
                latest.expiresAt(),
                createdAt,
                closedAt,
                summary);
    }
}
