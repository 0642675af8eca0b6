package io.reloop.server.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.reloop.core.checkpoint.ChainStatus;
import io.reloop.core.checkpoint.Checkpoint;
import io.reloop.core.checkpoint.CheckpointChain;
import io.reloop.core.checkpoint.CheckpointStore;
import io.reloop.core.checkpoint.CheckpointUpdate;
import io.reloop.core.exception.ChainClosedException;
import io.reloop.core.exception.DuplicateActiveSessionException;
import io.reloop.core.exception.SessionNotFoundException;
import io.reloop.core.exception.StaleChainException;
import io.reloop.core.iteration.IterationConfig;
import io.reloop.core.iteration.IterationVerdict;
import io.reloop.server.validation.LogSanitizer;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import javax.sql.DataSource;
import org.jboss.logging.Logger;

/// PostgreSQL-backed checkpoint store.
///
/// Chain headers live in `reloop.checkpoint_chains`, one row per session. Checkpoints
/// are append-only rows in `reloop.checkpoints` whose `payload` JSONB column holds the
/// full serialized {@link Checkpoint}. The chain row also holds the verdict of the
/// newest checkpoint as JSONB, tagged with the sequence it was computed on.
///
/// ### Concurrency
/// - A partial unique index on `task_id WHERE status = 'ACTIVE'` admits one active
///   chain per task. A losing concurrent `create` surfaces as
///   {@link DuplicateActiveSessionException}.
/// - `append` and `recordVerdict` compare-and-set on `latest_sequence`. The row lock
///   taken by that UPDATE serializes writers on one chain. Writers on other chains
///   never touch the same row.
/// - `findChain` prefers the active chain, so a session closed and restarted within
///   one clock tick never shadows the live one.
///
/// An expired active chain is deleted when its task starts a new session, since it
/// is already eligible for pruning.
///
/// ### Contracts
/// - **Precondition**: Flyway migrations up to `V2__record_verdict` have run
/// - **Postcondition**: every successful write is visible to the next read
///
/// @implNote Thread-safe. Each call acquires its own JDBC connection from the Agroal
/// pool via {@link JdbcSupport}.
///
/// @see io.reloop.core.checkpoint.InMemoryCheckpointStore
public class JdbcCheckpointStore implements CheckpointStore {

    private static final Logger LOG = Logger.getLogger(JdbcCheckpointStore.class);

    private static final String UNIQUE_VIOLATION = "23505";

    // --- SQL constants ---

    private static final String SQL_DELETE_EXPIRED_ACTIVE =
            """
            DELETE FROM reloop.checkpoint_chains
            WHERE task_id = ? AND status = 'ACTIVE'
              AND latest_expires_at IS NOT NULL AND latest_expires_at <= ?
            """;

    private static final String SQL_INSERT_CHAIN =
            """
            INSERT INTO reloop.checkpoint_chains
                (chain_id, task_id, status, latest_sequence, latest_checkpoint_id,
                 latest_expires_at, created_at)
            VALUES (?, ?, 'ACTIVE', ?, ?, ?, ?)
            """;

    private static final String SQL_INSERT_CHECKPOINT =
            """
            INSERT INTO reloop.checkpoints
                (checkpoint_id, chain_id, task_id, sequence, iteration_number,
                 payload, created_at, expires_at)
            VALUES (?, ?, ?, ?, ?, ?::jsonb, ?, ?)
            """;

    private static final String SQL_FIND_LATEST_CHAIN =
            """
            SELECT chain_id, task_id, status, latest_sequence, latest_checkpoint_id,
                   latest_expires_at, created_at, closed_at, summary
            FROM reloop.checkpoint_chains
            WHERE task_id = ?
            ORDER BY (status = 'ACTIVE') DESC, created_at DESC, chain_id DESC
            LIMIT 1
            """;

    private static final String SQL_FIND_CHAIN_BY_ID =
            """
            SELECT chain_id, task_id, status, latest_sequence, latest_checkpoint_id,
                   latest_expires_at, created_at, closed_at, summary
            FROM reloop.checkpoint_chains
            WHERE chain_id = ?
            """;

    private static final String SQL_RESUME_LATEST =
            """
            SELECT cp.payload
            FROM reloop.checkpoint_chains ch
            JOIN reloop.checkpoints cp ON cp.checkpoint_id = ch.latest_checkpoint_id
            WHERE ch.task_id = ? AND ch.status = 'ACTIVE'
              AND (ch.latest_expires_at IS NULL OR ch.latest_expires_at > ?)
            """;

    private static final String SQL_FIND_CHECKPOINT =
            "SELECT payload FROM reloop.checkpoints WHERE checkpoint_id = ?";

    /// Compare-and-set on the chain head. Zero rows means another writer moved the
    /// head or closed the chain.
    private static final String SQL_ADVANCE_HEAD =
            """
            UPDATE reloop.checkpoint_chains
            SET latest_sequence = ?, latest_checkpoint_id = ?, latest_expires_at = ?,
                verdict_sequence = NULL, verdict = NULL
            WHERE chain_id = ? AND status = 'ACTIVE' AND latest_sequence = ?
            """;

    private static final String SQL_RECORD_VERDICT =
            """
            UPDATE reloop.checkpoint_chains
            SET verdict_sequence = ?, verdict = ?::jsonb
            WHERE chain_id = ? AND status = 'ACTIVE' AND latest_sequence = ?
            """;

    private static final String SQL_FIND_VERDICT =
            """
            SELECT verdict
            FROM reloop.checkpoint_chains
            WHERE task_id = ? AND status = 'ACTIVE'
              AND (latest_expires_at IS NULL OR latest_expires_at > ?)
              AND verdict_sequence = ?
            """;

    private static final String SQL_CLOSE_CHAIN =
            """
            UPDATE reloop.checkpoint_chains
            SET status = ?, closed_at = ?, summary = ?
            WHERE chain_id = ? AND status = 'ACTIVE'
            """;

    private static final String SQL_DELETE_EXPIRED_CHECKPOINTS =
            """
            DELETE FROM reloop.checkpoints
            WHERE chain_id IN (
                SELECT chain_id FROM reloop.checkpoint_chains
                WHERE latest_expires_at IS NOT NULL AND latest_expires_at <= ?)
            """;

    private static final String SQL_DELETE_EXPIRED_CHAINS =
            """
            DELETE FROM reloop.checkpoint_chains
            WHERE latest_expires_at IS NOT NULL AND latest_expires_at <= ?
            """;

    // --- Fields ---

    private final JdbcSupport jdbc;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration ttl;

    /// Creates a store backed by the given data source.
    ///
    /// @param dataSource the JDBC connection pool, not null
    /// @param objectMapper Jackson mapper configured for Reloop types, not null
    /// @param clock time source for creation and expiry, not null
    /// @param ttl lifetime of each checkpoint, or null for no expiry
    public JdbcCheckpointStore(
            DataSource dataSource, ObjectMapper objectMapper, Clock clock, Duration ttl) {
        Objects.requireNonNull(dataSource, "dataSource must not be null");
        this.jdbc = new JdbcSupport(dataSource);
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.ttl = ttl;
    }

    @Override
    public Checkpoint create(
            String taskId, IterationConfig config, Map<String, Object> agentContext) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Objects.requireNonNull(config, "config must not be null");

        Instant now = clock.instant();
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
        String payload = writeJson(first, "checkpoint " + first.id());

        jdbc.inTransaction(
                conn -> {
                    JdbcSupport.update(
                            conn,
                            SQL_DELETE_EXPIRED_ACTIVE,
                            ps -> {
                                ps.setString(1, taskId);
                                ps.setObject(2, toOffset(now));
                            });
                    try {
                        JdbcSupport.update(
                                conn,
                                SQL_INSERT_CHAIN,
                                ps -> {
                                    ps.setString(1, first.chainId());
                                    ps.setString(2, taskId);
                                    ps.setLong(3, first.sequence());
                                    ps.setString(4, first.id());
                                    ps.setObject(5, toOffset(first.expiresAt()));
                                    ps.setObject(6, toOffset(now));
                                });
                    } catch (SQLException e) {
                        if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                            throw new DuplicateActiveSessionException(taskId);
                        }
                        throw e;
                    }
                    insertCheckpoint(conn, first, payload);
                    return null;
                },
                "Failed to create checkpoint chain for task: " + taskId);

        LOG.infov(
                "Started checkpoint chain {0} for task {1}",
                first.chainId(), LogSanitizer.sanitize(taskId));
        return first;
    }

    @Override
    public Optional<Checkpoint> resumeLatest(String taskId) {
        Objects.requireNonNull(taskId, "taskId must not be null");

        return jdbc.queryOne(
                SQL_RESUME_LATEST,
                ps -> {
                    ps.setString(1, taskId);
                    ps.setObject(2, toOffset(clock.instant()));
                },
                rs -> readJson(rs.getString("payload"), Checkpoint.class),
                "Failed to resume checkpoint for task: " + taskId);
    }

    @Override
    public Optional<Checkpoint> findById(String checkpointId) {
        Objects.requireNonNull(checkpointId, "checkpointId must not be null");

        return jdbc.queryOne(
                SQL_FIND_CHECKPOINT,
                ps -> ps.setString(1, checkpointId),
                rs -> readJson(rs.getString("payload"), Checkpoint.class),
                "Failed to find checkpoint: " + checkpointId);
    }

    @Override
    public Optional<CheckpointChain> findChain(String taskId) {
        Objects.requireNonNull(taskId, "taskId must not be null");

        return jdbc.queryOne(
                SQL_FIND_LATEST_CHAIN,
                ps -> ps.setString(1, taskId),
                JdbcCheckpointStore::mapChain,
                "Failed to find checkpoint chain for task: " + taskId);
    }

    @Override
    public Checkpoint append(String taskId, long baseSequence, CheckpointUpdate update) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Objects.requireNonNull(update, "update must not be null");

        return jdbc.inTransaction(
                conn -> {
                    Instant now = clock.instant();
                    CheckpointChain chain = requireLive(conn, taskId, now);
                    if (chain.latestSequence() != baseSequence) {
                        throw new StaleChainException(taskId, baseSequence, chain.latestSequence());
                    }

                    Checkpoint latest =
                            JdbcSupport.queryOne(
                                            conn,
                                            SQL_FIND_CHECKPOINT,
                                            ps -> ps.setString(1, chain.latestCheckpointId()),
                                            rs -> readJson(rs.getString("payload"), Checkpoint.class))
                                    .orElseThrow(
                                            () ->
                                                    new IllegalStateException(
                                                            "Chain head checkpoint missing: "
                                                                    + chain.latestCheckpointId()));
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

                    int moved =
                            JdbcSupport.update(
                                    conn,
                                    SQL_ADVANCE_HEAD,
                                    ps -> {
                                        ps.setLong(1, next.sequence());
                                        ps.setString(2, next.id());
                                        ps.setObject(3, toOffset(next.expiresAt()));
                                        ps.setString(4, chain.chainId());
                                        ps.setLong(5, baseSequence);
                                    });
                    if (moved == 0) {
                        throw lostRace(conn, taskId, chain.chainId(), baseSequence);
                    }

                    insertCheckpoint(conn, next, writeJson(next, "checkpoint " + next.id()));
                    return next;
                },
                "Failed to append checkpoint for task: " + taskId);
    }

    @Override
    public void recordVerdict(String taskId, long sequence, IterationVerdict verdict) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Objects.requireNonNull(verdict, "verdict must not be null");
        String payload = writeJson(verdict, "verdict for task " + taskId);

        jdbc.inTransaction(
                conn -> {
                    CheckpointChain chain = requireLive(conn, taskId, clock.instant());
                    if (chain.latestSequence() != sequence) {
                        throw new StaleChainException(taskId, sequence, chain.latestSequence());
                    }
                    int recorded =
                            JdbcSupport.update(
                                    conn,
                                    SQL_RECORD_VERDICT,
                                    ps -> {
                                        ps.setLong(1, sequence);
                                        ps.setString(2, payload);
                                        ps.setString(3, chain.chainId());
                                        ps.setLong(4, sequence);
                                    });
                    if (recorded == 0) {
                        throw lostRace(conn, taskId, chain.chainId(), sequence);
                    }
                    return null;
                },
                "Failed to record verdict for task: " + taskId);
    }

    @Override
    public Optional<IterationVerdict> findVerdict(String taskId, long sequence) {
        Objects.requireNonNull(taskId, "taskId must not be null");

        return jdbc.queryOne(
                SQL_FIND_VERDICT,
                ps -> {
                    ps.setString(1, taskId);
                    ps.setObject(2, toOffset(clock.instant()));
                    ps.setLong(3, sequence);
                },
                rs -> readJson(rs.getString("verdict"), IterationVerdict.class),
                "Failed to find verdict for task: " + taskId);
    }

    @Override
    public CheckpointChain close(String taskId, ChainStatus status, String summary) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Closing status must be terminal: " + status);
        }

        CheckpointChain closed =
                jdbc.inTransaction(
                        conn -> {
                            Instant now = clock.instant();
                            CheckpointChain chain = requireLive(conn, taskId, now);
                            int updated =
                                    JdbcSupport.update(
                                            conn,
                                            SQL_CLOSE_CHAIN,
                                            ps -> {
                                                ps.setString(1, status.name());
                                                ps.setObject(2, toOffset(now));
                                                ps.setString(3, summary);
                                                ps.setString(4, chain.chainId());
                                            });
                            if (updated == 0) {
                                throw new ChainClosedException(taskId);
                            }
                            return new CheckpointChain(
                                    chain.chainId(),
                                    chain.taskId(),
                                    status,
                                    chain.latestSequence(),
                                    chain.latestCheckpointId(),
                                    chain.latestExpiresAt(),
                                    chain.createdAt(),
                                    now,
                                    summary);
                        },
                        "Failed to close checkpoint chain for task: " + taskId);

        LOG.infov(
                "Closed checkpoint chain for task {0} as {1}",
                LogSanitizer.sanitize(taskId), status);
        return closed;
    }

    @Override
    public int pruneExpired(Instant now) {
        Objects.requireNonNull(now, "now must not be null");

        int removed =
                jdbc.inTransaction(
                        conn -> {
                            int checkpoints =
                                    JdbcSupport.update(
                                            conn,
                                            SQL_DELETE_EXPIRED_CHECKPOINTS,
                                            ps -> ps.setObject(1, toOffset(now)));
                            JdbcSupport.update(
                                    conn,
                                    SQL_DELETE_EXPIRED_CHAINS,
                                    ps -> ps.setObject(1, toOffset(now)));
                            return checkpoints;
                        },
                        "Failed to prune expired checkpoints");

        if (removed > 0) {
            LOG.infov("Pruned {0} expired checkpoint(s)", removed);
        }
        return removed;
    }

    // --- Internal helpers ---

    private CheckpointChain requireLive(Connection conn, String taskId, Instant now)
            throws SQLException {
        CheckpointChain chain =
                JdbcSupport.queryOne(
                                conn,
                                SQL_FIND_LATEST_CHAIN,
                                ps -> ps.setString(1, taskId),
                                JdbcCheckpointStore::mapChain)
                        .orElseThrow(() -> new SessionNotFoundException(taskId));
        if (chain.status().isTerminal()) {
            throw new ChainClosedException(taskId);
        }
        if (chain.isExpiredAt(now)) {
            throw new SessionNotFoundException(taskId);
        }
        return chain;
    }

    private RuntimeException lostRace(
            Connection conn, String taskId, String chainId, long baseSequence)
            throws SQLException {
        Optional<CheckpointChain> current =
                JdbcSupport.queryOne(
                        conn,
                        SQL_FIND_CHAIN_BY_ID,
                        ps -> ps.setString(1, chainId),
                        JdbcCheckpointStore::mapChain);
        if (current.isEmpty()) {
            return new SessionNotFoundException(taskId);
        }
        if (current.get().status().isTerminal()) {
            return new ChainClosedException(taskId);
        }
        return new StaleChainException(taskId, baseSequence, current.get().latestSequence());
    }

    private static void insertCheckpoint(Connection conn, Checkpoint checkpoint, String payload)
            throws SQLException {
        JdbcSupport.update(
                conn,
                SQL_INSERT_CHECKPOINT,
                ps -> {
                    ps.setString(1, checkpoint.id());
                    ps.setString(2, checkpoint.chainId());
                    ps.setString(3, checkpoint.taskId());
                    ps.setLong(4, checkpoint.sequence());
                    ps.setInt(5, checkpoint.iterationNumber());
                    ps.setString(6, payload);
                    ps.setObject(7, toOffset(checkpoint.createdAt()));
                    ps.setObject(8, toOffset(checkpoint.expiresAt()));
                });
    }

    private static CheckpointChain mapChain(ResultSet rs) throws SQLException {
        return new CheckpointChain(
                rs.getString("chain_id"),
                rs.getString("task_id"),
                ChainStatus.valueOf(rs.getString("status")),
                rs.getLong("latest_sequence"),
                rs.getString("latest_checkpoint_id"),
                toInstant(rs.getObject("latest_expires_at", OffsetDateTime.class)),
                toInstant(rs.getObject("created_at", OffsetDateTime.class)),
                toInstant(rs.getObject("closed_at", OffsetDateTime.class)),
                rs.getString("summary"));
    }

    private Instant expiry(Instant createdAt) {
        return ttl != null ? createdAt.plus(ttl) : null;
    }

    private static OffsetDateTime toOffset(Instant instant) {
        return instant != null ? OffsetDateTime.ofInstant(instant, ZoneOffset.UTC) : null;
    }

    private static Instant toInstant(OffsetDateTime value) {
        return value != null ? value.toInstant() : null;
    }

    private String writeJson(Object value, String what) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize " + what, e);
        }
    }

    private <T> T readJson(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }
}
