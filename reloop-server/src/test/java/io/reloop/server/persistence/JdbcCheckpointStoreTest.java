package io.reloop.server.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.reloop.core.checkpoint.ChainStatus;
import io.reloop.core.checkpoint.Checkpoint;
import io.reloop.core.checkpoint.CheckpointChain;
import io.reloop.core.checkpoint.CheckpointUpdate;
import io.reloop.core.checkpoint.HistoryEntry;
import io.reloop.core.exception.ChainClosedException;
import io.reloop.core.exception.DuplicateActiveSessionException;
import io.reloop.core.exception.SessionNotFoundException;
import io.reloop.core.exception.StaleChainException;
import io.reloop.core.guard.Escalation;
import io.reloop.core.iteration.IterationConfig;
import io.reloop.core.iteration.IterationVerdict;
import io.reloop.core.signal.CompletionSignal;
import io.reloop.core.validation.ValidationReport;
import io.reloop.core.validation.rule.ContentPatternRule;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/// Integration tests for {@link JdbcCheckpointStore} against a real PostgreSQL instance.
///
/// Stores observing a later point in time are separate instances over the same
/// data source, each with its own fixed clock.
class JdbcCheckpointStoreTest extends JdbcStoreTestBase {

    private static final Duration TTL = Duration.ofHours(1);

    private static final IterationConfig CONFIG =
            IterationConfig.builder()
                    .maxIterations(5)
                    .completionPatterns(List.of("DONE"))
                    .validationRules(
                            List.of(
                                    ContentPatternRule.builder()
                                            .name("no-todo")
                                            .pattern("TODO")
                                            .mustMatch(false)
                                            .build()))
                    .build();

    private JdbcCheckpointStore store;

    @BeforeEach
    void setUp() throws SQLException {
        deleteAllChains();
        store = storeAt(T0);
    }

    private static JdbcCheckpointStore storeAt(Instant instant) {
        return new JdbcCheckpointStore(dataSource, objectMapper, clockAt(instant), TTL);
    }

    private static CheckpointUpdate updateFrom(Checkpoint base) {
        ValidationReport report =
                ValidationReport.of(base.taskId(), base.iterationNumber(), List.of(), T0);
        List<HistoryEntry> history = new ArrayList<>(base.iterationHistory());
        history.add(HistoryEntry.from(report, base.id(), "iteration " + base.iterationNumber()));
        return new CheckpointUpdate(
                base.iterationNumber() + 1, history, report, base.agentContext(), List.of());
    }

    private static IterationVerdict escalated(Checkpoint checkpoint) {
        ValidationReport report =
                ValidationReport.of(
                        checkpoint.taskId(), checkpoint.iterationNumber(), List.of(), T0);
        return new IterationVerdict(
                false,
                0,
                CompletionSignal.ESCALATE,
                null,
                List.of("Escalated: [max_iterations] Iteration ceiling reached"),
                new Escalation("max_iterations", "Iteration ceiling reached", List.of("5 of 5")),
                null,
                report);
    }

    @Nested
    class Create {

        @Test
        void shouldPersistFirstCheckpoint() {
            Checkpoint first = store.create("task-1", CONFIG, Map.of("branch", "main"));

            assertThat(first.sequence()).isEqualTo(1);
            assertThat(first.expiresAt()).isEqualTo(T0.plus(TTL));

            Checkpoint resumed = store.resumeLatest("task-1").orElseThrow();
            assertThat(resumed.id()).isEqualTo(first.id());
            assertThat(resumed.iterationNumber()).isEqualTo(1);
            assertThat(resumed.iterationConfig()).isEqualTo(CONFIG);
            assertThat(resumed.agentContext()).containsEntry("branch", "main");
        }

        @Test
        void shouldRejectSecondActiveChain() {
            store.create("task-1", CONFIG, null);

            assertThatThrownBy(() -> store.create("task-1", CONFIG, null))
                    .isInstanceOf(DuplicateActiveSessionException.class);
        }

        @Test
        void shouldReplaceExpiredActiveChain() {
            Checkpoint old = store.create("task-1", CONFIG, null);
            JdbcCheckpointStore later = storeAt(T0.plus(Duration.ofHours(2)));

            assertThat(later.resumeLatest("task-1")).isEmpty();
            Checkpoint fresh = later.create("task-1", CONFIG, null);

            assertThat(fresh.chainId()).isNotEqualTo(old.chainId());
            assertThat(later.findById(old.id())).isEmpty();
        }

        @Test
        void shouldAllowNewChainAfterClose() {
            Checkpoint old = store.create("task-1", CONFIG, null);
            store.close("task-1", ChainStatus.COMPLETED, "done");

            Checkpoint fresh = store.create("task-1", CONFIG, null);

            assertThat(fresh.chainId()).isNotEqualTo(old.chainId());
            assertThat(store.findById(old.id())).isPresent();
        }
    }

    @Nested
    class Append {

        @Test
        void shouldAdvanceChainHead() {
            Checkpoint first = store.create("task-1", CONFIG, null);
            Checkpoint second = store.append("task-1", 1, updateFrom(first));
            Checkpoint third = store.append("task-1", 2, updateFrom(second));

            assertThat(third.sequence()).isEqualTo(3);
            assertThat(third.iterationNumber()).isEqualTo(3);
            assertThat(third.chainId()).isEqualTo(first.chainId());

            Checkpoint resumed = store.resumeLatest("task-1").orElseThrow();
            assertThat(resumed.id()).isEqualTo(third.id());
            assertThat(resumed.iterationHistory())
                    .extracting(HistoryEntry::checkpointId)
                    .containsExactly(first.id(), second.id());
            assertThat(store.findChain("task-1"))
                    .get()
                    .satisfies(
                            chain -> {
                                assertThat(chain.latestSequence()).isEqualTo(3);
                                assertThat(chain.latestCheckpointId()).isEqualTo(third.id());
                            });
        }

        @Test
        void shouldRejectStaleBase() {
            Checkpoint first = store.create("task-1", CONFIG, null);
            store.append("task-1", 1, updateFrom(first));

            assertThatThrownBy(() -> store.append("task-1", 1, updateFrom(first)))
                    .isInstanceOfSatisfying(
                            StaleChainException.class,
                            e -> assertThat(e.getActualSequence()).isEqualTo(2));
        }

        @Test
        void shouldRejectAppendToClosedChain() {
            Checkpoint first = store.create("task-1", CONFIG, null);
            store.close("task-1", ChainStatus.ESCALATED, null);

            assertThatThrownBy(() -> store.append("task-1", 1, updateFrom(first)))
                    .isInstanceOf(ChainClosedException.class);
        }

        @Test
        void shouldRejectAppendToExpiredChain() {
            Checkpoint first = store.create("task-1", CONFIG, null);
            JdbcCheckpointStore later = storeAt(T0.plus(Duration.ofHours(2)));

            assertThatThrownBy(() -> later.append("task-1", 1, updateFrom(first)))
                    .isInstanceOf(SessionNotFoundException.class);
        }

        @Test
        void shouldLetExactlyOneConcurrentWriterWin() throws Exception {
            Checkpoint first = store.create("task-1", CONFIG, null);
            int writers = 6;
            CountDownLatch ready = new CountDownLatch(1);
            ExecutorService pool = Executors.newFixedThreadPool(writers);
            try {
                List<Future<Checkpoint>> futures = new ArrayList<>();
                for (int i = 0; i < writers; i++) {
                    Callable<Checkpoint> attempt =
                            () -> {
                                ready.await();
                                return store.append("task-1", 1, updateFrom(first));
                            };
                    futures.add(pool.submit(attempt));
                }
                ready.countDown();

                int won = 0;
                for (Future<Checkpoint> future : futures) {
                    try {
                        future.get();
                        won++;
                    } catch (ExecutionException e) {
                        assertThat(e.getCause()).isInstanceOf(StaleChainException.class);
                    }
                }
                assertThat(won).isEqualTo(1);
                assertThat(store.findChain("task-1").orElseThrow().latestSequence())
                        .isEqualTo(2);
            } finally {
                pool.shutdownNow();
            }
        }
    }

    @Nested
    class Close {

        @Test
        void shouldRecordTerminalStatus() {
            store.create("task-1", CONFIG, null);

            CheckpointChain closed = store.close("task-1", ChainStatus.BLOCKED, "needs creds");

            assertThat(closed.status()).isEqualTo(ChainStatus.BLOCKED);
            assertThat(closed.closedAt()).isEqualTo(T0);
            assertThat(store.resumeLatest("task-1")).isEmpty();
            assertThat(store.findChain("task-1"))
                    .get()
                    .extracting(CheckpointChain::status, CheckpointChain::summary)
                    .containsExactly(ChainStatus.BLOCKED, "needs creds");
        }

        @Test
        void shouldRejectSecondClose() {
            store.create("task-1", CONFIG, null);
            store.close("task-1", ChainStatus.COMPLETED, null);

            assertThatThrownBy(() -> store.close("task-1", ChainStatus.COMPLETED, null))
                    .isInstanceOf(ChainClosedException.class);
        }

        @Test
        void shouldPreferActiveChainCreatedInSameInstant() {
            store.create("task-1", CONFIG, null);
            store.close("task-1", ChainStatus.COMPLETED, "first pass");
            Checkpoint active = store.create("task-1", CONFIG, null);

            assertThat(store.findChain("task-1"))
                    .get()
                    .extracting(CheckpointChain::chainId, CheckpointChain::status)
                    .containsExactly(active.chainId(), ChainStatus.ACTIVE);
        }

        @Test
        void shouldRejectCloseWithoutChain() {
            assertThatThrownBy(() -> store.close("missing", ChainStatus.COMPLETED, null))
                    .isInstanceOf(SessionNotFoundException.class);
        }
    }

    @Nested
    class Verdicts {

        @Test
        void shouldReadVerdictFromAnotherStoreInstance() {
            Checkpoint first = store.create("task-1", CONFIG, null);
            IterationVerdict verdict = escalated(first);

            store.recordVerdict("task-1", 1, verdict);

            assertThat(storeAt(T0.plus(Duration.ofMinutes(5))).findVerdict("task-1", 1))
                    .contains(verdict);
        }

        @Test
        void shouldKeepVerdictOnlyForItsSequence() {
            Checkpoint first = store.create("task-1", CONFIG, null);
            store.recordVerdict("task-1", 1, escalated(first));

            assertThat(store.findVerdict("task-1", 2)).isEmpty();
            store.append("task-1", 1, updateFrom(first));

            assertThat(store.findVerdict("task-1", 1)).isEmpty();
            assertThat(store.findVerdict("task-1", 2)).isEmpty();
        }

        @Test
        void shouldRejectVerdictForStaleSequence() {
            Checkpoint first = store.create("task-1", CONFIG, null);
            store.append("task-1", 1, updateFrom(first));

            assertThatThrownBy(() -> store.recordVerdict("task-1", 1, escalated(first)))
                    .isInstanceOf(StaleChainException.class);
        }

        @Test
        void shouldRejectVerdictForClosedOrMissingChain() {
            Checkpoint first = store.create("task-1", CONFIG, null);
            store.close("task-1", ChainStatus.ESCALATED, null);

            assertThatThrownBy(() -> store.recordVerdict("task-1", 1, escalated(first)))
                    .isInstanceOf(ChainClosedException.class);
            assertThatThrownBy(() -> store.recordVerdict("missing", 1, escalated(first)))
                    .isInstanceOf(SessionNotFoundException.class);
        }

        @Test
        void shouldHideVerdictOfExpiredChain() {
            Checkpoint first = store.create("task-1", CONFIG, null);
            store.recordVerdict("task-1", 1, escalated(first));

            assertThat(storeAt(T0.plus(Duration.ofHours(2))).findVerdict("task-1", 1)).isEmpty();
        }
    }

    @Nested
    class Prune {

        @Test
        void shouldDeleteOnlyExpiredChains() {
            Checkpoint first = store.create("task-old", CONFIG, null);
            store.append("task-old", 1, updateFrom(first));
            Checkpoint fresh =
                    storeAt(T0.plus(Duration.ofMinutes(45))).create("task-new", CONFIG, null);

            int removed = store.pruneExpired(T0.plus(Duration.ofMinutes(90)));

            assertThat(removed).isEqualTo(2);
            assertThat(store.findChain("task-old")).isEmpty();
            assertThat(store.findById(first.id())).isEmpty();
            assertThat(store.findById(fresh.id())).isPresent();
        }

        @Test
        void shouldKeepChainsWithoutTtl() {
            JdbcCheckpointStore noTtl =
                    new JdbcCheckpointStore(dataSource, objectMapper, clockAt(T0), null);
            noTtl.create("task-1", CONFIG, null);

            assertThat(noTtl.pruneExpired(T0.plus(Duration.ofDays(365)))).isZero();
            assertThat(noTtl.resumeLatest("task-1")).isPresent();
        }
    }
}
