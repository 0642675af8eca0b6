package io.reloop.server.checkpoint;

import io.reloop.core.checkpoint.CheckpointStore;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Instant;
import org.jboss.logging.Logger;

/// Scheduled job that deletes abandoned checkpoint chains.
///
/// A chain is abandoned once its newest checkpoint has passed its expiry, which is
/// set from `reloop.checkpoint.ttl`. Without a TTL nothing ever expires and each
/// tick is a cheap no-op query.
///
/// ### Configuration
/// | Property                          | Default | Description              |
/// |-----------------------------------|---------|--------------------------|
/// | `reloop.checkpoint.prune-interval` | `1h`    | How often the job runs   |
///
/// @implNote Thread-safe. Concurrent ticks are skipped.
///
/// @see CheckpointStore#pruneExpired(Instant)
@ApplicationScoped
public class CheckpointPruneJob {

    private static final Logger LOG = Logger.getLogger(CheckpointPruneJob.class);

    private final CheckpointStore checkpointStore;
    private final Clock clock;

    @Inject
    public CheckpointPruneJob(CheckpointStore checkpointStore) {
        this(checkpointStore, Clock.systemUTC());
    }

    CheckpointPruneJob(CheckpointStore checkpointStore, Clock clock) {
        this.checkpointStore = checkpointStore;
        this.clock = clock;
    }

    /// Removes every chain whose newest checkpoint has expired.
    ///
    /// Failures are logged and retried on the next tick.
    @Scheduled(
            every = "${reloop.checkpoint.prune-interval:1h}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void tick() {
        try {
            int removed = checkpointStore.pruneExpired(clock.instant());
            if (removed > 0) {
                LOG.infov("Pruned {0} expired checkpoint(s)", removed);
            }
        } catch (RuntimeException e) {
            LOG.errorv(e, "Checkpoint pruning failed: {0}", e.getMessage());
        }
    }
}
