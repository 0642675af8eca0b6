package io.reloop.server.checkpoint;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.reloop.core.checkpoint.CheckpointStore;
import io.reloop.server.persistence.PersistenceException;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class CheckpointPruneJobTest {

    private static final Instant NOW = Instant.parse("2026-03-02T00:00:00Z");

    private final CheckpointStore store = mock(CheckpointStore.class);
    private final CheckpointPruneJob job =
            new CheckpointPruneJob(store, Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void shouldPruneAtCurrentTime() {
        when(store.pruneExpired(NOW)).thenReturn(4);

        job.tick();

        verify(store).pruneExpired(NOW);
    }

    @Test
    void shouldSurviveStoreFailure() {
        when(store.pruneExpired(any()))
                .thenThrow(new PersistenceException("prune", new SQLException("down")));

        assertThatCode(job::tick).doesNotThrowAnyException();
    }
}
