package com.eainde.atlas.execution;

import com.eainde.atlas.error.PersistenceException;
import com.eainde.atlas.run.NodeStatus;
import com.eainde.atlas.run.RunSnapshot;
import com.eainde.atlas.run.RunState;
import com.eainde.atlas.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryRunRecordStoreTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-06-01T10:00:00Z"));
    private InMemoryRunRecordStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryRunRecordStore(clock);
    }

    private static RunSnapshot finishedSnapshot(String runId) {
        RunState state = new RunState(runId, "user-1", "session-1", "Lisbon");
        Instant start = Instant.parse("2026-06-01T10:00:01Z");
        state.recordNodeEvent("reasoning", NodeStatus.SUCCESS, start, start.plusMillis(20), null);
        state.finalizeOutput("Day 1: Alfama");
        return state.snapshot();
    }

    @Test
    @DisplayName("moves a record from PENDING through RUNNING to COMPLETED")
    void lifecycle() {
        String id = store.create(RunRecord.pending("run-1", "user-1", "session-1", "Lisbon"));
        assertThat(store.find(id)).hasValueSatisfying(r -> assertThat(r.status()).isEqualTo(RunStatus.PENDING));

        store.update(id, RunStatus.RUNNING, null);
        store.complete(id, RunStatus.COMPLETED, finishedSnapshot(id), null);

        RunRecord record = store.find(id).orElseThrow();
        assertThat(record.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(record.finalResponse()).isEqualTo("Day 1: Alfama");
        assertThat(record.timeline()).hasSize(1);
        assertThat(record.query()).isEqualTo("Lisbon");
    }

    @Test
    @DisplayName("rejects a non-terminal completion and writes to unknown ids")
    void rejectsInvalidWrites() {
        String id = store.create(RunRecord.pending("run-1", null, null, "q"));

        assertThatThrownBy(() -> store.complete(id, RunStatus.RUNNING, null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.update("missing", RunStatus.RUNNING, null))
                .isInstanceOf(PersistenceException.class);
        assertThatThrownBy(() -> store.create(RunRecord.pending("run-1", null, null, "q")))
                .isInstanceOf(PersistenceException.class);
    }

    @Test
    @DisplayName("finds only non-terminal runs idle for longer than the threshold")
    void findStale() {
        String idle = store.create(RunRecord.pending("idle", null, null, "q"));
        String done = store.create(RunRecord.pending("done", null, null, "q"));
        store.complete(done, RunStatus.FAILED, null, "boom");
        clock.advance(Duration.ofHours(1));
        String fresh = store.create(RunRecord.pending("fresh", null, null, "q"));

        assertThat(store.findStale(Duration.ofMinutes(30))).extracting(RunRecord::id).containsExactly(idle);
        assertThat(fresh).isEqualTo("fresh");
    }
}
