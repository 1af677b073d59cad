package com.eainde.atlas.execution;

import com.eainde.atlas.error.PersistenceException;
import com.eainde.atlas.run.NodeEvent;
import com.eainde.atlas.run.NodeStatus;
import com.eainde.atlas.run.RunState;
import com.eainde.atlas.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdbcRunRecordStoreTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-06-01T10:00:00Z"));
    private EmbeddedDatabase database;
    private JdbcRunRecordStore store;

    @BeforeEach
    void setUp() {
        database = new EmbeddedDatabaseBuilder()
                .setType(EmbeddedDatabaseType.H2)
                .generateUniqueName(true)
                .addScript("classpath:schema.sql")
                .build();
        store = new JdbcRunRecordStore(new JdbcTemplate(database),
                new ObjectMapper().registerModule(new JavaTimeModule()), clock);
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    @DisplayName("round-trips the timeline through its JSON column")
    void persistsTimeline() {
        String id = store.create(RunRecord.pending("run-1", "user-1", "session-1", "Plan Lisbon"));
        RunState state = new RunState(id, "user-1", "session-1", "Plan Lisbon");
        Instant start = Instant.parse("2026-06-01T10:00:01Z");
        state.recordNodeEvent("reasoning", NodeStatus.SUCCESS, start, start.plusMillis(250), null);
        state.recordNodeEvent("tool_dispatch", NodeStatus.ERROR, start.plusSeconds(1), start.plusSeconds(2), "boom");
        state.finalizeOutput("Day 1: Alfama");

        store.complete(id, RunStatus.COMPLETED, state.snapshot(), null);

        RunRecord record = store.find(id).orElseThrow();
        assertThat(record.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(record.userId()).isEqualTo("user-1");
        assertThat(record.finalResponse()).isEqualTo("Day 1: Alfama");
        assertThat(record.timeline()).extracting(NodeEvent::nodeName).containsExactly("reasoning", "tool_dispatch");
        assertThat(record.timeline().get(1).error()).isEqualTo("boom");
        assertThat(record.timeline().get(0).startedAt()).isEqualTo(start);
    }

    @Test
    @DisplayName("an error longer than the column is cut to fit and the run still fails")
    void longErrorIsBounded() {
        String id = store.create(RunRecord.pending("run-1", null, null, "q"));
        RunState state = new RunState(id, null, null, "q");
        String error = "REASONING_UNAVAILABLE: Reasoning step failed: " + "x".repeat(5000);

        store.complete(id, RunStatus.FAILED, state.snapshot(), error);

        RunRecord record = store.find(id).orElseThrow();
        assertThat(record.status()).isEqualTo(RunStatus.FAILED);
        assertThat(record.error()).hasSize(JdbcRunRecordStore.MAX_ERROR_LENGTH)
                .startsWith("REASONING_UNAVAILABLE: Reasoning step failed: ").endsWith("...");
    }

    @Test
    @DisplayName("a status-only write keeps the stored timeline")
    void statusOnlyWrite() {
        String id = store.create(RunRecord.pending("run-1", null, null, "q"));
        RunState state = new RunState(id, null, null, "q");
        Instant start = Instant.parse("2026-06-01T10:00:01Z");
        state.recordNodeEvent("reasoning", NodeStatus.SUCCESS, start, start.plusMillis(5), null);
        store.update(id, RunStatus.RUNNING, state.snapshot());

        store.complete(id, RunStatus.FAILED, null, "CANCELLED: Run run-1 was cancelled");

        RunRecord record = store.find(id).orElseThrow();
        assertThat(record.status()).isEqualTo(RunStatus.FAILED);
        assertThat(record.timeline()).hasSize(1);
        assertThat(record.error()).startsWith("CANCELLED");
    }

    @Test
    @DisplayName("unknown ids and duplicate inserts surface as PersistenceException")
    void failures() {
        store.create(RunRecord.pending("run-1", null, null, "q"));

        assertThatThrownBy(() -> store.create(RunRecord.pending("run-1", null, null, "q")))
                .isInstanceOf(PersistenceException.class);
        assertThatThrownBy(() -> store.update("missing", RunStatus.RUNNING, null))
                .isInstanceOf(PersistenceException.class)
                .hasMessageContaining("missing");
        assertThat(store.find("missing")).isEmpty();
    }

    @Test
    @DisplayName("finds runs that stopped making progress")
    void findStale() {
        store.create(RunRecord.pending("stuck", null, null, "q"));
        String done = store.create(RunRecord.pending("done", null, null, "q"));
        store.complete(done, RunStatus.COMPLETED, null, null);
        clock.advance(Duration.ofHours(2));

        assertThat(store.findStale(Duration.ofMinutes(30))).extracting(RunRecord::id).containsExactly("stuck");
    }
}
