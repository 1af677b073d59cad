package com.eainde.atlas.execution;

import com.eainde.atlas.error.PersistenceException;
import com.eainde.atlas.run.RunSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store, the default when no database is configured.
 */
@Slf4j
public class InMemoryRunRecordStore implements RunRecordStore {

    private final Map<String, RunRecord> records = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryRunRecordStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String create(RunRecord initial) {
        String id = initial.id() != null ? initial.id() : UUID.randomUUID().toString();
        RunRecord stored = new RunRecord(id, initial.userId(), initial.sessionId(), initial.query(),
                initial.status(), initial.createdAt(), clock.instant(), initial.finalResponse(),
                initial.timeline(), initial.iterations(), initial.error());
        if (records.putIfAbsent(id, stored) != null) {
            throw new PersistenceException("Run record " + id + " already exists", null);
        }
        return id;
    }

    @Override
    public void update(String id, RunStatus status, RunSnapshot snapshot) {
        replace(id, status, snapshot, null);
    }

    @Override
    public void complete(String id, RunStatus status, RunSnapshot snapshot, String error) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Cannot complete run " + id + " with status " + status);
        }
        replace(id, status, snapshot, error);
        log.debug("Run record {} completed as {}", id, status);
    }

    @Override
    public Optional<RunRecord> find(String id) {
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public List<RunRecord> findStale(Duration threshold) {
        Instant cutoff = clock.instant().minus(threshold);
        return records.values().stream()
                .filter(r -> !r.status().isTerminal())
                .filter(r -> r.updatedAt().isBefore(cutoff))
                .sorted(Comparator.comparing(RunRecord::updatedAt))
                .toList();
    }

    private void replace(String id, RunStatus status, RunSnapshot snapshot, String error) {
        RunRecord updated = records.computeIfPresent(id, (key, current) -> new RunRecord(
                key, current.userId(), current.sessionId(), current.query(), status,
                current.createdAt(), clock.instant(),
                snapshot != null ? snapshot.output() : current.finalResponse(),
                snapshot != null ? snapshot.nodeEvents() : current.timeline(),
                snapshot != null ? snapshot.iterations() : current.iterations(),
                error));
        if (updated == null) {
            throw new PersistenceException("No run record with id " + id, null);
        }
    }
}
