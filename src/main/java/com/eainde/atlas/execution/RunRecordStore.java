package com.eainde.atlas.execution;

import com.eainde.atlas.run.RunSnapshot;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Durable home of run records. Implementations report failures as
 * {@link com.eainde.atlas.error.PersistenceException}.
 */
public interface RunRecordStore {

    /**
     * @return id under which the record was stored
     */
    String create(RunRecord initial);

    /**
     * Intermediate checkpoint: status and the timeline so far.
     */
    void update(String id, RunStatus status, RunSnapshot snapshot);

    /**
     * Final write. {@code status} must be terminal.
     *
     * @param error failure description, null for a completed run
     */
    void complete(String id, RunStatus status, RunSnapshot snapshot, String error);

    Optional<RunRecord> find(String id);

    /**
     * @return non-terminal records not updated within {@code threshold}, oldest first
     */
    List<RunRecord> findStale(Duration threshold);
}
