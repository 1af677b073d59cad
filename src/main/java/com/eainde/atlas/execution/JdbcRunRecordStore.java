package com.eainde.atlas.execution;

import com.eainde.atlas.error.PersistenceException;
import com.eainde.atlas.run.NodeEvent;
import com.eainde.atlas.run.RunSnapshot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persists run records to the {@code agent_runs} table. The timeline is stored as a JSON
 * column.
 */
@Slf4j
public class JdbcRunRecordStore implements RunRecordStore {

    private static final TypeReference<List<NodeEvent>> TIMELINE = new TypeReference<>() {
    };

    /** Width of the {@code error_message} column. */
    static final int MAX_ERROR_LENGTH = 4000;

    private static final String COLUMNS = """
            run_id, user_id, session_id, request_text, status, created_at, updated_at,
            final_response, timeline, iterations, error_message""";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JdbcRunRecordStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public String create(RunRecord initial) {
        String id = initial.id() != null ? initial.id() : UUID.randomUUID().toString();
        try {
            jdbcTemplate.update("INSERT INTO agent_runs (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                    id,
                    initial.userId(),
                    initial.sessionId(),
                    initial.query(),
                    initial.status().name(),
                    Timestamp.from(initial.createdAt()),
                    Timestamp.from(clock.instant()),
                    initial.finalResponse(),
                    safeSerialize(initial.timeline()),
                    initial.iterations(),
                    bounded(initial.error()));
            return id;
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to insert run record " + id, e);
        }
    }

    @Override
    public void update(String id, RunStatus status, RunSnapshot snapshot) {
        write(id, status, snapshot, null);
    }

    @Override
    public void complete(String id, RunStatus status, RunSnapshot snapshot, String error) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Cannot complete run " + id + " with status " + status);
        }
        write(id, status, snapshot, error);
    }

    @Override
    public Optional<RunRecord> find(String id) {
        try {
            List<RunRecord> rows = jdbcTemplate.query(
                    "SELECT " + COLUMNS + " FROM agent_runs WHERE run_id = ?", this::mapRow, id);
            return rows.stream().findFirst();
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to load run record " + id, e);
        }
    }

    @Override
    public List<RunRecord> findStale(Duration threshold) {
        Instant cutoff = clock.instant().minus(threshold);
        try {
            return jdbcTemplate.query("""
                    SELECT %s FROM agent_runs
                    WHERE status IN ('PENDING', 'RUNNING') AND updated_at < ?
                    ORDER BY updated_at""".formatted(COLUMNS), this::mapRow, Timestamp.from(cutoff));
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to query stale run records", e);
        }
    }

    private void write(String id, RunStatus status, RunSnapshot snapshot, String rawError) {
        String error = bounded(rawError);
        int rows;
        try {
            if (snapshot == null) {
                rows = jdbcTemplate.update("""
                                UPDATE agent_runs
                                SET status = ?, updated_at = ?, error_message = ?
                                WHERE run_id = ?""",
                        status.name(), Timestamp.from(clock.instant()), error, id);
            } else {
                rows = jdbcTemplate.update("""
                                UPDATE agent_runs
                                SET status = ?,
                                    updated_at = ?,
                                    final_response = ?,
                                    timeline = ?,
                                    iterations = ?,
                                    error_message = ?
                                WHERE run_id = ?""",
                        status.name(),
                        Timestamp.from(clock.instant()),
                        snapshot.output(),
                        safeSerialize(snapshot.nodeEvents()),
                        snapshot.iterations(),
                        error,
                        id);
            }
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to write run record " + id, e);
        }
        if (rows == 0) {
            throw new PersistenceException("No run record with id " + id, null);
        }
    }

    private static String bounded(String error) {
        if (error == null || error.length() <= MAX_ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
    }

    private RunRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new RunRecord(
                rs.getString("run_id"),
                rs.getString("user_id"),
                rs.getString("session_id"),
                rs.getString("request_text"),
                RunStatus.valueOf(rs.getString("status")),
                rs.getTimestamp("created_at").toInstant(),
                rs.getTimestamp("updated_at").toInstant(),
                rs.getString("final_response"),
                safeDeserialize(rs.getString("timeline")),
                rs.getInt("iterations"),
                rs.getString("error_message"));
    }

    private String safeSerialize(List<NodeEvent> timeline) {
        try {
            return objectMapper.writeValueAsString(timeline);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize run timeline: {}", e.getMessage());
            return "[]";
        }
    }

    private List<NodeEvent> safeDeserialize(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, TIMELINE);
        } catch (JsonProcessingException e) {
            log.warn("Could not read run timeline: {}", e.getMessage());
            return List.of();
        }
    }
}
