package com.spa.aggregator.crawl.persistence;

import com.spa.aggregator.crawl.model.CrawlRun;
import com.spa.aggregator.crawl.model.CrawlRunStatus;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.List;

/**
 * Persistence of {@code crawl_runs}. Status changes are compare-and-set on the expected current status and counters
 * are incremented in SQL, so concurrent workers never lose updates.
 */
@Repository
public class CrawlRunJdbcRepository {
    private static final int MAX_ERROR_LENGTH = 1000;

    private static final RowMapper<CrawlRun> ROW_MAPPER = CrawlRunJdbcRepository::mapRun;

    private final NamedParameterJdbcTemplate jdbc;

    public CrawlRunJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public long insertRun(String name, String paramsJson, Instant startedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("name", name)
            .addValue("status", CrawlRunStatus.RUNNING.dbValue())
            .addValue("paramsJson", paramsJson, Types.VARCHAR)
            .addValue("startedAt", toTimestamp(startedAt));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO crawl_runs (
                    name, status, total, completed, errors_count, checkpoint_offset,
                    params_json, started_at, updated_at
                )
                VALUES (
                    :name, :status, NULL, 0, 0, 0,
                    :paramsJson, :startedAt, :startedAt
                )
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to insert crawl run " + name);
        }
        return key.longValue();
    }

    public CrawlRun findById(long runId) {
        List<CrawlRun> rows = jdbc.query(
            """
                SELECT *
                FROM crawl_runs
                WHERE id = :runId
                """,
            new MapSqlParameterSource("runId", runId),
            ROW_MAPPER
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public CrawlRunStatus findStatus(long runId) {
        List<String> rows = jdbc.queryForList(
            "SELECT status FROM crawl_runs WHERE id = :runId",
            new MapSqlParameterSource("runId", runId),
            String.class
        );
        return rows.isEmpty() ? null : CrawlRunStatus.fromDb(rows.get(0));
    }

    public List<CrawlRun> findRecent(int limit) {
        return jdbc.query(
            """
                SELECT *
                FROM crawl_runs
                ORDER BY started_at DESC, id DESC
                LIMIT :limit
                """,
            new MapSqlParameterSource("limit", Math.max(1, limit)),
            ROW_MAPPER
        );
    }

    public List<CrawlRun> findByStatus(CrawlRunStatus status) {
        return jdbc.query(
            """
                SELECT *
                FROM crawl_runs
                WHERE status = :status
                ORDER BY id
                """,
            new MapSqlParameterSource("status", status.dbValue()),
            ROW_MAPPER
        );
    }

    public CrawlRun findLatestByName(String name) {
        List<CrawlRun> rows = jdbc.query(
            """
                SELECT *
                FROM crawl_runs
                WHERE name = :name
                ORDER BY started_at DESC, id DESC
                LIMIT 1
                """,
            new MapSqlParameterSource("name", name),
            ROW_MAPPER
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<CrawlRun> findActiveByName(String name) {
        return jdbc.query(
            """
                SELECT *
                FROM crawl_runs
                WHERE name = :name
                  AND status IN ('running', 'paused')
                ORDER BY id
                """,
            new MapSqlParameterSource("name", name),
            ROW_MAPPER
        );
    }

    /**
     * Moves the run from {@code expected} to {@code target}. {@code ended_at} is stamped once, on entering a
     * terminal status. Returns false when the run was not in {@code expected}.
     */
    public boolean transition(
        long runId,
        CrawlRunStatus expected,
        CrawlRunStatus target,
        String lastError,
        Instant now
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("runId", runId)
            .addValue("expected", expected.dbValue())
            .addValue("target", target.dbValue())
            .addValue("lastError", truncateError(lastError), Types.VARCHAR)
            .addValue("now", toTimestamp(now))
            .addValue("endedAt", target.isTerminal() ? toTimestamp(now) : null, Types.TIMESTAMP);
        int updated = jdbc.update(
            """
                UPDATE crawl_runs
                SET status = :target,
                    last_error = COALESCE(:lastError, last_error),
                    ended_at = COALESCE(ended_at, :endedAt),
                    updated_at = :now
                WHERE id = :runId
                  AND status = :expected
                """,
            params
        );
        return updated == 1;
    }

    public void setTotal(long runId, long total, Instant now) {
        jdbc.update(
            """
                UPDATE crawl_runs
                SET total = :total,
                    updated_at = :now
                WHERE id = :runId
                """,
            new MapSqlParameterSource()
                .addValue("runId", runId)
                .addValue("total", Math.max(0, total))
                .addValue("now", toTimestamp(now))
        );
    }

    public void incrementCompleted(long runId, long delta, Instant now) {
        jdbc.update(
            """
                UPDATE crawl_runs
                SET completed = completed + :delta,
                    updated_at = :now
                WHERE id = :runId
                """,
            new MapSqlParameterSource()
                .addValue("runId", runId)
                .addValue("delta", Math.max(0, delta))
                .addValue("now", toTimestamp(now))
        );
    }

    public void incrementErrors(long runId, String lastError, Instant now) {
        jdbc.update(
            """
                UPDATE crawl_runs
                SET errors_count = errors_count + 1,
                    last_error = COALESCE(:lastError, last_error),
                    updated_at = :now
                WHERE id = :runId
                """,
            new MapSqlParameterSource()
                .addValue("runId", runId)
                .addValue("lastError", truncateError(lastError), Types.VARCHAR)
                .addValue("now", toTimestamp(now))
        );
    }

    public void updateCheckpoint(long runId, long checkpointOffset, Instant now) {
        jdbc.update(
            """
                UPDATE crawl_runs
                SET checkpoint_offset = :checkpointOffset,
                    updated_at = :now
                WHERE id = :runId
                """,
            new MapSqlParameterSource()
                .addValue("runId", runId)
                .addValue("checkpointOffset", Math.max(0, checkpointOffset))
                .addValue("now", toTimestamp(now))
        );
    }

    private static CrawlRun mapRun(ResultSet rs, int rowNum) throws SQLException {
        long total = rs.getLong("total");
        Long nullableTotal = rs.wasNull() ? null : total;
        return new CrawlRun(
            rs.getLong("id"),
            rs.getString("name"),
            CrawlRunStatus.fromDb(rs.getString("status")),
            nullableTotal,
            rs.getLong("completed"),
            rs.getLong("errors_count"),
            rs.getString("last_error"),
            rs.getLong("checkpoint_offset"),
            rs.getString("params_json"),
            toInstant(rs.getTimestamp("started_at")),
            toInstant(rs.getTimestamp("updated_at")),
            toInstant(rs.getTimestamp("ended_at"))
        );
    }

    private static Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private static String truncateError(String detail) {
        if (detail == null) {
            return null;
        }
        String trimmed = detail.trim();
        return trimmed.length() <= MAX_ERROR_LENGTH ? trimmed : trimmed.substring(0, MAX_ERROR_LENGTH);
    }
}
