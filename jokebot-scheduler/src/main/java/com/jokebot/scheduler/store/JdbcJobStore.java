package com.jokebot.scheduler.store;

import com.jokebot.scheduler.model.JobRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 基于 SQLite 的任务存储（表 t_job，见 db/job-schema.sql）。
 * <p>
 * 时间统一存 epoch 毫秒；每个写操作是一条带条件的 SQL，单 key 原子。
 * 执行锁以 locked_by / locked_until 两列实现，锁过期后可被其他轮询抢占。
 */
@Slf4j
@RequiredArgsConstructor
public class JdbcJobStore implements JobStore {

    private final NamedParameterJdbcTemplate jdbcTemplate;

    private static final String UPSERT =
            "INSERT INTO t_job (job_key, job_id, handler_name, interval_minutes, next_run_at, "
                    + "last_run_at, fail_count, active, created_at) "
                    + "VALUES (:key, :jobId, :handlerName, :intervalMinutes, :nextRunAt, "
                    + ":lastRunAt, :failCount, :active, :createdAt) "
                    + "ON CONFLICT (job_key) DO UPDATE SET "
                    + "job_id = excluded.job_id, "
                    + "handler_name = excluded.handler_name, "
                    + "interval_minutes = excluded.interval_minutes, "
                    + "next_run_at = excluded.next_run_at, "
                    + "last_run_at = excluded.last_run_at, "
                    + "fail_count = excluded.fail_count, "
                    + "active = excluded.active, "
                    + "created_at = excluded.created_at";

    private static final RowMapper<JobRecord> ROW_MAPPER = JdbcJobStore::mapRow;

    @Override
    public void upsert(JobRecord record) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("key", record.getKey())
                .addValue("jobId", record.getJobId())
                .addValue("handlerName", record.getHandlerName())
                .addValue("intervalMinutes", record.getIntervalMinutes())
                .addValue("nextRunAt", record.getNextRunAt().toEpochMilli())
                .addValue("lastRunAt", record.getLastRunAt() != null ? record.getLastRunAt().toEpochMilli() : null)
                .addValue("failCount", record.getFailCount())
                .addValue("active", record.isActive() ? 1 : 0)
                .addValue("createdAt", record.getCreatedAt().toEpochMilli());
        jdbcTemplate.update(UPSERT, params);
    }

    @Override
    public void cancel(String key) {
        int rows = jdbcTemplate.update(
                "UPDATE t_job SET active = 0 WHERE job_key = :key AND active = 1",
                new MapSqlParameterSource("key", key));
        if (rows > 0) {
            log.debug("已停用任务: {}", key);
        }
    }

    @Override
    public boolean cancel(String key, String jobId) {
        return jdbcTemplate.update(
                "UPDATE t_job SET active = 0 WHERE job_key = :key AND job_id = :jobId AND active = 1",
                new MapSqlParameterSource("key", key).addValue("jobId", jobId)) > 0;
    }

    @Override
    public Optional<JobRecord> find(String key) {
        List<JobRecord> rows = jdbcTemplate.query(
                "SELECT * FROM t_job WHERE job_key = :key",
                new MapSqlParameterSource("key", key), ROW_MAPPER);
        return rows.stream().findFirst();
    }

    @Override
    public List<JobRecord> findDue(Instant now, int limit) {
        return jdbcTemplate.query(
                "SELECT * FROM t_job WHERE active = 1 AND next_run_at <= :now ORDER BY next_run_at LIMIT :limit",
                new MapSqlParameterSource("now", now.toEpochMilli()).addValue("limit", limit),
                ROW_MAPPER);
    }

    @Override
    public boolean markRun(String key, String jobId, boolean success, Instant nextRunAt, Instant ranAt) {
        String sql = success
                ? "UPDATE t_job SET next_run_at = :next, last_run_at = :ranAt, fail_count = 0 "
                + "WHERE job_key = :key AND job_id = :jobId AND active = 1"
                : "UPDATE t_job SET next_run_at = :next, fail_count = fail_count + 1 "
                + "WHERE job_key = :key AND job_id = :jobId AND active = 1";
        MapSqlParameterSource params = new MapSqlParameterSource("key", key)
                .addValue("jobId", jobId)
                .addValue("next", nextRunAt.toEpochMilli())
                .addValue("ranAt", ranAt.toEpochMilli());
        return jdbcTemplate.update(sql, params) > 0;
    }

    @Override
    public boolean tryLock(String key, String owner, Instant now, Instant lockUntil) {
        MapSqlParameterSource params = new MapSqlParameterSource("key", key)
                .addValue("owner", owner)
                .addValue("now", now.toEpochMilli())
                .addValue("until", lockUntil.toEpochMilli());
        return jdbcTemplate.update(
                "UPDATE t_job SET locked_by = :owner, locked_until = :until "
                        + "WHERE job_key = :key AND (locked_until IS NULL OR locked_until <= :now)",
                params) > 0;
    }

    @Override
    public void unlock(String key, String owner) {
        jdbcTemplate.update(
                "UPDATE t_job SET locked_by = NULL, locked_until = NULL WHERE job_key = :key AND locked_by = :owner",
                new MapSqlParameterSource("key", key).addValue("owner", owner));
    }

    @Override
    public long activeCount() {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM t_job WHERE active = 1",
                new MapSqlParameterSource(), Long.class);
        return count != null ? count : 0;
    }

    private static JobRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        long lastRunAt = rs.getLong("last_run_at");
        boolean neverRan = rs.wasNull();
        return JobRecord.builder()
                .key(rs.getString("job_key"))
                .jobId(rs.getString("job_id"))
                .handlerName(rs.getString("handler_name"))
                .intervalMinutes(rs.getInt("interval_minutes"))
                .nextRunAt(Instant.ofEpochMilli(rs.getLong("next_run_at")))
                .lastRunAt(neverRan ? null : Instant.ofEpochMilli(lastRunAt))
                .failCount(rs.getInt("fail_count"))
                .active(rs.getInt("active") == 1)
                .createdAt(Instant.ofEpochMilli(rs.getLong("created_at")))
                .build();
    }
}
