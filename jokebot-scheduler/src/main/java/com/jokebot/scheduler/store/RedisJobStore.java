package com.jokebot.scheduler.store;

import com.jokebot.scheduler.model.JobRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 基于 Redis 的任务存储。
 * <p>
 * 每个任务一个 hash，另用一个以 nextRunAt 为分值的有序集合做到期扫描；
 * 多步写操作放在 Lua 脚本（classpath:scripts/*.lua）里执行，保证单 key 原子。
 * 执行锁用 {@code SET NX PX}，进程崩溃后随过期时间自动释放。
 */
@Slf4j
public class RedisJobStore implements JobStore {

    private static final String JOB_PREFIX = "jokebot:job:";
    private static final String LOCK_PREFIX = "jokebot:job-lock:";
    private static final String DUE_KEY = "jokebot:jobs:due";

    private static final RedisScript<Long> UPSERT_SCRIPT = script("job-upsert.lua");
    private static final RedisScript<Long> CANCEL_SCRIPT = script("job-cancel.lua");
    private static final RedisScript<Long> MARK_RUN_SCRIPT = script("job-mark-run.lua");
    private static final RedisScript<Long> UNLOCK_SCRIPT = script("job-unlock.lua");

    private final StringRedisTemplate redisTemplate;

    public RedisJobStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public void upsert(JobRecord record) {
        List<String> args = new ArrayList<>();
        args.add(record.getKey());
        args.add(String.valueOf(record.getNextRunAt().toEpochMilli()));
        addField(args, "jobId", record.getJobId());
        addField(args, "handlerName", record.getHandlerName());
        addField(args, "intervalMinutes", String.valueOf(record.getIntervalMinutes()));
        addField(args, "nextRunAt", String.valueOf(record.getNextRunAt().toEpochMilli()));
        addField(args, "failCount", String.valueOf(record.getFailCount()));
        addField(args, "createdAt", String.valueOf(record.getCreatedAt().toEpochMilli()));
        if (record.getLastRunAt() != null) {
            addField(args, "lastRunAt", String.valueOf(record.getLastRunAt().toEpochMilli()));
        }
        redisTemplate.execute(UPSERT_SCRIPT, List.of(jobKey(record.getKey()), DUE_KEY), args.toArray());
    }

    @Override
    public void cancel(String key) {
        redisTemplate.execute(CANCEL_SCRIPT, List.of(jobKey(key), DUE_KEY), key, "");
    }

    @Override
    public boolean cancel(String key, String jobId) {
        Long removed = redisTemplate.execute(CANCEL_SCRIPT, List.of(jobKey(key), DUE_KEY), key, jobId);
        return removed != null && removed > 0;
    }

    @Override
    public Optional<JobRecord> find(String key) {
        Map<Object, Object> fields = redisTemplate.opsForHash().entries(jobKey(key));
        if (fields.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(toRecord(key, fields));
    }

    @Override
    public List<JobRecord> findDue(Instant now, int limit) {
        Set<String> keys = redisTemplate.opsForZSet().rangeByScore(DUE_KEY, 0, now.toEpochMilli(), 0, limit);
        if (keys == null || keys.isEmpty()) {
            return List.of();
        }
        List<JobRecord> due = new ArrayList<>(keys.size());
        for (String key : keys) {
            // 有序集合与 hash 分两次读取，期间被取消的任务直接跳过
            find(key).filter(job -> job.isDue(now)).ifPresent(due::add);
        }
        return due;
    }

    @Override
    public boolean markRun(String key, String jobId, boolean success, Instant nextRunAt, Instant ranAt) {
        Long updated = redisTemplate.execute(MARK_RUN_SCRIPT, List.of(jobKey(key), DUE_KEY),
                key, jobId, success ? "1" : "0",
                String.valueOf(nextRunAt.toEpochMilli()), String.valueOf(ranAt.toEpochMilli()));
        return updated != null && updated > 0;
    }

    @Override
    public boolean tryLock(String key, String owner, Instant now, Instant lockUntil) {
        Duration ttl = Duration.between(now, lockUntil);
        if (ttl.isZero() || ttl.isNegative()) {
            return false;
        }
        return Boolean.TRUE.equals(redisTemplate.opsForValue().setIfAbsent(LOCK_PREFIX + key, owner, ttl));
    }

    @Override
    public void unlock(String key, String owner) {
        redisTemplate.execute(UNLOCK_SCRIPT, List.of(LOCK_PREFIX + key), owner);
    }

    @Override
    public long activeCount() {
        Long size = redisTemplate.opsForZSet().zCard(DUE_KEY);
        return size != null ? size : 0;
    }

    private static JobRecord toRecord(String key, Map<Object, Object> fields) {
        Object lastRunAt = fields.get("lastRunAt");
        return JobRecord.builder()
                .key(key)
                .jobId((String) fields.get("jobId"))
                .handlerName((String) fields.get("handlerName"))
                .intervalMinutes(Integer.parseInt((String) fields.get("intervalMinutes")))
                .nextRunAt(epochMilli(fields.get("nextRunAt")))
                .lastRunAt(lastRunAt != null ? epochMilli(lastRunAt) : null)
                .failCount(Integer.parseInt((String) fields.get("failCount")))
                .active(true)
                .createdAt(epochMilli(fields.get("createdAt")))
                .build();
    }

    private static Instant epochMilli(Object value) {
        return Instant.ofEpochMilli(Long.parseLong((String) value));
    }

    private static void addField(List<String> args, String field, String value) {
        args.add(field);
        args.add(value);
    }

    private static String jobKey(String key) {
        return JOB_PREFIX + key;
    }

    private static RedisScript<Long> script(String name) {
        return RedisScript.of(new ClassPathResource("scripts/" + name), Long.class);
    }
}
