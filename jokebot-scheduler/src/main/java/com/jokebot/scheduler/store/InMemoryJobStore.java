package com.jokebot.scheduler.store;

import com.jokebot.scheduler.model.JobRecord;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 基于内存的任务存储。
 * <p>
 * 单 key 的读-改-写通过 {@link ConcurrentHashMap#compute} 保证原子性。
 * 进程重启后所有任务丢失，仅适合测试与轻量部署。
 */
@Slf4j
public class InMemoryJobStore implements JobStore {

    private final Map<String, JobRecord> jobs = new ConcurrentHashMap<>();
    private final Map<String, ExecutionLock> locks = new ConcurrentHashMap<>();

    @Override
    public void upsert(JobRecord record) {
        jobs.put(record.getKey(), copy(record));
    }

    @Override
    public void cancel(String key) {
        if (jobs.remove(key) != null) {
            log.debug("已移除任务: {}", key);
        }
    }

    @Override
    public boolean cancel(String key, String jobId) {
        AtomicBoolean removed = new AtomicBoolean(false);
        jobs.computeIfPresent(key, (k, job) -> {
            if (job.getJobId().equals(jobId)) {
                removed.set(true);
                return null;
            }
            return job;
        });
        return removed.get();
    }

    @Override
    public Optional<JobRecord> find(String key) {
        return Optional.ofNullable(jobs.get(key)).map(this::copy);
    }

    @Override
    public List<JobRecord> findDue(Instant now, int limit) {
        return jobs.values().stream()
                .filter(job -> job.isDue(now))
                .sorted(Comparator.comparing(JobRecord::getNextRunAt))
                .limit(limit)
                .map(this::copy)
                .toList();
    }

    @Override
    public boolean markRun(String key, String jobId, boolean success, Instant nextRunAt, Instant ranAt) {
        AtomicBoolean updated = new AtomicBoolean(false);
        jobs.computeIfPresent(key, (k, job) -> {
            if (!job.isActive() || !job.getJobId().equals(jobId)) {
                return job;
            }
            updated.set(true);
            JobRecord.JobRecordBuilder next = job.toBuilder().nextRunAt(nextRunAt);
            if (success) {
                next.failCount(0).lastRunAt(ranAt);
            } else {
                next.failCount(job.getFailCount() + 1);
            }
            return next.build();
        });
        return updated.get();
    }

    @Override
    public boolean tryLock(String key, String owner, Instant now, Instant lockUntil) {
        ExecutionLock candidate = new ExecutionLock(owner, lockUntil);
        ExecutionLock holder = locks.compute(key, (k, current) ->
                current == null || !current.until.isAfter(now) ? candidate : current);
        return holder == candidate;
    }

    @Override
    public void unlock(String key, String owner) {
        locks.computeIfPresent(key, (k, current) -> current.owner.equals(owner) ? null : current);
    }

    @Override
    public long activeCount() {
        return jobs.values().stream().filter(JobRecord::isActive).count();
    }

    private JobRecord copy(JobRecord record) {
        return record.toBuilder().build();
    }

    @AllArgsConstructor
    private static final class ExecutionLock {
        private final String owner;
        private final Instant until;
    }
}
