package com.jokebot.scheduler.service;

import com.jokebot.common.exception.InvalidIntervalException;
import com.jokebot.common.util.IdGenerator;
import com.jokebot.scheduler.config.SchedulerProperties;
import com.jokebot.scheduler.model.JobRecord;
import com.jokebot.scheduler.model.JobResult;
import com.jokebot.scheduler.runner.JobRunner;
import com.jokebot.scheduler.store.JobStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 订阅调度门面：命令处理层通过它创建、取消、更新订阅者的周期任务。
 * <p>
 * 同一 key 的变更按调用顺序串行执行（分段锁），保证 schedule → cancel → schedule
 * 不会被旧的 cancel 抢先覆盖。每次 schedule 都整体替换旧任务，同一 key 至多一个活跃任务。
 */
@Slf4j
public class SubscriptionScheduler {

    private static final int LOCK_STRIPES = 64;

    private final JobStore store;
    private final JobRunner runner;
    private final SchedulerProperties properties;
    private final Clock clock;
    private final ReentrantLock[] stripes = new ReentrantLock[LOCK_STRIPES];

    public SubscriptionScheduler(JobStore store, JobRunner runner, SchedulerProperties properties, Clock clock) {
        this.store = store;
        this.runner = runner;
        this.properties = properties;
        this.clock = clock;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    /**
     * 为订阅者安排周期任务，取代已有任务。首次运行在 now + intervalMinutes。
     *
     * @throws InvalidIntervalException 间隔不在 1~1440 分钟内，此时不会创建或修改任何记录
     */
    public JobRecord schedule(String key, int intervalMinutes) {
        return schedule(key, intervalMinutes, properties.getDefaultHandler());
    }

    public JobRecord schedule(String key, int intervalMinutes, String handlerName) {
        InvalidIntervalException.check(intervalMinutes);
        return withKeyLock(key, () -> {
            Instant now = clock.instant();
            JobRecord record = JobRecord.builder()
                    .key(key)
                    .jobId(IdGenerator.withPrefix("job"))
                    .handlerName(handlerName)
                    .intervalMinutes(intervalMinutes)
                    .nextRunAt(now.plus(Duration.ofMinutes(intervalMinutes)))
                    .failCount(0)
                    .active(true)
                    .createdAt(now)
                    .build();
            store.upsert(record);
            log.info("已安排订阅任务: key={}, 每 {} 分钟, 首次运行 {}", key, intervalMinutes, record.getNextRunAt());
            return record;
        });
    }

    /**
     * 取消订阅者的任务；没有任务时无操作。进行中的推送不会被中断。
     */
    public void cancel(String key) {
        withKeyLock(key, () -> {
            store.cancel(key);
            log.info("已取消订阅任务: {}", key);
            return null;
        });
    }

    /**
     * 跳过调度立即推送一次，用于调试或手动触发，不改变 nextRunAt。
     */
    public JobResult runNow(String key) {
        log.info("手动触发推送: {}", key);
        return runner.runNow(key, properties.getDefaultHandler());
    }

    /**
     * 查询订阅者当前的活跃任务。
     */
    public Optional<JobRecord> find(String key) {
        return store.find(key).filter(JobRecord::isActive);
    }

    public long activeCount() {
        return store.activeCount();
    }

    private <T> T withKeyLock(String key, Supplier<T> action) {
        ReentrantLock lock = stripes[Math.floorMod(key.hashCode(), LOCK_STRIPES)];
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
