package com.jokebot.scheduler.store;

import com.jokebot.scheduler.model.JobRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 周期任务存储接口。
 * <p>
 * 提供三种实现：
 * - {@link JdbcJobStore}：SQLite 持久化（默认），重启后任务不丢失
 * - {@link InMemoryJobStore}：纯内存，适合测试与轻量部署
 * - {@link RedisJobStore}：Redis 持久化，多实例可共享同一存储
 * <p>
 * 每个操作对单个 key 原子，不提供跨 key 事务。
 */
public interface JobStore {

    /** 写入任务，同 key 的旧记录被整体替换（执行锁保留） */
    void upsert(JobRecord record);

    /** 取消任务，不存在时无操作 */
    void cancel(String key);

    /**
     * 仅当该 key 当前仍是 jobId 这次调度时才取消。
     *
     * @return 是否取消成功
     */
    boolean cancel(String key, String jobId);

    Optional<JobRecord> find(String key);

    /**
     * 查询到期任务。每次调用返回一份新的快照，按 nextRunAt 升序。
     */
    List<JobRecord> findDue(Instant now, int limit);

    /**
     * 记录一次执行结果。任务已被取消或被新的调度替换时忽略。
     *
     * @param success   true 时清零 failCount 并更新 lastRunAt，false 时 failCount + 1
     * @param nextRunAt 下一次运行时间
     * @param ranAt     本次执行时间
     * @return 是否更新成功
     */
    boolean markRun(String key, String jobId, boolean success, Instant nextRunAt, Instant ranAt);

    /**
     * 获取执行锁。锁未被持有或已过期时成功。
     *
     * @param lockUntil 锁过期时间，进程崩溃时锁在此之后自动失效
     */
    boolean tryLock(String key, String owner, Instant now, Instant lockUntil);

    /** 释放执行锁，只释放 owner 自己持有的锁 */
    void unlock(String key, String owner);

    long activeCount();
}
