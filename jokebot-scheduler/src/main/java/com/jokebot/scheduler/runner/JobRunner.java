package com.jokebot.scheduler.runner;

import com.jokebot.common.exception.LockContentionException;
import com.jokebot.common.util.IdGenerator;
import com.jokebot.scheduler.config.SchedulerProperties;
import com.jokebot.scheduler.handler.JobFailureListener;
import com.jokebot.scheduler.handler.JobHandlerRegistry;
import com.jokebot.scheduler.model.JobRecord;
import com.jokebot.scheduler.model.JobResult;
import com.jokebot.scheduler.model.RunnerState;
import com.jokebot.scheduler.store.JobStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 到期任务执行器：轮询任务存储，在并发上限内异步调用处理器，并推进下一次运行时间。
 * <p>
 * 核心策略：
 * - 每个任务执行前先抢执行锁，避免两轮轮询（或共享存储的两个进程）重复推送
 * - 用 Semaphore 控制同时在途的处理器调用数，满了就把剩余任务留到下一轮
 * - 每次调用有超时上限，超时按失败结算并中断工作线程；执行锁与许可等处理器真正返回后才释放
 * - 失败不会中断轮询，失败次数 + 1 后按固定节奏推进，下个周期重试
 * - 处理器报告订阅者已失效时直接取消任务
 */
@Slf4j
public class JobRunner {

    private final JobStore store;
    private final JobHandlerRegistry handlers;
    private final List<JobFailureListener> failureListeners;
    private final SchedulerProperties properties;
    private final Clock clock;

    private final String ownerId = IdGenerator.withPrefix("runner");
    private final AtomicReference<RunnerState> state = new AtomicReference<>(RunnerState.IDLE);
    private final AtomicInteger inFlight = new AtomicInteger();
    private final Object idleMonitor = new Object();
    private final Semaphore permits;
    private final ExecutorService workers;

    public JobRunner(JobStore store, JobHandlerRegistry handlers, List<JobFailureListener> failureListeners,
                     SchedulerProperties properties, Clock clock) {
        this.store = store;
        this.handlers = handlers;
        this.failureListeners = List.copyOf(failureListeners);
        this.properties = properties;
        this.clock = clock;
        this.permits = new Semaphore(properties.getMaxConcurrency());
        AtomicInteger threadIndex = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(properties.getMaxConcurrency(), r -> {
            Thread t = new Thread(r, "job-worker-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * 执行一轮轮询。
     *
     * @return 本轮派发的任务数
     */
    public int pollOnce() {
        if (!state.compareAndSet(RunnerState.IDLE, RunnerState.POLLING)) {
            log.debug("执行器状态为 {}，跳过本轮轮询", state.get());
            return 0;
        }

        int dispatched = 0;
        try {
            Instant now = clock.instant();
            List<JobRecord> due = store.findDue(now, properties.getBatchSize());
            if (due.isEmpty()) {
                return 0;
            }

            state.compareAndSet(RunnerState.POLLING, RunnerState.DISPATCHING);
            for (JobRecord candidate : due) {
                if (state.get() == RunnerState.STOPPED) {
                    break;
                }
                if (!permits.tryAcquire()) {
                    log.debug("在途任务已达上限 {}，剩余到期任务留到下一轮", properties.getMaxConcurrency());
                    break;
                }
                Optional<JobRecord> locked;
                try {
                    locked = lockIfStillDue(candidate.getKey(), now);
                } catch (RuntimeException e) {
                    permits.release();
                    throw e;
                }
                if (locked.isEmpty()) {
                    permits.release();
                    continue;
                }
                dispatch(locked.get());
                dispatched++;
            }

            log.info("本轮到期任务 {} 个，派发 {} 个，在途 {} 个", due.size(), dispatched, inFlight.get());
        } catch (RuntimeException e) {
            log.error("轮询到期任务失败", e);
        } finally {
            state.compareAndSet(RunnerState.POLLING, RunnerState.IDLE);
            state.compareAndSet(RunnerState.DISPATCHING, RunnerState.IDLE);
        }
        return dispatched;
    }

    /**
     * 立即执行某个订阅者的处理器，不改变其 nextRunAt 与失败计数。
     * <p>
     * 存在任务时先抢执行锁；没有任务时用默认处理器直接执行。超时只结束等待，
     * 执行锁要等处理器真正返回后才释放。
     *
     * @throws LockContentionException 该订阅者的推送正在进行中
     */
    public JobResult runNow(String key, String defaultHandler) {
        if (state.get() == RunnerState.STOPPED) {
            return JobResult.failed("执行器已停止", null);
        }
        Optional<JobRecord> existing = store.find(key).filter(JobRecord::isActive);
        if (existing.isEmpty()) {
            JobRecord adhoc = JobRecord.builder()
                    .key(key)
                    .handlerName(defaultHandler)
                    .build();
            return invokeAndWait(adhoc, () -> {
            });
        }

        JobRecord job = existing.get();
        Instant now = clock.instant();
        if (!store.tryLock(key, ownerId, now, now.plusSeconds(properties.getLockTimeoutSeconds()))) {
            throw new LockContentionException("订阅者 " + key + " 的推送正在进行中");
        }
        JobResult result = invokeAndWait(job, () -> unlockQuietly(key));
        if (result.getOutcome() == JobResult.Outcome.SUBSCRIBER_GONE) {
            store.cancel(key, job.getJobId());
            log.info("手动执行发现订阅者已失效，取消任务: {}", key);
        } else if (result.getOutcome() == JobResult.Outcome.FAILED) {
            log.warn("手动执行失败: key={}, 原因: {}", key, result.getMessage());
        }
        return result;
    }

    /**
     * 停止轮询并等待在途任务结束。
     */
    public void stop() {
        if (state.getAndSet(RunnerState.STOPPED) == RunnerState.STOPPED) {
            return;
        }
        log.info("停止任务执行器，在途任务 {} 个", inFlight.get());
        try {
            if (!awaitIdle(Duration.ofSeconds(properties.getShutdownTimeoutSeconds()))) {
                log.warn("等待在途任务超时，仍有 {} 个未结束", inFlight.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        workers.shutdownNow();
    }

    /**
     * 等待所有在途任务结算完毕（包括 markRun 与释放锁）。
     *
     * @return 超时前是否已空闲
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (idleMonitor) {
            while (inFlight.get() > 0) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                TimeUnit.NANOSECONDS.timedWait(idleMonitor, remaining);
            }
        }
        return true;
    }

    public RunnerState getState() {
        return state.get();
    }

    public int inFlightCount() {
        return inFlight.get();
    }

    /**
     * 抢锁后重新读取任务：快照可能已过时（被取消、被替换或刚被其他轮询推进）。
     */
    private Optional<JobRecord> lockIfStillDue(String key, Instant now) {
        Instant lockUntil = now.plusSeconds(properties.getLockTimeoutSeconds());
        if (!store.tryLock(key, ownerId, now, lockUntil)) {
            log.debug("任务 {} 的执行锁被占用，本轮跳过", key);
            return Optional.empty();
        }
        Optional<JobRecord> current = store.find(key).filter(job -> job.isDue(now));
        if (current.isEmpty()) {
            store.unlock(key, ownerId);
        }
        return current;
    }

    /**
     * 派发一次调用。结算与释放分开：
     * 正常返回时由工作线程结算；超时由延时任务先按失败结算并中断工作线程，
     * 执行锁与并发许可始终等到处理器真正返回后才释放，避免同一 key 被再次派发。
     */
    private void dispatch(JobRecord job) {
        inFlight.incrementAndGet();
        AtomicBoolean started = new AtomicBoolean();
        AtomicBoolean settled = new AtomicBoolean();

        Future<?> task;
        try {
            task = workers.submit(() -> {
                if (!started.compareAndSet(false, true)) {
                    return;
                }
                try {
                    JobResult result = invoke(job);
                    if (settled.compareAndSet(false, true)) {
                        settleQuietly(job, result);
                    } else {
                        log.info("任务 {} 超时后才返回，结果已丢弃", job.getKey());
                    }
                } finally {
                    release(job);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("执行器已关闭，任务 {} 未派发", job.getKey());
            release(job);
            return;
        }

        CompletableFuture.delayedExecutor(properties.getHandlerTimeoutSeconds(), TimeUnit.SECONDS).execute(() -> {
            if (!settled.compareAndSet(false, true)) {
                return;
            }
            settleQuietly(job, timedOut());
            if (started.compareAndSet(false, true)) {
                // 还在队列里没开始执行，直接由这里释放
                task.cancel(false);
                release(job);
            } else {
                task.cancel(true);
            }
        });
    }

    /**
     * 同步调用处理器，最多等待处理器超时时间。onFinished 在处理器真正返回后执行。
     */
    private JobResult invokeAndWait(JobRecord job, Runnable onFinished) {
        AtomicBoolean started = new AtomicBoolean();
        CompletableFuture<JobResult> result = new CompletableFuture<>();

        Future<?> task;
        try {
            task = workers.submit(() -> {
                if (!started.compareAndSet(false, true)) {
                    return;
                }
                try {
                    result.complete(invoke(job));
                } finally {
                    onFinished.run();
                }
            });
        } catch (RejectedExecutionException e) {
            onFinished.run();
            return JobResult.failed("执行器已停止", e);
        }

        try {
            return result.get(properties.getHandlerTimeoutSeconds(), TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            abandon(task, started, onFinished);
            return timedOut();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abandon(task, started, onFinished);
            return JobResult.failed("等待处理器时被中断", e);
        } catch (ExecutionException e) {
            return JobResult.failed(e.getCause().getMessage(), e.getCause());
        }
    }

    private void abandon(Future<?> task, AtomicBoolean started, Runnable onFinished) {
        if (started.compareAndSet(false, true)) {
            task.cancel(false);
            onFinished.run();
        } else {
            task.cancel(true);
        }
    }

    private JobResult invoke(JobRecord job) {
        try {
            JobResult result = handlers.get(job.getHandlerName()).handle(job);
            return result != null ? result : JobResult.failed("处理器未返回结果", null);
        } catch (Exception e) {
            return JobResult.failed(e.getMessage(), e);
        }
    }

    private JobResult timedOut() {
        return JobResult.failed("处理器执行超过 " + properties.getHandlerTimeoutSeconds() + " 秒",
                new TimeoutException());
    }

    private void settleQuietly(JobRecord job, JobResult result) {
        try {
            settle(job, result);
        } catch (RuntimeException e) {
            log.error("任务 {} 结算失败", job.getKey(), e);
        }
    }

    private void settle(JobRecord job, JobResult result) {
        Instant now = clock.instant();
        if (result.getOutcome() == JobResult.Outcome.SUCCESS) {
            store.markRun(job.getKey(), job.getJobId(), true, job.nextRunAfter(now), now);
            log.debug("任务执行成功: {}", job.getKey());
        } else if (result.getOutcome() == JobResult.Outcome.SUBSCRIBER_GONE) {
            store.cancel(job.getKey(), job.getJobId());
            log.info("订阅者 {} 已失效，任务已取消: {}", job.getKey(), result.getMessage());
        } else if (store.markRun(job.getKey(), job.getJobId(), false, job.nextRunAfter(now), now)) {
            notifyFailure(job, job.getFailCount() + 1, result);
        }
    }

    private void notifyFailure(JobRecord job, int failCount, JobResult result) {
        for (JobFailureListener listener : failureListeners) {
            try {
                listener.onFailure(job, failCount, result);
            } catch (RuntimeException e) {
                log.error("失败观察者处理异常: {}", listener.getClass().getSimpleName(), e);
            }
        }
    }

    private void unlockQuietly(String key) {
        try {
            store.unlock(key, ownerId);
        } catch (RuntimeException e) {
            log.error("释放任务 {} 的执行锁失败，锁将在过期后失效", key, e);
        }
    }

    private void release(JobRecord job) {
        try {
            unlockQuietly(job.getKey());
        } finally {
            permits.release();
            if (inFlight.decrementAndGet() == 0) {
                synchronized (idleMonitor) {
                    idleMonitor.notifyAll();
                }
            }
        }
    }
}
