package com.jokebot.ratelimit.limiter;

import com.jokebot.ratelimit.store.RateWindow;
import com.jokebot.ratelimit.store.RateWindowStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 固定窗口限流器：一个窗口存储 + 一条策略。
 * <p>
 * 计数与窗口重置在存储层一次原子操作内完成；本类不会抛出运行时异常，
 * 唯一的误用（查找未注册的限流器）由 {@link RateLimiterRegistry} 报告。
 */
@Slf4j
public class RateLimiter {

    private final String name;
    private final RateLimitPolicy policy;
    private final RateWindowStore store;
    private final Clock clock;

    private volatile ScheduledFuture<?> sweepTask;

    public RateLimiter(String name, RateLimitPolicy policy, RateWindowStore store, Clock clock) {
        this.name = name;
        this.policy = policy;
        this.store = store;
        this.clock = clock;
    }

    /**
     * 检查并计数一次。
     *
     * @param identifier 调用方标识（订阅者 ID、IP 等）
     */
    public RateLimitDecision checkAndIncrement(String identifier) {
        String key = policy.resolveKey(identifier);
        long now = clock.millis();
        RateWindow window = store.increment(key, now, policy.getWindowMs());

        int limit = policy.getMaxRequests();
        boolean allowed = window.getCount() <= limit;
        Integer retryAfter = null;
        if (!allowed) {
            retryAfter = (int) Math.max(1, (window.getWindowResetAt() - now + 999) / 1000);
            log.warn("[{}] 限流触发: {} ({}/{})", name, key, window.getCount(), limit);
        }

        return RateLimitDecision.builder()
                .allowed(allowed)
                .limit(limit)
                .remaining(Math.max(0, limit - window.getCount()))
                .resetAt(window.getWindowResetAt())
                .retryAfterSeconds(retryAfter)
                .build();
    }

    /**
     * 查询某个标识的当前状态，不计数。
     */
    public RateLimitStatus status(String identifier) {
        String key = policy.resolveKey(identifier);
        long now = clock.millis();
        return store.get(key)
                .filter(w -> now < w.getWindowResetAt())
                .map(w -> new RateLimitStatus(w.getCount(),
                        Math.max(0, policy.getMaxRequests() - w.getCount()), w.getWindowResetAt(), true))
                .orElseGet(() -> new RateLimitStatus(0, policy.getMaxRequests(),
                        now + policy.getWindowMs(), false));
    }

    public void reset(String identifier) {
        store.reset(policy.resolveKey(identifier));
        log.info("[{}] 已重置限流计数: {}", name, identifier);
    }

    public void resetAll() {
        store.clear();
        log.info("[{}] 已重置全部限流计数", name);
    }

    /**
     * 清理已过期超过一个完整窗口的条目，限制长期运行下的内存占用。
     */
    public int sweep() {
        int removed = store.sweep(clock.millis(), policy.getWindowMs());
        if (removed > 0) {
            log.info("[{}] 清理过期窗口 {} 个, 当前剩余 {}", name, removed, store.size());
        }
        return removed;
    }

    void startSweep(ScheduledExecutorService sweeper, Duration interval) {
        if (interval.isZero() || interval.isNegative()) {
            return;
        }
        long periodMs = interval.toMillis();
        sweepTask = sweeper.scheduleAtFixedRate(this::sweepQuietly, periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    /**
     * 停止定时清理并丢弃全部状态。
     */
    public void destroy() {
        ScheduledFuture<?> task = sweepTask;
        if (task != null) {
            task.cancel(false);
            sweepTask = null;
        }
        store.clear();
        log.info("[{}] 限流器已销毁", name);
    }

    public RateLimiterStats stats() {
        long total = store.snapshot().stream().mapToLong(RateWindow::getCount).sum();
        return new RateLimiterStats(name, policy.getMaxRequests(), policy.getWindowMs(), store.size(), total);
    }

    public String getName() {
        return name;
    }

    public RateLimitPolicy getPolicy() {
        return policy;
    }

    private void sweepQuietly() {
        try {
            sweep();
        } catch (RuntimeException e) {
            // 抛出异常会让 ScheduledExecutorService 静默取消后续执行
            log.error("[{}] 清理过期窗口失败", name, e);
        }
    }
}
