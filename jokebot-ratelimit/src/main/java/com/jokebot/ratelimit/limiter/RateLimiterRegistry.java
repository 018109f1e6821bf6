package com.jokebot.ratelimit.limiter;

import com.jokebot.common.exception.NotFoundException;
import com.jokebot.ratelimit.store.InMemoryRateWindowStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * 限流器注册表：启动时按静态策略表构建一次，之后在各调用点按名称查找。
 * <p>
 * 作为普通对象由容器创建并注入，不使用全局单例。稳态下只读，查找无需加锁。
 */
@Slf4j
public class RateLimiterRegistry {

    private final Map<String, RateLimiter> limiters = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration sweepInterval;
    private final ScheduledExecutorService sweeper;

    public RateLimiterRegistry(Clock clock, Duration sweepInterval) {
        this.clock = clock;
        this.sweepInterval = sweepInterval;
        this.sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "ratelimit-sweeper");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * 注册一个限流器；同名限流器会被替换并销毁。
     */
    public RateLimiter register(String name, RateLimitPolicy policy) {
        RateLimiter limiter = new RateLimiter(name, policy, new InMemoryRateWindowStore(), clock);
        limiter.startSweep(sweeper, sweepInterval);
        RateLimiter previous = limiters.put(name, limiter);
        if (previous != null) {
            previous.destroy();
        }
        log.info("注册限流器: {} ({} 次 / {} ms)", name, policy.getMaxRequests(), policy.getWindowMs());
        return limiter;
    }

    /**
     * 按名称获取限流器。
     *
     * @throws NotFoundException 未注册时抛出，属于调用方集成错误
     */
    public RateLimiter get(String name) {
        RateLimiter limiter = limiters.get(name);
        if (limiter == null) {
            throw new NotFoundException("未找到限流器: " + name);
        }
        return limiter;
    }

    public boolean has(String name) {
        return limiters.containsKey(name);
    }

    public int size() {
        return limiters.size();
    }

    public Map<String, RateLimiter> getAll() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(limiters));
    }

    /**
     * 重置某个限流器；identifier 为空时重置该限流器的全部计数。
     */
    public void reset(String name, String identifier) {
        RateLimiter limiter = get(name);
        if (identifier == null || identifier.isBlank()) {
            limiter.resetAll();
        } else {
            limiter.reset(identifier);
        }
    }

    public void resetAll() {
        limiters.values().forEach(RateLimiter::resetAll);
    }

    /**
     * 停止所有清理任务并丢弃全部状态，关闭时调用。
     */
    public void destroyAll() {
        log.info("销毁全部限流器, 数量: {}", limiters.size());
        limiters.values().forEach(RateLimiter::destroy);
        limiters.clear();
        sweeper.shutdownNow();
    }

    public Map<String, RateLimiterStats> stats() {
        Map<String, RateLimiterStats> stats = new LinkedHashMap<>();
        limiters.forEach((name, limiter) -> stats.put(name, limiter.stats()));
        return stats;
    }
}
