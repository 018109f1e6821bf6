package com.jokebot.ratelimit.limiter;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

/**
 * 一次限流检查的结果。
 */
@Data
@Builder
@AllArgsConstructor
public class RateLimitDecision {

    private boolean allowed;

    /** 策略上限 */
    private int limit;

    /** 本窗口剩余可用次数 */
    private int remaining;

    /** 窗口翻转时间（epoch 毫秒） */
    private long resetAt;

    /** 被拒绝时需等待的秒数，放行时为 null */
    private Integer retryAfterSeconds;

    /** 窗口翻转时间（epoch 秒，向上取整），用于 RateLimit-Reset 响应头 */
    public long resetAtEpochSeconds() {
        return (resetAt + 999) / 1000;
    }
}
