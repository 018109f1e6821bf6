package com.jokebot.ratelimit.limiter;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

import java.util.function.UnaryOperator;

/**
 * 限流策略：窗口内最大请求数 + 窗口长度 + 可选的 key 派生函数。启动时设定，之后不可变。
 */
@Slf4j
@Getter
@ToString(exclude = "keyResolver")
public class RateLimitPolicy {

    private final int maxRequests;

    private final long windowMs;

    /** 从调用方标识派生限流 key，默认原样使用 */
    private final UnaryOperator<String> keyResolver;

    @Builder
    public RateLimitPolicy(int maxRequests, long windowMs, UnaryOperator<String> keyResolver) {
        if (maxRequests <= 0) {
            throw new IllegalArgumentException("maxRequests 必须大于 0: " + maxRequests);
        }
        if (windowMs <= 0) {
            throw new IllegalArgumentException("windowMs 必须大于 0: " + windowMs);
        }
        this.maxRequests = maxRequests;
        this.windowMs = windowMs;
        this.keyResolver = keyResolver != null ? keyResolver : UnaryOperator.identity();
    }

    public static RateLimitPolicy of(int maxRequests, long windowMs) {
        return new RateLimitPolicy(maxRequests, windowMs, null);
    }

    /**
     * 派生函数出错时退回原始标识，限流检查本身不抛异常。
     */
    String resolveKey(String identifier) {
        String raw = identifier == null || identifier.isBlank() ? "default" : identifier;
        String key;
        try {
            key = keyResolver.apply(raw);
        } catch (RuntimeException e) {
            log.warn("限流 key 派生失败，改用原始标识 {}: {}", raw, e.toString());
            return raw;
        }
        return key != null && !key.isBlank() ? key : raw;
    }
}
