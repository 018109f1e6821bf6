package com.jokebot.ratelimit.limiter;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 单个限流器的统计信息。
 */
@Data
@AllArgsConstructor
public class RateLimiterStats {

    private String name;
    private int maxRequests;
    private long windowMs;
    private int activeIdentifiers;
    private long totalRequests;
}
