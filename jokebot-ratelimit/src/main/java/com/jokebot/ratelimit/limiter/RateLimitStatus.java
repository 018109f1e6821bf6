package com.jokebot.ratelimit.limiter;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 某个标识的只读限流状态（不计数）。
 */
@Data
@AllArgsConstructor
public class RateLimitStatus {

    private int requests;
    private int remaining;
    private long resetAt;

    /** 是否存在活跃窗口 */
    private boolean active;
}
