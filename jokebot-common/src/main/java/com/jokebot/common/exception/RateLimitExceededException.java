package com.jokebot.common.exception;

import lombok.Getter;

/**
 * 请求被限流器拒绝。
 */
@Getter
public class RateLimitExceededException extends JokeBotException {

    private final int retryAfterSeconds;

    public RateLimitExceededException(String limiterName, int retryAfterSeconds) {
        super("RATE_LIMITED", "Rate limit exceeded (" + limiterName + "). Please try again in "
                + retryAfterSeconds + " seconds.");
        this.retryAfterSeconds = retryAfterSeconds;
    }
}
