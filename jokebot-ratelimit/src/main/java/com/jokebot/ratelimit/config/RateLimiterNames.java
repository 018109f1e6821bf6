package com.jokebot.ratelimit.config;

/**
 * 限流器名称常量，与 {@link RateLimitProperties} 默认策略表一一对应。
 */
public final class RateLimiterNames {

    private RateLimiterNames() {
    }

    public static final String API_HEALTH = "api:health";
    public static final String API_STATUS = "api:status";
    public static final String API_ADMIN = "api:admin";

    /** Telegram 命令的通用兜底限流器 */
    public static final String TELEGRAM_COMMAND = "telegram:command";
    public static final String TELEGRAM_PREFIX = "telegram:";

    public static final String DB_USER_CREATION = "db:user-creation";
    public static final String DB_USER_UPDATE = "db:user-update";

    public static final String SCHEDULER_CREATION = "scheduler:creation";
}
