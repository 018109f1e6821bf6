package com.jokebot.ratelimit.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 限流配置项。
 * <p>
 * YAML 中名称含冒号，需用方括号写法覆盖，例如 {@code "[telegram:start]": {max-requests: 3}}。
 */
@Data
@ConfigurationProperties(prefix = "jokebot.rate-limit")
public class RateLimitProperties {

    private static final long SECOND = 1000L;
    private static final long MINUTE = 60 * SECOND;
    private static final long HOUR = 60 * MINUTE;

    /** 过期窗口清理周期（秒），0 表示不清理 */
    private int sweepIntervalSeconds = 300;

    /** 限流器名称 -> 策略 */
    private Map<String, Policy> policies = defaultPolicies();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Policy {

        /** 窗口内最大请求数 */
        private int maxRequests;

        /** 窗口长度（毫秒） */
        private long windowMs;
    }

    private static Map<String, Policy> defaultPolicies() {
        Map<String, Policy> table = new LinkedHashMap<>();
        // HTTP 接口，按 IP 限流
        table.put(RateLimiterNames.API_HEALTH, new Policy(30, MINUTE));
        table.put(RateLimiterNames.API_STATUS, new Policy(20, MINUTE));
        table.put(RateLimiterNames.API_ADMIN, new Policy(30, MINUTE));
        // Telegram 命令，按 chatId 限流
        table.put(RateLimiterNames.TELEGRAM_COMMAND, new Policy(5, 5 * SECOND));
        table.put("telegram:start", new Policy(3, MINUTE));
        table.put("telegram:enable", new Policy(5, MINUTE));
        table.put("telegram:disable", new Policy(5, MINUTE));
        table.put("telegram:frequency", new Policy(3, MINUTE));
        table.put("telegram:status", new Policy(10, MINUTE));
        table.put("telegram:help", new Policy(20, MINUTE));
        table.put("telegram:test", new Policy(20, MINUTE));
        // 数据库写入
        table.put(RateLimiterNames.DB_USER_CREATION, new Policy(100, HOUR));
        table.put(RateLimiterNames.DB_USER_UPDATE, new Policy(500, HOUR));
        // 调度创建
        table.put(RateLimiterNames.SCHEDULER_CREATION, new Policy(50, MINUTE));
        return table;
    }
}
