package com.jokebot.ratelimit.config;

import com.jokebot.ratelimit.limiter.RateLimitPolicy;
import com.jokebot.ratelimit.limiter.RateLimiterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * 限流模块配置：按策略表一次性构建注册表，关闭时销毁。
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(RateLimitProperties.class)
public class RateLimitModuleConfig {

    @Bean(destroyMethod = "destroyAll")
    public RateLimiterRegistry rateLimiterRegistry(RateLimitProperties properties, Clock clock) {
        RateLimiterRegistry registry = new RateLimiterRegistry(clock,
                Duration.ofSeconds(properties.getSweepIntervalSeconds()));
        properties.getPolicies().forEach((name, policy) ->
                registry.register(name, RateLimitPolicy.of(policy.getMaxRequests(), policy.getWindowMs())));
        log.info("限流器初始化完成，共 {} 个", registry.size());
        return registry;
    }
}
