package com.jokebot.scheduler.config;

import com.jokebot.scheduler.handler.JobFailureListener;
import com.jokebot.scheduler.handler.JobHandlerRegistry;
import com.jokebot.scheduler.runner.JobRunner;
import com.jokebot.scheduler.service.SubscriptionScheduler;
import com.jokebot.scheduler.store.InMemoryJobStore;
import com.jokebot.scheduler.store.JdbcJobStore;
import com.jokebot.scheduler.store.JobStore;
import com.jokebot.scheduler.store.RedisJobStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.time.Clock;
import java.util.List;

/**
 * 调度模块自动配置。
 * <p>
 * 通过 {@code jokebot.scheduler.storage-type} 切换任务存储实现：
 * <ul>
 *   <li>{@code jdbc}（默认）：SQLite 持久化，重启后自动补跑到期任务</li>
 *   <li>{@code memory}：纯内存，零外部依赖，重启丢失全部任务</li>
 *   <li>{@code redis}：Redis 持久化，适合多实例共享</li>
 * </ul>
 */
@Slf4j
@Configuration
@ComponentScan(basePackages = "com.jokebot.scheduler")
@EnableConfigurationProperties(SchedulerProperties.class)
public class SchedulerModuleConfig {

    // ==================== 任务存储 ====================

    @Bean
    @ConditionalOnProperty(name = "jokebot.scheduler.storage-type", havingValue = "jdbc", matchIfMissing = true)
    public JobStore jdbcJobStore(NamedParameterJdbcTemplate jdbcTemplate) {
        log.info("使用 SQLite 任务存储（持久化模式）");
        return new JdbcJobStore(jdbcTemplate);
    }

    @Bean
    @ConditionalOnProperty(name = "jokebot.scheduler.storage-type", havingValue = "memory")
    public JobStore inMemoryJobStore() {
        log.info("使用内存任务存储（轻量模式，重启后任务丢失）");
        return new InMemoryJobStore();
    }

    @Bean
    @ConditionalOnProperty(name = "jokebot.scheduler.storage-type", havingValue = "redis")
    public JobStore redisJobStore(StringRedisTemplate redisTemplate) {
        log.info("使用 Redis 任务存储（共享模式）");
        return new RedisJobStore(redisTemplate);
    }

    // ==================== 执行器与门面 ====================

    @Bean(destroyMethod = "stop")
    public JobRunner jobRunner(JobStore jobStore, JobHandlerRegistry handlerRegistry,
                               List<JobFailureListener> failureListeners,
                               SchedulerProperties properties, Clock clock) {
        log.info("任务执行器: 轮询间隔 {} ms, 并发上限 {}, 处理器超时 {} 秒",
                properties.getPollIntervalMs(), properties.getMaxConcurrency(),
                properties.getHandlerTimeoutSeconds());
        return new JobRunner(jobStore, handlerRegistry, failureListeners, properties, clock);
    }

    @Bean
    public SubscriptionScheduler subscriptionScheduler(JobStore jobStore, JobRunner jobRunner,
                                                       SchedulerProperties properties, Clock clock) {
        return new SubscriptionScheduler(jobStore, jobRunner, properties, clock);
    }
}
