package com.jokebot.scheduler.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 调度模块配置项。
 */
@Data
@ConfigurationProperties(prefix = "jokebot.scheduler")
public class SchedulerProperties {

    /** 存储类型: jdbc（SQLite，默认） / memory（内存，重启丢失） / redis（可多实例共享） */
    private String storageType = "jdbc";

    /** 轮询间隔（毫秒） */
    private long pollIntervalMs = 10_000;

    /** 同时执行的处理器调用上限 */
    private int maxConcurrency = 20;

    /** 单次处理器调用的超时时间（秒），超时按失败处理 */
    private int handlerTimeoutSeconds = 60;

    /** 执行锁的有效期（秒），需大于处理器超时，进程崩溃后锁在此之后失效 */
    private int lockTimeoutSeconds = 120;

    /** 单轮轮询最多取出的到期任务数 */
    private int batchSize = 100;

    /** 新建任务默认使用的处理器 */
    private String defaultHandler = "deliver-joke";

    /** 关闭时等待进行中任务的最长时间（秒） */
    private int shutdownTimeoutSeconds = 30;
}
