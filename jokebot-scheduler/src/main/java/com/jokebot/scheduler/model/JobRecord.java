package com.jokebot.scheduler.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * 订阅者的周期推送任务。每个 key 至多一条 active 记录。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class JobRecord {

    /** 订阅者标识 */
    private String key;

    /** 本次调度的唯一 ID，重新调度时更换，用于识别已被替换的旧任务 */
    private String jobId;

    /** 到期时调用的处理器名称 */
    private String handlerName;

    /** 推送间隔（分钟），1~1440 */
    private int intervalMinutes;

    private Instant nextRunAt;

    /** 上次成功执行时间，从未成功时为空 */
    private Instant lastRunAt;

    /** 自上次成功以来的连续失败次数 */
    @Builder.Default
    private int failCount = 0;

    @Builder.Default
    private boolean active = true;

    private Instant createdAt;

    public Duration interval() {
        return Duration.ofMinutes(intervalMinutes);
    }

    public boolean isDue(Instant now) {
        return active && nextRunAt != null && !nextRunAt.isAfter(now);
    }

    /**
     * 按固定节奏计算下一次运行时间：从原定时间起推进整数个间隔，直到晚于 now。
     * <p>
     * 停机期间错过的多次运行只补跑一次，之后回到原有节奏。
     */
    public Instant nextRunAfter(Instant now) {
        Duration interval = interval();
        Instant next = nextRunAt.plus(interval);
        if (next.isAfter(now)) {
            return next;
        }
        long steps = Duration.between(next, now).toMillis() / interval.toMillis() + 1;
        return next.plus(interval.multipliedBy(steps));
    }
}
