package com.jokebot.scheduler.runner;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 定时任务：按固定间隔驱动一轮到期任务轮询。
 * <p>
 * initialDelay 为 0，停机期间积压的到期任务在启动后的第一轮就会执行。
 */
@Component
@RequiredArgsConstructor
public class JobPollingTrigger {

    private final JobRunner jobRunner;

    @Scheduled(fixedDelayString = "${jokebot.scheduler.poll-interval-ms:10000}", initialDelay = 0)
    public void poll() {
        jobRunner.pollOnce();
    }
}
