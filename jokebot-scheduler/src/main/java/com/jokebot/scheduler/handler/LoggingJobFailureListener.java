package com.jokebot.scheduler.handler;

import com.jokebot.scheduler.model.JobRecord;
import com.jokebot.scheduler.model.JobResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 默认失败观察者：仅记录日志，推送失败不通知订阅者。
 */
@Slf4j
@Component
public class LoggingJobFailureListener implements JobFailureListener {

    @Override
    public void onFailure(JobRecord job, int failCount, JobResult result) {
        log.warn("任务执行失败: key={}, handler={}, 连续失败 {} 次, 原因: {}",
                job.getKey(), job.getHandlerName(), failCount, result.getMessage(), result.getError());
    }
}
