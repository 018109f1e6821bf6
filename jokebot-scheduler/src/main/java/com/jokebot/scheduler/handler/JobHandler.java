package com.jokebot.scheduler.handler;

import com.jokebot.scheduler.model.JobRecord;
import com.jokebot.scheduler.model.JobResult;

/**
 * 任务到期时调用的处理器。
 * <p>
 * 通过返回值报告结果，不依赖抛异常触发重试；逃逸的异常按失败处理。
 */
public interface JobHandler {

    /** 处理器名称，对应 {@link JobRecord#getHandlerName()} */
    String getHandlerName();

    JobResult handle(JobRecord job);
}
