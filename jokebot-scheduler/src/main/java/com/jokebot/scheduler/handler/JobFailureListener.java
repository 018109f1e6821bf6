package com.jokebot.scheduler.handler;

import com.jokebot.scheduler.model.JobRecord;
import com.jokebot.scheduler.model.JobResult;

/**
 * 任务失败的外部观察者。回调在执行器线程上执行，不应阻塞。
 */
public interface JobFailureListener {

    /**
     * @param job       失败的任务（失败前的快照）
     * @param failCount 本次失败后的连续失败次数
     * @param result    失败结果
     */
    void onFailure(JobRecord job, int failCount, JobResult result);
}
