package com.jokebot.scheduler.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 处理器的显式执行结果，执行器据此决定推进、计失败或取消任务。
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class JobResult {

    public enum Outcome {
        /** 推送成功 */
        SUCCESS,
        /** 推送失败，下一周期重试 */
        FAILED,
        /** 订阅者已不存在或已停用，任务应被取消 */
        SUBSCRIBER_GONE
    }

    private final Outcome outcome;
    private final String message;
    private final Throwable error;

    public static JobResult success() {
        return new JobResult(Outcome.SUCCESS, null, null);
    }

    public static JobResult failed(String message, Throwable error) {
        return new JobResult(Outcome.FAILED, message, error);
    }

    public static JobResult subscriberGone(String reason) {
        return new JobResult(Outcome.SUBSCRIBER_GONE, reason, null);
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }
}
