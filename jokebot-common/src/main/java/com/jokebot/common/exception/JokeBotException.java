package com.jokebot.common.exception;

import lombok.Getter;

/**
 * 所有业务异常的父类，errorCode 直接作为 HTTP 错误体的 code 返回。
 * <p>
 * 处理器内部的失败不靠抛它触发重试，而是返回 JobResult；逃逸到执行器的异常一律按失败计。
 */
@Getter
public abstract class JokeBotException extends RuntimeException {

    private final String errorCode;

    protected JokeBotException(String errorCode, String message) {
        this(errorCode, message, null);
    }

    protected JokeBotException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
