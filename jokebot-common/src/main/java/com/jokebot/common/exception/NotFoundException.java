package com.jokebot.common.exception;

/**
 * 查找的对象不存在（未注册的限流器、未知的任务处理器、不存在的订阅者或任务）。
 */
public class NotFoundException extends JokeBotException {

    public NotFoundException(String message) {
        super("NOT_FOUND", message);
    }
}
