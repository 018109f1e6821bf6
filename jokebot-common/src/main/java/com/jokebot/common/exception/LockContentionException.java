package com.jokebot.common.exception;

/**
 * 任务执行锁已被占用，说明同一订阅者的推送正在进行中。
 */
public class LockContentionException extends JokeBotException {

    public LockContentionException(String message) {
        super("LOCK_CONTENTION", message);
    }
}
