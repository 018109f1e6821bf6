package com.jokebot.common.exception;

/**
 * 上游服务不可用（笑话 API 拉取失败、Telegram 发送失败等），由调度器在下一周期重试。
 */
public class UpstreamUnavailableException extends JokeBotException {

    public UpstreamUnavailableException(String message) {
        super("UPSTREAM_UNAVAILABLE", message);
    }

    public UpstreamUnavailableException(String message, Throwable cause) {
        super("UPSTREAM_UNAVAILABLE", message, cause);
    }
}
