package com.jokebot.telegram.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Telegram Bot API 配置项。
 */
@Data
@ConfigurationProperties(prefix = "jokebot.telegram")
public class TelegramProperties {

    /** Bot Token，为空时不拉取消息（推送会失败并按失败计数） */
    private String botToken = "";

    private String baseUrl = "https://api.telegram.org";

    /** 是否通过 getUpdates 长轮询接收用户消息 */
    private boolean pollingEnabled = true;

    /** getUpdates 长轮询的服务端等待时间（秒） */
    private int longPollTimeoutSeconds = 30;

    /** 两次长轮询之间的间隔（毫秒） */
    private long pollDelayMs = 1000;

    private int connectTimeoutSeconds = 10;

    /** 普通请求的读超时（秒），长轮询在此基础上叠加 longPollTimeoutSeconds */
    private int requestTimeoutSeconds = 30;
}
