package com.jokebot.telegram.bot;

import com.jokebot.common.dto.Joke;

/**
 * 推送通道：把一条笑话送达订阅者。
 */
public interface DeliveryChannel {

    /**
     * @param key  订阅者标识（Telegram chat id）
     * @throws ChatUnavailableException 对方已屏蔽 Bot 或会话不存在
     * @throws com.jokebot.common.exception.UpstreamUnavailableException 其他发送失败
     */
    void deliver(String key, Joke joke);
}
