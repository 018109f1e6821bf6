package com.jokebot.telegram.bot;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * getUpdates 返回的一条文本消息（非文本消息只保留 updateId 用于推进 offset）。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TelegramUpdate {

    private long updateId;

    /** 发送方会话，非消息类更新为空 */
    private String chatId;

    /** 消息文本，非文本消息为空 */
    private String text;

    public boolean hasText() {
        return chatId != null && text != null;
    }
}
