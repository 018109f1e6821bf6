package com.jokebot.telegram.bot;

import com.jokebot.common.exception.JokeBotException;

/**
 * 会话已不可达（用户屏蔽了 Bot、会话被删除），重试没有意义。
 */
public class ChatUnavailableException extends JokeBotException {

    public ChatUnavailableException(String message) {
        super("CHAT_UNAVAILABLE", message);
    }
}
