package com.jokebot.web.bot;

import lombok.Value;

import java.util.Locale;
import java.util.Optional;

/**
 * 解析后的用户消息：命令名（小写、去掉斜杠与 @botname）加参数。
 */
@Value
class BotCommand {

    String name;
    String argument;
    boolean slashed;

    static Optional<BotCommand> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String trimmed = text.trim();
        boolean slashed = trimmed.startsWith("/");
        if (slashed) {
            trimmed = trimmed.substring(1);
        }

        String[] parts = trimmed.split("\\s+", 2);
        String name = parts[0].toLowerCase(Locale.ROOT);
        int at = name.indexOf('@');
        if (slashed && at > 0) {
            name = name.substring(0, at);
        }
        if (name.isEmpty()) {
            return Optional.empty();
        }
        String argument = parts.length > 1 ? parts[1].trim() : "";
        return Optional.of(new BotCommand(name, argument, slashed));
    }

    boolean hasArgument() {
        return !argument.isEmpty();
    }
}
