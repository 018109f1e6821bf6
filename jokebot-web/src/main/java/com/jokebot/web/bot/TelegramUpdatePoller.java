package com.jokebot.web.bot;

import com.jokebot.common.exception.JokeBotException;
import com.jokebot.telegram.bot.TelegramClient;
import com.jokebot.telegram.bot.TelegramUpdate;
import com.jokebot.telegram.config.TelegramProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 定时任务：长轮询 getUpdates，把文本消息交给命令处理。
 * <p>
 * 未配置 Bot Token 或关闭轮询时不做任何事。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TelegramUpdatePoller {

    private final TelegramClient telegramClient;
    private final TelegramProperties properties;
    private final BotCommandService commandService;

    /** 下一次拉取的起始 update_id，只在轮询线程上读写 */
    private long offset;

    @Scheduled(fixedDelayString = "${jokebot.telegram.poll-delay-ms:1000}")
    public void poll() {
        if (!properties.isPollingEnabled() || !telegramClient.isConfigured()) {
            return;
        }

        List<TelegramUpdate> updates;
        try {
            updates = telegramClient.getUpdates(offset, properties.getLongPollTimeoutSeconds());
        } catch (JokeBotException e) {
            log.warn("拉取 Telegram 更新失败: {}", e.getMessage());
            return;
        }

        for (TelegramUpdate update : updates) {
            offset = Math.max(offset, update.getUpdateId() + 1);
            if (!update.hasText()) {
                continue;
            }
            try {
                commandService.handle(update.getChatId(), update.getText());
            } catch (RuntimeException e) {
                log.error("处理消息失败: chatId={}", update.getChatId(), e);
            }
        }
    }

    long getOffset() {
        return offset;
    }
}
