package com.jokebot.web.bot;

import com.jokebot.common.exception.InvalidIntervalException;
import com.jokebot.common.exception.JokeBotException;
import com.jokebot.common.exception.LockContentionException;
import com.jokebot.common.exception.RateLimitExceededException;
import com.jokebot.ratelimit.config.RateLimiterNames;
import com.jokebot.ratelimit.limiter.RateLimitDecision;
import com.jokebot.ratelimit.limiter.RateLimiterRegistry;
import com.jokebot.scheduler.model.JobRecord;
import com.jokebot.scheduler.model.JobResult;
import com.jokebot.scheduler.service.SubscriptionScheduler;
import com.jokebot.telegram.bot.TelegramClient;
import com.jokebot.web.entity.SubscriberEntity;
import com.jokebot.web.service.SubscriberService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Telegram 命令处理。
 * <p>
 * 命令可带或不带前导斜杠，大小写不敏感。每条命令先过 telegram:&lt;命令&gt; 限流器
 * （没有专属限流器时用 telegram:command 兜底），被拒绝时提示用户等待。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BotCommandService {

    private static final Set<String> COMMANDS = Set.of(
            "start", "enable", "disable", "frequency", "status", "help", "test", "jobstatus");

    private static final Pattern MINUTES = Pattern.compile("\\d{1,9}");

    private static final DateTimeFormatter TIME_FMT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final SubscriberService subscriberService;
    private final SubscriptionScheduler subscriptionScheduler;
    private final RateLimiterRegistry rateLimiterRegistry;
    private final TelegramClient telegramClient;
    private final Clock clock;

    /**
     * 处理一条用户消息。
     */
    public void handle(String chatId, String text) {
        Optional<BotCommand> parsed = BotCommand.parse(text);
        if (parsed.isEmpty()) {
            return;
        }
        BotCommand command = parsed.get();
        String name = command.getName();

        if (!COMMANDS.contains(name)) {
            if (allowed(chatId, RateLimiterNames.TELEGRAM_COMMAND)) {
                reply(chatId, command.isSlashed() ? BotReplies.unknownCommand(name) : BotReplies.UNRECOGNIZED);
            }
            return;
        }
        if (command.hasArgument() && !"frequency".equals(name)) {
            if (allowed(chatId, RateLimiterNames.TELEGRAM_COMMAND)) {
                reply(chatId, BotReplies.UNRECOGNIZED);
            }
            return;
        }
        if (!allowed(chatId, limiterFor(name))) {
            return;
        }

        log.debug("处理命令: chatId={}, command={}", chatId, name);
        try {
            dispatch(chatId, command);
        } catch (RateLimitExceededException e) {
            reply(chatId, BotReplies.tooFast(e.getRetryAfterSeconds()));
        } catch (RuntimeException e) {
            log.error("处理命令 /{} 失败: chatId={}", name, chatId, e);
            reply(chatId, BotReplies.ERROR);
        }
    }

    private void dispatch(String chatId, BotCommand command) {
        String name = command.getName();
        if ("start".equals(name)) {
            handleStart(chatId);
        } else if ("enable".equals(name)) {
            handleEnable(chatId);
        } else if ("disable".equals(name)) {
            handleDisable(chatId);
        } else if ("frequency".equals(name)) {
            handleFrequency(chatId, command.getArgument());
        } else if ("status".equals(name)) {
            handleStatus(chatId);
        } else if ("help".equals(name)) {
            reply(chatId, BotReplies.HELP);
        } else if ("test".equals(name)) {
            handleTest(chatId);
        } else {
            handleJobStatus(chatId);
        }
    }

    // ======================== 命令 ========================

    private void handleStart(String chatId) {
        if (subscriberService.find(chatId).isEmpty()) {
            guardScheduling(chatId);
            SubscriberEntity subscriber = subscriberService.create(chatId);
            subscriptionScheduler.schedule(chatId, subscriber.getFrequency());
        }
        reply(chatId, BotReplies.WELCOME);
    }

    private void handleEnable(String chatId) {
        Optional<SubscriberEntity> existing = subscriberService.find(chatId);
        if (existing.isEmpty()) {
            reply(chatId, BotReplies.USER_NOT_FOUND);
            return;
        }
        SubscriberEntity subscriber = existing.get();
        if (Boolean.TRUE.equals(subscriber.getEnabled())) {
            reply(chatId, BotReplies.alreadyEnabled(subscriber.getFrequency()));
            return;
        }

        guardScheduling(chatId);
        subscriber = subscriberService.enable(chatId);
        subscriptionScheduler.schedule(chatId, subscriber.getFrequency());
        reply(chatId, BotReplies.enabled(subscriber.getFrequency()));
    }

    private void handleDisable(String chatId) {
        Optional<SubscriberEntity> existing = subscriberService.find(chatId);
        if (existing.isEmpty()) {
            reply(chatId, BotReplies.USER_NOT_FOUND);
            return;
        }
        if (!Boolean.TRUE.equals(existing.get().getEnabled())) {
            reply(chatId, BotReplies.ALREADY_DISABLED);
            return;
        }

        subscriberService.disable(chatId);
        subscriptionScheduler.cancel(chatId);
        reply(chatId, BotReplies.DISABLED);
    }

    private void handleFrequency(String chatId, String argument) {
        if (!MINUTES.matcher(argument).matches()) {
            reply(chatId, BotReplies.FREQUENCY_FORMAT);
            return;
        }
        int minutes = Integer.parseInt(argument);
        try {
            InvalidIntervalException.check(minutes);
        } catch (InvalidIntervalException e) {
            reply(chatId, "❌ " + e.getMessage());
            return;
        }

        Optional<SubscriberEntity> existing = subscriberService.find(chatId);
        if (existing.isEmpty()) {
            reply(chatId, BotReplies.USER_NOT_FOUND);
            return;
        }
        boolean enabled = Boolean.TRUE.equals(existing.get().getEnabled());
        if (enabled) {
            guardScheduling(chatId);
        }
        subscriberService.setFrequency(chatId, minutes);
        if (enabled) {
            subscriptionScheduler.schedule(chatId, minutes);
        }
        reply(chatId, BotReplies.frequencyUpdated(minutes));
    }

    private void handleStatus(String chatId) {
        Optional<SubscriberEntity> existing = subscriberService.find(chatId);
        if (existing.isEmpty()) {
            reply(chatId, BotReplies.USER_NOT_FOUND);
            return;
        }
        SubscriberEntity subscriber = existing.get();
        String lastSent = subscriber.getLastSentAt() != null ? subscriber.getLastSentAt().format(TIME_FMT) : "Never";
        reply(chatId, BotReplies.status(Boolean.TRUE.equals(subscriber.getEnabled()),
                subscriber.getFrequency(), lastSent));
    }

    private void handleTest(String chatId) {
        reply(chatId, BotReplies.TESTING);
        JobResult result;
        try {
            result = subscriptionScheduler.runNow(chatId);
        } catch (LockContentionException e) {
            reply(chatId, BotReplies.TEST_BUSY);
            return;
        }

        if (result.getOutcome() == JobResult.Outcome.SUBSCRIBER_GONE) {
            reply(chatId, BotReplies.TEST_NOT_ENABLED);
        } else if (result.getOutcome() == JobResult.Outcome.FAILED) {
            reply(chatId, BotReplies.TEST_FAILED);
        }
    }

    private void handleJobStatus(String chatId) {
        long activeJobs = subscriptionScheduler.activeCount();
        Optional<JobRecord> job = subscriptionScheduler.find(chatId);
        if (job.isEmpty()) {
            reply(chatId, BotReplies.jobStatus(false, 0, null, 0, activeJobs));
            return;
        }
        JobRecord record = job.get();
        reply(chatId, BotReplies.jobStatus(true, record.getIntervalMinutes(),
                format(record.getNextRunAt()), record.getFailCount(), activeJobs));
    }

    // ======================== 公共方法 ========================

    /**
     * jobstatus 与 status 共用限流器。
     */
    private String limiterFor(String command) {
        String limiter = RateLimiterNames.TELEGRAM_PREFIX + ("jobstatus".equals(command) ? "status" : command);
        return rateLimiterRegistry.has(limiter) ? limiter : RateLimiterNames.TELEGRAM_COMMAND;
    }

    private boolean allowed(String chatId, String limiterName) {
        if (!rateLimiterRegistry.has(limiterName)) {
            return true;
        }
        RateLimitDecision decision = rateLimiterRegistry.get(limiterName).checkAndIncrement(chatId);
        if (!decision.isAllowed()) {
            reply(chatId, BotReplies.tooFast(decision.getRetryAfterSeconds()));
        }
        return decision.isAllowed();
    }

    private void guardScheduling(String chatId) {
        if (!rateLimiterRegistry.has(RateLimiterNames.SCHEDULER_CREATION)) {
            return;
        }
        RateLimitDecision decision = rateLimiterRegistry.get(RateLimiterNames.SCHEDULER_CREATION)
                .checkAndIncrement(chatId);
        if (!decision.isAllowed()) {
            throw new RateLimitExceededException(RateLimiterNames.SCHEDULER_CREATION,
                    decision.getRetryAfterSeconds());
        }
    }

    private String format(Instant instant) {
        return LocalDateTime.ofInstant(instant, clock.getZone()).format(TIME_FMT);
    }

    private void reply(String chatId, String text) {
        try {
            telegramClient.sendMessage(chatId, text);
        } catch (JokeBotException e) {
            log.warn("回复 {} 失败: {}", chatId, e.getMessage());
        }
    }
}
