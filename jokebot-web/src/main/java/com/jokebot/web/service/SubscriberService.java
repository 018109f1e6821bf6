package com.jokebot.web.service;

import com.jokebot.common.exception.InvalidIntervalException;
import com.jokebot.common.exception.NotFoundException;
import com.jokebot.common.exception.RateLimitExceededException;
import com.jokebot.ratelimit.config.RateLimiterNames;
import com.jokebot.ratelimit.limiter.RateLimitDecision;
import com.jokebot.ratelimit.limiter.RateLimiterRegistry;
import com.jokebot.web.entity.SubscriberEntity;
import com.jokebot.web.repository.SubscriberRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.relational.core.conversion.DbActionExecutionException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * 订阅者数据服务，基于 Spring Data JDBC。
 * <p>
 * 用户发起的写操作经过全局的 db:user-creation / db:user-update 限流器，防止被刷写。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SubscriberService implements SubscriberDirectory {

    /** 数据库写入限流按全局计数 */
    private static final String GLOBAL = "global";

    private static final int DEFAULT_FREQUENCY = 1;

    private final SubscriberRepository repository;
    private final RateLimiterRegistry rateLimiterRegistry;
    private final Clock clock;

    // ==================== 查询 ====================

    public Optional<SubscriberEntity> find(String chatId) {
        return repository.findByChatId(chatId);
    }

    public List<SubscriberEntity> findAllEnabled() {
        return repository.findAllEnabled();
    }

    public long countEnabled() {
        return repository.countEnabled();
    }

    // ==================== 写入 ====================

    /**
     * 创建新订阅者：默认启用，每分钟一条。
     */
    public SubscriberEntity create(String chatId) {
        guard(RateLimiterNames.DB_USER_CREATION);
        LocalDateTime now = LocalDateTime.now(clock);
        SubscriberEntity subscriber = SubscriberEntity.builder()
                .chatId(chatId)
                .enabled(true)
                .frequency(DEFAULT_FREQUENCY)
                .createdAt(now)
                .updatedAt(now)
                .build();
        try {
            subscriber = repository.save(subscriber);
        } catch (DbActionExecutionException e) {
            // 并发的 /start 已经插入了同一会话
            return repository.findByChatId(chatId).orElseThrow(() -> e);
        }
        log.info("新订阅者: chatId={}", chatId);
        return subscriber;
    }

    public SubscriberEntity enable(String chatId) {
        return update(chatId, subscriber -> subscriber.setEnabled(true));
    }

    public SubscriberEntity disable(String chatId) {
        return update(chatId, subscriber -> subscriber.setEnabled(false));
    }

    /**
     * @throws InvalidIntervalException 不在 1~1440 分钟内
     * @throws NotFoundException        订阅者不存在
     */
    public SubscriberEntity setFrequency(String chatId, int minutes) {
        InvalidIntervalException.check(minutes);
        return update(chatId, subscriber -> subscriber.setFrequency(minutes));
    }

    // ==================== SubscriberDirectory ====================

    @Override
    public boolean isActive(String key) {
        return repository.findByChatId(key)
                .map(subscriber -> Boolean.TRUE.equals(subscriber.getEnabled()))
                .orElse(false);
    }

    @Override
    public void recordDelivery(String key) {
        repository.findByChatId(key).ifPresent(subscriber -> {
            LocalDateTime now = LocalDateTime.now(clock);
            subscriber.setLastSentAt(now);
            subscriber.setUpdatedAt(now);
            repository.save(subscriber);
        });
    }

    @Override
    public void markUnreachable(String key) {
        repository.findByChatId(key).ifPresent(subscriber -> {
            subscriber.setEnabled(false);
            subscriber.setUpdatedAt(LocalDateTime.now(clock));
            repository.save(subscriber);
            log.info("会话不可达，已停用订阅者: {}", key);
        });
    }

    // ==================== 内部方法 ====================

    private SubscriberEntity update(String chatId, Consumer<SubscriberEntity> change) {
        SubscriberEntity subscriber = repository.findByChatId(chatId)
                .orElseThrow(() -> new NotFoundException("订阅者不存在: " + chatId));
        guard(RateLimiterNames.DB_USER_UPDATE);
        change.accept(subscriber);
        subscriber.setUpdatedAt(LocalDateTime.now(clock));
        return repository.save(subscriber);
    }

    private void guard(String limiterName) {
        if (!rateLimiterRegistry.has(limiterName)) {
            return;
        }
        RateLimitDecision decision = rateLimiterRegistry.get(limiterName).checkAndIncrement(GLOBAL);
        if (!decision.isAllowed()) {
            throw new RateLimitExceededException(limiterName, decision.getRetryAfterSeconds());
        }
    }
}
