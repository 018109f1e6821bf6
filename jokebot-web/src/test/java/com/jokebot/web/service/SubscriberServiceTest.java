package com.jokebot.web.service;

import com.jokebot.common.exception.InvalidIntervalException;
import com.jokebot.common.exception.NotFoundException;
import com.jokebot.common.exception.RateLimitExceededException;
import com.jokebot.ratelimit.config.RateLimiterNames;
import com.jokebot.ratelimit.limiter.RateLimitPolicy;
import com.jokebot.ratelimit.limiter.RateLimiterRegistry;
import com.jokebot.web.entity.SubscriberEntity;
import com.jokebot.web.repository.SubscriberRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SubscriberServiceTest {

    private static final Instant NOW = Instant.parse("2024-01-01T08:00:00Z");

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final SubscriberRepository repository = mock(SubscriberRepository.class);
    private final RateLimiterRegistry registry = new RateLimiterRegistry(clock, Duration.ofMinutes(5));
    private final SubscriberService service = new SubscriberService(repository, registry, clock);

    @BeforeEach
    void setUp() {
        when(repository.save(any(SubscriberEntity.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @AfterEach
    void tearDown() {
        registry.destroyAll();
    }

    private SubscriberEntity existing(boolean enabled) {
        return SubscriberEntity.builder().id(1L).chatId("123").enabled(enabled).frequency(5).build();
    }

    @Test
    void createdSubscriberIsEnabledEveryMinute() {
        SubscriberEntity created = service.create("123");

        assertThat(created.getEnabled()).isTrue();
        assertThat(created.getFrequency()).isEqualTo(1);
        assertThat(created.getCreatedAt()).isEqualTo(LocalDateTime.of(2024, 1, 1, 8, 0));
    }

    @Test
    void creationIsLimitedGlobally() {
        registry.register(RateLimiterNames.DB_USER_CREATION, RateLimitPolicy.of(2, 3_600_000));

        service.create("1");
        service.create("2");

        assertThatThrownBy(() -> service.create("3"))
                .isInstanceOf(RateLimitExceededException.class)
                .extracting("retryAfterSeconds").isEqualTo(3600);
    }

    @Test
    void setFrequencyValidatesRange() {
        assertThatThrownBy(() -> service.setFrequency("123", 1441))
                .isInstanceOf(InvalidIntervalException.class);
        verify(repository, never()).save(any());
    }

    @Test
    void setFrequencyOnMissingSubscriberFails() {
        when(repository.findByChatId("123")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.setFrequency("123", 10))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void setFrequencyPersistsNewValue() {
        when(repository.findByChatId("123")).thenReturn(Optional.of(existing(true)));

        SubscriberEntity updated = service.setFrequency("123", 30);

        assertThat(updated.getFrequency()).isEqualTo(30);
        assertThat(updated.getUpdatedAt()).isEqualTo(LocalDateTime.of(2024, 1, 1, 8, 0));
    }

    @Test
    void updatesAreLimitedGlobally() {
        registry.register(RateLimiterNames.DB_USER_UPDATE, RateLimitPolicy.of(1, 3_600_000));
        when(repository.findByChatId("123")).thenReturn(Optional.of(existing(true)));

        service.disable("123");

        assertThatThrownBy(() -> service.enable("123")).isInstanceOf(RateLimitExceededException.class);
    }

    @Test
    void activeOnlyWhenEnabled() {
        when(repository.findByChatId("on")).thenReturn(Optional.of(existing(true)));
        when(repository.findByChatId("off")).thenReturn(Optional.of(existing(false)));
        when(repository.findByChatId("gone")).thenReturn(Optional.empty());

        assertThat(service.isActive("on")).isTrue();
        assertThat(service.isActive("off")).isFalse();
        assertThat(service.isActive("gone")).isFalse();
    }

    @Test
    void recordDeliveryStampsLastSent() {
        when(repository.findByChatId("123")).thenReturn(Optional.of(existing(true)));

        service.recordDelivery("123");

        ArgumentCaptor<SubscriberEntity> saved = ArgumentCaptor.forClass(SubscriberEntity.class);
        verify(repository).save(saved.capture());
        assertThat(saved.getValue().getLastSentAt()).isEqualTo(LocalDateTime.of(2024, 1, 1, 8, 0));
    }

    @Test
    void unreachableSubscriberIsDisabled() {
        when(repository.findByChatId("123")).thenReturn(Optional.of(existing(true)));

        service.markUnreachable("123");

        ArgumentCaptor<SubscriberEntity> saved = ArgumentCaptor.forClass(SubscriberEntity.class);
        verify(repository).save(saved.capture());
        assertThat(saved.getValue().getEnabled()).isFalse();
    }
}
