package com.jokebot.web.service;

import com.jokebot.common.dto.Joke;
import com.jokebot.common.exception.UpstreamUnavailableException;
import com.jokebot.scheduler.model.JobRecord;
import com.jokebot.scheduler.model.JobResult;
import com.jokebot.telegram.bot.ChatUnavailableException;
import com.jokebot.telegram.bot.DeliveryChannel;
import com.jokebot.telegram.joke.PayloadSource;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class JokeDeliveryHandlerTest {

    private final SubscriberDirectory directory = mock(SubscriberDirectory.class);
    private final PayloadSource payloadSource = mock(PayloadSource.class);
    private final DeliveryChannel channel = mock(DeliveryChannel.class);
    private final JokeDeliveryHandler handler = new JokeDeliveryHandler(directory, payloadSource, channel);

    private final Joke joke = Joke.builder().setup("Why?").punchline("Because.").build();
    private final JobRecord job = JobRecord.builder()
            .key("123").jobId("job-1").handlerName(JokeDeliveryHandler.HANDLER_NAME)
            .intervalMinutes(5).nextRunAt(Instant.EPOCH).createdAt(Instant.EPOCH).build();

    @Test
    void deliversAndRecords() {
        when(directory.isActive("123")).thenReturn(true);
        when(payloadSource.fetch()).thenReturn(joke);

        JobResult result = handler.handle(job);

        assertThat(result.isSuccess()).isTrue();
        verify(channel).deliver("123", joke);
        verify(directory).recordDelivery("123");
    }

    @Test
    void inactiveSubscriberIsGone() {
        when(directory.isActive("123")).thenReturn(false);

        JobResult result = handler.handle(job);

        assertThat(result.getOutcome()).isEqualTo(JobResult.Outcome.SUBSCRIBER_GONE);
        verifyNoInteractions(payloadSource, channel);
    }

    @Test
    void jokeApiFailureIsRetryable() {
        when(directory.isActive("123")).thenReturn(true);
        when(payloadSource.fetch()).thenThrow(new UpstreamUnavailableException("503"));

        JobResult result = handler.handle(job);

        assertThat(result.getOutcome()).isEqualTo(JobResult.Outcome.FAILED);
        verify(directory, never()).recordDelivery(anyString());
    }

    @Test
    void blockedChatDisablesSubscriber() {
        when(directory.isActive("123")).thenReturn(true);
        when(payloadSource.fetch()).thenReturn(joke);
        doThrow(new ChatUnavailableException("blocked")).when(channel).deliver(anyString(), any());

        JobResult result = handler.handle(job);

        assertThat(result.getOutcome()).isEqualTo(JobResult.Outcome.SUBSCRIBER_GONE);
        verify(directory).markUnreachable("123");
        verify(directory, never()).recordDelivery(anyString());
    }
}
