package com.jokebot.web.service;

import com.jokebot.common.dto.Joke;
import com.jokebot.common.exception.UpstreamUnavailableException;
import com.jokebot.scheduler.handler.JobHandler;
import com.jokebot.scheduler.model.JobRecord;
import com.jokebot.scheduler.model.JobResult;
import com.jokebot.telegram.bot.ChatUnavailableException;
import com.jokebot.telegram.bot.DeliveryChannel;
import com.jokebot.telegram.joke.PayloadSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 到期推送：取一条笑话发给订阅者。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JokeDeliveryHandler implements JobHandler {

    public static final String HANDLER_NAME = "deliver-joke";

    private final SubscriberDirectory subscriberDirectory;
    private final PayloadSource payloadSource;
    private final DeliveryChannel deliveryChannel;

    @Override
    public String getHandlerName() {
        return HANDLER_NAME;
    }

    @Override
    public JobResult handle(JobRecord job) {
        String key = job.getKey();
        if (!subscriberDirectory.isActive(key)) {
            return JobResult.subscriberGone("订阅者不存在或已停用");
        }

        try {
            Joke joke = payloadSource.fetch();
            deliveryChannel.deliver(key, joke);
        } catch (ChatUnavailableException e) {
            subscriberDirectory.markUnreachable(key);
            return JobResult.subscriberGone(e.getMessage());
        } catch (UpstreamUnavailableException e) {
            return JobResult.failed(e.getMessage(), e);
        }

        subscriberDirectory.recordDelivery(key);
        log.debug("已向 {} 推送笑话", key);
        return JobResult.success();
    }
}
