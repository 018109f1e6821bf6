package com.jokebot.config;

import com.jokebot.scheduler.model.JobRecord;
import com.jokebot.scheduler.service.SubscriptionScheduler;
import com.jokebot.web.entity.SubscriberEntity;
import com.jokebot.web.service.SubscriberService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * 应用启动时，让调度任务与订阅者表保持一致。
 * <p>
 * 已存在且间隔一致的任务保持原样，停机期间错过的推送由第一轮轮询补发；
 * 订阅者已停用但任务仍在的，交给执行器在到期时自行取消。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SubscriptionReconciler implements CommandLineRunner {

    private final SubscriberService subscriberService;
    private final SubscriptionScheduler subscriptionScheduler;

    @Override
    public void run(String... args) {
        List<SubscriberEntity> enabled = subscriberService.findAllEnabled();
        int scheduled = 0;

        for (SubscriberEntity subscriber : enabled) {
            String chatId = subscriber.getChatId();
            Optional<JobRecord> job = subscriptionScheduler.find(chatId);
            if (job.isPresent() && job.get().getIntervalMinutes() == subscriber.getFrequency()) {
                continue;
            }
            try {
                subscriptionScheduler.schedule(chatId, subscriber.getFrequency());
                scheduled++;
            } catch (RuntimeException e) {
                log.error("恢复订阅任务失败: chatId={}", chatId, e);
            }
        }

        log.info("启动对账完成: 启用订阅者 {} 个，补建任务 {} 个，当前活跃任务 {} 个",
                enabled.size(), scheduled, subscriptionScheduler.activeCount());
    }
}
