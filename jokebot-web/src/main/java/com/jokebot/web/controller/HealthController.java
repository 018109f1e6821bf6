package com.jokebot.web.controller;

import com.jokebot.common.dto.ApiResponse;
import com.jokebot.ratelimit.config.RateLimiterNames;
import com.jokebot.ratelimit.limiter.RateLimiterRegistry;
import com.jokebot.scheduler.runner.JobRunner;
import com.jokebot.scheduler.service.SubscriptionScheduler;
import com.jokebot.web.ratelimit.RateLimited;
import com.jokebot.web.service.SubscriberService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 健康检查与运行状态。
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final SubscriptionScheduler subscriptionScheduler;
    private final JobRunner jobRunner;
    private final SubscriberService subscriberService;
    private final RateLimiterRegistry rateLimiterRegistry;
    private final Clock clock;

    @GetMapping("/health")
    @RateLimited(RateLimiterNames.API_HEALTH)
    public ApiResponse<Map<String, Object>> health() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("status", "healthy");
        data.put("timestamp", clock.instant().toString());
        data.put("activeSchedules", subscriptionScheduler.activeCount());
        return ApiResponse.ok(data);
    }

    @GetMapping("/status")
    @RateLimited(RateLimiterNames.API_STATUS)
    public ApiResponse<Map<String, Object>> status() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("scheduler", jobRunner.getState().name());
        data.put("inFlightJobs", jobRunner.inFlightCount());
        data.put("activeSchedules", subscriptionScheduler.activeCount());
        data.put("enabledSubscribers", subscriberService.countEnabled());
        data.put("rateLimiters", rateLimiterRegistry.size());
        data.put("timestamp", clock.instant().toString());
        return ApiResponse.ok(data);
    }
}
