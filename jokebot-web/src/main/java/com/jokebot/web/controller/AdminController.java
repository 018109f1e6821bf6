package com.jokebot.web.controller;

import com.jokebot.common.dto.ApiResponse;
import com.jokebot.common.exception.NotFoundException;
import com.jokebot.ratelimit.config.RateLimiterNames;
import com.jokebot.ratelimit.limiter.RateLimiterRegistry;
import com.jokebot.ratelimit.limiter.RateLimiterStats;
import com.jokebot.scheduler.model.JobRecord;
import com.jokebot.scheduler.model.JobResult;
import com.jokebot.scheduler.service.SubscriptionScheduler;
import com.jokebot.web.ratelimit.RateLimited;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * 运维接口：查看与操作调度任务、限流器。
 */
@Slf4j
@RestController
@RequestMapping("/api/admin")
@RateLimited(RateLimiterNames.API_ADMIN)
@RequiredArgsConstructor
public class AdminController {

    private final SubscriptionScheduler subscriptionScheduler;
    private final RateLimiterRegistry rateLimiterRegistry;

    // ======================== 调度任务 ========================

    @GetMapping("/jobs/{key}")
    public ApiResponse<JobRecord> getJob(@PathVariable String key) {
        return subscriptionScheduler.find(key)
                .map(ApiResponse::ok)
                .orElseThrow(() -> new NotFoundException("任务不存在: " + key));
    }

    /**
     * 立即执行一次，不影响原有节奏。
     */
    @PostMapping("/jobs/{key}/run")
    public ApiResponse<String> runJob(@PathVariable String key) {
        JobResult result = subscriptionScheduler.runNow(key);
        log.info("管理接口手动执行任务: key={}, 结果={}", key, result.getOutcome());
        if (result.isSuccess()) {
            return ApiResponse.ok(result.getOutcome().name(), "执行成功");
        }
        return ApiResponse.<String>builder()
                .success(false)
                .code(result.getOutcome().name())
                .message(result.getMessage())
                .data(result.getOutcome().name())
                .build();
    }

    @DeleteMapping("/jobs/{key}")
    public ApiResponse<Void> cancelJob(@PathVariable String key) {
        subscriptionScheduler.cancel(key);
        return ApiResponse.ok(null, "已取消");
    }

    // ======================== 限流器 ========================

    @GetMapping("/rate-limits")
    public ApiResponse<Map<String, RateLimiterStats>> rateLimits() {
        return ApiResponse.ok(rateLimiterRegistry.stats());
    }

    /**
     * 重置限流器；带 identifier 时只清除该标识的窗口。
     */
    @DeleteMapping("/rate-limits/{name}")
    public ApiResponse<Void> resetRateLimit(@PathVariable String name,
                                            @RequestParam(value = "identifier", required = false) String identifier) {
        rateLimiterRegistry.reset(name, identifier);
        log.info("管理接口重置限流器: name={}, identifier={}", name, identifier);
        return ApiResponse.ok(null, "已重置");
    }
}
