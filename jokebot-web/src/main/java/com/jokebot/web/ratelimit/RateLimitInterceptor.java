package com.jokebot.web.ratelimit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jokebot.common.dto.ApiResponse;
import com.jokebot.ratelimit.limiter.RateLimitDecision;
import com.jokebot.ratelimit.limiter.RateLimiterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

import java.nio.charset.StandardCharsets;

/**
 * HTTP 限流拦截器。
 * <p>
 * 默认按客户端地址计数，注解声明 {@link RateLimitKey#USER} 时按 X-User-Id 头计数。每个响应都带 RateLimit-Limit / RateLimit-Remaining / RateLimit-Reset 头；
 * 超限时返回 429，附 Retry-After 头与 JSON 错误体。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RateLimitInterceptor implements HandlerInterceptor {

    static final String USER_ID_HEADER = "X-User-Id";

    private final RateLimiterRegistry rateLimiterRegistry;
    private final ObjectMapper objectMapper;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
            throws Exception {
        if (!(handler instanceof HandlerMethod)) {
            return true;
        }
        RateLimited rateLimited = findAnnotation((HandlerMethod) handler);
        if (rateLimited == null) {
            return true;
        }

        String clientId = resolveIdentifier(request, rateLimited.key());
        RateLimitDecision decision = rateLimiterRegistry.get(rateLimited.value()).checkAndIncrement(clientId);

        response.setHeader("RateLimit-Limit", String.valueOf(decision.getLimit()));
        response.setHeader("RateLimit-Remaining", String.valueOf(decision.getRemaining()));
        response.setHeader("RateLimit-Reset", String.valueOf(decision.resetAtEpochSeconds()));
        if (decision.isAllowed()) {
            return true;
        }

        int retryAfter = decision.getRetryAfterSeconds();
        log.debug("HTTP 请求被限流: {} {} client={}", request.getMethod(), request.getRequestURI(), clientId);
        response.setHeader("Retry-After", String.valueOf(retryAfter));
        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        ApiResponse<Void> body = ApiResponse.error("RATE_LIMITED",
                "Rate limit exceeded. Please try again in " + retryAfter + " seconds.");
        objectMapper.writeValue(response.getWriter(), body);
        return false;
    }

    /**
     * 计数标识。按用户计数时取 X-User-Id 头，加上 user: 前缀避免与地址撞 key；没有该头时退回客户端地址。
     */
    static String resolveIdentifier(HttpServletRequest request, RateLimitKey key) {
        if (key == RateLimitKey.USER) {
            String userId = request.getHeader(USER_ID_HEADER);
            if (userId != null && !userId.isBlank()) {
                return "user:" + userId.trim();
            }
        }
        return resolveClientId(request);
    }

    /**
     * 客户端标识：X-Forwarded-For 的第一跳，没有时用连接地址。
     */
    static String resolveClientId(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            String first = forwarded.split(",")[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }
        String remote = request.getRemoteAddr();
        return remote != null && !remote.isBlank() ? remote : "unknown";
    }

    private RateLimited findAnnotation(HandlerMethod handlerMethod) {
        RateLimited onMethod = handlerMethod.getMethodAnnotation(RateLimited.class);
        if (onMethod != null) {
            return onMethod;
        }
        return AnnotatedElementUtils.findMergedAnnotation(handlerMethod.getBeanType(), RateLimited.class);
    }
}
