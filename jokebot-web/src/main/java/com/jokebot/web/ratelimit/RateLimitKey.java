package com.jokebot.web.ratelimit;

/**
 * HTTP 限流的计数维度。
 */
public enum RateLimitKey {

    /** 按客户端地址计数 */
    CLIENT_IP,

    /** 按 X-User-Id 头计数，请求没带该头时退回客户端地址 */
    USER
}
