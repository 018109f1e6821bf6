package com.jokebot.web.ratelimit;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 为接口方法（或整个 Controller）指定限流器名称，由 {@link RateLimitInterceptor} 执行。
 */
@Documented
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
public @interface RateLimited {

    /** 限流器名称，如 api:health */
    String value();

    /** 计数维度，默认按客户端地址 */
    RateLimitKey key() default RateLimitKey.CLIENT_IP;
}
