package com.jokebot.web.service;

/**
 * 推送处理器查询与回写订阅者状态的入口。
 */
public interface SubscriberDirectory {

    /** 订阅者存在且处于启用状态 */
    boolean isActive(String key);

    /** 记录一次成功推送 */
    void recordDelivery(String key);

    /** 会话已不可达（屏蔽 Bot 等），停用订阅者 */
    void markUnreachable(String key);
}
