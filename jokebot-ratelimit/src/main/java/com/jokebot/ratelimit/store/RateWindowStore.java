package com.jokebot.ratelimit.store;

import java.util.Collection;
import java.util.Optional;

/**
 * 限流窗口存储接口：按 key 保存计数与过期时间。
 * <p>
 * 同一 key 的每次 {@link #increment} 必须是一次原子的读-改-写，并发下不能丢计数；
 * 不同 key 之间不需要任何原子性。
 */
public interface RateWindowStore {

    /**
     * 为 key 计数一次并返回计数后的窗口。
     * <p>
     * 不存在时惰性创建；{@code now >= windowResetAt} 时先重置窗口再计数。
     *
     * @param key      限流标识
     * @param now      当前时间（epoch 毫秒）
     * @param windowMs 窗口长度
     */
    RateWindow increment(String key, long now, long windowMs);

    /** 读取 key 当前窗口，不计数 */
    Optional<RateWindow> get(String key);

    /** 删除单个 key 的窗口 */
    void reset(String key);

    /** 清空所有窗口 */
    void clear();

    /** 当前保存的 key 数量 */
    int size();

    /** 所有窗口的快照 */
    Collection<RateWindow> snapshot();

    /**
     * 清理过期窗口：{@code now > windowResetAt + windowMs} 的条目被移除。
     *
     * @return 移除的条目数
     */
    int sweep(long now, long windowMs);
}
