package com.jokebot.ratelimit.store;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 基于内存的固定窗口计数存储。
 * <p>
 * 每个 key 的计数通过 {@link ConcurrentHashMap#compute} 原子更新，
 * 每个 key 只占一个条目（O(1) 内存）。进程重启后计数清零。
 */
public class InMemoryRateWindowStore implements RateWindowStore {

    private final Map<String, RateWindow> windows = new ConcurrentHashMap<>();

    @Override
    public RateWindow increment(String key, long now, long windowMs) {
        return windows.compute(key, (k, current) -> {
            if (current == null || now >= current.getWindowResetAt()) {
                return new RateWindow(k, 1, now + windowMs);
            }
            return new RateWindow(k, current.getCount() + 1, current.getWindowResetAt());
        });
    }

    @Override
    public Optional<RateWindow> get(String key) {
        return Optional.ofNullable(windows.get(key));
    }

    @Override
    public void reset(String key) {
        windows.remove(key);
    }

    @Override
    public void clear() {
        windows.clear();
    }

    @Override
    public int size() {
        return windows.size();
    }

    @Override
    public Collection<RateWindow> snapshot() {
        return List.copyOf(windows.values());
    }

    @Override
    public int sweep(long now, long windowMs) {
        int removed = 0;
        for (RateWindow window : new ArrayList<>(windows.values())) {
            // 只删除仍是同一对象的条目，期间被重新计数的 key 保留
            if (now > window.getWindowResetAt() + windowMs && windows.remove(window.getKey(), window)) {
                removed++;
            }
        }
        return removed;
    }
}
