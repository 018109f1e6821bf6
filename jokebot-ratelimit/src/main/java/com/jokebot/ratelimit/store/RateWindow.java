package com.jokebot.ratelimit.store;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 单个标识在当前固定窗口内的计数快照。不可变，每次计数都会替换为新对象。
 */
@Getter
@ToString
@AllArgsConstructor
public class RateWindow {

    private final String key;

    /** 当前窗口内已观察到的请求数 */
    private final int count;

    /** 窗口翻转时间（epoch 毫秒） */
    private final long windowResetAt;
}
