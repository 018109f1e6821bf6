package com.jokebot.common.util;

import java.util.UUID;

/**
 * 任务与执行器的标识生成。
 */
public final class IdGenerator {

    private static final int RANDOM_LENGTH = 12;

    private IdGenerator() {
    }

    /**
     * 如 "job-3f9c0a1b2d4e"。每次调度都会换新 jobId，用来识别已被替换的旧任务。
     */
    public static String withPrefix(String prefix) {
        String random = UUID.randomUUID().toString().replace("-", "");
        return prefix + "-" + random.substring(0, RANDOM_LENGTH);
    }
}
