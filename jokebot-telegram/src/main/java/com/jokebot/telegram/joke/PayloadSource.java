package com.jokebot.telegram.joke;

import com.jokebot.common.dto.Joke;

/**
 * 推送内容来源。
 */
public interface PayloadSource {

    /**
     * 获取一条随机笑话。
     *
     * @throws com.jokebot.common.exception.UpstreamUnavailableException 上游不可用
     */
    Joke fetch();
}
