package com.jokebot.telegram.joke;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jokebot.common.dto.Joke;
import com.jokebot.common.exception.UpstreamUnavailableException;
import com.jokebot.telegram.config.JokeApiProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

import java.io.IOException;

/**
 * Official Joke API 客户端：GET {baseUrl}/random_joke。
 */
@Slf4j
@RequiredArgsConstructor
public class JokeApiClient implements PayloadSource {

    private final OkHttpClient httpClient;
    private final JokeApiProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public Joke fetch() {
        Request request = new Request.Builder()
                .url(properties.getBaseUrl() + "/random_joke")
                .get()
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            String body = response.body() != null ? response.body().string() : "";

            if (!response.isSuccessful()) {
                log.error("笑话 API 调用失败: {} - {}", response.code(), body);
                throw new UpstreamUnavailableException("笑话 API 返回错误: " + response.code());
            }

            Joke joke = objectMapper.readValue(body, Joke.class);
            if (joke.getSetup() == null || joke.getPunchline() == null) {
                throw new UpstreamUnavailableException("笑话 API 返回内容不完整");
            }
            return joke;
        } catch (UpstreamUnavailableException e) {
            throw e;
        } catch (IOException e) {
            throw new UpstreamUnavailableException("获取笑话时发生网络错误", e);
        }
    }
}
