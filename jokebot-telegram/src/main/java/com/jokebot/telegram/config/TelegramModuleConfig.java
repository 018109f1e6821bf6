package com.jokebot.telegram.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jokebot.telegram.bot.TelegramClient;
import com.jokebot.telegram.joke.JokeApiClient;
import okhttp3.OkHttpClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * 外部接口模块自动配置：两个上游各用一个 OkHttpClient，超时互不影响。
 */
@Configuration
@EnableConfigurationProperties({TelegramProperties.class, JokeApiProperties.class})
public class TelegramModuleConfig {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Bean
    public TelegramClient telegramClient(TelegramProperties properties) {
        OkHttpClient httpClient = new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(properties.getConnectTimeoutSeconds()))
                .readTimeout(Duration.ofSeconds(
                        properties.getRequestTimeoutSeconds() + properties.getLongPollTimeoutSeconds()))
                .writeTimeout(Duration.ofSeconds(10))
                .build();
        return new TelegramClient(httpClient, properties, objectMapper);
    }

    @Bean
    public JokeApiClient jokeApiClient(JokeApiProperties properties) {
        OkHttpClient httpClient = new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .readTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .build();
        return new JokeApiClient(httpClient, properties, objectMapper);
    }
}
