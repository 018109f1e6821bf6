package com.jokebot.telegram.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 笑话 API 配置项。
 */
@Data
@ConfigurationProperties(prefix = "jokebot.joke-api")
public class JokeApiProperties {

    private String baseUrl = "https://official-joke-api.appspot.com";

    private int requestTimeoutSeconds = 10;
}
