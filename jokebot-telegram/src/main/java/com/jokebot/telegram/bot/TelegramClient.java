package com.jokebot.telegram.bot;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.jokebot.common.dto.Joke;
import com.jokebot.common.exception.UpstreamUnavailableException;
import com.jokebot.telegram.config.TelegramProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Telegram Bot API 客户端：发送消息与长轮询拉取更新。
 */
@Slf4j
@RequiredArgsConstructor
public class TelegramClient implements DeliveryChannel {

    private static final MediaType JSON_MEDIA = MediaType.parse("application/json; charset=utf-8");

    private final OkHttpClient httpClient;
    private final TelegramProperties properties;
    private final ObjectMapper objectMapper;

    // ======================== 推送 ========================

    @Override
    public void deliver(String key, Joke joke) {
        send(key, "😂 *Joke time!*\n\n" + joke.format(), "Markdown");
        log.debug("笑话已送达: {}", key);
    }

    /**
     * 发送纯文本消息（命令回复等）。
     */
    public void sendMessage(String chatId, String text) {
        send(chatId, text, null);
    }

    // ======================== 拉取更新 ========================

    /**
     * 长轮询拉取 offset 之后的更新。
     *
     * @param offset         上次处理的最大 update_id + 1
     * @param timeoutSeconds 服务端等待时间，0 为立即返回
     */
    public List<TelegramUpdate> getUpdates(long offset, int timeoutSeconds) {
        HttpUrl url = HttpUrl.get(methodUrl("getUpdates")).newBuilder()
                .addQueryParameter("offset", String.valueOf(offset))
                .addQueryParameter("timeout", String.valueOf(timeoutSeconds))
                .addQueryParameter("allowed_updates", "[\"message\"]")
                .build();

        JsonNode result = call("getUpdates", new Request.Builder().url(url).get().build());

        List<TelegramUpdate> updates = new ArrayList<>();
        for (JsonNode node : result) {
            JsonNode message = node.path("message");
            String chatId = message.path("chat").has("id") ? message.path("chat").path("id").asText() : null;
            String text = message.has("text") ? message.path("text").asText() : null;
            updates.add(new TelegramUpdate(node.path("update_id").asLong(), chatId, text));
        }
        return updates;
    }

    public boolean isConfigured() {
        return properties.getBotToken() != null && !properties.getBotToken().isBlank();
    }

    // ======================== 公共方法 ========================

    private void send(String chatId, String text, String parseMode) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("chat_id", chatId);
        root.put("text", text);
        if (parseMode != null) {
            root.put("parse_mode", parseMode);
        }

        Request request;
        try {
            request = new Request.Builder()
                    .url(methodUrl("sendMessage"))
                    .post(RequestBody.create(objectMapper.writeValueAsString(root), JSON_MEDIA))
                    .build();
        } catch (IOException e) {
            throw new UpstreamUnavailableException("构建 Telegram 请求体失败", e);
        }
        call("sendMessage", request);
    }

    /**
     * 执行请求并返回 result 字段。
     * 403 与 "chat not found" 视为会话不可达，其余错误视为上游暂时不可用。
     */
    private JsonNode call(String method, Request request) {
        try (Response response = httpClient.newCall(request).execute()) {
            String body = response.body() != null ? response.body().string() : "";
            JsonNode json = body.isEmpty() ? objectMapper.createObjectNode() : objectMapper.readTree(body);

            if (response.isSuccessful() && json.path("ok").asBoolean(false)) {
                return json.path("result");
            }

            String description = json.path("description").asText("");
            log.warn("Telegram {} 调用失败: {} - {}", method, response.code(), description);
            if (response.code() == 403 || description.toLowerCase().contains("chat not found")) {
                throw new ChatUnavailableException("会话不可达: " + description);
            }
            throw new UpstreamUnavailableException("Telegram API 返回错误: " + response.code());
        } catch (ChatUnavailableException | UpstreamUnavailableException e) {
            throw e;
        } catch (IOException e) {
            throw new UpstreamUnavailableException("调用 Telegram " + method + " 时发生网络错误", e);
        }
    }

    private String methodUrl(String method) {
        return properties.getBaseUrl() + "/bot" + properties.getBotToken() + "/" + method;
    }
}
