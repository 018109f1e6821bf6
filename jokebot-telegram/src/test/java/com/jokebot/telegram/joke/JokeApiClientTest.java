package com.jokebot.telegram.joke;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jokebot.common.dto.Joke;
import com.jokebot.common.exception.UpstreamUnavailableException;
import com.jokebot.telegram.config.JokeApiProperties;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JokeApiClientTest {

    private MockWebServer server;
    private JokeApiClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        JokeApiProperties properties = new JokeApiProperties();
        properties.setBaseUrl(server.url("/api").toString());
        client = new JokeApiClient(new OkHttpClient(), properties, new ObjectMapper());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void fetchesAndParsesRandomJoke() throws InterruptedException {
        server.enqueue(new MockResponse().setBody(
                "{\"type\":\"general\",\"setup\":\"Why?\",\"punchline\":\"Because.\",\"id\":42,\"extra\":true}"));

        Joke joke = client.fetch();

        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/api/random_joke");
        assertThat(joke.getId()).isEqualTo(42L);
        assertThat(joke.format()).isEqualTo("Why?\n\nBecause.");
    }

    @Test
    void serverErrorIsUpstreamUnavailable() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("down"));

        assertThatThrownBy(() -> client.fetch())
                .isInstanceOf(UpstreamUnavailableException.class)
                .hasMessageContaining("503");
    }

    @Test
    void incompletePayloadIsUpstreamUnavailable() {
        server.enqueue(new MockResponse().setBody("{\"id\":1}"));

        assertThatThrownBy(() -> client.fetch()).isInstanceOf(UpstreamUnavailableException.class);
    }

    @Test
    void malformedBodyIsUpstreamUnavailable() {
        server.enqueue(new MockResponse().setBody("<html>oops</html>"));

        assertThatThrownBy(() -> client.fetch()).isInstanceOf(UpstreamUnavailableException.class);
    }
}
