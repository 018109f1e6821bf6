package com.jokebot.web.ratelimit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jokebot.ratelimit.limiter.RateLimitPolicy;
import com.jokebot.ratelimit.limiter.RateLimiterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.method.HandlerMethod;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class RateLimitInterceptorTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final RateLimiterRegistry registry =
            new RateLimiterRegistry(Clock.fixed(NOW, ZoneOffset.UTC), Duration.ofMinutes(5));
    private final RateLimitInterceptor interceptor = new RateLimitInterceptor(registry, objectMapper);

    @BeforeEach
    void setUp() {
        registry.register("api:test", RateLimitPolicy.of(2, 60_000));
        registry.register("api:class", RateLimitPolicy.of(1, 60_000));
        registry.register("api:user", RateLimitPolicy.of(1, 60_000));
    }

    @AfterEach
    void tearDown() {
        registry.destroyAll();
    }

    static class SampleController {

        @RateLimited("api:test")
        public String limited() {
            return "ok";
        }

        public String open() {
            return "ok";
        }

        @RateLimited(value = "api:user", key = RateLimitKey.USER)
        public String perUser() {
            return "ok";
        }
    }

    @RateLimited("api:class")
    static class ClassLevelController {

        public String anything() {
            return "ok";
        }
    }

    private HandlerMethod handler(Object bean, String method) throws NoSuchMethodException {
        return new HandlerMethod(bean, method);
    }

    private MockHttpServletRequest request(String remoteAddr) {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/health");
        request.setRemoteAddr(remoteAddr);
        return request;
    }

    @Test
    void allowedRequestCarriesRateLimitHeaders() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        boolean proceed = interceptor.preHandle(request("10.0.0.1"), response,
                handler(new SampleController(), "limited"));

        assertThat(proceed).isTrue();
        assertThat(response.getHeader("RateLimit-Limit")).isEqualTo("2");
        assertThat(response.getHeader("RateLimit-Remaining")).isEqualTo("1");
        assertThat(response.getHeader("RateLimit-Reset"))
                .isEqualTo(String.valueOf(NOW.plusSeconds(60).getEpochSecond()));
        assertThat(response.getHeader("Retry-After")).isNull();
    }

    @Test
    void rejectedRequestGets429WithRetryAfterAndJsonBody() throws Exception {
        HandlerMethod handler = handler(new SampleController(), "limited");
        interceptor.preHandle(request("10.0.0.1"), new MockHttpServletResponse(), handler);
        interceptor.preHandle(request("10.0.0.1"), new MockHttpServletResponse(), handler);

        MockHttpServletResponse response = new MockHttpServletResponse();
        boolean proceed = interceptor.preHandle(request("10.0.0.1"), response, handler);

        assertThat(proceed).isFalse();
        assertThat(response.getStatus()).isEqualTo(429);
        assertThat(response.getHeader("Retry-After")).isEqualTo("60");
        assertThat(response.getHeader("RateLimit-Remaining")).isEqualTo("0");
        JsonNode body = objectMapper.readTree(response.getContentAsString());
        assertThat(body.path("success").asBoolean()).isFalse();
        assertThat(body.path("code").asText()).isEqualTo("RATE_LIMITED");
        assertThat(body.path("message").asText()).contains("60 seconds");
    }

    @Test
    void clientsAreCountedSeparately() throws Exception {
        HandlerMethod handler = handler(new SampleController(), "limited");
        interceptor.preHandle(request("10.0.0.1"), new MockHttpServletResponse(), handler);
        interceptor.preHandle(request("10.0.0.1"), new MockHttpServletResponse(), handler);

        assertThat(interceptor.preHandle(request("10.0.0.2"), new MockHttpServletResponse(), handler)).isTrue();
    }

    @Test
    void forwardedForFirstHopIdentifiesClient() throws Exception {
        HandlerMethod handler = handler(new SampleController(), "limited");
        for (int i = 0; i < 2; i++) {
            MockHttpServletRequest request = request("10.0.0.9");
            request.addHeader("X-Forwarded-For", "203.0.113.7, 10.0.0.9");
            interceptor.preHandle(request, new MockHttpServletResponse(), handler);
        }

        assertThat(registry.get("api:test").status("203.0.113.7").getRemaining()).isZero();
        assertThat(interceptor.preHandle(request("10.0.0.9"), new MockHttpServletResponse(), handler)).isTrue();
    }

    @Test
    void unannotatedHandlerIsNotLimited() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        boolean proceed = interceptor.preHandle(request("10.0.0.1"), response,
                handler(new SampleController(), "open"));

        assertThat(proceed).isTrue();
        assertThat(response.getHeader("RateLimit-Limit")).isNull();
    }

    @Test
    void classLevelAnnotationAppliesToAllMethods() throws Exception {
        HandlerMethod handler = handler(new ClassLevelController(), "anything");

        assertThat(interceptor.preHandle(request("10.0.0.1"), new MockHttpServletResponse(), handler)).isTrue();
        assertThat(interceptor.preHandle(request("10.0.0.1"), new MockHttpServletResponse(), handler)).isFalse();
    }

    private MockHttpServletRequest userRequest(String remoteAddr, String userId) {
        MockHttpServletRequest request = request(remoteAddr);
        request.addHeader("X-User-Id", userId);
        return request;
    }

    @Test
    void userKeyedLimiterCountsPerUserAcrossAddresses() throws Exception {
        HandlerMethod handler = handler(new SampleController(), "perUser");

        assertThat(interceptor.preHandle(userRequest("10.0.0.1", "alice"), new MockHttpServletResponse(), handler))
                .isTrue();
        assertThat(interceptor.preHandle(userRequest("10.0.0.2", "alice"), new MockHttpServletResponse(), handler))
                .isFalse();
        assertThat(interceptor.preHandle(userRequest("10.0.0.1", "bob"), new MockHttpServletResponse(), handler))
                .isTrue();
        assertThat(registry.get("api:user").status("user:alice").getRemaining()).isZero();
    }

    @Test
    void userKeyedLimiterFallsBackToAddressWithoutHeader() throws Exception {
        HandlerMethod handler = handler(new SampleController(), "perUser");

        assertThat(interceptor.preHandle(request("10.0.0.1"), new MockHttpServletResponse(), handler)).isTrue();
        assertThat(interceptor.preHandle(request("10.0.0.1"), new MockHttpServletResponse(), handler)).isFalse();
        assertThat(interceptor.preHandle(userRequest("10.0.0.1", "alice"), new MockHttpServletResponse(), handler))
                .isTrue();
    }

    @Test
    void addressKeyedLimiterIgnoresUserHeader() {
        MockHttpServletRequest request = userRequest("10.0.0.1", "alice");

        assertThat(RateLimitInterceptor.resolveIdentifier(request, RateLimitKey.CLIENT_IP)).isEqualTo("10.0.0.1");
        assertThat(RateLimitInterceptor.resolveIdentifier(request, RateLimitKey.USER)).isEqualTo("user:alice");
    }

    @Test
    void clientIdFallsBackToRemoteAddress() {
        MockHttpServletRequest request = request("192.168.1.5");
        request.addHeader("X-Forwarded-For", " ");

        assertThat(RateLimitInterceptor.resolveClientId(request)).isEqualTo("192.168.1.5");
    }
}
