package com.automate.FindingSync.client;

import com.automate.FindingSync.Config.SonarProperties;
import com.automate.FindingSync.exception.SonarApiException;
import com.automate.FindingSync.exception.SonarErrorKind;
import com.automate.FindingSync.support.FakeSonarServer;
import com.automate.FindingSync.support.FakeSonarServer.Reply;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SonarClientTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private FakeSonarServer server;
    private SonarProperties props;
    private ResponseCache cache;
    private RequestLimiter limiter;

    @BeforeEach
    void setUp() throws Exception {
        server = FakeSonarServer.start();
        props = new SonarProperties();
        props.setRequestTimeoutMs(2000);
        props.setRetryBackoffMs(10);
        props.setMaxRetryAfterMs(50);
        cache = new ResponseCache(1000, Duration.ofMinutes(5), mapper);
        limiter = new RequestLimiter(5, Duration.ofMillis(1), Duration.ofSeconds(30));
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private SonarClient client(SonarConnection connection) {
        return new SonarClient(connection, WebClient.builder(), cache, limiter, props, mapper);
    }

    private SonarClient tokenClient() {
        return client(SonarConnection.withToken(server.baseUrl(), "tok"));
    }

    private static String page(int items) {
        StringBuilder sb = new StringBuilder("{\"issues\":[");
        for (int i = 0; i < items; i++) {
            if (i > 0) sb.append(',');
            sb.append("{\"key\":\"k").append(i).append("\"}");
        }
        return sb.append("]}").toString();
    }

    private static int countIssues(JsonNode page, List<String> results) {
        page.path("issues").forEach(i -> results.add(i.path("key").asText()));
        return page.path("issues").size();
    }

    @Test
    void paginateStopsOnFirstShortPage() {
        server.on("/api/issues/search", r -> Reply.json("1".equals(r.param("p")) ? page(3) : page(1)));

        List<String> keys = tokenClient().paginate("/api/issues/search", Map.of("componentKeys", "app"),
                SonarClientTest::countIssues, 3);

        assertThat(keys).hasSize(4);
        assertThat(server.count("/api/issues/search")).isEqualTo(2);
        assertThat(server.requests("/api/issues/search").get(1).param("ps")).isEqualTo("3");
        assertThat(server.requests("/api/issues/search").get(1).param("p")).isEqualTo("2");
    }

    @Test
    void paginateStopsAtPageCapWhenEveryPageIsFull() {
        props.setMaxPages(2);
        server.json("/api/issues/search", page(3));

        List<String> keys = tokenClient().paginate("/api/issues/search", Map.of(),
                SonarClientTest::countIssues, 3);

        assertThat(keys).hasSize(6);
        assertThat(server.count("/api/issues/search")).isEqualTo(2);
    }

    @Test
    void getIsCachedWhateverTheParameterOrder() {
        server.json("/api/rules/search", "{\"rules\":[]}");
        SonarClient client = tokenClient();

        Map<String, String> ab = new LinkedHashMap<>();
        ab.put("a", "1");
        ab.put("b", "2");
        Map<String, String> ba = new LinkedHashMap<>();
        ba.put("b", "2");
        ba.put("a", "1");

        JsonNode first = client.get("/api/rules/search", ab);
        JsonNode second = client.get("/api/rules/search", ba);

        assertThat(second).isEqualTo(first);
        assertThat(server.count("/api/rules/search")).isEqualTo(1);
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void fetchAlwaysGoesToTheServer() {
        server.json("/api/authentication/validate", "{\"valid\":true}");
        SonarClient client = tokenClient();

        client.fetch("/api/authentication/validate", Map.of());
        client.fetch("/api/authentication/validate", Map.of());

        assertThat(server.count("/api/authentication/validate")).isEqualTo(2);
    }

    @Test
    void retriesServiceUnavailableThenSucceeds() {
        server.sequence("/api/system/status",
                Reply.status(503, ""),
                Reply.status(503, ""),
                Reply.json("{\"version\":\"10.3.0.82913\"}"));

        assertThat(tokenClient().detectVersion()).isEqualTo("10.3.0.82913");
        assertThat(server.count("/api/system/status")).isEqualTo(3);
    }

    @Test
    void exhaustedRetriesEndAsTransientFailure() {
        server.on("/api/system/status", r -> Reply.status(503, "down"));

        assertThatThrownBy(() -> tokenClient().detectVersion())
                .isInstanceOfSatisfying(SonarApiException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(SonarErrorKind.TRANSIENT_NETWORK);
                    assertThat(e.getStatusCode()).isEqualTo(503);
                    assertThat(e.getEndpoint()).isEqualTo("/api/system/status");
                });
        assertThat(server.count("/api/system/status")).isEqualTo(1 + props.getMaxRetries());
    }

    @Test
    void notFoundFailsWithoutRetry() {
        assertThatThrownBy(() -> tokenClient().get("/api/qualitygates/project_status", Map.of("projectKey", "x")))
                .isInstanceOfSatisfying(SonarApiException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(SonarErrorKind.UPSTREAM_API);
                    assertThat(e.getStatusCode()).isEqualTo(404);
                    assertThat(e.getMethod()).isEqualTo("GET");
                    assertThat(e.getResponseBody()).contains("Unknown url");
                });
        assertThat(server.count("/api/qualitygates/project_status")).isEqualTo(1);
    }

    @Test
    void retryAfterIsHonoured() {
        server.sequence("/api/system/status",
                Reply.status(429, "").withHeader("Retry-After", "0"),
                Reply.json("{\"version\":\"9.9\"}"));

        assertThat(tokenClient().detectVersion()).isEqualTo("9.9");
        assertThat(server.count("/api/system/status")).isEqualTo(2);
    }

    @Test
    void invalidJsonIsAnUpstreamError() {
        server.on("/api/system/status", r -> Reply.status(200, "<html>login</html>"));

        assertThatThrownBy(() -> tokenClient().detectVersion())
                .isInstanceOfSatisfying(SonarApiException.class,
                        e -> assertThat(e.getKind()).isEqualTo(SonarErrorKind.UPSTREAM_API));
    }

    @Test
    void tokenAuthenticationSendsBearerHeader() {
        server.json("/api/authentication/validate", "{\"valid\":true}");
        server.json("/api/system/status", "{\"version\":\"10.0\"}");
        SonarClient client = tokenClient();

        client.authenticate();
        client.detectVersion();

        assertThat(server.requests("/api/authentication/validate").get(0).header("Authorization")).isEqualTo("Bearer tok");
        assertThat(server.requests("/api/system/status").get(0).header("Authorization")).isEqualTo("Bearer tok");
    }

    @Test
    void passwordAuthenticationForwardsSessionCookies() {
        server.on("/api/authentication/login", r -> Reply.status(200, "")
                .withHeader("Set-Cookie", "JWT-SESSION=abc; Path=/; HttpOnly", "XSRF-TOKEN=xyz; Path=/"));
        server.json("/api/authentication/validate", "{\"valid\":true}");
        SonarClient client = client(new SonarConnection(server.baseUrl(), null, "admin", "secret", null));

        client.authenticate();

        FakeSonarServer.Recorded login = server.requests("/api/authentication/login").get(0);
        assertThat(login.method()).isEqualTo("POST");
        assertThat(FakeSonarServer.parseQuery(login.body()))
                .containsEntry("login", "admin")
                .containsEntry("password", "secret");
        assertThat(server.requests("/api/authentication/validate").get(0).header("Cookie"))
                .isEqualTo("JWT-SESSION=abc; XSRF-TOKEN=xyz");
    }

    @Test
    void rejectedLoginIsAnAuthenticationFailure() {
        server.on("/api/authentication/login", r -> Reply.status(401, ""));
        SonarClient client = client(new SonarConnection(server.baseUrl(), null, "admin", "wrong", null));

        assertThatThrownBy(client::authenticate)
                .isInstanceOfSatisfying(SonarApiException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(SonarErrorKind.AUTHENTICATION);
                    assertThat(e.getStatusCode()).isEqualTo(401);
                });
        assertThat(server.count("/api/authentication/validate")).isZero();
    }

    @Test
    void invalidCredentialsAreAnAuthenticationFailure() {
        server.json("/api/authentication/validate", "{\"valid\":false}");

        assertThatThrownBy(() -> tokenClient().authenticate())
                .isInstanceOfSatisfying(SonarApiException.class,
                        e -> assertThat(e.getKind()).isEqualTo(SonarErrorKind.AUTHENTICATION));
    }

    @Test
    void missingCredentialsAreAValidationFailure() {
        SonarClient client = client(new SonarConnection(server.baseUrl(), null, null, null, null));

        assertThatThrownBy(client::authenticate)
                .isInstanceOfSatisfying(SonarApiException.class,
                        e -> assertThat(e.getKind()).isEqualTo(SonarErrorKind.VALIDATION));
        assertThat(server.count("/api/authentication/login")).isZero();
    }

    @Test
    void concurrentCallsNeverExceedTheLimiter() throws Exception {
        server.on("/api/measures/component", r -> Reply.json("{}").withDelay(100));
        SonarClient client = tokenClient();

        ExecutorService pool = Executors.newFixedThreadPool(12);
        try {
            List<Future<JsonNode>> futures = new ArrayList<>();
            for (int i = 0; i < 12; i++) {
                String component = "c" + i;
                futures.add(pool.submit(() -> client.fetch("/api/measures/component", Map.of("component", component))));
            }
            for (Future<JsonNode> f : futures) {
                assertThat(f.get()).isNotNull();
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(server.count("/api/measures/component")).isEqualTo(12);
        assertThat(server.maxInFlight()).isLessThanOrEqualTo(5);
        assertThat(limiter.availableConcurrentCalls()).isEqualTo(5);
    }

    @Test
    void backToBackDispatchesAreSpacedByTheMinimumInterval() throws Exception {
        RequestLimiter spaced = new RequestLimiter(5, Duration.ofMillis(100), Duration.ofSeconds(10));
        long smallestGap = Long.MAX_VALUE;

        for (int round = 0; round < 6; round++) {
            Thread.sleep(150 + round * 9L);
            long first = spaced.execute(System::nanoTime);
            long second = spaced.execute(System::nanoTime);
            smallestGap = Math.min(smallestGap, second - first);
        }

        assertThat(Duration.ofNanos(smallestGap)).isGreaterThanOrEqualTo(Duration.ofMillis(100));
    }

    @Test
    void joinCookiesKeepsOnlyNameValuePairs() {
        assertThat(SonarClient.joinCookies(List.of("A=1; Path=/; HttpOnly", "B=2", " "))).isEqualTo("A=1; B=2");
        assertThat(SonarClient.joinCookies(null)).isEmpty();
    }

    @Test
    void blankBaseUrlIsRejectedAndTrailingSlashesAreDropped() {
        assertThatThrownBy(() -> SonarConnection.withToken(" ", "t"))
                .isInstanceOfSatisfying(SonarApiException.class,
                        e -> assertThat(e.getKind()).isEqualTo(SonarErrorKind.VALIDATION));
        assertThat(SonarConnection.withToken("http://sonar.local//", "t").baseUrl()).isEqualTo("http://sonar.local");
        assertThat(SonarConnection.withToken("http://sonar.local", "secret").toString()).doesNotContain("secret");
    }
}
