package com.automate.FindingSync.client;

import com.automate.FindingSync.Config.SonarProperties;
import com.automate.FindingSync.exception.SonarApiException;
import com.automate.FindingSync.exception.SonarErrorKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * HTTP access to one SonarQube server. GET responses are cached, every network
 * call goes through the shared {@link RequestLimiter} and transient failures
 * are retried.
 */
@Slf4j
public class SonarClient {

    public static final String STATUS_PATH = "/api/system/status";
    public static final String LOGIN_PATH = "/api/authentication/login";
    public static final String VALIDATE_PATH = "/api/authentication/validate";

    private final SonarConnection connection;
    private final WebClient webClient;
    private final ResponseCache cache;
    private final RequestLimiter limiter;
    private final SonarProperties props;
    private final ObjectMapper mapper;

    /** Authorization or Cookie header once authenticated. */
    private final Map<String, String> authHeaders = new ConcurrentHashMap<>();

    public SonarClient(SonarConnection connection, WebClient.Builder builder, ResponseCache cache,
                       RequestLimiter limiter, SonarProperties props, ObjectMapper mapper) {
        this.connection = connection;
        this.webClient = builder.clone().baseUrl(connection.baseUrl()).build();
        this.cache = cache;
        this.limiter = limiter;
        this.props = props;
        this.mapper = mapper;
    }

    public String getBaseUrl() {
        return connection.baseUrl();
    }

    public SonarConnection getConnection() {
        return connection;
    }

    public JsonNode get(String endpoint) {
        return get(endpoint, Map.of());
    }

    /** Cached GET. A hit never touches the network or the limiter. */
    public JsonNode get(String endpoint, Map<String, String> params) {
        String path = normalize(endpoint);
        String key = cache.key(connection.baseUrl(), path, params);
        JsonNode cached = cache.get(key);
        if (cached != null) {
            log.debug("Cache hit GET {} {}", path, params);
            return cached;
        }
        JsonNode body = fetch(path, params);
        cache.put(key, body);
        return body;
    }

    /** Uncached GET. */
    public JsonNode fetch(String endpoint, Map<String, String> params) {
        String path = normalize(endpoint);
        return readJson(exchange(HttpMethod.GET, path, params, null), HttpMethod.GET, path);
    }

    public JsonNode post(String endpoint, Map<String, String> form) {
        String path = normalize(endpoint);
        return readJson(exchange(HttpMethod.POST, path, Map.of(), form), HttpMethod.POST, path);
    }

    public <T> List<T> paginate(String endpoint, Map<String, String> params, PageProcessor<T> processor) {
        return paginate(endpoint, params, processor, props.getPageSize());
    }

    /**
     * Reads pages 1..n until one holds fewer than {@code pageSize} items or the
     * page cap is reached. Hitting the cap truncates the result with a warning.
     */
    public <T> List<T> paginate(String endpoint, Map<String, String> params, PageProcessor<T> processor, int pageSize) {
        List<T> results = new ArrayList<>();
        int maxPages = props.getMaxPages();
        for (int page = 1; ; page++) {
            Map<String, String> pageParams = new LinkedHashMap<>(params);
            pageParams.put("ps", String.valueOf(pageSize));
            pageParams.put("p", String.valueOf(page));

            int count = processor.process(get(endpoint, pageParams), results);
            if (count < pageSize) {
                break;
            }
            if (page >= maxPages) {
                log.warn("Reached the {} page limit ({} results) on {}, results truncated",
                        maxPages, maxPages * pageSize, endpoint);
                break;
            }
        }
        return results;
    }

    /**
     * Bearer token when configured, otherwise a session cookie from a form login.
     * Either way the credentials are checked against the validate endpoint.
     */
    public void authenticate() {
        if (connection.hasToken()) {
            authHeaders.put(HttpHeaders.AUTHORIZATION, "Bearer " + connection.token());
        } else if (connection.hasPassword()) {
            Map<String, String> form = new LinkedHashMap<>();
            form.put("login", connection.username());
            form.put("password", connection.password());
            ResponseEntity<String> resp;
            try {
                resp = exchange(HttpMethod.POST, LOGIN_PATH, Map.of(), form);
            } catch (SonarApiException e) {
                if (e.isTransient()) throw e;
                throw SonarApiException.authentication("Login rejected for user " + connection.username(), e);
            }
            String cookies = joinCookies(resp.getHeaders().get(HttpHeaders.SET_COOKIE));
            if (cookies.isEmpty()) {
                log.warn("Login to {} returned no session cookie", connection.baseUrl());
            } else {
                authHeaders.put(HttpHeaders.COOKIE, cookies);
            }
        } else {
            throw SonarApiException.validation("No SonarQube credentials configured (token or username/password)");
        }

        JsonNode validation;
        try {
            validation = fetch(VALIDATE_PATH, Map.of());
        } catch (SonarApiException e) {
            if (e.isTransient()) throw e;
            throw SonarApiException.authentication("Credential validation failed", e);
        }
        if (validation.has("valid") && !validation.path("valid").asBoolean()) {
            throw SonarApiException.authentication("SonarQube rejected the provided credentials", null);
        }
        log.info("Authenticated against {}", connection.baseUrl());
    }

    public String detectVersion() {
        String version = get(STATUS_PATH).path("version").asText(null);
        log.info("SonarQube version at {}: {}", connection.baseUrl(), version);
        return version;
    }

    /** Keeps the name=value part of every Set-Cookie header, joined for a Cookie header. */
    static String joinCookies(List<String> setCookies) {
        if (setCookies == null) return "";
        return setCookies.stream()
                .map(c -> c.split(";", 2)[0].trim())
                .filter(c -> !c.isEmpty())
                .collect(Collectors.joining("; "));
    }

    private ResponseEntity<String> exchange(HttpMethod method, String path,
                                            Map<String, String> params, Map<String, String> form) {
        Mono<ResponseEntity<String>> call = request(method, path, params, form)
                .timeout(Duration.ofMillis(props.getRequestTimeoutMs()))
                .retryWhen(SonarRetry.policy(
                        props.getMaxRetries(),
                        Duration.ofMillis(props.getRetryBackoffMs()),
                        Duration.ofMillis(props.getMaxRetryAfterMs())));
        try {
            log.debug("{} {}{} {}", method, connection.baseUrl(), path, params);
            return limiter.execute(call::block);
        } catch (BulkheadFullException | RequestNotPermitted e) {
            throw SonarApiException.network(method.name(), path, e);
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof SonarApiException sae) throw sae;
            if (SonarRetry.shouldRetry(cause)) throw SonarApiException.network(method.name(), path, cause);
            throw e;
        }
    }

    private Mono<ResponseEntity<String>> request(HttpMethod method, String path,
                                                 Map<String, String> params, Map<String, String> form) {
        WebClient.RequestBodySpec spec = webClient.method(method)
                .uri(b -> {
                    b.path(path);
                    params.forEach((k, v) -> b.queryParam(k, v));
                    return b.build();
                })
                .headers(h -> authHeaders.forEach(h::set));

        WebClient.RequestHeadersSpec<?> req = form == null
                ? spec
                : spec.contentType(MediaType.APPLICATION_FORM_URLENCODED).body(BodyInserters.fromFormData(toMultiValue(form)));

        return req.retrieve()
                .onStatus(HttpStatusCode::isError, resp ->
                        resp.bodyToMono(String.class).defaultIfEmpty("")
                                .flatMap(body -> Mono.error(SonarApiException.of(
                                        resp.statusCode().value(), method.name(), path, body,
                                        SonarRetry.parseRetryAfter(resp.headers().asHttpHeaders().getFirst(HttpHeaders.RETRY_AFTER)))))
                )
                .toEntity(String.class);
    }

    private JsonNode readJson(ResponseEntity<String> resp, HttpMethod method, String path) {
        String body = resp.getBody();
        if (body == null || body.isBlank()) {
            return mapper.createObjectNode();
        }
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new SonarApiException(SonarErrorKind.UPSTREAM_API, resp.getStatusCode().value(),
                    "Invalid JSON from " + method + " " + path, body, method.name(), path, null, e);
        }
    }

    private static MultiValueMap<String, String> toMultiValue(Map<String, String> form) {
        MultiValueMap<String, String> map = new LinkedMultiValueMap<>();
        form.forEach(map::add);
        return map;
    }

    private static String normalize(String endpoint) {
        return endpoint.startsWith("/") ? endpoint : "/" + endpoint;
    }
}
