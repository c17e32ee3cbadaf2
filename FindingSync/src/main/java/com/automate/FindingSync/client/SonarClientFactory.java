package com.automate.FindingSync.client;

import com.automate.FindingSync.Config.SonarProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Builds per-server clients that all share the process-wide cache and limiter.
 */
@Component
@RequiredArgsConstructor
public class SonarClientFactory {

    private final WebClient.Builder sonarWebClientBuilder;
    private final ResponseCache sonarResponseCache;
    private final RequestLimiter sonarRequestLimiter;
    private final SonarProperties sonarProperties;
    private final ObjectMapper objectMapper;

    public SonarClient create(SonarConnection connection) {
        return new SonarClient(connection, sonarWebClientBuilder, sonarResponseCache,
                sonarRequestLimiter, sonarProperties, objectMapper);
    }
}
