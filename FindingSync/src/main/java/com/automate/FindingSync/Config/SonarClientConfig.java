package com.automate.FindingSync.Config;

import com.automate.FindingSync.client.RequestLimiter;
import com.automate.FindingSync.client.ResponseCache;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Process-wide collaborators shared by every SonarClient: one response cache
 * and one request limiter, whatever the number of projects syncing.
 */
@Configuration
public class SonarClientConfig {

    @Bean
    public ResponseCache sonarResponseCache(SonarProperties props, ObjectMapper objectMapper) {
        return new ResponseCache(props.getCacheMaxSize(), Duration.ofMillis(props.getCacheTtlMs()), objectMapper);
    }

    @Bean
    public RequestLimiter sonarRequestLimiter(SonarProperties props) {
        return new RequestLimiter(
                props.getMaxConcurrent(),
                Duration.ofMillis(props.getMinIntervalMs()),
                Duration.ofMillis(props.getLimiterMaxWaitMs()));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
