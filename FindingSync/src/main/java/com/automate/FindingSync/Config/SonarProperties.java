package com.automate.FindingSync.Config;

import jakarta.validation.constraints.*;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Upstream client settings: paging, timeouts, retry, cache and request limiter.
 */
@Data
@Validated
@ConfigurationProperties("sonar")
public class SonarProperties {

    @Min(1) @Max(500)
    private int pageSize = 500;

    /** Hard cap on pages per paginated call (20 x 500 = 10,000 results). */
    @Min(1) @Max(100)
    private int maxPages = 20;

    @Min(100) @Max(60000)
    private int connectTimeoutMs = 10000;

    @Min(500) @Max(180000)
    private int requestTimeoutMs = 30000;

    @PositiveOrZero
    private int maxRetries = 3;

    @PositiveOrZero
    private long retryBackoffMs = 1000;

    @PositiveOrZero
    private long maxRetryAfterMs = 10000;

    @Positive
    private int cacheMaxSize = 1000;

    @Positive
    private long cacheTtlMs = 300000;

    @Positive
    private int maxConcurrent = 5;

    @Positive
    private long minIntervalMs = 100;

    @Positive
    private long limiterMaxWaitMs = 600000;

    @Min(262144)
    private int maxResponseBytes = 32 * 1024 * 1024;
}
