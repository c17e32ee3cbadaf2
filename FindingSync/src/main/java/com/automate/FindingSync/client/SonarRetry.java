package com.automate.FindingSync.client;

import com.automate.FindingSync.exception.SonarApiException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.concurrent.TimeoutException;

/**
 * Retry policy for upstream calls: transient statuses, connection failures and
 * timeouts are retried; everything else fails on the first attempt.
 */
@Slf4j
final class SonarRetry {

    private SonarRetry() {
    }

    static boolean shouldRetry(Throwable ex) {
        if (ex instanceof WebClientRequestException) return true;
        if (ex instanceof TimeoutException) return true;
        if (ex instanceof IOException) return true;
        if (ex instanceof SonarApiException sae) {
            return sae.isTransient();
        }
        return false;
    }

    static Retry policy(int maxRetries, Duration backoff, Duration maxRetryAfter) {
        return Retry.from(signals -> signals.concatMap(signal -> {
            Throwable failure = signal.failure();
            long attempt = signal.totalRetries();
            if (!shouldRetry(failure) || attempt >= maxRetries) {
                return Mono.<Long>error(failure);
            }
            Duration delay = delayFor(failure, attempt, backoff, maxRetryAfter);
            log.warn("Retrying upstream call ({}/{}) in {} ms: {}",
                    attempt + 1, maxRetries, delay.toMillis(), failure.getMessage());
            return Mono.delay(delay);
        }));
    }

    /** Server-provided Retry-After wins, capped; otherwise exponential backoff. */
    static Duration delayFor(Throwable failure, long attempt, Duration backoff, Duration maxRetryAfter) {
        if (failure instanceof SonarApiException sae && sae.getRetryAfter() != null) {
            Duration retryAfter = sae.getRetryAfter();
            return retryAfter.compareTo(maxRetryAfter) > 0 ? maxRetryAfter : retryAfter;
        }
        return backoff.multipliedBy(1L << Math.min(attempt, 10));
    }

    /** Retry-After is either delta-seconds or an HTTP date. */
    static Duration parseRetryAfter(String header) {
        if (header == null || header.isBlank()) return null;
        String value = header.trim();
        try {
            return Duration.ofSeconds(Math.max(0, Long.parseLong(value)));
        } catch (NumberFormatException notSeconds) {
            try {
                ZonedDateTime at = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME);
                Duration until = Duration.between(ZonedDateTime.now(at.getZone()), at);
                return until.isNegative() ? Duration.ZERO : until;
            } catch (DateTimeParseException e) {
                log.debug("Ignoring unparsable Retry-After header '{}'", value);
                return null;
            }
        }
    }
}
