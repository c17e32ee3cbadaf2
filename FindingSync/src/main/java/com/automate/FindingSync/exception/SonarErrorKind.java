package com.automate.FindingSync.exception;

/**
 * Closed set of failure kinds raised while talking to the upstream server.
 */
public enum SonarErrorKind {
    /** Timeouts, connection failures and retryable statuses, after retries ran out. */
    TRANSIENT_NETWORK,
    /** Non-retryable HTTP status such as 401/403/404. */
    UPSTREAM_API,
    /** Credentials were rejected. */
    AUTHENTICATION,
    /** Required configuration is missing or inconsistent; raised before any network call. */
    VALIDATION,
    /** A non-critical collector failed; its contribution is treated as empty. */
    PARTIAL_COLLECTION;

    public boolean abortsRun() {
        return this != PARTIAL_COLLECTION;
    }
}
