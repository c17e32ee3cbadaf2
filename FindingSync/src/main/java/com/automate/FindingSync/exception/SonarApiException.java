package com.automate.FindingSync.exception;

import java.time.Duration;
import java.util.Set;

public class SonarApiException extends RuntimeException {
    private static final int BODY_PREVIEW_MAX = 2_000;

    public static final Set<Integer> RETRYABLE_STATUS = Set.of(408, 429, 500, 502, 503, 504);

    private final SonarErrorKind kind;
    private final int statusCode;
    private final String responseBody;
    private final String method;
    private final String endpoint;
    private final Duration retryAfter;

    public SonarApiException(SonarErrorKind kind, int statusCode, String message, String responseBody,
                             String method, String endpoint, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
        this.responseBody = responseBody;
        this.method = method;
        this.endpoint = endpoint;
        this.retryAfter = retryAfter;
    }

    /** Non-2xx answer from the server. Retryable statuses are tagged transient. */
    public static SonarApiException of(int statusCode, String method, String endpoint, String body, Duration retryAfter) {
        SonarErrorKind kind = RETRYABLE_STATUS.contains(statusCode)
                ? SonarErrorKind.TRANSIENT_NETWORK
                : SonarErrorKind.UPSTREAM_API;
        String msg = method + " " + endpoint + " failed with status " + statusCode;
        return new SonarApiException(kind, statusCode, msg, body, method, endpoint, retryAfter, null);
    }

    /** No HTTP answer at all (DNS, refused connection, timeout). */
    public static SonarApiException network(String method, String endpoint, Throwable cause) {
        String reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new SonarApiException(SonarErrorKind.TRANSIENT_NETWORK, 0,
                "Network error on " + method + " " + endpoint + ": " + reason,
                null, method, endpoint, null, cause);
    }

    public static SonarApiException authentication(String message, SonarApiException cause) {
        int status = cause != null && cause.getStatusCode() > 0 ? cause.getStatusCode() : 401;
        return new SonarApiException(SonarErrorKind.AUTHENTICATION, status, message,
                cause != null ? cause.getResponseBody() : null,
                cause != null ? cause.getMethod() : null,
                cause != null ? cause.getEndpoint() : null,
                null, cause);
    }

    public static SonarApiException validation(String message) {
        return new SonarApiException(SonarErrorKind.VALIDATION, 0, message, null, null, null, null, null);
    }

    /** Same failure with collector context prepended; kind and status are kept. */
    public static SonarApiException wrap(String context, SonarApiException cause) {
        return new SonarApiException(cause.getKind(), cause.getStatusCode(),
                context + ": " + cause.getMessage(), cause.getResponseBody(),
                cause.getMethod(), cause.getEndpoint(), cause.getRetryAfter(), cause);
    }

    /** Re-tag a failure from a collector whose loss does not abort the run. */
    public SonarApiException asPartial() {
        return new SonarApiException(SonarErrorKind.PARTIAL_COLLECTION, statusCode, getMessage(),
                responseBody, method, endpoint, retryAfter, this);
    }

    public SonarErrorKind getKind() { return kind; }
    public int getStatusCode() { return statusCode; }
    public String getResponseBody() { return responseBody; }
    public String getMethod() { return method; }
    public String getEndpoint() { return endpoint; }
    public Duration getRetryAfter() { return retryAfter; }

    public boolean isTransient() { return kind == SonarErrorKind.TRANSIENT_NETWORK; }

    public boolean isServerError() { return statusCode >= 500; }

    public String bodyPreview() {
        if (responseBody == null) return null;
        return responseBody.length() <= BODY_PREVIEW_MAX
                ? responseBody
                : responseBody.substring(0, BODY_PREVIEW_MAX) + "...(truncated)";
    }

    @Override
    public String toString() {
        return "SonarApiException{kind=" + kind +
                ", statusCode=" + statusCode +
                ", method=" + method +
                ", endpoint=" + endpoint +
                ", message=" + getMessage() +
                ", bodyPreview=" + (responseBody == null ? "null" : bodyPreview()) +
                '}';
    }
}
