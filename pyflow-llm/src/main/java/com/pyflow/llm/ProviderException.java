package com.pyflow.llm;

import com.pyflow.model.ConversionException;

import java.io.UncheckedIOException;

/**
 * Failure talking to an LLM provider: connection problems, timeouts, non-success HTTP status,
 * empty replies or missing configuration. {@link #isTransient()} tells the retry decorator
 * whether another attempt may succeed.
 */
public final class ProviderException extends ConversionException {

    /** Status code when the failure came from an HTTP reply; otherwise -1. */
    private final int statusCode;
    private final boolean transientFailure;

    public ProviderException(String message, int statusCode, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.transientFailure = transientFailure;
    }

    /** Non-success HTTP status; 408, 429 and 5xx are transient. */
    public static ProviderException httpStatus(String provider, int status, String body) {
        boolean retry = status == 408 || status == 429 || status >= 500;
        return new ProviderException(String.format("%s returned HTTP %d: %s", provider, status, abbreviate(body)),
                status, retry, null);
    }

    public static ProviderException unreachable(String provider, Throwable cause) {
        return new ProviderException(String.format("%s request failed: %s", provider, cause.getMessage()), -1, true, cause);
    }

    /** Wraps a runtime failure the provider did not translate itself; I/O problems are transient. */
    public static ProviderException unexpected(String provider, RuntimeException cause) {
        if (cause instanceof UncheckedIOException) return unreachable(provider, cause);
        return new ProviderException(String.format("%s failed: %s", provider, cause), -1, false, cause);
    }

    public static ProviderException emptyResponse(String provider) {
        return new ProviderException(String.format("%s returned an empty response", provider), -1, false, null);
    }

    public static ProviderException configuration(String message) {
        return new ProviderException(message, -1, false, null);
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isTransient() {
        return transientFailure;
    }

    static String abbreviate(String text) {
        if (text == null) return "";
        String flat = text.strip();
        return flat.length() > 300 ? flat.substring(0, 300) + "...[truncated length=" + flat.length() + "]" : flat;
    }
}
