package com.pyflow.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.pyflow.model.ConversionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Retries transient {@link ProviderException}s with exponential backoff. Parse errors, empty
 * replies and configuration problems fail on the first attempt. Other runtime failures of the
 * delegate are wrapped with {@link ProviderException#unexpected}.
 */
public final class RetryingLlmProvider implements LlmProvider {

    private static final Logger log = LoggerFactory.getLogger(RetryingLlmProvider.class);

    /** Waits between attempts; replaced in tests. */
    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final LlmProvider delegate;
    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Sleeper sleeper;

    public RetryingLlmProvider(LlmProvider delegate, int maxAttempts, Duration initialBackoff) {
        this(delegate, maxAttempts, initialBackoff, d -> Thread.sleep(d.toMillis()));
    }

    RetryingLlmProvider(LlmProvider delegate, int maxAttempts, Duration initialBackoff, Sleeper sleeper) {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff != null && !initialBackoff.isNegative() ? initialBackoff : Duration.ZERO;
        this.sleeper = sleeper;
    }

    @Override
    public String complete(String prompt, String systemPrompt) {
        return withRetry(() -> delegate.complete(prompt, systemPrompt));
    }

    @Override
    public JsonNode completeJson(String prompt, String systemPrompt) {
        return withRetry(() -> delegate.completeJson(prompt, systemPrompt));
    }

    @Override
    public String modelName() {
        return delegate.modelName();
    }

    private <T> T withRetry(Supplier<T> call) {
        Duration backoff = initialBackoff;
        for (int attempt = 1; ; attempt++) {
            ProviderException e;
            try {
                return call.get();
            } catch (ProviderException failure) {
                e = failure;
            } catch (ConversionException failure) {
                throw failure;
            } catch (RuntimeException failure) {
                e = ProviderException.unexpected(delegate.modelName(), failure);
            }
            if (!e.isTransient() || attempt >= maxAttempts) throw e;
            log.warn("Transient provider failure, retrying | model={} attempt={}/{} backoffMs={} error={}",
                    delegate.modelName(), attempt, maxAttempts, backoff.toMillis(), e.getMessage());
            try {
                sleeper.sleep(backoff);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new ProviderException("Interrupted while waiting to retry: " + e.getMessage(),
                        e.getStatusCode(), false, ie);
            }
            backoff = backoff.multipliedBy(2);
        }
    }
}
