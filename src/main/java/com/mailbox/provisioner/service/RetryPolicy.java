package com.mailbox.provisioner.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.NoBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.support.RetryTemplate;

import java.io.IOException;
import java.time.Duration;

public final class RetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final int maxAttempts;
    private final RetryTemplate ioTemplate;
    private final RetryTemplate stepTemplate;

    RetryPolicy(int maxAttempts, BackOffPolicy backOff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.maxAttempts = maxAttempts;
        this.ioTemplate = RetryTemplate.builder()
                .maxAttempts(maxAttempts)
                .retryOn(IOException.class)
                .customBackoff(backOff)
                .build();
        this.stepTemplate = RetryTemplate.builder()
                .maxAttempts(maxAttempts)
                .retryOn(TransientStepException.class)
                .customBackoff(backOff)
                .build();
    }

    /**
     * {@code base * 2^(attempt-1)}, capped at {@code max}.
     */
    public static RetryPolicy exponential(int maxAttempts, Duration base, Duration max) {
        return exponential(maxAttempts, base, max, new ThreadWaitSleeper());
    }

    static RetryPolicy exponential(int maxAttempts, Duration base, Duration max, Sleeper sleeper) {
        ExponentialBackOffPolicy backOff = new ExponentialBackOffPolicy();
        backOff.setInitialInterval(Math.max(1, base.toMillis()));
        backOff.setMultiplier(2.0);
        backOff.setMaxInterval(Math.max(1, max.toMillis()));
        backOff.setSleeper(sleeper);
        return new RetryPolicy(maxAttempts, backOff);
    }

    public static RetryPolicy noBackoff(int maxAttempts) {
        return new RetryPolicy(maxAttempts, new NoBackOffPolicy());
    }

    static Duration exponentialBackoff(Duration base, Duration max, int attempt) {
        int shift = Math.max(0, Math.min(attempt - 1, 30));
        Duration candidate = base.multipliedBy(1L << shift);
        return candidate.compareTo(max) > 0 ? max : candidate;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * Retries {@code action} on {@link IOException}; the last failure is rethrown.
     */
    public <T> T execute(String operation, RetryCallback<T, IOException> action) throws IOException {
        RetryCallback<T, IOException> logged = context -> {
            try {
                return action.doWithRetry(context);
            } catch (IOException ex) {
                log.warn("{} failed (attempt {}/{}): {}", operation, context.getRetryCount() + 1, maxAttempts,
                        ex.getMessage());
                throw ex;
            }
        };
        return ioTemplate.execute(logged);
    }

    /**
     * Retries {@code step} while it throws {@link TransientStepException}. Any
     * other exception ends the loop at once.
     *
     * @throws TransientStepException when every attempt failed transiently
     */
    public <T> T retryTransient(RetryCallback<T, RuntimeException> step) {
        return stepTemplate.execute(step);
    }
}
