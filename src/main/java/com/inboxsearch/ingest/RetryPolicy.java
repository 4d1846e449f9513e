package com.inboxsearch.ingest;

import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.inboxsearch.runtime.ConfigurationException;

/**
 * Bounded exponential backoff with jitter. Only {@link TransientProviderException} is retried; once the
 * attempts are used up the last failure is wrapped in a {@link ProviderUnavailableException}.
 */
public class RetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final int maxAttempts;
    private final long initialBackoffMs;
    private final long maxBackoffMs;
    private final Random random;

    public RetryPolicy(int maxAttempts, long initialBackoffMs, long maxBackoffMs) {
        this(maxAttempts, initialBackoffMs, maxBackoffMs, null);
    }

    public RetryPolicy(int maxAttempts, long initialBackoffMs, long maxBackoffMs, Random random) {
        if (maxAttempts < 1 || initialBackoffMs < 0 || maxBackoffMs < initialBackoffMs) {
            throw new ConfigurationException("retry policy requires maxAttempts >= 1 and 0 <= initialBackoffMs <= maxBackoffMs");
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoffMs = initialBackoffMs;
        this.maxBackoffMs = maxBackoffMs;
        this.random = random;
    }

    public static RetryPolicy noBackoff(int maxAttempts) {
        return new RetryPolicy(maxAttempts, 0, 0);
    }

    public <T> T execute(String operation, Supplier<T> attempt) {
        TransientProviderException last = null;
        for (int attemptNumber = 1; attemptNumber <= maxAttempts; attemptNumber++) {
            try {
                return attempt.get();
            } catch (TransientProviderException e) {
                last = e;
                if (attemptNumber == maxAttempts) {
                    break;
                }
                long backoff = backoffMillis(attemptNumber);
                log.warn("retry.scheduled operation={} attempt={} maxAttempts={} backoffMs={} reason={}",
                        operation, attemptNumber, maxAttempts, backoff, e.getMessage());
                sleep(operation, backoff);
            }
        }
        throw new ProviderUnavailableException(
                "%s unavailable after %d attempts: %s".formatted(operation, maxAttempts, last.getMessage()), last);
    }

    long backoffMillis(int attemptNumber) {
        if (initialBackoffMs == 0) {
            return 0;
        }
        long exponential = initialBackoffMs << Math.min(attemptNumber - 1, 30);
        long capped = Math.min(maxBackoffMs, exponential);
        long half = capped / 2;
        Random source = random == null ? ThreadLocalRandom.current() : random;
        return half + (long) (source.nextDouble() * (capped - half + 1));
    }

    private static void sleep(String operation, long backoff) {
        if (backoff <= 0) {
            return;
        }
        try {
            Thread.sleep(backoff);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderUnavailableException(operation + " interrupted during backoff", e);
        }
    }
}
