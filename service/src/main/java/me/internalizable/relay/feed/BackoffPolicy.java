package me.internalizable.relay.feed;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.Objects;

/**
 * Exponential reconnect backoff with a ceiling.
 *
 * <p>Attempt {@code n} (starting at 1) waits
 * {@code min(initialDelay * multiplier^(n-1), maxDelay)}.</p>
 *
 * @param initialDelay delay before the first reconnect attempt
 * @param maxDelay upper bound for any delay
 * @param multiplier growth factor between attempts, at least 1
 * @param maxAttempts attempts allowed before giving up, 0 for unlimited
 */
public record BackoffPolicy(
        @Nonnull Duration initialDelay,
        @Nonnull Duration maxDelay,
        double multiplier,
        int maxAttempts
) {

    public BackoffPolicy {
        Objects.requireNonNull(initialDelay, "initialDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        if (initialDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("Backoff delays must not be negative");
        }
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay " + maxDelay + " is shorter than initialDelay " + initialDelay);
        }
        if (multiplier < 1.0 || Double.isNaN(multiplier)) {
            throw new IllegalArgumentException("multiplier must be at least 1: " + multiplier);
        }
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must not be negative: " + maxAttempts);
        }
    }

    /**
     * 2s initial delay, doubling up to 30s, unlimited attempts.
     *
     * @return the default policy
     */
    @Nonnull
    public static BackoffPolicy defaults() {
        return new BackoffPolicy(Duration.ofSeconds(2), Duration.ofSeconds(30), 2.0, 0);
    }

    /**
     * Get the delay before a reconnect attempt.
     *
     * @param attempt the attempt number, starting at 1
     * @return the delay
     */
    @Nonnull
    public Duration delayFor(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be at least 1: " + attempt);
        }
        double millis = initialDelay.toMillis() * Math.pow(multiplier, attempt - 1);
        long capped = (long) Math.min(millis, (double) maxDelay.toMillis());
        return Duration.ofMillis(capped);
    }

    /**
     * Check whether an attempt exceeds the configured limit.
     *
     * @param attempt the attempt number, starting at 1
     * @return true if the attempt must not be made
     */
    public boolean isExhausted(int attempt) {
        return maxAttempts > 0 && attempt > maxAttempts;
    }
}
