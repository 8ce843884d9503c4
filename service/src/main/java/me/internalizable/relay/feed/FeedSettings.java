package me.internalizable.relay.feed;

import me.internalizable.relay.config.RelayConfig;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.Objects;

/**
 * Immutable timing settings of a {@link SubscriptionMultiplexer}.
 *
 * @param debounce default quiet period before a delivery
 * @param gracePeriod delay between a channel losing its last handler and its teardown
 * @param backoff reconnect policy for failed channels
 * @param logAllChannels log every channel's transitions at INFO, not only those
 *                       subscribed with {@code enableLogging}
 */
public record FeedSettings(
        @Nonnull Duration debounce,
        @Nonnull Duration gracePeriod,
        @Nonnull BackoffPolicy backoff,
        boolean logAllChannels
) {

    public FeedSettings {
        Objects.requireNonNull(debounce, "debounce");
        Objects.requireNonNull(gracePeriod, "gracePeriod");
        Objects.requireNonNull(backoff, "backoff");
        if (debounce.isNegative()) {
            throw new IllegalArgumentException("debounce must not be negative: " + debounce);
        }
        if (gracePeriod.isNegative()) {
            throw new IllegalArgumentException("gracePeriod must not be negative: " + gracePeriod);
        }
    }

    public FeedSettings(@Nonnull Duration debounce, @Nonnull Duration gracePeriod, @Nonnull BackoffPolicy backoff) {
        this(debounce, gracePeriod, backoff, false);
    }

    @Nonnull
    public static FeedSettings defaults() {
        return new FeedSettings(Duration.ofMillis(500), Duration.ofMillis(5000), BackoffPolicy.defaults());
    }

    @Nonnull
    public static FeedSettings fromConfig(@Nonnull RelayConfig config) {
        Objects.requireNonNull(config, "config");
        BackoffPolicy backoff = new BackoffPolicy(
                Duration.ofMillis(config.getRetryInitialDelayMs()),
                Duration.ofMillis(config.getRetryMaxDelayMs()),
                config.getRetryMultiplier(),
                config.getMaxRetryAttempts());
        return new FeedSettings(
                Duration.ofMillis(config.getDefaultDebounceMs()),
                Duration.ofMillis(config.getGracePeriodMs()),
                backoff,
                config.isDebugLogging());
    }
}
