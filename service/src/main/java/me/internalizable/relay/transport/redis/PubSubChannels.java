package me.internalizable.relay.transport.redis;

import javax.annotation.Nonnull;
import java.util.concurrent.CompletionStage;

/**
 * The pub/sub commands {@link RedisChangeTransport} issues.
 *
 * <p>Backed by Lettuce's async pub/sub commands in production.</p>
 */
interface PubSubChannels {

    /**
     * Subscribe to a Redis channel.
     *
     * @param channel the Redis channel
     * @return completes once Redis acknowledges the subscription
     */
    @Nonnull
    CompletionStage<Void> subscribe(@Nonnull String channel);

    /**
     * Unsubscribe from a Redis channel.
     *
     * @param channel the Redis channel
     */
    void unsubscribe(@Nonnull String channel);
}
