package me.internalizable.relay.transport.redis;

import io.lettuce.core.pubsub.RedisPubSubAdapter;

import java.util.function.BiConsumer;

/**
 * Redis pub/sub listener that forwards change payloads.
 *
 * <p>Receives raw messages from Redis and hands them to the transport for
 * decoding and routing.</p>
 */
public final class RedisChangeListener extends RedisPubSubAdapter<String, String> {

    private final BiConsumer<String, String> messageHandler;

    /**
     * Create a new Redis change listener.
     *
     * @param messageHandler receives (redisChannel, json) for each message
     */
    public RedisChangeListener(BiConsumer<String, String> messageHandler) {
        this.messageHandler = messageHandler;
    }

    @Override
    public void message(String channel, String message) {
        messageHandler.accept(channel, message);
    }
}
