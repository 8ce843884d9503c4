package me.internalizable.relay.transport.redis;

import io.lettuce.core.RedisChannelHandler;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisConnectionStateListener;
import io.lettuce.core.RedisURI;
import io.lettuce.core.pubsub.StatefulRedisPubSubConnection;
import io.lettuce.core.pubsub.api.async.RedisPubSubAsyncCommands;
import me.internalizable.relay.api.event.SubscribedEvent;
import me.internalizable.relay.api.table.RowFilter;
import me.internalizable.relay.api.table.Table;
import me.internalizable.relay.config.RelayConfig;
import me.internalizable.relay.transport.ChangePayloadDecoder;
import me.internalizable.relay.transport.ChangePayloadDecoder.DecodedChange;
import me.internalizable.relay.transport.ChangeTransport;
import me.internalizable.relay.transport.ChannelHandle;
import me.internalizable.relay.transport.RowFilterMatcher;
import me.internalizable.relay.transport.TransportListener;
import me.internalizable.relay.transport.TransportStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Redis-based change transport using Lettuce.
 *
 * <p>The change-data-capture producer publishes every row change of a table as a
 * JSON payload on {@code <prefix><table>}. This transport keeps one Redis
 * subscription per table, shared by every channel on that table, and evaluates
 * event selectors and row filters locally.</p>
 *
 * <h2>Status reporting</h2>
 * <ul>
 *   <li>{@code SUBSCRIBED} once Redis acknowledges the table subscription</li>
 *   <li>{@code TIMED_OUT} if the acknowledgement does not arrive in time</li>
 *   <li>{@code CHANNEL_ERROR} if the subscribe command fails or the connection drops</li>
 * </ul>
 */
public final class RedisChangeTransport implements ChangeTransport {

    private static final Logger LOGGER = LoggerFactory.getLogger(RedisChangeTransport.class);
    private static final Duration CONNECTION_TIMEOUT = Duration.ofSeconds(10);

    private final RelayConfig config;
    private final ChangePayloadDecoder decoder;
    private final Duration subscribeTimeout;

    private RedisClient redisClient;
    private StatefulRedisPubSubConnection<String, String> pubSubConnection;
    private volatile PubSubChannels pubSub;

    private final Map<Long, RedisChannel> channels = new ConcurrentHashMap<>();
    private final Map<String, TableSubscription> tableSubscriptions = new HashMap<>();
    private final AtomicLong handleIdCounter = new AtomicLong(0);
    private final AtomicBoolean connected = new AtomicBoolean(false);

    public RedisChangeTransport(@Nonnull RelayConfig config, @Nonnull ChangePayloadDecoder decoder) {
        this(config, decoder, Duration.ofSeconds(config.getChannelTimeoutSeconds()));
    }

    RedisChangeTransport(@Nonnull RelayConfig config, @Nonnull ChangePayloadDecoder decoder,
                         @Nonnull Duration subscribeTimeout) {
        this.config = Objects.requireNonNull(config, "config");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.subscribeTimeout = Objects.requireNonNull(subscribeTimeout, "subscribeTimeout");
    }

    // ==================== Connection ====================

    @Override
    public void start() {
        RedisURI redisUri = buildRedisUri(config);
        LOGGER.info("Connecting to Redis at {}:{}", config.getRedisHost(), config.getRedisPort());

        this.redisClient = RedisClient.create(redisUri);
        redisClient.addListener(new ConnectionStateListener());
        this.pubSubConnection = redisClient.connectPubSub();
        pubSubConnection.addListener(new RedisChangeListener(this::handleMessage));

        attach(lettuceChannels(pubSubConnection.async()));
        LOGGER.info("Redis change transport connected");
    }

    /**
     * Start issuing pub/sub commands through the given channels.
     */
    void attach(@Nonnull PubSubChannels channels) {
        this.pubSub = Objects.requireNonNull(channels, "channels");
        connected.set(true);
    }

    private static PubSubChannels lettuceChannels(RedisPubSubAsyncCommands<String, String> commands) {
        return new PubSubChannels() {
            @Override
            @Nonnull
            public CompletionStage<Void> subscribe(@Nonnull String channel) {
                return commands.subscribe(channel);
            }

            @Override
            public void unsubscribe(@Nonnull String channel) {
                commands.unsubscribe(channel);
            }
        };
    }

    private RedisURI buildRedisUri(RelayConfig config) {
        RedisURI.Builder uriBuilder = RedisURI.builder()
                .withHost(config.getRedisHost())
                .withPort(config.getRedisPort())
                .withDatabase(config.getRedisDatabase())
                .withTimeout(CONNECTION_TIMEOUT);

        if (config.getRedisPassword() != null && !config.getRedisPassword().isBlank()) {
            uriBuilder.withPassword(config.getRedisPassword().toCharArray());
        }

        if (config.isRedisSsl()) {
            uriBuilder.withSsl(true);
        }

        return uriBuilder.build();
    }

    public boolean isConnected() {
        return connected.get() && (pubSubConnection == null || pubSubConnection.isOpen());
    }

    @Override
    public void shutdown() {
        LOGGER.info("Shutting down Redis change transport");
        connected.set(false);
        pubSub = null;
        channels.clear();
        synchronized (tableSubscriptions) {
            tableSubscriptions.clear();
        }

        try {
            if (pubSubConnection != null) {
                pubSubConnection.close();
            }
            if (redisClient != null) {
                redisClient.shutdown();
            }
        } catch (Exception e) {
            LOGGER.error("Error during Redis shutdown", e);
        }
    }

    // ==================== Channels ====================

    @Override
    @Nonnull
    public ChannelHandle openChannel(
            @Nonnull String name,
            @Nonnull Table table,
            @Nonnull SubscribedEvent event,
            @Nullable RowFilter filter,
            @Nonnull TransportListener listener) {
        PubSubChannels commands = pubSub;
        if (commands == null) {
            throw new IllegalStateException("Redis change transport is not started");
        }

        ChannelHandle handle = new ChannelHandle(handleIdCounter.incrementAndGet(), name);
        String redisChannel = config.getRedisChannelPrefix() + table.tableName();

        TableSubscription subscription;
        synchronized (tableSubscriptions) {
            subscription = tableSubscriptions.get(redisChannel);
            if (subscription == null || subscription.failed) {
                // a failed entry stays with the handles that hold it
                subscription = new TableSubscription(redisChannel);
                tableSubscriptions.put(redisChannel, subscription);
                subscription.confirmation = subscribe(commands, subscription);
            }
            subscription.references++;
        }

        RedisChannel channel = new RedisChannel(handle, subscription, table, event, filter, listener);
        channels.put(handle.id(), channel);

        subscription.confirmation.copy()
                .orTimeout(subscribeTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((ignored, error) -> {
                    if (channels.get(handle.id()) != channel) {
                        return;
                    }
                    if (error == null) {
                        listener.onStatus(TransportStatus.SUBSCRIBED, null);
                    } else {
                        Throwable cause = unwrap(error);
                        listener.onStatus(cause instanceof TimeoutException
                                ? TransportStatus.TIMED_OUT
                                : TransportStatus.CHANNEL_ERROR, cause);
                    }
                });

        return handle;
    }

    private CompletableFuture<Void> subscribe(PubSubChannels commands, TableSubscription subscription) {
        String redisChannel = subscription.redisChannel;
        CompletableFuture<Void> future;
        try {
            future = commands.subscribe(redisChannel).toCompletableFuture();
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }

        future.whenComplete((ignored, error) -> {
            if (error == null) {
                LOGGER.debug("Subscribed to Redis channel: {}", redisChannel);
                return;
            }
            LOGGER.warn("Failed to subscribe to Redis channel {}: {}", redisChannel, unwrap(error).getMessage());
            synchronized (tableSubscriptions) {
                subscription.failed = true;
                if (tableSubscriptions.get(redisChannel) == subscription) {
                    tableSubscriptions.remove(redisChannel);
                }
            }
        });
        return future;
    }

    @Override
    public void closeChannel(@Nonnull ChannelHandle handle) {
        RedisChannel channel = channels.remove(handle.id());
        if (channel == null) {
            return;
        }

        TableSubscription subscription = channel.subscription();
        synchronized (tableSubscriptions) {
            subscription.references--;
            if (subscription.references > 0) {
                return;
            }
            if (tableSubscriptions.get(subscription.redisChannel) == subscription) {
                tableSubscriptions.remove(subscription.redisChannel);
            }
            PubSubChannels commands = pubSub;
            if (!subscription.failed && commands != null) {
                commands.unsubscribe(subscription.redisChannel);
                LOGGER.debug("Unsubscribed from Redis channel: {} (no more channels)", subscription.redisChannel);
            }
        }
    }

    /**
     * Count the handles currently sharing the Redis subscription of a table.
     *
     * @param table the table
     * @return the reference count of the live subscription, 0 if there is none
     */
    public int getSubscriberCount(@Nonnull Table table) {
        synchronized (tableSubscriptions) {
            TableSubscription subscription = tableSubscriptions.get(config.getRedisChannelPrefix() + table.tableName());
            return subscription != null ? subscription.references : 0;
        }
    }

    // ==================== Internal ====================

    void handleMessage(String redisChannel, String json) {
        Optional<DecodedChange> decoded = decoder.decode(json);
        if (decoded.isEmpty()) {
            return;
        }

        DecodedChange change = decoded.get();
        for (RedisChannel channel : channels.values()) {
            if (!channel.subscription().redisChannel.equals(redisChannel) || channel.table() != change.table()) {
                continue;
            }
            if (!RowFilterMatcher.accepts(channel.event(), channel.filter(), change.event())) {
                continue;
            }
            try {
                channel.listener().onChange(change.event());
            } catch (Exception e) {
                LOGGER.error("Error delivering change on {}", channel.handle().name(), e);
            }
        }
    }

    /**
     * Report CHANNEL_ERROR on every open channel after the connection dropped.
     */
    void onConnectionLost() {
        if (!connected.getAndSet(false)) {
            return;
        }
        LOGGER.warn("Lost connection to Redis, failing {} open channel(s)", channels.size());
        IllegalStateException cause = new IllegalStateException("Redis connection lost");
        for (RedisChannel channel : channels.values()) {
            channel.listener().onStatus(TransportStatus.CHANNEL_ERROR, cause);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * One SUBSCRIBE on a table's Redis channel, shared by the handles opened on it.
     * Guarded by {@code tableSubscriptions}.
     */
    private static final class TableSubscription {
        private final String redisChannel;
        private CompletableFuture<Void> confirmation;
        private int references;
        private boolean failed;

        TableSubscription(String redisChannel) {
            this.redisChannel = redisChannel;
        }
    }

    private record RedisChannel(
            ChannelHandle handle,
            TableSubscription subscription,
            Table table,
            SubscribedEvent event,
            RowFilter filter,
            TransportListener listener
    ) {
    }

    private final class ConnectionStateListener implements RedisConnectionStateListener {

        @Override
        public void onRedisConnected(RedisChannelHandler<?, ?> connection, SocketAddress socketAddress) {
            connected.set(true);
            LOGGER.info("Connected to Redis at {}", socketAddress);
        }

        @Override
        public void onRedisDisconnected(RedisChannelHandler<?, ?> connection) {
            onConnectionLost();
        }

        @Override
        public void onRedisExceptionCaught(RedisChannelHandler<?, ?> connection, Throwable cause) {
            LOGGER.warn("Redis connection error: {}", cause.getMessage());
        }
    }
}
