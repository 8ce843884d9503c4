package me.internalizable.relay;

import me.internalizable.relay.api.feed.ChangeFeedService;
import me.internalizable.relay.config.RelayConfig;
import me.internalizable.relay.feed.FeedSettings;
import me.internalizable.relay.feed.SubscriptionMultiplexer;
import me.internalizable.relay.feed.wrapper.BookingRestaurantLookup;
import me.internalizable.relay.feed.wrapper.TableSubscriptions;
import me.internalizable.relay.scheduler.RelayScheduler;
import me.internalizable.relay.transport.ChangePayloadDecoder;
import me.internalizable.relay.transport.ChangeTransport;
import me.internalizable.relay.transport.local.LocalChangeTransport;
import me.internalizable.relay.transport.redis.RedisChangeTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Wires the change feed together and owns its lifecycle.
 *
 * <p>One runtime is created at application startup. {@link #start()} connects the
 * transport and initializes the feed; {@link #shutdown()} tears every channel
 * down and stops the scheduler thread.</p>
 *
 * <pre>{@code
 * RelayRuntime runtime = RelayRuntime.create(Path.of("relay.yml"));
 * runtime.start();
 * ChangeFeedService feed = runtime.getFeed();
 * }</pre>
 */
public final class RelayRuntime {

    private static final Logger LOGGER = LoggerFactory.getLogger(RelayRuntime.class);

    private final RelayConfig config;
    private final RelayScheduler scheduler;
    private final ChangePayloadDecoder decoder = new ChangePayloadDecoder();

    private ChangeTransport transport;
    private SubscriptionMultiplexer feed;
    private boolean running;

    public RelayRuntime(@Nonnull RelayConfig config) {
        this(config, new RelayScheduler());
    }

    public RelayRuntime(@Nonnull RelayConfig config, @Nonnull RelayScheduler scheduler) {
        this.config = Objects.requireNonNull(config, "config");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    /**
     * Create a runtime from a YAML configuration file, writing the defaults if it
     * does not exist.
     *
     * @param configPath the configuration file
     * @return the runtime, not yet started
     * @throws IOException if the file cannot be read or written
     */
    @Nonnull
    public static RelayRuntime create(@Nonnull Path configPath) throws IOException {
        return new RelayRuntime(RelayConfig.load(configPath));
    }

    // ==================== Lifecycle ====================

    public synchronized void start() {
        if (running) {
            return;
        }

        this.transport = initializeTransport();
        this.feed = new SubscriptionMultiplexer(transport, scheduler, FeedSettings.fromConfig(config));
        feed.init();
        running = true;
        LOGGER.info("Relay started");
    }

    private ChangeTransport initializeTransport() {
        if (config.isRedisEnabled()) {
            RedisChangeTransport redis = new RedisChangeTransport(config, decoder);
            try {
                redis.start();
                LOGGER.info("Using Redis change transport");
                return redis;
            } catch (Exception e) {
                LOGGER.error("Failed to connect to Redis, falling back to local transport", e);
                redis.shutdown();
            }
        }

        LocalChangeTransport local = new LocalChangeTransport(scheduler, decoder);
        local.start();
        LOGGER.info("Using local change transport");
        return local;
    }

    public synchronized void shutdown() {
        if (!running) {
            return;
        }
        running = false;

        LOGGER.info("Shutting down Relay");
        feed.cleanup();
        try {
            transport.shutdown();
        } catch (Exception e) {
            LOGGER.error("Error shutting down change transport", e);
        }
        scheduler.shutdown();
    }

    public synchronized boolean isRunning() {
        return running;
    }

    // ==================== Accessors ====================

    @Nonnull
    public ChangeFeedService getFeed() {
        return requireFeed();
    }

    /**
     * Create the table helpers bound to this runtime's feed.
     *
     * @param bookingLookup resolves bookings for availability subscriptions, or null
     * @return the helpers
     */
    @Nonnull
    public TableSubscriptions tableSubscriptions(@Nullable BookingRestaurantLookup bookingLookup) {
        return new TableSubscriptions(requireFeed(), bookingLookup);
    }

    private synchronized SubscriptionMultiplexer requireFeed() {
        if (feed == null) {
            throw new IllegalStateException("Relay is not started");
        }
        return feed;
    }

    /**
     * Get the in-process transport, used to publish changes when Redis is disabled.
     *
     * @return the local transport, or empty when running on Redis or not started
     */
    @Nonnull
    public synchronized Optional<LocalChangeTransport> getLocalTransport() {
        return transport instanceof LocalChangeTransport local ? Optional.of(local) : Optional.empty();
    }

    @Nonnull
    public RelayConfig getConfig() {
        return config;
    }
}
