package me.internalizable.relay.feed;

import com.google.gson.JsonObject;
import me.internalizable.relay.api.event.ChangeEvent;
import me.internalizable.relay.api.feed.ChangeFeedService;
import me.internalizable.relay.api.feed.ChangeHandler;
import me.internalizable.relay.api.feed.ChannelKey;
import me.internalizable.relay.api.feed.ChannelStatus;
import me.internalizable.relay.api.feed.FeedStats;
import me.internalizable.relay.api.feed.InvalidSubscriptionException;
import me.internalizable.relay.api.feed.Subscription;
import me.internalizable.relay.api.feed.SubscriptionOptions;
import me.internalizable.relay.api.table.RowFilter;
import me.internalizable.relay.api.table.Table;
import me.internalizable.relay.feed.RetryScheduler.RetryOutcome;
import me.internalizable.relay.feed.subscription.ChannelSubscription;
import me.internalizable.relay.scheduler.TaskScheduler;
import me.internalizable.relay.transport.ChangeTransport;
import me.internalizable.relay.transport.ChannelHandle;
import me.internalizable.relay.transport.TransportListener;
import me.internalizable.relay.transport.TransportStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * {@link ChangeFeedService} that shares one transport channel per channel key.
 *
 * <h2>Locking</h2>
 * <p>All bookkeeping happens under the monitor of {@code channels}: channel lookup,
 * handler registration, status changes and timer (re)arming. Handler callbacks are
 * invoked after the monitor is released, on the scheduler thread. Timer firings
 * and transport callbacks carry a sequence or generation number and are dropped
 * when the channel has moved on since they were armed.</p>
 */
public final class SubscriptionMultiplexer implements ChangeFeedService {

    private static final Logger LOGGER = LoggerFactory.getLogger(SubscriptionMultiplexer.class);

    private final ChangeTransport transport;
    private final TaskScheduler scheduler;
    private final FeedSettings settings;
    private final DebounceDispatcher dispatcher;
    private final RetryScheduler retryScheduler;
    private final LifecycleReaper reaper;
    private final ChannelCallbacks callbacks = new TimerCallbacks();

    private final Map<ChannelKey, Channel> channels = new LinkedHashMap<>();
    private final AtomicLong slotIdCounter = new AtomicLong(0);
    private final AtomicLong eventsReceived = new AtomicLong(0);

    private boolean initialized;
    private boolean paused;

    public SubscriptionMultiplexer(
            @Nonnull ChangeTransport transport,
            @Nonnull TaskScheduler scheduler,
            @Nonnull FeedSettings settings) {
        this(transport, scheduler, settings, new RowMapper());
    }

    public SubscriptionMultiplexer(
            @Nonnull ChangeTransport transport,
            @Nonnull TaskScheduler scheduler,
            @Nonnull FeedSettings settings,
            @Nonnull RowMapper rowMapper) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.settings = Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(rowMapper, "rowMapper");

        this.dispatcher = new DebounceDispatcher(scheduler, rowMapper);
        this.retryScheduler = new RetryScheduler(scheduler, settings.backoff());
        this.reaper = new LifecycleReaper(scheduler, settings.gracePeriod());
    }

    @Override
    public void init() {
        synchronized (channels) {
            if (initialized) {
                return;
            }
            initialized = true;
            paused = false;
        }
        LOGGER.info("Change feed initialized (debounce={}ms, grace={}ms, retry={}ms..{}ms)",
                settings.debounce().toMillis(),
                settings.gracePeriod().toMillis(),
                settings.backoff().initialDelay().toMillis(),
                settings.backoff().maxDelay().toMillis());
    }

    // ==================== Subscribing ====================

    @Override
    @Nonnull
    public <T> Subscription subscribe(
            @Nonnull Table table,
            @Nonnull Class<T> rowType,
            @Nonnull ChangeHandler<T> handler,
            @Nonnull SubscriptionOptions options) {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(rowType, "rowType");
        Objects.requireNonNull(handler, "handler");
        Objects.requireNonNull(options, "options");

        if (!handler.hasCallbacks()) {
            throw new InvalidSubscriptionException("Handler for " + table + " defines no callbacks");
        }
        RowFilter filter = options.getFilter() != null ? RowFilter.parse(options.getFilter()) : null;
        Duration debounce = options.getDebounce() != null ? options.getDebounce() : settings.debounce();
        if (debounce.isNegative()) {
            throw new InvalidSubscriptionException("Debounce must not be negative: " + debounce);
        }
        ChannelKey key = ChannelKeyRegistry.computeKey(table, options.getEvent(), filter);

        HandlerSlot<T> slot;
        synchronized (channels) {
            if (!initialized) {
                throw new IllegalStateException("Change feed is not initialized");
            }

            Channel channel = channels.get(key);
            boolean created = channel == null;
            if (created) {
                boolean logging = options.isEnableLogging() || settings.logAllChannels();
                channel = new Channel(key, table, options.getEvent(), filter, debounce, logging);
                channels.put(key, channel);
                channel.log("Created channel {}", key);
            } else if (reaper.cancelTeardown(channel)) {
                channel.setStatus(channel.isConfirmed() ? ChannelStatus.ACTIVE : ChannelStatus.CONNECTING);
                channel.log("Channel {} reused within grace period", key);
            }

            slot = channel.handlers().find(handler);
            if (slot != null && !slot.isActive()) {
                // released concurrently, its removal has not run yet
                channel.handlers().remove(slot);
                slot = null;
            }
            if (slot == null) {
                slot = new HandlerSlot<>(slotIdCounter.incrementAndGet(), handler, rowType, channel);
                channel.handlers().add(slot);
            } else {
                LOGGER.debug("Handler already registered on {}, sharing its slot", key);
            }

            if (created) {
                if (paused) {
                    channel.setStatus(ChannelStatus.SUSPENDED);
                } else {
                    openTransport(channel);
                }
            }
        }

        return new ChannelSubscription(slot, this::removeHandler);
    }

    /**
     * Subscribe with rows delivered as raw JSON objects.
     *
     * @param table the table to watch
     * @param handler the callbacks to invoke
     * @param options the subscription options
     * @return a subscription used to remove the handler
     */
    @Nonnull
    public Subscription subscribeRaw(
            @Nonnull Table table,
            @Nonnull ChangeHandler<JsonObject> handler,
            @Nonnull SubscriptionOptions options) {
        return subscribe(table, JsonObject.class, handler, options);
    }

    /**
     * Run a callback on the scheduler thread with the same isolation and error
     * accounting as debounced deliveries.
     *
     * <p>Used for deliveries that complete outside a debounce timer, such as
     * changes forwarded after an asynchronous lookup.</p>
     *
     * @param key the channel the delivery belongs to, used for logging
     * @param callbackName the callback name, used for logging
     * @param callback the callback
     * @param argument the callback argument
     * @param <A> the argument type
     */
    public <A> void invokeOnScheduler(
            @Nonnull ChannelKey key,
            @Nonnull String callbackName,
            @Nonnull Consumer<A> callback,
            A argument) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(callbackName, "callbackName");
        Objects.requireNonNull(callback, "callback");
        scheduler.execute(() -> dispatcher.invoke(key, callbackName, callback, argument));
    }

    private void removeHandler(HandlerSlot<?> slot) {
        synchronized (channels) {
            Channel channel = slot.getChannel();
            if (!isTracked(channel)) {
                return;
            }
            channel.handlers().remove(slot);
            if (!channel.handlers().isEmpty()) {
                return;
            }

            switch (channel.getStatus()) {
                case ERROR, SUSPENDED -> teardown(channel, true);
                default -> {
                    channel.setStatus(ChannelStatus.DRAINING);
                    reaper.scheduleTeardown(channel, callbacks);
                }
            }
        }
    }

    // ==================== Bulk Control ====================

    @Override
    public void cleanup() {
        int closed;
        synchronized (channels) {
            List<Channel> snapshot = new ArrayList<>(channels.values());
            for (Channel channel : snapshot) {
                teardown(channel, true);
                channel.handlers().clear();
            }
            closed = snapshot.size();
            initialized = false;
            paused = false;
        }
        LOGGER.info("Change feed cleaned up ({} channel(s) closed)", closed);
    }

    @Override
    public void pauseAll() {
        int suspended = 0;
        synchronized (channels) {
            if (!initialized || paused) {
                return;
            }
            paused = true;

            for (Channel channel : new ArrayList<>(channels.values())) {
                if (channel.handlers().isEmpty()) {
                    teardown(channel, true);
                    continue;
                }
                dispatcher.discard(channel);
                retryScheduler.cancel(channel);
                reaper.cancelTeardown(channel);
                channel.nextGeneration();
                releaseHandle(channel);
                channel.setConfirmed(false);
                channel.setStatus(ChannelStatus.SUSPENDED);
                suspended++;
            }
        }
        LOGGER.info("Change feed paused ({} channel(s) suspended)", suspended);
    }

    @Override
    public void resumeAll() {
        int resumed = 0;
        synchronized (channels) {
            if (!initialized || !paused) {
                return;
            }
            paused = false;

            for (Channel channel : new ArrayList<>(channels.values())) {
                if (channel.getStatus() != ChannelStatus.SUSPENDED) {
                    continue;
                }
                if (channel.handlers().isEmpty()) {
                    teardown(channel, true);
                    continue;
                }
                channel.resetRetryAttempts();
                openTransport(channel);
                resumed++;
            }
        }
        LOGGER.info("Change feed resumed ({} channel(s) reconnecting)", resumed);
    }

    // ==================== Introspection ====================

    @Override
    @Nonnull
    public Set<ChannelKey> getActiveSubscriptions() {
        synchronized (channels) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(channels.keySet()));
        }
    }

    @Override
    @Nonnull
    public Optional<ChannelStatus> getChannelStatus(@Nonnull ChannelKey key) {
        Objects.requireNonNull(key, "key");
        synchronized (channels) {
            return Optional.ofNullable(channels.get(key)).map(Channel::getStatus);
        }
    }

    @Override
    public boolean isHealthy() {
        synchronized (channels) {
            boolean healthy = true;
            for (Channel channel : channels.values()) {
                ChannelStatus status = channel.getStatus();
                if (status != ChannelStatus.ACTIVE && status != ChannelStatus.DRAINING) {
                    LOGGER.warn("Unhealthy channel detected: {} (status: {})", channel.getKey(), status);
                    healthy = false;
                }
            }
            return healthy;
        }
    }

    @Override
    @Nonnull
    public FeedStats getStats() {
        synchronized (channels) {
            int totalHandlers = 0;
            int retrying = 0;
            int pendingTimers = 0;
            for (Channel channel : channels.values()) {
                totalHandlers += channel.handlers().size();
                if (retryScheduler.isRetryPending(channel)) {
                    retrying++;
                }
                pendingTimers += channel.pendingTimerCount();
            }
            return new FeedStats(
                    channels.size(),
                    totalHandlers,
                    retrying,
                    pendingTimers,
                    eventsReceived.get(),
                    dispatcher.getDispatchCount(),
                    dispatcher.getHandlerErrorCount());
        }
    }

    @Override
    public void debugStatus() {
        synchronized (channels) {
            LOGGER.info("=== Change feed: {} channel(s), paused={} ===", channels.size(), paused);
            for (Channel channel : channels.values()) {
                LOGGER.info("  {} status={} handlers={} retries={} pending={}",
                        channel.getKey(),
                        channel.getStatus(),
                        channel.handlers().size(),
                        channel.getRetryAttempts(),
                        channel.getPendingEvent() != null);
            }
        }
    }

    // ==================== Internal ====================

    private boolean isTracked(Channel channel) {
        return channels.get(channel.getKey()) == channel;
    }

    private void openTransport(Channel channel) {
        long generation = channel.nextGeneration();
        channel.setConfirmed(false);
        channel.setStatus(ChannelStatus.CONNECTING);

        ChannelHandle handle;
        try {
            handle = transport.openChannel(
                    channel.getKey().value(),
                    channel.getTable(),
                    channel.getEvent(),
                    channel.getFilter(),
                    new ChannelListener(channel, generation));
        } catch (Exception e) {
            LOGGER.warn("Failed to open channel {}: {}", channel.getKey(), e.getMessage());
            onTransportFailure(channel, TransportStatus.CHANNEL_ERROR, e);
            return;
        }

        if (!isTracked(channel) || channel.getGeneration() != generation) {
            // failed or torn down while opening
            closeQuietly(channel, handle);
            return;
        }
        channel.setHandle(handle);
    }

    private void onConfirmed(Channel channel) {
        channel.setConfirmed(true);
        retryScheduler.onConfirmed(channel);
        if (channel.getStatus() == ChannelStatus.CONNECTING) {
            channel.setStatus(ChannelStatus.ACTIVE);
        }
    }

    private void onTransportFailure(Channel channel, TransportStatus status, @Nullable Throwable cause) {
        LOGGER.warn("Channel {} reported {}{}", channel.getKey(), status,
                cause != null ? ": " + cause.getMessage() : "");

        channel.nextGeneration();
        releaseHandle(channel);
        channel.setConfirmed(false);
        channel.setStatus(ChannelStatus.ERROR);

        RetryOutcome outcome = retryScheduler.onFailure(channel, callbacks);
        switch (outcome) {
            case TEAR_DOWN_NO_HANDLERS -> teardown(channel, false);
            case TEAR_DOWN_EXHAUSTED -> {
                LOGGER.error("Channel {} failed {} time(s), giving up",
                        channel.getKey(), retryScheduler.getMaxAttempts());
                teardown(channel, false);
            }
            default -> {
                // reconnect armed
            }
        }
    }

    private void onTransportClosed(Channel channel) {
        LOGGER.warn("Channel {} was closed by the transport", channel.getKey());
        channel.setHandle(null);
        teardown(channel, false);
    }

    private void teardown(Channel channel, boolean closeTransport) {
        if (isTracked(channel)) {
            channels.remove(channel.getKey());
        }
        dispatcher.discard(channel);
        retryScheduler.cancel(channel);
        reaper.cancelTeardown(channel);
        channel.nextGeneration();
        if (closeTransport) {
            releaseHandle(channel);
        } else {
            channel.setHandle(null);
        }
        channel.setStatus(ChannelStatus.CLOSED);
    }

    private void releaseHandle(Channel channel) {
        ChannelHandle handle = channel.getHandle();
        channel.setHandle(null);
        if (handle != null) {
            closeQuietly(channel, handle);
        }
    }

    private void closeQuietly(Channel channel, ChannelHandle handle) {
        try {
            transport.closeChannel(handle);
        } catch (Exception e) {
            LOGGER.warn("Failed to close transport channel for {}: {}", channel.getKey(), e.getMessage());
        }
    }

    /**
     * Receives transport callbacks for one connection attempt of a channel.
     */
    private final class ChannelListener implements TransportListener {
        private final Channel channel;
        private final long generation;

        ChannelListener(Channel channel, long generation) {
            this.channel = channel;
            this.generation = generation;
        }

        private boolean isCurrent() {
            return isTracked(channel) && channel.getGeneration() == generation;
        }

        @Override
        public void onStatus(@Nonnull TransportStatus status, @Nullable Throwable cause) {
            synchronized (channels) {
                if (!isCurrent()) {
                    LOGGER.debug("Ignoring stale {} for {}", status, channel.getKey());
                    return;
                }
                switch (status) {
                    case SUBSCRIBED -> onConfirmed(channel);
                    case CHANNEL_ERROR, TIMED_OUT -> onTransportFailure(channel, status, cause);
                    case CLOSED -> onTransportClosed(channel);
                }
            }
        }

        @Override
        public void onChange(@Nonnull ChangeEvent<JsonObject> event) {
            synchronized (channels) {
                if (!isCurrent()) {
                    return;
                }
                eventsReceived.incrementAndGet();
                dispatcher.offer(channel, event, callbacks);
            }
        }
    }

    private final class TimerCallbacks implements ChannelCallbacks {

        @Override
        public void debounceElapsed(Channel channel, long sequence) {
            ChangeEvent<JsonObject> event;
            synchronized (channels) {
                if (!isTracked(channel)) {
                    return;
                }
                event = dispatcher.takePending(channel, sequence);
            }
            if (event != null) {
                dispatcher.dispatch(channel, event);
            }
        }

        @Override
        public void retryDue(Channel channel, long sequence) {
            synchronized (channels) {
                if (!isTracked(channel) || !retryScheduler.claim(channel, sequence)) {
                    return;
                }
                if (channel.handlers().isEmpty()) {
                    teardown(channel, true);
                    return;
                }
                channel.log("Reconnecting channel {} (attempt {})", channel.getKey(), channel.getRetryAttempts());
                openTransport(channel);
            }
        }

        @Override
        public void gracePeriodElapsed(Channel channel, long sequence) {
            synchronized (channels) {
                if (!isTracked(channel) || !reaper.claim(channel, sequence)) {
                    return;
                }
                if (channel.handlers().isEmpty()) {
                    teardown(channel, true);
                }
            }
        }
    }
}
