package me.internalizable.relay.api.feed;

import me.internalizable.relay.api.table.Table;

import javax.annotation.Nonnull;
import java.util.Optional;
import java.util.Set;

/**
 * Multiplexes one shared change feed into many filtered, debounced subscriptions.
 *
 * <p>Subscriptions with the same table, event selector and filter share a single
 * transport channel. Bursts of changes on a channel are coalesced: after a quiet
 * period only the most recent change is delivered. Handlers may therefore see fewer
 * deliveries than changes happened upstream.</p>
 *
 * <h2>Lifecycle</h2>
 * <p>The service is created once at application startup and must be initialized with
 * {@link #init()} before use. {@link #cleanup()} tears everything down and cancels all
 * outstanding timers.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>All methods are thread-safe and never block on the transport. Handlers are
 * invoked on the service's scheduler thread and should not block.</p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * Subscription subscription = feed.subscribe(Table.BOOKINGS, Booking.class,
 *     ChangeHandler.<Booking>builder()
 *         .onInsert(booking -> logger.info("New booking {}", booking.id()))
 *         .build(),
 *     SubscriptionOptions.builder()
 *         .filter("user_id=eq." + userId)
 *         .debounceMs(250)
 *         .build());
 *
 * // Later, when the screen goes away
 * subscription.unsubscribe();
 * }</pre>
 *
 * @see Subscription
 * @see ChangeHandler
 */
public interface ChangeFeedService {

    /**
     * Prepare the service for subscriptions. Calling it again has no effect.
     */
    void init();

    // ==================== Subscribing ====================

    /**
     * Subscribe to changes on a table.
     *
     * @param table the table to watch
     * @param rowType the type rows are converted to before delivery
     * @param handler the callbacks to invoke
     * @param options the subscription options
     * @param <T> the row type
     * @return a subscription used to remove the handler
     * @throws InvalidSubscriptionException if the handler has no callbacks or the filter is malformed
     * @throws IllegalStateException if the service is not initialized
     */
    @Nonnull
    <T> Subscription subscribe(
            @Nonnull Table table,
            @Nonnull Class<T> rowType,
            @Nonnull ChangeHandler<T> handler,
            @Nonnull SubscriptionOptions options);

    /**
     * Subscribe to every change on a table with default options.
     *
     * @param table the table to watch
     * @param rowType the type rows are converted to before delivery
     * @param handler the callbacks to invoke
     * @param <T> the row type
     * @return a subscription used to remove the handler
     */
    @Nonnull
    default <T> Subscription subscribe(
            @Nonnull Table table,
            @Nonnull Class<T> rowType,
            @Nonnull ChangeHandler<T> handler) {
        return subscribe(table, rowType, handler, SubscriptionOptions.defaults());
    }

    // ==================== Bulk Control ====================

    /**
     * Tear down every channel immediately and cancel all timers.
     *
     * <p>Used on application shutdown. The service must be initialized again
     * before new subscriptions are accepted.</p>
     */
    void cleanup();

    /**
     * Drop all transport connections while keeping registered handlers.
     *
     * <p>Pending deliveries are discarded. New subscriptions made while paused are
     * recorded and connected on {@link #resumeAll()}.</p>
     */
    void pauseAll();

    /**
     * Reconnect every channel that still has handlers after {@link #pauseAll()}.
     */
    void resumeAll();

    // ==================== Introspection ====================

    /**
     * Get the keys of all tracked channels.
     *
     * @return a snapshot of channel keys
     */
    @Nonnull
    Set<ChannelKey> getActiveSubscriptions();

    /**
     * Get the state of a channel.
     *
     * @param key the channel key
     * @return the status, or empty if no such channel is tracked
     */
    @Nonnull
    Optional<ChannelStatus> getChannelStatus(@Nonnull ChannelKey key);

    /**
     * Check whether every tracked channel is connected.
     *
     * @return true if no channel is connecting, failing or suspended
     */
    boolean isHealthy();

    /**
     * Get service counters.
     *
     * @return a snapshot of the counters
     */
    @Nonnull
    FeedStats getStats();

    /**
     * Log the state of every channel.
     */
    void debugStatus();
}
