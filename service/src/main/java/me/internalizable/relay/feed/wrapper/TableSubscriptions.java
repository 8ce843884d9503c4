package me.internalizable.relay.feed.wrapper;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import me.internalizable.relay.api.event.ChangeEvent;
import me.internalizable.relay.api.feed.ChangeHandler;
import me.internalizable.relay.api.feed.ChannelKey;
import me.internalizable.relay.api.feed.Subscription;
import me.internalizable.relay.api.feed.SubscriptionOptions;
import me.internalizable.relay.api.table.RowFilter;
import me.internalizable.relay.api.table.Table;
import me.internalizable.relay.feed.ChannelKeyRegistry;
import me.internalizable.relay.feed.SubscriptionMultiplexer;
import me.internalizable.relay.feed.subscription.CompositeSubscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Convenience subscriptions for the common per-user and per-restaurant feeds.
 *
 * <p>Every helper is a thin filter builder on top of
 * {@link SubscriptionMultiplexer#subscribe}; any filter already present in the given
 * options is replaced. Helpers that need several channels return a
 * {@link CompositeSubscription}.</p>
 */
public final class TableSubscriptions {

    private static final Logger LOGGER = LoggerFactory.getLogger(TableSubscriptions.class);

    private static final String USER_ID = "user_id";
    private static final String RESTAURANT_ID = "restaurant_id";
    private static final String FROM_USER_ID = "from_user_id";
    private static final String TO_USER_ID = "to_user_id";
    private static final String BOOKING_ID = "booking_id";

    private final SubscriptionMultiplexer feed;
    private final BookingRestaurantLookup bookingLookup;

    public TableSubscriptions(@Nonnull SubscriptionMultiplexer feed) {
        this(feed, null);
    }

    public TableSubscriptions(@Nonnull SubscriptionMultiplexer feed, @Nullable BookingRestaurantLookup bookingLookup) {
        this.feed = Objects.requireNonNull(feed, "feed");
        this.bookingLookup = bookingLookup;
    }

    // ==================== Generic ====================

    @Nonnull
    public <T> Subscription subscribeToUser(
            @Nonnull Table table,
            @Nonnull String userId,
            @Nonnull Class<T> rowType,
            @Nonnull ChangeHandler<T> handler,
            @Nonnull SubscriptionOptions options) {
        return subscribeWhere(table, USER_ID, userId, rowType, handler, options);
    }

    @Nonnull
    public <T> Subscription subscribeToRestaurant(
            @Nonnull Table table,
            @Nonnull String restaurantId,
            @Nonnull Class<T> rowType,
            @Nonnull ChangeHandler<T> handler,
            @Nonnull SubscriptionOptions options) {
        return subscribeWhere(table, RESTAURANT_ID, restaurantId, rowType, handler, options);
    }

    // ==================== Per User ====================

    @Nonnull
    public <T> Subscription subscribeToUserBookings(
            @Nonnull String userId,
            @Nonnull Class<T> rowType,
            @Nonnull ChangeHandler<T> handler,
            @Nonnull SubscriptionOptions options) {
        return subscribeToUser(Table.BOOKINGS, userId, rowType, handler, options);
    }

    @Nonnull
    public <T> Subscription subscribeToUserWaitlist(
            @Nonnull String userId,
            @Nonnull Class<T> rowType,
            @Nonnull ChangeHandler<T> handler,
            @Nonnull SubscriptionOptions options) {
        return subscribeToUser(Table.WAITLIST, userId, rowType, handler, options);
    }

    @Nonnull
    public <T> Subscription subscribeToUserNotifications(
            @Nonnull String userId,
            @Nonnull Class<T> rowType,
            @Nonnull ChangeHandler<T> handler,
            @Nonnull SubscriptionOptions options) {
        return subscribeToUser(Table.NOTIFICATIONS, userId, rowType, handler, options);
    }

    /**
     * Subscribe to invitations a user sent or received.
     */
    @Nonnull
    public <T> CompositeSubscription subscribeToUserInvitations(
            @Nonnull String userId,
            @Nonnull Class<T> rowType,
            @Nonnull ChangeHandler<T> handler,
            @Nonnull SubscriptionOptions options) {
        return subscribeBothDirections(Table.BOOKING_INVITES, userId, rowType, handler, options);
    }

    /**
     * Subscribe to friend requests a user sent or received.
     */
    @Nonnull
    public <T> CompositeSubscription subscribeToUserFriendRequests(
            @Nonnull String userId,
            @Nonnull Class<T> rowType,
            @Nonnull ChangeHandler<T> handler,
            @Nonnull SubscriptionOptions options) {
        return subscribeBothDirections(Table.FRIEND_REQUESTS, userId, rowType, handler, options);
    }

    // ==================== Per Restaurant ====================

    /**
     * Subscribe to every change that can affect a restaurant's table availability.
     *
     * <p>Listens to the restaurant's bookings and tables, and to table assignments
     * whose booking resolves to the restaurant. Assignment changes are only passed
     * to {@code onAny}, on the scheduler thread once the lookup completes.</p>
     *
     * @throws IllegalStateException if no {@link BookingRestaurantLookup} was configured
     */
    @Nonnull
    public CompositeSubscription subscribeToRestaurantAvailability(
            @Nonnull String restaurantId,
            @Nonnull ChangeHandler<JsonObject> handler,
            @Nonnull SubscriptionOptions options) {
        Objects.requireNonNull(restaurantId, "restaurantId");
        if (bookingLookup == null) {
            throw new IllegalStateException("No booking lookup configured for availability subscriptions");
        }

        Subscription bookings = subscribeToRestaurant(Table.BOOKINGS, restaurantId, JsonObject.class, handler, options);
        Subscription tables = subscribeToRestaurant(Table.RESTAURANT_TABLES, restaurantId, JsonObject.class, handler, options);
        SubscriptionOptions assignmentOptions = options.withFilter(null);
        ChannelKey assignmentKey = ChannelKeyRegistry.computeKey(
                Table.BOOKING_TABLES, assignmentOptions.getEvent(), null);
        Subscription assignments;
        try {
            assignments = feed.subscribe(Table.BOOKING_TABLES, JsonObject.class,
                    ChangeHandler.onAny(event -> forwardIfRestaurant(event, assignmentKey, restaurantId, handler)),
                    assignmentOptions);
        } catch (RuntimeException e) {
            bookings.unsubscribe();
            tables.unsubscribe();
            throw e;
        }

        return new CompositeSubscription(List.of(bookings, tables, assignments));
    }

    // ==================== Global ====================

    @Nonnull
    public <T> Subscription subscribeToGlobalOffers(
            @Nonnull Class<T> rowType,
            @Nonnull ChangeHandler<T> handler,
            @Nonnull SubscriptionOptions options) {
        return feed.subscribe(Table.SPECIAL_OFFERS, rowType, handler, options.withFilter(null));
    }

    // ==================== Internal ====================

    private <T> Subscription subscribeWhere(
            Table table, String column, String value,
            Class<T> rowType, ChangeHandler<T> handler, SubscriptionOptions options) {
        Objects.requireNonNull(value, column);
        Objects.requireNonNull(options, "options");
        return feed.subscribe(table, rowType, handler, options.withFilter(RowFilter.eq(column, value).expression()));
    }

    private <T> CompositeSubscription subscribeBothDirections(
            Table table, String userId, Class<T> rowType, ChangeHandler<T> handler, SubscriptionOptions options) {
        Subscription sent = subscribeWhere(table, FROM_USER_ID, userId, rowType, handler, options);
        Subscription received;
        try {
            received = subscribeWhere(table, TO_USER_ID, userId, rowType, handler, options);
        } catch (RuntimeException e) {
            sent.unsubscribe();
            throw e;
        }
        return new CompositeSubscription(List.of(sent, received));
    }

    private void forwardIfRestaurant(ChangeEvent<JsonObject> event, ChannelKey key, String restaurantId,
                                     ChangeHandler<JsonObject> handler) {
        Consumer<ChangeEvent<JsonObject>> onAny = handler.getOnAny();
        String bookingId = bookingIdOf(event);
        if (onAny == null || bookingId == null) {
            return;
        }

        bookingLookup.restaurantIdOf(bookingId).whenComplete((owner, error) -> {
            if (error != null) {
                LOGGER.error("Failed to resolve restaurant of booking {}", bookingId, error);
                return;
            }
            if (owner != null && owner.filter(restaurantId::equals).isPresent()) {
                feed.invokeOnScheduler(key, "onAny", onAny, event);
            }
        });
    }

    @Nullable
    private static String bookingIdOf(ChangeEvent<JsonObject> event) {
        String bookingId = stringColumn(event.newRow(), BOOKING_ID);
        return bookingId != null ? bookingId : stringColumn(event.oldRow(), BOOKING_ID);
    }

    @Nullable
    private static String stringColumn(@Nullable JsonObject row, String column) {
        if (row == null) {
            return null;
        }
        JsonElement element = row.get(column);
        if (element == null || !element.isJsonPrimitive()) {
            return null;
        }
        return element.getAsString();
    }
}
