package me.internalizable.relay.api.table;

import javax.annotation.Nonnull;
import java.util.Optional;

/**
 * Tables whose row changes are published on the change feed.
 *
 * <p>Only tables listed here can be subscribed to. The {@link #tableName()} is the
 * identifier used by the upstream change-data-capture producer.</p>
 */
public enum Table {

    BOOKINGS("bookings"),
    BOOKING_INVITES("booking_invites"),
    BOOKING_TABLES("booking_tables"),
    WAITLIST("waitlist"),
    NOTIFICATIONS("notifications"),
    FRIEND_REQUESTS("friend_requests"),
    RESTAURANTS("restaurants"),
    RESTAURANT_TABLES("restaurant_tables"),
    SPECIAL_OFFERS("special_offers"),
    USER_OFFERS("user_offers"),
    LOYALTY_ACTIVITIES("loyalty_activities"),
    POSTS("posts"),
    REVIEWS("reviews"),
    PROFILES("profiles");

    private final String tableName;

    Table(String tableName) {
        this.tableName = tableName;
    }

    /**
     * Get the table identifier as published by the change feed.
     *
     * @return the table name, e.g. {@code "bookings"}
     */
    @Nonnull
    public String tableName() {
        return tableName;
    }

    /**
     * Look up a table by its published identifier.
     *
     * @param tableName the table identifier
     * @return the table, or empty if the identifier is not a known table
     */
    @Nonnull
    public static Optional<Table> fromName(@Nonnull String tableName) {
        for (Table table : values()) {
            if (table.tableName.equals(tableName)) {
                return Optional.of(table);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return tableName;
    }
}
