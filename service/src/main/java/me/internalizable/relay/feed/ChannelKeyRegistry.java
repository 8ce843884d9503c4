package me.internalizable.relay.feed;

import me.internalizable.relay.api.event.SubscribedEvent;
import me.internalizable.relay.api.feed.ChannelKey;
import me.internalizable.relay.api.table.RowFilter;
import me.internalizable.relay.api.table.Table;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Computes the canonical identity of a channel.
 *
 * <p>Keys have the form {@code <table>:<event>[:<filter>]}. Table names and event
 * tokens never contain {@code ':'}, so two different (table, event, filter) triples
 * never produce the same key, and equal triples always do.</p>
 */
public final class ChannelKeyRegistry {

    private static final char SEPARATOR = ':';

    private ChannelKeyRegistry() {
    }

    /**
     * Compute the key for a subscription.
     *
     * @param table the table
     * @param event the event selector
     * @param filter the validated filter, or null for none
     * @return the channel key
     */
    @Nonnull
    public static ChannelKey computeKey(@Nonnull Table table, @Nonnull SubscribedEvent event, @Nullable RowFilter filter) {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(event, "event");

        StringBuilder builder = new StringBuilder()
                .append(table.tableName())
                .append(SEPARATOR)
                .append(event.wireName());
        if (filter != null) {
            builder.append(SEPARATOR).append(filter.expression());
        }
        return new ChannelKey(builder.toString());
    }
}
