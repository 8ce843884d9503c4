package me.internalizable.relay.transport;

import me.internalizable.relay.api.event.SubscribedEvent;
import me.internalizable.relay.api.table.RowFilter;
import me.internalizable.relay.api.table.Table;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Change-data-capture transport the multiplexer opens channels on.
 *
 * <p>{@link #openChannel} must not block: confirmation or failure is reported
 * later through {@link TransportListener#onStatus}. Only changes matching the
 * channel's table, event selector and filter are delivered.</p>
 *
 * @see me.internalizable.relay.transport.local.LocalChangeTransport
 * @see me.internalizable.relay.transport.redis.RedisChangeTransport
 */
public interface ChangeTransport {

    /**
     * Open a channel.
     *
     * @param name the channel name, the canonical channel key
     * @param table the table to follow
     * @param event the event selector
     * @param filter the row filter, or null for every row
     * @param listener receives status transitions and changes
     * @return a handle used to close the channel
     */
    @Nonnull
    ChannelHandle openChannel(
            @Nonnull String name,
            @Nonnull Table table,
            @Nonnull SubscribedEvent event,
            @Nullable RowFilter filter,
            @Nonnull TransportListener listener);

    /**
     * Close a channel. Closing an unknown or already closed handle has no effect.
     *
     * @param handle the handle returned by {@link #openChannel}
     */
    void closeChannel(@Nonnull ChannelHandle handle);

    /**
     * Connect the transport.
     */
    default void start() {
    }

    /**
     * Close every channel and release the transport's connections.
     */
    default void shutdown() {
    }
}
