package me.internalizable.relay.feed;

import me.internalizable.relay.api.feed.ChangeHandler;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Registration of a caller's handler on a channel.
 *
 * <p>The slot does not own the handler; it is released through the
 * {@link me.internalizable.relay.api.feed.Subscription} returned to the caller.</p>
 *
 * @param <T> the row type
 */
public final class HandlerSlot<T> {

    private final long id;
    private final ChangeHandler<T> handler;
    private final Class<T> rowType;
    private final Channel channel;
    private final AtomicBoolean active = new AtomicBoolean(true);

    HandlerSlot(long id, ChangeHandler<T> handler, Class<T> rowType, Channel channel) {
        this.id = id;
        this.handler = handler;
        this.rowType = rowType;
        this.channel = channel;
    }

    public long getId() {
        return id;
    }

    public ChangeHandler<T> getHandler() {
        return handler;
    }

    public Class<T> getRowType() {
        return rowType;
    }

    public Channel getChannel() {
        return channel;
    }

    public boolean isActive() {
        return active.get();
    }

    /**
     * Mark the slot released.
     *
     * @return true for the first call only
     */
    public boolean deactivate() {
        return active.compareAndSet(true, false);
    }
}
