package me.internalizable.relay.api.feed;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Handle to a registered change handler.
 *
 * <p>The caller owns the handler and must call {@link #unsubscribe()} to release
 * it. Unsubscribing is idempotent and remains safe after the underlying channel
 * has been torn down.</p>
 *
 * <p>A subscription is attached to one or more channels. Helpers that listen in
 * several places at once, such as both directions of a friend request, return a
 * subscription spanning several keys.</p>
 */
public interface Subscription {

    /**
     * Get the channel this subscription was registered on first.
     *
     * <p>For a single-channel subscription this is its only channel.</p>
     *
     * @return the primary channel key
     */
    @Nonnull
    ChannelKey getChannelKey();

    /**
     * Get every channel this subscription is attached to, primary key first.
     *
     * @return the distinct channel keys, never empty
     */
    @Nonnull
    default List<ChannelKey> getChannelKeys() {
        return List.of(getChannelKey());
    }

    /**
     * Check if this subscription still receives events.
     *
     * @return true if not unsubscribed and the channel is still tracked
     */
    boolean isActive();

    /**
     * Remove the handler from its channel.
     */
    void unsubscribe();
}
