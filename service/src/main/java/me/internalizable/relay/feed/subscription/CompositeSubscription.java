package me.internalizable.relay.feed.subscription;

import me.internalizable.relay.api.feed.ChannelKey;
import me.internalizable.relay.api.feed.Subscription;

import javax.annotation.Nonnull;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Subscription made of several channel subscriptions released together.
 *
 * <p>The first part is the primary one: its key is {@link #getChannelKey()}.
 * {@link #getChannelKeys()} lists every distinct key in registration order. The
 * composite stays active while any part still receives events.</p>
 */
public final class CompositeSubscription implements Subscription {

    private final List<Subscription> parts;
    private final List<ChannelKey> channelKeys;
    private final AtomicBoolean released = new AtomicBoolean(false);

    /**
     * Group subscriptions.
     *
     * @param parts the subscriptions, primary first
     * @throws IllegalArgumentException if {@code parts} is empty
     */
    public CompositeSubscription(@Nonnull List<? extends Subscription> parts) {
        Objects.requireNonNull(parts, "parts");
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("A composite subscription needs at least one part");
        }
        this.parts = List.copyOf(parts);

        Set<ChannelKey> keys = new LinkedHashSet<>();
        for (Subscription part : this.parts) {
            keys.addAll(part.getChannelKeys());
        }
        this.channelKeys = List.copyOf(keys);
    }

    @Override
    @Nonnull
    public ChannelKey getChannelKey() {
        return channelKeys.get(0);
    }

    @Override
    @Nonnull
    public List<ChannelKey> getChannelKeys() {
        return channelKeys;
    }

    @Override
    public boolean isActive() {
        if (released.get()) {
            return false;
        }
        for (Subscription part : parts) {
            if (part.isActive()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public void unsubscribe() {
        if (released.compareAndSet(false, true)) {
            parts.forEach(Subscription::unsubscribe);
        }
    }

    /**
     * Get the number of grouped subscriptions.
     *
     * @return the part count
     */
    public int size() {
        return parts.size();
    }

    @Override
    public String toString() {
        return "CompositeSubscription{channels=" + channelKeys + "}";
    }
}
