package me.internalizable.relay.feed.subscription;

import me.internalizable.relay.api.feed.ChannelKey;
import me.internalizable.relay.api.feed.ChannelStatus;
import me.internalizable.relay.api.feed.Subscription;
import me.internalizable.relay.feed.HandlerSlot;

import javax.annotation.Nonnull;
import java.util.function.Consumer;

/**
 * Subscription bound to one handler slot of a channel.
 *
 * <p>Subscribing the same handler twice yields two of these sharing a slot;
 * whichever unsubscribes first releases it.</p>
 */
public final class ChannelSubscription implements Subscription {

    private final HandlerSlot<?> slot;
    private final Consumer<HandlerSlot<?>> removeCallback;

    /**
     * Create a new channel subscription.
     *
     * @param slot the handler slot
     * @param removeCallback called once when the slot is released
     */
    public ChannelSubscription(HandlerSlot<?> slot, Consumer<HandlerSlot<?>> removeCallback) {
        this.slot = slot;
        this.removeCallback = removeCallback;
    }

    @Override
    @Nonnull
    public ChannelKey getChannelKey() {
        return slot.getChannel().getKey();
    }

    @Override
    public boolean isActive() {
        return slot.isActive() && slot.getChannel().getStatus() != ChannelStatus.CLOSED;
    }

    @Override
    public void unsubscribe() {
        if (slot.deactivate()) {
            removeCallback.accept(slot);
        }
    }

    @Override
    public String toString() {
        return "ChannelSubscription{channel=" + getChannelKey() + ", slot=" + slot.getId() + "}";
    }
}
