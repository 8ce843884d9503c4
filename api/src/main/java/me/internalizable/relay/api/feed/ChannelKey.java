package me.internalizable.relay.api.feed;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Canonical identity of a physical change-feed channel.
 *
 * <p>Logical subscriptions with the same table, event selector and filter share one
 * key, and therefore one transport connection. The textual form is
 * {@code table:event[:filter]}, e.g. {@code bookings:*:user_id=eq.42}.</p>
 *
 * @param value the canonical key string
 */
public record ChannelKey(@Nonnull String value) {

    public ChannelKey {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String toString() {
        return value;
    }
}
