package me.internalizable.relay.transport;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Opaque reference to a channel opened on a {@link ChangeTransport}.
 *
 * @param id transport-assigned identifier, unique per transport instance
 * @param name the channel name given to {@code openChannel}
 */
public record ChannelHandle(long id, @Nonnull String name) {

    public ChannelHandle {
        Objects.requireNonNull(name, "name");
    }
}
