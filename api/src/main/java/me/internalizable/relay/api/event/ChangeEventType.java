package me.internalizable.relay.api.event;

import javax.annotation.Nonnull;
import java.util.Optional;

/**
 * Kind of row change carried by a {@link ChangeEvent}.
 */
public enum ChangeEventType {

    INSERT,
    UPDATE,
    DELETE;

    /**
     * Look up an event type by its wire name, ignoring case.
     *
     * @param name the wire name, e.g. {@code "INSERT"}
     * @return the event type, or empty if the name is unknown
     */
    @Nonnull
    public static Optional<ChangeEventType> fromName(@Nonnull String name) {
        for (ChangeEventType type : values()) {
            if (type.name().equalsIgnoreCase(name)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
