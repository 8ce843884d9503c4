package me.internalizable.relay.api.event;

import javax.annotation.Nonnull;

/**
 * Which change events a subscription listens for.
 */
public enum SubscribedEvent {

    INSERT("INSERT"),
    UPDATE("UPDATE"),
    DELETE("DELETE"),

    /**
     * Every change on the table.
     */
    ANY("*");

    private final String wireName;

    SubscribedEvent(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Get the token used for this selector in channel names.
     *
     * @return {@code INSERT}, {@code UPDATE}, {@code DELETE} or {@code *}
     */
    @Nonnull
    public String wireName() {
        return wireName;
    }

    /**
     * Check whether an event of the given type is selected.
     *
     * @param type the event type
     * @return true if this selector accepts the type
     */
    public boolean matches(@Nonnull ChangeEventType type) {
        return this == ANY || name().equals(type.name());
    }
}
