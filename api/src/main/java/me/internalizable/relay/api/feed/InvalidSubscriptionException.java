package me.internalizable.relay.api.feed;

/**
 * Thrown when a subscription request cannot produce a working channel, for example
 * a handler without callbacks or a malformed row filter.
 *
 * <p>Raised synchronously from {@code subscribe}; no channel is created.</p>
 */
public class InvalidSubscriptionException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidSubscriptionException(String message) {
        super(message);
    }
}
