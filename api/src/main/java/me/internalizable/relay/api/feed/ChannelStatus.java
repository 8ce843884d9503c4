package me.internalizable.relay.api.feed;

/**
 * Lifecycle state of a change-feed channel.
 *
 * <pre>
 * CONNECTING --confirmed--> ACTIVE --last handler removed--> DRAINING --grace elapsed--> CLOSED
 *     |                       |                                 |
 *     +------- error ---------+--> ERROR --backoff--> CONNECTING +--resubscribe--> ACTIVE
 * </pre>
 */
public enum ChannelStatus {

    /**
     * Transport subscription requested, not yet confirmed.
     */
    CONNECTING,

    /**
     * Transport confirmed the subscription; events are flowing.
     */
    ACTIVE,

    /**
     * No handlers left; the channel is torn down unless someone subscribes
     * again before the grace period ends.
     */
    DRAINING,

    /**
     * The transport reported an error or timeout; a reconnect may be pending.
     */
    ERROR,

    /**
     * Connection dropped by {@code pauseAll()}; handlers are kept until resume.
     */
    SUSPENDED,

    /**
     * The channel has been torn down and is no longer tracked.
     */
    CLOSED
}
