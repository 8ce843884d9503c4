package me.internalizable.relay.transport;

/**
 * Status notifications a transport reports for an open channel.
 */
public enum TransportStatus {

    /**
     * The subscription is confirmed and events will be delivered.
     */
    SUBSCRIBED,

    /**
     * The channel failed; no further events are expected on it.
     */
    CHANNEL_ERROR,

    /**
     * The subscription was not confirmed in time.
     */
    TIMED_OUT,

    /**
     * The transport closed the channel on its own.
     */
    CLOSED
}
