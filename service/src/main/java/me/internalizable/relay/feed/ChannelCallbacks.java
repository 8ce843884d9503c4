package me.internalizable.relay.feed;

/**
 * Timer callbacks raised by the channel components.
 *
 * <p>Each callback carries the sequence number the timer was armed with; a
 * receiver ignores firings whose sequence is no longer current.</p>
 */
interface ChannelCallbacks {

    void debounceElapsed(Channel channel, long sequence);

    void retryDue(Channel channel, long sequence);

    void gracePeriodElapsed(Channel channel, long sequence);
}
