package me.internalizable.relay.api.feed;

/**
 * Point-in-time counters describing a {@link ChangeFeedService}.
 *
 * @param activeChannels channels currently tracked, in any state
 * @param totalHandlers handlers registered across all channels
 * @param retryingChannels channels waiting for a reconnect attempt
 * @param pendingTimers debounce, grace and retry timers still scheduled
 * @param eventsReceived change events received from the transport since start
 * @param dispatches debounced deliveries performed since start
 * @param handlerErrors callback invocations that failed since start
 */
public record FeedStats(
        int activeChannels,
        int totalHandlers,
        int retryingChannels,
        int pendingTimers,
        long eventsReceived,
        long dispatches,
        long handlerErrors
) {
}
