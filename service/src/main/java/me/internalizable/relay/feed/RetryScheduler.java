package me.internalizable.relay.feed;

import me.internalizable.relay.scheduler.ScheduledTask;
import me.internalizable.relay.scheduler.TaskScheduler;

import java.time.Duration;

/**
 * Reconnect state machine for failed channels.
 *
 * <p>A failed channel with handlers is reopened after a backoff delay; one without
 * handlers, or one that used up its attempts, is torn down instead. A confirmed
 * subscription resets the attempt counter.</p>
 *
 * <p>All methods must be called while holding the multiplexer's lock.</p>
 */
final class RetryScheduler {

    /**
     * What the multiplexer has to do after a failure.
     */
    enum RetryOutcome {
        RETRY_SCHEDULED,
        TEAR_DOWN_NO_HANDLERS,
        TEAR_DOWN_EXHAUSTED
    }

    private final TaskScheduler scheduler;
    private final BackoffPolicy policy;

    RetryScheduler(TaskScheduler scheduler, BackoffPolicy policy) {
        this.scheduler = scheduler;
        this.policy = policy;
    }

    RetryOutcome onFailure(Channel channel, ChannelCallbacks callbacks) {
        cancel(channel);
        if (channel.handlers().isEmpty()) {
            return RetryOutcome.TEAR_DOWN_NO_HANDLERS;
        }

        int attempt = channel.incrementRetryAttempts();
        if (policy.isExhausted(attempt)) {
            return RetryOutcome.TEAR_DOWN_EXHAUSTED;
        }

        Duration delay = policy.delayFor(attempt);
        long sequence = channel.nextRetrySequence();
        channel.setRetryTask(scheduler.schedule(() -> callbacks.retryDue(channel, sequence), delay));
        channel.log("Channel {} will reconnect in {}ms (attempt {})", channel.getKey(), delay.toMillis(), attempt);
        return RetryOutcome.RETRY_SCHEDULED;
    }

    void onConfirmed(Channel channel) {
        channel.resetRetryAttempts();
    }

    /**
     * Claim a retry firing.
     *
     * @return false if the firing is stale
     */
    boolean claim(Channel channel, long sequence) {
        if (channel.getRetrySequence() != sequence) {
            return false;
        }
        channel.setRetryTask(null);
        return true;
    }

    boolean isRetryPending(Channel channel) {
        return channel.getRetryTask() != null;
    }

    void cancel(Channel channel) {
        ScheduledTask task = channel.getRetryTask();
        if (task != null) {
            task.cancel();
            channel.setRetryTask(null);
        }
        channel.nextRetrySequence();
    }

    int getMaxAttempts() {
        return policy.maxAttempts();
    }
}
