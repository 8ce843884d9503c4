package me.internalizable.relay.feed;

import me.internalizable.relay.scheduler.ScheduledTask;
import me.internalizable.relay.scheduler.TaskScheduler;

import java.time.Duration;

/**
 * Delays the teardown of channels that lost their last handler.
 *
 * <p>Screens that unsubscribe and resubscribe in quick succession keep their
 * transport connection; a channel is only closed if it is still empty when the
 * grace period ends.</p>
 *
 * <p>All methods must be called while holding the multiplexer's lock.</p>
 */
final class LifecycleReaper {

    private final TaskScheduler scheduler;
    private final Duration gracePeriod;

    LifecycleReaper(TaskScheduler scheduler, Duration gracePeriod) {
        this.scheduler = scheduler;
        this.gracePeriod = gracePeriod;
    }

    void scheduleTeardown(Channel channel, ChannelCallbacks callbacks) {
        cancelTeardown(channel);
        long sequence = channel.nextReapSequence();
        channel.setReapTask(scheduler.schedule(() -> callbacks.gracePeriodElapsed(channel, sequence), gracePeriod));
        channel.log("Channel {} has no handlers, closing in {}ms", channel.getKey(), gracePeriod.toMillis());
    }

    /**
     * Cancel a pending teardown.
     *
     * @return true if a teardown was pending
     */
    boolean cancelTeardown(Channel channel) {
        ScheduledTask task = channel.getReapTask();
        channel.nextReapSequence();
        if (task == null) {
            return false;
        }
        task.cancel();
        channel.setReapTask(null);
        return true;
    }

    /**
     * Claim a grace period firing.
     *
     * @return false if the firing is stale
     */
    boolean claim(Channel channel, long sequence) {
        if (channel.getReapSequence() != sequence) {
            return false;
        }
        channel.setReapTask(null);
        return true;
    }
}
