package me.internalizable.relay.scheduler;

import javax.annotation.Nonnull;

/**
 * A delayed task that can be cancelled before it runs.
 */
public interface ScheduledTask {

    @Nonnull
    TaskStatus getStatus();

    /**
     * Cancel the task. Has no effect if it already ran or was cancelled.
     */
    void cancel();
}
