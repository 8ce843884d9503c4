package me.internalizable.relay.scheduler;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * Timer service used for debounce, grace-period and retry delays.
 *
 * <p>Implementations run tasks one at a time, in due order. Tasks submitted through
 * {@link #execute(Runnable)} run as soon as possible on the same thread.</p>
 */
public interface TaskScheduler extends Executor {

    /**
     * Run a task once after a delay.
     *
     * @param task the task
     * @param delay the delay, zero to run as soon as possible
     * @return a handle used to cancel the task
     */
    @Nonnull
    ScheduledTask schedule(@Nonnull Runnable task, @Nonnull Duration delay);

    /**
     * Get the number of tasks scheduled but not yet run or cancelled.
     *
     * @return the pending task count
     */
    int pendingTaskCount();
}
