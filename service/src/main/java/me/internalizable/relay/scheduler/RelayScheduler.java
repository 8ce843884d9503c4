package me.internalizable.relay.scheduler;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link TaskScheduler} backed by a single daemon thread.
 *
 * <p>Running every timer on one thread keeps deliveries for a channel in firing
 * order and lets handlers assume they are never invoked concurrently.</p>
 */
public class RelayScheduler implements TaskScheduler {

    private static final Logger LOGGER = LoggerFactory.getLogger(RelayScheduler.class);

    private final ScheduledExecutorService executor;
    private final Set<RelayScheduledTask> tasks = ConcurrentHashMap.newKeySet();

    public RelayScheduler() {
        this(Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                .setNameFormat("relay-scheduler-%d")
                .setDaemon(true)
                .build()));
    }

    public RelayScheduler(ScheduledExecutorService executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    @Nonnull
    public ScheduledTask schedule(@Nonnull Runnable task, @Nonnull Duration delay) {
        Objects.requireNonNull(task, "task");
        Objects.requireNonNull(delay, "delay");

        RelayScheduledTask scheduledTask = new RelayScheduledTask();
        Runnable wrapper = () -> {
            if (scheduledTask.getStatus() == TaskStatus.CANCELLED) {
                return;
            }
            scheduledTask.setStatus(TaskStatus.RUNNING);
            try {
                task.run();
            } catch (Exception e) {
                LOGGER.error("Error executing scheduled task", e);
            } finally {
                scheduledTask.setStatus(TaskStatus.FINISHED);
                tasks.remove(scheduledTask);
            }
        };

        tasks.add(scheduledTask);
        try {
            long delayMillis = Math.max(0, delay.toMillis());
            scheduledTask.setFuture(executor.schedule(wrapper, delayMillis, TimeUnit.MILLISECONDS));
        } catch (RejectedExecutionException e) {
            tasks.remove(scheduledTask);
            scheduledTask.setStatus(TaskStatus.CANCELLED);
            LOGGER.warn("Scheduler is shut down, dropping task");
        }
        return scheduledTask;
    }

    @Override
    public void execute(@Nonnull Runnable command) {
        schedule(command, Duration.ZERO);
    }

    @Override
    public int pendingTaskCount() {
        return tasks.size();
    }

    /**
     * Cancel all pending tasks and stop the scheduler thread.
     */
    public void shutdown() {
        for (RelayScheduledTask task : tasks) {
            task.cancel();
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private final class RelayScheduledTask implements ScheduledTask {
        private volatile TaskStatus status = TaskStatus.SCHEDULED;
        private volatile ScheduledFuture<?> future;

        void setFuture(ScheduledFuture<?> future) {
            this.future = future;
        }

        void setStatus(TaskStatus status) {
            this.status = status;
        }

        @Override
        @Nonnull
        public TaskStatus getStatus() {
            return status;
        }

        @Override
        public void cancel() {
            if (status == TaskStatus.FINISHED) {
                return;
            }
            status = TaskStatus.CANCELLED;
            tasks.remove(this);
            if (future != null) {
                future.cancel(false);
            }
        }
    }
}
