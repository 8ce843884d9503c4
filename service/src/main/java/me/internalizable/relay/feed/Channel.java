package me.internalizable.relay.feed;

import com.google.gson.JsonObject;
import me.internalizable.relay.api.event.ChangeEvent;
import me.internalizable.relay.api.event.SubscribedEvent;
import me.internalizable.relay.api.feed.ChannelKey;
import me.internalizable.relay.api.feed.ChannelStatus;
import me.internalizable.relay.api.table.RowFilter;
import me.internalizable.relay.api.table.Table;
import me.internalizable.relay.scheduler.ScheduledTask;
import me.internalizable.relay.scheduler.TaskStatus;
import me.internalizable.relay.transport.ChannelHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;

/**
 * One physical subscription to the change feed.
 *
 * <p>Apart from the handler set, which is its own monitor, and the status, which
 * may be read without locking, all state is guarded by the owning
 * {@link SubscriptionMultiplexer}'s channel map.</p>
 */
public final class Channel {

    private static final Logger LOGGER = LoggerFactory.getLogger(Channel.class);

    private final ChannelKey key;
    private final Table table;
    private final SubscribedEvent event;
    private final RowFilter filter;
    private final Duration debounce;
    private final boolean loggingEnabled;
    private final HandlerSet handlers = new HandlerSet();

    private volatile ChannelStatus status = ChannelStatus.CONNECTING;
    private boolean confirmed;
    private ChannelHandle handle;
    private long generation;
    private int retryAttempts;

    // ==================== Timers ====================

    private ChangeEvent<JsonObject> pendingEvent;
    private ScheduledTask debounceTask;
    private long debounceSequence;
    private ScheduledTask retryTask;
    private long retrySequence;
    private ScheduledTask reapTask;
    private long reapSequence;

    Channel(ChannelKey key, Table table, SubscribedEvent event, @Nullable RowFilter filter,
            Duration debounce, boolean loggingEnabled) {
        this.key = key;
        this.table = table;
        this.event = event;
        this.filter = filter;
        this.debounce = debounce;
        this.loggingEnabled = loggingEnabled;
    }

    @Nonnull
    public ChannelKey getKey() {
        return key;
    }

    @Nonnull
    public ChannelStatus getStatus() {
        return status;
    }

    @Nonnull
    public Table getTable() {
        return table;
    }

    @Nonnull
    public SubscribedEvent getEvent() {
        return event;
    }

    @Nullable
    public RowFilter getFilter() {
        return filter;
    }

    @Nonnull
    public Duration getDebounce() {
        return debounce;
    }

    public boolean isLoggingEnabled() {
        return loggingEnabled;
    }

    HandlerSet handlers() {
        return handlers;
    }

    void setStatus(ChannelStatus status) {
        ChannelStatus previous = this.status;
        this.status = status;
        if (previous != status) {
            log("Channel {}: {} -> {}", key, previous, status);
        }
    }

    /**
     * Log a state transition at INFO when the channel asked for it, DEBUG otherwise.
     */
    void log(String message, Object... args) {
        if (loggingEnabled) {
            LOGGER.info(message, args);
        } else {
            LOGGER.debug(message, args);
        }
    }

    boolean isConfirmed() {
        return confirmed;
    }

    void setConfirmed(boolean confirmed) {
        this.confirmed = confirmed;
    }

    @Nullable
    ChannelHandle getHandle() {
        return handle;
    }

    void setHandle(@Nullable ChannelHandle handle) {
        this.handle = handle;
    }

    long getGeneration() {
        return generation;
    }

    /**
     * Invalidate callbacks from the current transport connection.
     *
     * @return the new generation
     */
    long nextGeneration() {
        return ++generation;
    }

    int getRetryAttempts() {
        return retryAttempts;
    }

    int incrementRetryAttempts() {
        return ++retryAttempts;
    }

    void resetRetryAttempts() {
        this.retryAttempts = 0;
    }

    // ==================== Debounce ====================

    @Nullable
    ChangeEvent<JsonObject> getPendingEvent() {
        return pendingEvent;
    }

    void setPendingEvent(@Nullable ChangeEvent<JsonObject> pendingEvent) {
        this.pendingEvent = pendingEvent;
    }

    @Nullable
    ScheduledTask getDebounceTask() {
        return debounceTask;
    }

    void setDebounceTask(@Nullable ScheduledTask debounceTask) {
        this.debounceTask = debounceTask;
    }

    long getDebounceSequence() {
        return debounceSequence;
    }

    long nextDebounceSequence() {
        return ++debounceSequence;
    }

    // ==================== Retry ====================

    @Nullable
    ScheduledTask getRetryTask() {
        return retryTask;
    }

    void setRetryTask(@Nullable ScheduledTask retryTask) {
        this.retryTask = retryTask;
    }

    long getRetrySequence() {
        return retrySequence;
    }

    long nextRetrySequence() {
        return ++retrySequence;
    }

    // ==================== Reaping ====================

    @Nullable
    ScheduledTask getReapTask() {
        return reapTask;
    }

    void setReapTask(@Nullable ScheduledTask reapTask) {
        this.reapTask = reapTask;
    }

    long getReapSequence() {
        return reapSequence;
    }

    long nextReapSequence() {
        return ++reapSequence;
    }

    /**
     * Count the timers armed on this channel that have not run yet.
     *
     * @return 0 to 3
     */
    int pendingTimerCount() {
        return isPending(debounceTask) + isPending(retryTask) + isPending(reapTask);
    }

    private static int isPending(@Nullable ScheduledTask task) {
        return task != null && task.getStatus() == TaskStatus.SCHEDULED ? 1 : 0;
    }

    @Override
    public String toString() {
        return "Channel{key=" + key + ", status=" + status + ", handlers=" + handlers.size() + "}";
    }
}
