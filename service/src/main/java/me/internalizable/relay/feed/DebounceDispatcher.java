package me.internalizable.relay.feed;

import com.google.gson.JsonObject;
import me.internalizable.relay.api.event.ChangeEvent;
import me.internalizable.relay.api.event.DeleteEvent;
import me.internalizable.relay.api.event.InsertEvent;
import me.internalizable.relay.api.event.UpdateEvent;
import me.internalizable.relay.api.feed.ChangeHandler;
import me.internalizable.relay.api.feed.ChannelKey;
import me.internalizable.relay.scheduler.ScheduledTask;
import me.internalizable.relay.scheduler.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Coalesces bursts of changes on a channel into a single delivery.
 *
 * <p>Every offered event replaces the channel's pending event and restarts its
 * debounce timer. When the timer fires, the latest event is delivered to the
 * handlers registered at that moment. This is a quiet-period debounce: a steady
 * stream of events closer together than the debounce delays delivery until the
 * stream pauses.</p>
 *
 * <p>{@link #offer}, {@link #discard} and {@link #takePending} must be called while
 * holding the multiplexer's lock. {@link #dispatch} must be called without it.</p>
 */
final class DebounceDispatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(DebounceDispatcher.class);

    private final TaskScheduler scheduler;
    private final RowMapper rowMapper;

    private final AtomicLong dispatches = new AtomicLong();
    private final AtomicLong handlerErrors = new AtomicLong();

    DebounceDispatcher(TaskScheduler scheduler, RowMapper rowMapper) {
        this.scheduler = scheduler;
        this.rowMapper = rowMapper;
    }

    void offer(Channel channel, ChangeEvent<JsonObject> event, ChannelCallbacks callbacks) {
        cancelTimer(channel);
        channel.setPendingEvent(event);
        long sequence = channel.nextDebounceSequence();
        channel.setDebounceTask(scheduler.schedule(
                () -> callbacks.debounceElapsed(channel, sequence),
                channel.getDebounce()));
    }

    /**
     * Drop the pending event and stop the timer.
     */
    void discard(Channel channel) {
        cancelTimer(channel);
        channel.nextDebounceSequence();
        channel.setPendingEvent(null);
    }

    /**
     * Claim the pending event for a timer firing.
     *
     * @return the event, or null if the firing is stale
     */
    @Nullable
    ChangeEvent<JsonObject> takePending(Channel channel, long sequence) {
        if (channel.getDebounceSequence() != sequence) {
            return null;
        }
        ChangeEvent<JsonObject> event = channel.getPendingEvent();
        channel.setPendingEvent(null);
        channel.setDebounceTask(null);
        return event;
    }

    void dispatch(Channel channel, ChangeEvent<JsonObject> event) {
        dispatches.incrementAndGet();
        channel.log("Dispatching {} on {} to {} handler(s)", event.eventType(), channel.getKey(), channel.handlers().size());

        for (HandlerSlot<?> slot : channel.handlers().snapshot()) {
            if (slot.isActive()) {
                deliver(channel, slot, event);
            }
        }
    }

    private <T> void deliver(Channel channel, HandlerSlot<T> slot, ChangeEvent<JsonObject> raw) {
        ChangeEvent<T> event;
        try {
            event = rowMapper.convert(raw, slot.getRowType());
        } catch (Throwable t) {
            rethrowIfFatal(t);
            handlerErrors.incrementAndGet();
            LOGGER.error("Failed to convert {} row on {} to {}",
                    raw.eventType(), channel.getKey(), slot.getRowType().getSimpleName(), t);
            return;
        }

        ChangeHandler<T> handler = slot.getHandler();
        if (event instanceof InsertEvent<T> insert) {
            invoke(channel.getKey(), "onInsert", handler.getOnInsert(), insert.newRow());
        } else if (event instanceof UpdateEvent<T> update) {
            invoke(channel.getKey(), "onUpdate", handler.getOnUpdate(), update);
        } else if (event instanceof DeleteEvent<T> delete) {
            invoke(channel.getKey(), "onDelete", handler.getOnDelete(), delete.oldRow());
        }
        invoke(channel.getKey(), "onAny", handler.getOnAny(), event);
    }

    /**
     * Run one callback in isolation. Anything it throws short of a
     * {@link VirtualMachineError} is logged and counted as a handler error.
     */
    <A> void invoke(ChannelKey key, String callbackName, @Nullable Consumer<A> callback, A argument) {
        if (callback == null) {
            return;
        }
        try {
            callback.accept(argument);
        } catch (Throwable t) {
            rethrowIfFatal(t);
            handlerErrors.incrementAndGet();
            LOGGER.error("Handler {} failed on channel {}", callbackName, key, t);
        }
    }

    private static void rethrowIfFatal(Throwable t) {
        if (t instanceof VirtualMachineError error) {
            throw error;
        }
    }

    private static void cancelTimer(Channel channel) {
        ScheduledTask task = channel.getDebounceTask();
        if (task != null) {
            task.cancel();
            channel.setDebounceTask(null);
        }
    }

    long getDispatchCount() {
        return dispatches.get();
    }

    long getHandlerErrorCount() {
        return handlerErrors.get();
    }
}
