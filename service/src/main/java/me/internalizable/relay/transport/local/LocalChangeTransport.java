package me.internalizable.relay.transport.local;

import com.google.gson.JsonObject;
import me.internalizable.relay.api.event.ChangeEvent;
import me.internalizable.relay.api.event.SubscribedEvent;
import me.internalizable.relay.api.table.RowFilter;
import me.internalizable.relay.api.table.Table;
import me.internalizable.relay.transport.ChangePayloadDecoder;
import me.internalizable.relay.transport.ChangeTransport;
import me.internalizable.relay.transport.ChannelHandle;
import me.internalizable.relay.transport.RowFilterMatcher;
import me.internalizable.relay.transport.TransportListener;
import me.internalizable.relay.transport.TransportStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process {@link ChangeTransport} for single-node deployments and local development.
 *
 * <p>Changes are pushed with {@link #publish} or {@link #publishJson} and delivered
 * synchronously, on the publishing thread, to every open channel whose table, event
 * selector and filter accept them. Subscription confirmations are delivered
 * asynchronously on the supplied executor, as a remote transport would.</p>
 */
public final class LocalChangeTransport implements ChangeTransport {

    private static final Logger LOGGER = LoggerFactory.getLogger(LocalChangeTransport.class);

    private final Executor callbackExecutor;
    private final ChangePayloadDecoder decoder;
    private final Map<Long, LocalChannel> channels = new ConcurrentHashMap<>();
    private final AtomicLong handleIdCounter = new AtomicLong(0);

    public LocalChangeTransport(@Nonnull Executor callbackExecutor, @Nonnull ChangePayloadDecoder decoder) {
        this.callbackExecutor = Objects.requireNonNull(callbackExecutor, "callbackExecutor");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
    }

    @Override
    @Nonnull
    public ChannelHandle openChannel(
            @Nonnull String name,
            @Nonnull Table table,
            @Nonnull SubscribedEvent event,
            @Nullable RowFilter filter,
            @Nonnull TransportListener listener) {
        ChannelHandle handle = new ChannelHandle(handleIdCounter.incrementAndGet(), name);
        LocalChannel channel = new LocalChannel(handle, table, event, filter, listener);
        channels.put(handle.id(), channel);

        callbackExecutor.execute(() -> {
            if (channels.get(handle.id()) == channel) {
                listener.onStatus(TransportStatus.SUBSCRIBED, null);
            }
        });

        LOGGER.debug("Opened local channel {} ({})", name, handle.id());
        return handle;
    }

    @Override
    public void closeChannel(@Nonnull ChannelHandle handle) {
        if (channels.remove(handle.id()) != null) {
            LOGGER.debug("Closed local channel {} ({})", handle.name(), handle.id());
        }
    }

    @Override
    public void shutdown() {
        channels.clear();
    }

    // ==================== Publishing ====================

    /**
     * Deliver a change to every matching channel.
     *
     * @param table the table the change happened on
     * @param event the change
     * @return the number of channels the change was delivered to
     */
    public int publish(@Nonnull Table table, @Nonnull ChangeEvent<JsonObject> event) {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(event, "event");

        int delivered = 0;
        for (LocalChannel channel : channels.values()) {
            if (channel.table() != table || !RowFilterMatcher.accepts(channel.event(), channel.filter(), event)) {
                continue;
            }
            channel.listener().onChange(event);
            delivered++;
        }
        return delivered;
    }

    /**
     * Decode a JSON change payload and deliver it.
     *
     * @param json the payload
     * @return the number of channels the change was delivered to, 0 if the payload was invalid
     */
    public int publishJson(@Nonnull String json) {
        return decoder.decode(json)
                .map(change -> publish(change.table(), change.event()))
                .orElse(0);
    }

    /**
     * Get the number of open channels.
     *
     * @return the open channel count
     */
    public int getOpenChannelCount() {
        return channels.size();
    }

    private record LocalChannel(
            ChannelHandle handle,
            Table table,
            SubscribedEvent event,
            RowFilter filter,
            TransportListener listener
    ) {
    }
}
