package me.internalizable.relay.transport;

import com.google.gson.JsonObject;
import me.internalizable.relay.api.event.ChangeEvent;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Receives status transitions and row changes for one opened channel.
 *
 * <p>Transports may call these methods from any thread.</p>
 */
public interface TransportListener {

    /**
     * Called when the channel's status changes.
     *
     * @param status the new status
     * @param cause the failure, if the transport has one
     */
    void onStatus(@Nonnull TransportStatus status, @Nullable Throwable cause);

    /**
     * Called for each change matching the channel's table, event selector and filter.
     *
     * @param event the decoded change
     */
    void onChange(@Nonnull ChangeEvent<JsonObject> event);
}
