package me.internalizable.relay.api.event;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.function.Function;

/**
 * A single row change delivered by the change feed.
 *
 * <p>Change events form a closed hierarchy: every event is exactly one of
 * {@link InsertEvent}, {@link UpdateEvent} or {@link DeleteEvent}. Payloads are
 * validated into this shape where they enter the service, so handlers never see
 * a loosely-typed payload.</p>
 *
 * <pre>{@code
 * if (event instanceof UpdateEvent<Booking> update) {
 *     render(update.oldRow(), update.newRow());
 * }
 * }</pre>
 *
 * @param <T> the row type
 */
public sealed interface ChangeEvent<T> permits InsertEvent, UpdateEvent, DeleteEvent {

    /**
     * Get the kind of change.
     *
     * @return the event type
     */
    @Nonnull
    ChangeEventType eventType();

    /**
     * Get the row as it was before the change.
     *
     * @return the previous row, or null for inserts
     */
    @Nullable
    T oldRow();

    /**
     * Get the row as it is after the change.
     *
     * @return the new row, or null for deletes
     */
    @Nullable
    T newRow();

    /**
     * Convert the rows of this event, keeping its type.
     *
     * @param mapper the row conversion
     * @param <R> the target row type
     * @return an event of the same kind carrying converted rows
     */
    @Nonnull
    <R> ChangeEvent<R> map(@Nonnull Function<? super T, ? extends R> mapper);
}
