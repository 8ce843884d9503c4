package me.internalizable.relay.api.event;

import javax.annotation.Nonnull;
import java.util.Objects;
import java.util.function.Function;

/**
 * A row was updated.
 *
 * <p>Depending on the table's replica identity the old row may only carry the
 * primary key columns.</p>
 *
 * @param oldRow the row before the update
 * @param newRow the row after the update
 * @param <T> the row type
 */
public record UpdateEvent<T>(@Nonnull T oldRow, @Nonnull T newRow) implements ChangeEvent<T> {

    public UpdateEvent {
        Objects.requireNonNull(oldRow, "oldRow");
        Objects.requireNonNull(newRow, "newRow");
    }

    @Override
    @Nonnull
    public ChangeEventType eventType() {
        return ChangeEventType.UPDATE;
    }

    @Override
    @Nonnull
    public <R> UpdateEvent<R> map(@Nonnull Function<? super T, ? extends R> mapper) {
        return new UpdateEvent<>(mapper.apply(oldRow), mapper.apply(newRow));
    }
}
