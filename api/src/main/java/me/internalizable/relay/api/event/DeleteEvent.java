package me.internalizable.relay.api.event;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;
import java.util.function.Function;

/**
 * A row was deleted.
 *
 * @param oldRow the deleted row
 * @param <T> the row type
 */
public record DeleteEvent<T>(@Nonnull T oldRow) implements ChangeEvent<T> {

    public DeleteEvent {
        Objects.requireNonNull(oldRow, "oldRow");
    }

    @Override
    @Nonnull
    public ChangeEventType eventType() {
        return ChangeEventType.DELETE;
    }

    @Override
    @Nullable
    public T newRow() {
        return null;
    }

    @Override
    @Nonnull
    public <R> DeleteEvent<R> map(@Nonnull Function<? super T, ? extends R> mapper) {
        return new DeleteEvent<>(mapper.apply(oldRow));
    }
}
