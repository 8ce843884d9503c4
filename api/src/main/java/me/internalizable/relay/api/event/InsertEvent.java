package me.internalizable.relay.api.event;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;
import java.util.function.Function;

/**
 * A row was inserted.
 *
 * @param newRow the inserted row
 * @param <T> the row type
 */
public record InsertEvent<T>(@Nonnull T newRow) implements ChangeEvent<T> {

    public InsertEvent {
        Objects.requireNonNull(newRow, "newRow");
    }

    @Override
    @Nonnull
    public ChangeEventType eventType() {
        return ChangeEventType.INSERT;
    }

    @Override
    @Nullable
    public T oldRow() {
        return null;
    }

    @Override
    @Nonnull
    public <R> InsertEvent<R> map(@Nonnull Function<? super T, ? extends R> mapper) {
        return new InsertEvent<>(mapper.apply(newRow));
    }
}
