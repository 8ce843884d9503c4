package me.internalizable.relay.api.feed;

import me.internalizable.relay.api.event.ChangeEvent;
import me.internalizable.relay.api.event.UpdateEvent;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Set of callbacks invoked when a change is delivered on a channel.
 *
 * <p>Every callback is optional, but a handler must define at least one to be
 * accepted by {@link ChangeFeedService#subscribe}. For each delivery the
 * type-specific callback runs first, then {@code onAny}. The two invocations are
 * isolated: if one throws, the other still runs.</p>
 *
 * <pre>{@code
 * ChangeHandler<Booking> handler = ChangeHandler.<Booking>builder()
 *     .onInsert(booking -> list.add(booking))
 *     .onUpdate(update -> list.replace(update.oldRow(), update.newRow()))
 *     .onDelete(booking -> list.remove(booking))
 *     .build();
 * }</pre>
 *
 * <p>Handlers are identified by reference: subscribing the same instance twice
 * to the same channel registers it once.</p>
 *
 * @param <T> the row type
 */
public final class ChangeHandler<T> {

    private final Consumer<T> onInsert;
    private final Consumer<UpdateEvent<T>> onUpdate;
    private final Consumer<T> onDelete;
    private final Consumer<ChangeEvent<T>> onAny;

    private ChangeHandler(Builder<T> builder) {
        this.onInsert = builder.onInsert;
        this.onUpdate = builder.onUpdate;
        this.onDelete = builder.onDelete;
        this.onAny = builder.onAny;
    }

    @Nonnull
    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    /**
     * Create a handler that only listens to every change.
     *
     * @param onAny the callback
     * @param <T> the row type
     * @return the handler
     */
    @Nonnull
    public static <T> ChangeHandler<T> onAny(@Nonnull Consumer<ChangeEvent<T>> onAny) {
        return ChangeHandler.<T>builder().onAny(onAny).build();
    }

    @Nullable
    public Consumer<T> getOnInsert() {
        return onInsert;
    }

    @Nullable
    public Consumer<UpdateEvent<T>> getOnUpdate() {
        return onUpdate;
    }

    @Nullable
    public Consumer<T> getOnDelete() {
        return onDelete;
    }

    @Nullable
    public Consumer<ChangeEvent<T>> getOnAny() {
        return onAny;
    }

    /**
     * Check whether at least one callback is defined.
     *
     * @return true if the handler can receive anything
     */
    public boolean hasCallbacks() {
        return onInsert != null || onUpdate != null || onDelete != null || onAny != null;
    }

    public static final class Builder<T> {
        private Consumer<T> onInsert;
        private Consumer<UpdateEvent<T>> onUpdate;
        private Consumer<T> onDelete;
        private Consumer<ChangeEvent<T>> onAny;

        private Builder() {
        }

        @Nonnull
        public Builder<T> onInsert(@Nonnull Consumer<T> callback) {
            this.onInsert = Objects.requireNonNull(callback, "callback");
            return this;
        }

        @Nonnull
        public Builder<T> onUpdate(@Nonnull Consumer<UpdateEvent<T>> callback) {
            this.onUpdate = Objects.requireNonNull(callback, "callback");
            return this;
        }

        @Nonnull
        public Builder<T> onDelete(@Nonnull Consumer<T> callback) {
            this.onDelete = Objects.requireNonNull(callback, "callback");
            return this;
        }

        @Nonnull
        public Builder<T> onAny(@Nonnull Consumer<ChangeEvent<T>> callback) {
            this.onAny = Objects.requireNonNull(callback, "callback");
            return this;
        }

        @Nonnull
        public ChangeHandler<T> build() {
            return new ChangeHandler<>(this);
        }
    }
}
