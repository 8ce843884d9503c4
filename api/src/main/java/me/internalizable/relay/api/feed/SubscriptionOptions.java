package me.internalizable.relay.api.feed;

import me.internalizable.relay.api.event.SubscribedEvent;
import me.internalizable.relay.api.table.RowFilter;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Objects;

/**
 * Options for a single {@link ChangeFeedService#subscribe} call.
 *
 * <ul>
 *   <li>{@code event}: which changes to listen for, defaults to {@link SubscribedEvent#ANY}</li>
 *   <li>{@code filter}: optional row filter expression, e.g. {@code user_id=eq.42}</li>
 *   <li>{@code debounce}: quiet period before delivery; the service default when unset</li>
 *   <li>{@code enableLogging}: log this channel's state transitions at INFO</li>
 * </ul>
 *
 * <p>{@code debounce} and {@code enableLogging} are channel properties: they are
 * taken from the subscription that creates the channel and shared by every
 * later subscriber of the same key.</p>
 */
public final class SubscriptionOptions {

    private static final SubscriptionOptions DEFAULTS = builder().build();

    private final SubscribedEvent event;
    private final String filter;
    private final Duration debounce;
    private final boolean enableLogging;

    private SubscriptionOptions(SubscribedEvent event, String filter, Duration debounce, boolean enableLogging) {
        this.event = event;
        this.filter = filter;
        this.debounce = debounce;
        this.enableLogging = enableLogging;
    }

    @Nonnull
    public static SubscriptionOptions defaults() {
        return DEFAULTS;
    }

    @Nonnull
    public static Builder builder() {
        return new Builder();
    }

    @Nonnull
    public SubscribedEvent getEvent() {
        return event;
    }

    @Nullable
    public String getFilter() {
        return filter;
    }

    @Nullable
    public Duration getDebounce() {
        return debounce;
    }

    public boolean isEnableLogging() {
        return enableLogging;
    }

    /**
     * Copy these options with a different filter.
     *
     * @param filter the filter expression, or null for none
     * @return the new options
     */
    @Nonnull
    public SubscriptionOptions withFilter(@Nullable String filter) {
        return new SubscriptionOptions(event, filter, debounce, enableLogging);
    }

    @Nonnull
    public Builder toBuilder() {
        return new Builder()
                .event(event)
                .filter(filter)
                .debounce(debounce)
                .enableLogging(enableLogging);
    }

    @Override
    public String toString() {
        return "SubscriptionOptions{event=" + event
                + ", filter=" + filter
                + ", debounce=" + debounce
                + ", enableLogging=" + enableLogging + "}";
    }

    public static final class Builder {
        private SubscribedEvent event = SubscribedEvent.ANY;
        private String filter;
        private Duration debounce;
        private boolean enableLogging;

        private Builder() {
        }

        @Nonnull
        public Builder event(@Nonnull SubscribedEvent event) {
            this.event = Objects.requireNonNull(event, "event");
            return this;
        }

        @Nonnull
        public Builder filter(@Nullable String filter) {
            this.filter = filter;
            return this;
        }

        @Nonnull
        public Builder filter(@Nonnull RowFilter filter) {
            this.filter = filter.expression();
            return this;
        }

        @Nonnull
        public Builder debounce(@Nullable Duration debounce) {
            this.debounce = debounce;
            return this;
        }

        @Nonnull
        public Builder debounceMs(long debounceMs) {
            this.debounce = Duration.ofMillis(debounceMs);
            return this;
        }

        @Nonnull
        public Builder enableLogging(boolean enableLogging) {
            this.enableLogging = enableLogging;
            return this;
        }

        @Nonnull
        public SubscriptionOptions build() {
            return new SubscriptionOptions(event, filter, debounce, enableLogging);
        }
    }
}
