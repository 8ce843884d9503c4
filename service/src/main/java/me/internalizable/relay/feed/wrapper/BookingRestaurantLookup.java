package me.internalizable.relay.feed.wrapper;

import javax.annotation.Nonnull;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Resolves the restaurant a booking belongs to.
 *
 * <p>{@code booking_tables} rows only carry a booking id, so availability
 * subscriptions need this lookup to tell whether a row concerns their restaurant.</p>
 */
@FunctionalInterface
public interface BookingRestaurantLookup {

    /**
     * Look up the restaurant of a booking.
     *
     * @param bookingId the booking id
     * @return a future completing with the restaurant id, or empty if the booking is unknown
     */
    @Nonnull
    CompletableFuture<Optional<String>> restaurantIdOf(@Nonnull String bookingId);
}
