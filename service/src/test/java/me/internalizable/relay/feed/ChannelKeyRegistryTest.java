package me.internalizable.relay.feed;

import me.internalizable.relay.api.event.SubscribedEvent;
import me.internalizable.relay.api.table.RowFilter;
import me.internalizable.relay.api.table.Table;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

class ChannelKeyRegistryTest {

    @Test
    void keyWithoutFilter() {
        assertEquals("bookings:*", ChannelKeyRegistry.computeKey(Table.BOOKINGS, SubscribedEvent.ANY, null).value());
    }

    @Test
    void keyWithFilter() {
        RowFilter filter = RowFilter.parse("user_id=eq.42");

        assertEquals("bookings:INSERT:user_id=eq.42",
                ChannelKeyRegistry.computeKey(Table.BOOKINGS, SubscribedEvent.INSERT, filter).value());
    }

    @Test
    void equivalentFiltersProduceTheSameKey() {
        assertEquals(
                ChannelKeyRegistry.computeKey(Table.WAITLIST, SubscribedEvent.ANY, RowFilter.parse("  user_id=eq.42 ")),
                ChannelKeyRegistry.computeKey(Table.WAITLIST, SubscribedEvent.ANY, RowFilter.eq("user_id", 42)));
    }

    @Test
    void everyCombinationHasItsOwnKey() {
        RowFilter[] filters = {
                null,
                RowFilter.parse("user_id=eq.42"),
                RowFilter.parse("user_id=eq.420"),
                RowFilter.parse("restaurant_id=eq.42"),
                RowFilter.parse("user_id=neq.42"),
        };

        Set<String> keys = new HashSet<>();
        int combinations = 0;
        for (Table table : Table.values()) {
            for (SubscribedEvent event : SubscribedEvent.values()) {
                for (RowFilter filter : filters) {
                    keys.add(ChannelKeyRegistry.computeKey(table, event, filter).value());
                    combinations++;
                }
            }
        }

        assertEquals(combinations, keys.size());
    }

    @Test
    void tableIsPartOfTheKey() {
        assertNotEquals(
                ChannelKeyRegistry.computeKey(Table.BOOKING_INVITES, SubscribedEvent.ANY, null),
                ChannelKeyRegistry.computeKey(Table.BOOKINGS, SubscribedEvent.ANY, null));
    }
}
