package me.internalizable.relay.feed;

import me.internalizable.relay.api.feed.ChangeHandler;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Handlers registered on one channel, keyed by handler identity.
 *
 * <p>Insertion order is kept so handlers are invoked in the order they subscribed.</p>
 */
final class HandlerSet {

    private final Map<ChangeHandler<?>, HandlerSlot<?>> slots = new IdentityHashMap<>();
    private final List<HandlerSlot<?>> order = new ArrayList<>();

    @Nullable
    @SuppressWarnings("unchecked")
    synchronized <T> HandlerSlot<T> find(ChangeHandler<T> handler) {
        return (HandlerSlot<T>) slots.get(handler);
    }

    synchronized boolean add(HandlerSlot<?> slot) {
        if (slots.putIfAbsent(slot.getHandler(), slot) != null) {
            return false;
        }
        order.add(slot);
        return true;
    }

    synchronized boolean remove(HandlerSlot<?> slot) {
        if (!slots.remove(slot.getHandler(), slot)) {
            return false;
        }
        order.remove(slot);
        return true;
    }

    synchronized int size() {
        return order.size();
    }

    synchronized boolean isEmpty() {
        return order.isEmpty();
    }

    synchronized List<HandlerSlot<?>> snapshot() {
        return List.copyOf(order);
    }

    synchronized void clear() {
        order.forEach(HandlerSlot::deactivate);
        order.clear();
        slots.clear();
    }
}
