package me.internalizable.relay.feed;

import com.google.gson.JsonObject;
import me.internalizable.relay.api.event.ChangeEvent;
import me.internalizable.relay.api.event.ChangeEventType;
import me.internalizable.relay.api.event.DeleteEvent;
import me.internalizable.relay.api.event.InsertEvent;
import me.internalizable.relay.api.event.SubscribedEvent;
import me.internalizable.relay.api.event.UpdateEvent;
import me.internalizable.relay.api.feed.ChangeHandler;
import me.internalizable.relay.api.feed.ChannelKey;
import me.internalizable.relay.api.feed.ChannelStatus;
import me.internalizable.relay.api.feed.FeedStats;
import me.internalizable.relay.api.feed.InvalidSubscriptionException;
import me.internalizable.relay.api.feed.Subscription;
import me.internalizable.relay.api.feed.SubscriptionOptions;
import me.internalizable.relay.api.table.Table;
import me.internalizable.relay.scheduler.ManualTaskScheduler;
import me.internalizable.relay.transport.RecordingTransport;
import me.internalizable.relay.transport.RecordingTransport.OpenedChannel;
import me.internalizable.relay.transport.TransportStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SubscriptionMultiplexerTest {

    private static final ChannelKey USER_42_BOOKINGS = new ChannelKey("bookings:*:user_id=eq.42");

    private ManualTaskScheduler scheduler;
    private RecordingTransport transport;
    private SubscriptionMultiplexer feed;

    @BeforeEach
    void setUp() {
        scheduler = new ManualTaskScheduler();
        transport = new RecordingTransport();
        feed = new SubscriptionMultiplexer(transport, scheduler, FeedSettings.defaults());
        feed.init();
    }

    private static SubscriptionOptions userFilter() {
        return SubscriptionOptions.builder().filter("user_id=eq.42").build();
    }

    private static JsonObject row(String id, String status) {
        JsonObject row = new JsonObject();
        row.addProperty("id", id);
        row.addProperty("user_id", "42");
        row.addProperty("status", status);
        return row;
    }

    private Subscription subscribeRecording(List<ChangeEvent<JsonObject>> sink) {
        return feed.subscribeRaw(Table.BOOKINGS, ChangeHandler.onAny(sink::add), userFilter());
    }

    // ==================== Deduplication ====================

    @Test
    void identicalSubscriptionsShareOneChannel() {
        for (int i = 0; i < 3; i++) {
            subscribeRecording(new ArrayList<>());
        }

        assertEquals(1, transport.openCount());
        assertEquals(USER_42_BOOKINGS.value(), transport.lastOpened().name());
        assertEquals(Set.of(USER_42_BOOKINGS), feed.getActiveSubscriptions());
        assertEquals(3, feed.getStats().totalHandlers());
    }

    @Test
    void concurrentSubscriptionsOpenOneChannel() throws Exception {
        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Subscription>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return subscribeRecording(new CopyOnWriteArrayList<>());
                }));
            }
            start.countDown();
            for (Future<Subscription> future : futures) {
                assertEquals(USER_42_BOOKINGS, future.get(5, TimeUnit.SECONDS).getChannelKey());
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, transport.openCount());
        assertEquals(threads, feed.getStats().totalHandlers());
    }

    @Test
    void distinctFiltersAndEventsOpenSeparateChannels() {
        ChangeHandler<JsonObject> handler = ChangeHandler.onAny(event -> { });
        feed.subscribeRaw(Table.BOOKINGS, handler, userFilter());
        feed.subscribeRaw(Table.BOOKINGS, handler, SubscriptionOptions.builder().filter("user_id=eq.43").build());
        feed.subscribeRaw(Table.BOOKINGS, handler, userFilter().toBuilder().event(SubscribedEvent.INSERT).build());
        feed.subscribeRaw(Table.WAITLIST, handler, userFilter());

        assertEquals(4, transport.openCount());
        assertEquals(4, feed.getActiveSubscriptions().size());
    }

    @Test
    void sameHandlerInstanceIsRegisteredOnce() {
        List<ChangeEvent<JsonObject>> received = new ArrayList<>();
        ChangeHandler<JsonObject> handler = ChangeHandler.onAny(received::add);

        Subscription first = feed.subscribeRaw(Table.BOOKINGS, handler, userFilter());
        Subscription second = feed.subscribeRaw(Table.BOOKINGS, handler, userFilter());
        transport.confirmLast();

        assertEquals(1, feed.getStats().totalHandlers());

        transport.emit(transport.lastOpened(), new InsertEvent<>(row("b-1", "pending")));
        scheduler.advanceMillis(500);
        assertEquals(1, received.size());

        first.unsubscribe();
        assertFalse(second.isActive());
        assertEquals(Optional.of(ChannelStatus.DRAINING), feed.getChannelStatus(USER_42_BOOKINGS));
    }

    // ==================== Status ====================

    @Test
    void confirmationActivatesChannel() {
        subscribeRecording(new ArrayList<>());

        assertEquals(Optional.of(ChannelStatus.CONNECTING), feed.getChannelStatus(USER_42_BOOKINGS));
        assertFalse(feed.isHealthy());

        transport.confirmLast();

        assertEquals(Optional.of(ChannelStatus.ACTIVE), feed.getChannelStatus(USER_42_BOOKINGS));
        assertTrue(feed.isHealthy());
    }

    @Test
    void emptyServiceIsHealthy() {
        assertTrue(feed.isHealthy());
        assertEquals(Optional.empty(), feed.getChannelStatus(USER_42_BOOKINGS));
    }

    // ==================== Debounce ====================

    @Test
    void insertThenUpdateWithinDebounceDeliversOnlyTheUpdate() {
        List<ChangeEvent<JsonObject>> received = new ArrayList<>();
        subscribeRecording(received);
        OpenedChannel channel = transport.lastOpened();
        transport.confirm(channel);

        transport.emit(channel, new InsertEvent<>(row("b-1", "pending")));
        scheduler.advanceMillis(50);
        transport.emit(channel, new UpdateEvent<>(row("b-1", "pending"), row("b-1", "confirmed")));

        scheduler.advanceMillis(499);
        assertTrue(received.isEmpty());

        scheduler.advanceMillis(1);
        assertEquals(1, received.size());
        UpdateEvent<JsonObject> update = assertInstanceOf(UpdateEvent.class, received.get(0));
        assertEquals("confirmed", update.newRow().get("status").getAsString());
        assertEquals(550, scheduler.nowMillis());
    }

    @Test
    void spacedEventsAreDeliveredInOrder() {
        List<ChangeEvent<JsonObject>> received = new ArrayList<>();
        subscribeRecording(received);
        OpenedChannel channel = transport.lastOpened();
        transport.confirm(channel);

        transport.emit(channel, new InsertEvent<>(row("b-1", "pending")));
        scheduler.advanceMillis(600);
        transport.emit(channel, new UpdateEvent<>(row("b-1", "pending"), row("b-1", "confirmed")));
        scheduler.advanceMillis(600);
        transport.emit(channel, new DeleteEvent<>(row("b-1", "confirmed")));
        scheduler.advanceMillis(600);

        assertEquals(List.of(ChangeEventType.INSERT, ChangeEventType.UPDATE, ChangeEventType.DELETE),
                received.stream().map(ChangeEvent::eventType).toList());
        assertEquals(3, feed.getStats().dispatches());
        assertEquals(3, feed.getStats().eventsReceived());
    }

    @Test
    void debounceIsTakenFromTheCreatingSubscription() {
        List<ChangeEvent<JsonObject>> received = new ArrayList<>();
        feed.subscribeRaw(Table.BOOKINGS, ChangeHandler.onAny(received::add),
                userFilter().toBuilder().debounceMs(100).build());
        feed.subscribeRaw(Table.BOOKINGS, ChangeHandler.onAny(event -> { }),
                userFilter().toBuilder().debounceMs(2000).build());
        transport.confirmLast();

        transport.emit(transport.lastOpened(), new InsertEvent<>(row("b-1", "pending")));
        scheduler.advanceMillis(100);

        assertEquals(1, received.size());
    }

    @Test
    void zeroDebounceDeliversOnTheSchedulerRightAway() {
        List<ChangeEvent<JsonObject>> received = new ArrayList<>();
        feed.subscribeRaw(Table.BOOKINGS, ChangeHandler.onAny(received::add),
                userFilter().toBuilder().debounce(Duration.ZERO).build());
        transport.confirmLast();

        transport.emit(transport.lastOpened(), new InsertEvent<>(row("b-1", "pending")));
        assertTrue(received.isEmpty());

        scheduler.runPending();
        assertEquals(1, received.size());
    }

    // ==================== Handlers ====================

    @Test
    void throwingCallbackDoesNotStopOtherCallbacks() {
        List<String> calls = new ArrayList<>();
        feed.subscribeRaw(Table.BOOKINGS, ChangeHandler.<JsonObject>builder()
                .onInsert(row -> {
                    calls.add("first.onInsert");
                    throw new IllegalStateException("boom");
                })
                .onAny(event -> calls.add("first.onAny"))
                .build(), userFilter());
        feed.subscribeRaw(Table.BOOKINGS, ChangeHandler.onAny(event -> calls.add("second.onAny")), userFilter());
        transport.confirmLast();

        transport.emit(transport.lastOpened(), new InsertEvent<>(row("b-1", "pending")));
        scheduler.advanceMillis(500);

        assertEquals(List.of("first.onInsert", "first.onAny", "second.onAny"), calls);
        assertEquals(1, feed.getStats().handlerErrors());
        assertTrue(feed.isHealthy());
    }

    @Test
    void typeSpecificCallbacksReceiveRows() {
        List<String> calls = new ArrayList<>();
        feed.subscribeRaw(Table.BOOKINGS, ChangeHandler.<JsonObject>builder()
                .onInsert(row -> calls.add("insert:" + row.get("status").getAsString()))
                .onUpdate(update -> calls.add("update:" + update.oldRow().get("status").getAsString()
                        + "->" + update.newRow().get("status").getAsString()))
                .onDelete(row -> calls.add("delete:" + row.get("id").getAsString()))
                .build(), userFilter());
        OpenedChannel channel = transport.lastOpened();
        transport.confirm(channel);

        transport.emit(channel, new InsertEvent<>(row("b-1", "pending")));
        scheduler.advanceMillis(500);
        transport.emit(channel, new UpdateEvent<>(row("b-1", "pending"), row("b-1", "seated")));
        scheduler.advanceMillis(500);
        transport.emit(channel, new DeleteEvent<>(row("b-1", "seated")));
        scheduler.advanceMillis(500);

        assertEquals(List.of("insert:pending", "update:pending->seated", "delete:b-1"), calls);
    }

    record Booking(String id, String userId, String status) {
    }

    @Test
    void rowsAreConvertedToTheRequestedType() {
        List<Booking> bookings = new ArrayList<>();
        feed.subscribe(Table.BOOKINGS, Booking.class,
                ChangeHandler.<Booking>builder().onInsert(bookings::add).build(), userFilter());
        transport.confirmLast();

        transport.emit(transport.lastOpened(), new InsertEvent<>(row("b-7", "pending")));
        scheduler.advanceMillis(500);

        assertEquals(List.of(new Booking("b-7", "42", "pending")), bookings);
    }

    @Test
    void conversionFailureOnlyAffectsThatHandler() {
        List<Booking> typed = new ArrayList<>();
        List<ChangeEvent<JsonObject>> raw = new ArrayList<>();
        feed.subscribe(Table.BOOKINGS, Booking.class,
                ChangeHandler.<Booking>builder().onInsert(typed::add).build(), userFilter());
        subscribeRecording(raw);
        transport.confirmLast();

        JsonObject malformed = row("b-1", "pending");
        JsonObject nested = new JsonObject();
        nested.addProperty("unexpected", true);
        malformed.add("status", nested);
        transport.emit(transport.lastOpened(), new InsertEvent<>(malformed));
        scheduler.advanceMillis(500);

        assertTrue(typed.isEmpty());
        assertEquals(1, raw.size());
        assertEquals(1, feed.getStats().handlerErrors());
    }

    @Test
    void handlerRemovedBeforeDispatchIsNotInvoked() {
        List<ChangeEvent<JsonObject>> removed = new ArrayList<>();
        List<ChangeEvent<JsonObject>> kept = new ArrayList<>();
        Subscription subscription = subscribeRecording(removed);
        subscribeRecording(kept);
        transport.confirmLast();

        transport.emit(transport.lastOpened(), new InsertEvent<>(row("b-1", "pending")));
        subscription.unsubscribe();
        scheduler.advanceMillis(500);

        assertTrue(removed.isEmpty());
        assertEquals(1, kept.size());
    }

    // ==================== Unsubscribe & Grace Period ====================

    @Test
    void lastUnsubscribeTearsDownAfterGracePeriod() {
        Subscription subscription = subscribeRecording(new ArrayList<>());
        transport.confirmLast();

        subscription.unsubscribe();
        assertFalse(subscription.isActive());
        assertEquals(Optional.of(ChannelStatus.DRAINING), feed.getChannelStatus(USER_42_BOOKINGS));

        scheduler.advanceMillis(4999);
        assertEquals(0, transport.closeCount());

        scheduler.advanceMillis(1);
        assertEquals(1, transport.closeCount());
        assertTrue(feed.getActiveSubscriptions().isEmpty());
    }

    @Test
    void resubscribeWithinGracePeriodReusesChannel() {
        Subscription subscription = subscribeRecording(new ArrayList<>());
        transport.confirmLast();
        subscription.unsubscribe();
        scheduler.advanceMillis(3000);

        List<ChangeEvent<JsonObject>> received = new ArrayList<>();
        subscribeRecording(received);
        scheduler.advanceMillis(10_000);

        assertEquals(1, transport.openCount());
        assertEquals(0, transport.closeCount());
        assertEquals(Optional.of(ChannelStatus.ACTIVE), feed.getChannelStatus(USER_42_BOOKINGS));

        transport.emit(transport.lastOpened(), new InsertEvent<>(row("b-1", "pending")));
        scheduler.advanceMillis(500);
        assertEquals(1, received.size());
    }

    @Test
    void resubscribeAfterGracePeriodOpensNewChannel() {
        subscribeRecording(new ArrayList<>()).unsubscribe();
        scheduler.advanceMillis(5000);

        subscribeRecording(new ArrayList<>());

        assertEquals(2, transport.openCount());
        assertEquals(Optional.of(ChannelStatus.CONNECTING), feed.getChannelStatus(USER_42_BOOKINGS));
    }

    @Test
    void doubleUnsubscribeHasNoFurtherEffect() {
        Subscription first = subscribeRecording(new ArrayList<>());
        subscribeRecording(new ArrayList<>());
        transport.confirmLast();

        first.unsubscribe();
        first.unsubscribe();

        assertEquals(1, feed.getStats().totalHandlers());
        assertEquals(Optional.of(ChannelStatus.ACTIVE), feed.getChannelStatus(USER_42_BOOKINGS));
    }

    @Test
    void closeFailureDuringTeardownIsSwallowed() {
        transport.failCloses(new IllegalStateException("socket gone"));
        subscribeRecording(new ArrayList<>()).unsubscribe();

        scheduler.advanceMillis(5000);

        assertEquals(1, transport.closeCount());
        assertTrue(feed.getActiveSubscriptions().isEmpty());
    }

    // ==================== Cleanup ====================

    @Test
    void cleanupCancelsEveryTimer() {
        List<ChangeEvent<JsonObject>> received = new ArrayList<>();
        Subscription kept = subscribeRecording(received);
        feed.subscribeRaw(Table.WAITLIST, ChangeHandler.onAny(event -> { }), userFilter()).unsubscribe();
        transport.confirm(transport.opened().get(0));
        transport.emit(transport.opened().get(0), new InsertEvent<>(row("b-1", "pending")));
        assertEquals(2, feed.getStats().pendingTimers());

        feed.cleanup();

        assertTrue(feed.getActiveSubscriptions().isEmpty());
        assertEquals(0, scheduler.pendingTaskCount());
        assertEquals(2, transport.closeCount());

        scheduler.advanceMillis(60_000);
        assertTrue(received.isEmpty());
        assertFalse(kept.isActive());
        kept.unsubscribe();
    }

    @Test
    void subscribeRequiresInitialization() {
        feed.cleanup();
        assertThrows(IllegalStateException.class, () -> subscribeRecording(new ArrayList<>()));

        feed.init();
        subscribeRecording(new ArrayList<>());
        assertEquals(1, transport.openCount());
    }

    // ==================== Validation ====================

    @Test
    void handlerWithoutCallbacksIsRejected() {
        assertThrows(InvalidSubscriptionException.class,
                () -> feed.subscribeRaw(Table.BOOKINGS, ChangeHandler.<JsonObject>builder().build(), userFilter()));
        assertEquals(0, transport.openCount());
    }

    @Test
    void malformedFilterIsRejected() {
        ChangeHandler<JsonObject> handler = ChangeHandler.onAny(event -> { });
        assertThrows(InvalidSubscriptionException.class, () -> feed.subscribeRaw(Table.BOOKINGS, handler,
                SubscriptionOptions.builder().filter("user_id==42").build()));
        assertThrows(InvalidSubscriptionException.class, () -> feed.subscribeRaw(Table.BOOKINGS, handler,
                SubscriptionOptions.builder().filter("user_id=like.42").build()));
    }

    @Test
    void negativeDebounceIsRejected() {
        assertThrows(InvalidSubscriptionException.class, () -> feed.subscribeRaw(Table.BOOKINGS,
                ChangeHandler.onAny(event -> { }),
                SubscriptionOptions.builder().debounceMs(-1).build()));
    }

    // ==================== Retry ====================

    @Nested
    class Retry {

        @Test
        void errorWithHandlersReconnectsWithExponentialBackoff() {
            subscribeRecording(new ArrayList<>());
            transport.confirmLast();

            long[] expectedDelays = {2000, 4000, 8000, 16_000, 30_000, 30_000};
            for (long delay : expectedDelays) {
                int opened = transport.openCount();
                transport.report(transport.lastOpened(), TransportStatus.CHANNEL_ERROR);
                assertEquals(Optional.of(ChannelStatus.ERROR), feed.getChannelStatus(USER_42_BOOKINGS));
                assertEquals(1, feed.getStats().retryingChannels());

                scheduler.advanceMillis(delay - 1);
                assertEquals(opened, transport.openCount());

                scheduler.advanceMillis(1);
                assertEquals(opened + 1, transport.openCount());
                assertEquals(Optional.of(ChannelStatus.CONNECTING), feed.getChannelStatus(USER_42_BOOKINGS));
            }
        }

        @Test
        void timeoutIsTreatedAsError() {
            subscribeRecording(new ArrayList<>());
            transport.report(transport.lastOpened(), TransportStatus.TIMED_OUT);

            assertEquals(Optional.of(ChannelStatus.ERROR), feed.getChannelStatus(USER_42_BOOKINGS));
            assertEquals(1, transport.closeCount());

            scheduler.advanceMillis(2000);
            assertEquals(2, transport.openCount());
        }

        @Test
        void confirmationResetsBackoff() {
            subscribeRecording(new ArrayList<>());
            transport.report(transport.lastOpened(), TransportStatus.CHANNEL_ERROR);
            scheduler.advanceMillis(2000);
            transport.report(transport.lastOpened(), TransportStatus.CHANNEL_ERROR);
            scheduler.advanceMillis(4000);
            transport.confirmLast();

            transport.report(transport.lastOpened(), TransportStatus.CHANNEL_ERROR);
            scheduler.advanceMillis(2000);

            assertEquals(4, transport.openCount());
        }

        @Test
        void errorWithoutHandlersTearsDownImmediately() {
            subscribeRecording(new ArrayList<>()).unsubscribe();
            transport.report(transport.lastOpened(), TransportStatus.CHANNEL_ERROR);

            assertTrue(feed.getActiveSubscriptions().isEmpty());
            assertEquals(0, scheduler.pendingTaskCount());
        }

        @Test
        void lastUnsubscribeWhileFailedTearsDownImmediately() {
            Subscription subscription = subscribeRecording(new ArrayList<>());
            transport.report(transport.lastOpened(), TransportStatus.CHANNEL_ERROR);

            subscription.unsubscribe();

            assertTrue(feed.getActiveSubscriptions().isEmpty());
            scheduler.advanceMillis(60_000);
            assertEquals(1, transport.openCount());
        }

        @Test
        void callbacksFromReplacedConnectionsAreIgnored() {
            List<ChangeEvent<JsonObject>> received = new ArrayList<>();
            subscribeRecording(received);
            OpenedChannel stale = transport.lastOpened();
            transport.report(stale, TransportStatus.CHANNEL_ERROR);
            scheduler.advanceMillis(2000);

            transport.confirm(stale);
            transport.emit(stale, new InsertEvent<>(row("b-1", "pending")));
            scheduler.advanceMillis(500);

            assertEquals(Optional.of(ChannelStatus.CONNECTING), feed.getChannelStatus(USER_42_BOOKINGS));
            assertTrue(received.isEmpty());
            assertEquals(0, feed.getStats().eventsReceived());
        }

        @Test
        void openFailureIsRetried() {
            transport.failNextOpen(new IllegalStateException("not connected"));

            Subscription subscription = subscribeRecording(new ArrayList<>());

            assertTrue(subscription.isActive());
            assertEquals(Optional.of(ChannelStatus.ERROR), feed.getChannelStatus(USER_42_BOOKINGS));
            scheduler.advanceMillis(2000);
            assertEquals(1, transport.openCount());
        }

        @Test
        void exhaustedAttemptsTearChannelDown() {
            BackoffPolicy limited = new BackoffPolicy(Duration.ofSeconds(2), Duration.ofSeconds(30), 2.0, 2);
            feed = new SubscriptionMultiplexer(transport, scheduler,
                    new FeedSettings(Duration.ofMillis(500), Duration.ofMillis(5000), limited));
            feed.init();
            Subscription subscription = subscribeRecording(new ArrayList<>());

            transport.report(transport.lastOpened(), TransportStatus.CHANNEL_ERROR);
            scheduler.advanceMillis(2000);
            transport.report(transport.lastOpened(), TransportStatus.CHANNEL_ERROR);
            scheduler.advanceMillis(4000);
            transport.report(transport.lastOpened(), TransportStatus.CHANNEL_ERROR);

            assertEquals(3, transport.openCount());
            assertTrue(feed.getActiveSubscriptions().isEmpty());
            assertFalse(subscription.isActive());
            subscription.unsubscribe();
        }

        @Test
        void closedByTransportRemovesBookkeeping() {
            Subscription subscription = subscribeRecording(new ArrayList<>());
            transport.confirmLast();

            transport.report(transport.lastOpened(), TransportStatus.CLOSED);

            assertTrue(feed.getActiveSubscriptions().isEmpty());
            assertEquals(0, transport.closeCount());
            assertFalse(subscription.isActive());

            subscribeRecording(new ArrayList<>());
            assertEquals(2, transport.openCount());
        }
    }

    // ==================== Pause / Resume ====================

    @Nested
    class PauseResume {

        @Test
        void pauseDropsConnectionsButKeepsHandlers() {
            List<ChangeEvent<JsonObject>> received = new ArrayList<>();
            subscribeRecording(received);
            feed.subscribeRaw(Table.WAITLIST, ChangeHandler.onAny(event -> { }), userFilter());
            transport.opened().forEach(transport::confirm);
            OpenedChannel before = transport.opened().get(0);

            feed.pauseAll();

            assertEquals(2, transport.closeCount());
            assertEquals(2, feed.getActiveSubscriptions().size());
            assertEquals(2, feed.getStats().totalHandlers());
            assertEquals(Optional.of(ChannelStatus.SUSPENDED), feed.getChannelStatus(USER_42_BOOKINGS));
            assertFalse(feed.isHealthy());

            transport.emit(before, new InsertEvent<>(row("b-1", "pending")));
            scheduler.advanceMillis(500);
            assertTrue(received.isEmpty());

            feed.resumeAll();

            assertEquals(4, transport.openCount());
            assertEquals(Optional.of(ChannelStatus.CONNECTING), feed.getChannelStatus(USER_42_BOOKINGS));

            OpenedChannel after = transport.opened().stream()
                    .filter(channel -> channel.name().equals(USER_42_BOOKINGS.value()))
                    .reduce((first, second) -> second)
                    .orElseThrow();
            transport.confirm(after);
            transport.emit(after, new InsertEvent<>(row("b-2", "pending")));
            scheduler.advanceMillis(500);
            assertEquals(1, received.size());
        }

        @Test
        void pauseDiscardsPendingDeliveries() {
            List<ChangeEvent<JsonObject>> received = new ArrayList<>();
            subscribeRecording(received);
            transport.confirmLast();
            transport.emit(transport.lastOpened(), new InsertEvent<>(row("b-1", "pending")));

            feed.pauseAll();
            scheduler.advanceMillis(1000);

            assertTrue(received.isEmpty());
            assertEquals(0, scheduler.pendingTaskCount());
        }

        @Test
        void pauseReapsDrainingChannels() {
            subscribeRecording(new ArrayList<>()).unsubscribe();

            feed.pauseAll();

            assertTrue(feed.getActiveSubscriptions().isEmpty());
        }

        @Test
        void subscriptionsMadeWhilePausedConnectOnResume() {
            feed.pauseAll();
            subscribeRecording(new ArrayList<>());

            assertEquals(0, transport.openCount());
            assertEquals(Optional.of(ChannelStatus.SUSPENDED), feed.getChannelStatus(USER_42_BOOKINGS));

            feed.resumeAll();
            assertEquals(1, transport.openCount());
        }

        @Test
        void lastUnsubscribeWhileSuspendedTearsDownImmediately() {
            Subscription subscription = subscribeRecording(new ArrayList<>());
            feed.pauseAll();

            subscription.unsubscribe();
            feed.resumeAll();

            assertTrue(feed.getActiveSubscriptions().isEmpty());
            assertEquals(1, transport.openCount());
        }

        @Test
        void resumeWithoutPauseDoesNothing() {
            subscribeRecording(new ArrayList<>());
            feed.resumeAll();

            assertEquals(1, transport.openCount());
        }
    }

    // ==================== Introspection ====================

    @Test
    void statsReflectChannelsAndHandlers() {
        subscribeRecording(new ArrayList<>());
        subscribeRecording(new ArrayList<>());
        feed.subscribeRaw(Table.NOTIFICATIONS, ChangeHandler.onAny(event -> { }), userFilter());

        FeedStats stats = feed.getStats();

        assertEquals(2, stats.activeChannels());
        assertEquals(3, stats.totalHandlers());
        assertEquals(0, stats.retryingChannels());
        assertEquals(0, stats.pendingTimers());
        feed.debugStatus();
    }

    @Test
    void subscriptionReportsItsChannelKey() {
        Subscription subscription = subscribeRecording(new ArrayList<>());

        assertEquals(USER_42_BOOKINGS, subscription.getChannelKey());
        assertTrue(subscription.isActive());
        assertEquals("bookings:*:user_id=eq.42", subscription.getChannelKey().toString());
    }
}
