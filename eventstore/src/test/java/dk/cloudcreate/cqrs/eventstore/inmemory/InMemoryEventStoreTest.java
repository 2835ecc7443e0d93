package dk.cloudcreate.cqrs.eventstore.inmemory;

import dk.cloudcreate.cqrs.common.types.CorrelationId;
import dk.cloudcreate.cqrs.eventstore.OptimisticAppendToStreamException;
import dk.cloudcreate.cqrs.eventstore.eventstream.*;
import dk.cloudcreate.cqrs.eventstore.types.*;
import dk.cloudcreate.essentials.types.LongRange;
import org.junit.jupiter.api.*;

import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.*;

import static org.assertj.core.api.Assertions.*;

class InMemoryEventStoreTest {
    private static final AggregateType ACCOUNTS = AggregateType.of("Accounts");

    private InMemoryEventStore<AccountEvent> eventStore;

    @BeforeEach
    void setup() {
        eventStore = new InMemoryEventStore<>(ACCOUNTS);
    }

    @Test
    void verify_that_an_aggregate_without_events_has_an_empty_history() {
        assertThat(eventStore.load("unknown")).isEmpty();
        assertThat(eventStore.loadLastEventOrder("unknown")).isEqualTo(EventOrder.NO_EVENTS_PERSISTED);
    }

    @Test
    void verify_that_appended_events_get_consecutive_event_orders() {
        // Given
        var correlationId = CorrelationId.random();
        var metaData      = EventMetaData.empty().withCorrelationId(correlationId);

        // When
        var firstBatch = eventStore.append("account-1",
                                           EventOrder.NO_EVENTS_PERSISTED,
                                           List.of(PersistableEvent.from(new AccountEvent("opened"), metaData),
                                                   PersistableEvent.from(new AccountEvent("deposited"), metaData)));
        var secondBatch = eventStore.append("account-1",
                                            EventOrder.of(2),
                                            List.of(PersistableEvent.from(new AccountEvent("withdrawn"))));

        // Then
        assertThat(firstBatch).extracting(PersistedEvent::eventOrder)
                              .containsExactly(EventOrder.of(1), EventOrder.of(2));
        assertThat(secondBatch).extracting(PersistedEvent::eventOrder)
                               .containsExactly(EventOrder.of(3));
        assertThat(firstBatch.get(0).correlationId()).contains(correlationId);
        assertThat(firstBatch.get(0).aggregateType()).isEqualTo(ACCOUNTS);
        assertThat(firstBatch.get(0).eventType()).isEqualTo(AccountEvent.class.getName());

        var history = eventStore.load("account-1");
        assertThat(history).extracting(persistedEvent -> persistedEvent.event().description())
                           .containsExactly("opened", "deposited", "withdrawn");
        assertThat(history).extracting(PersistedEvent::eventOrder)
                           .containsExactly(EventOrder.of(1), EventOrder.of(2), EventOrder.of(3));
        assertThat(eventStore.loadLastEventOrder("account-1")).isEqualTo(EventOrder.of(3));
    }

    @Test
    void verify_that_appending_with_a_stale_expected_event_order_is_rejected_without_persisting_anything() {
        // Given
        eventStore.append("account-1", EventOrder.NO_EVENTS_PERSISTED, List.of(PersistableEvent.from(new AccountEvent("opened"))));

        // When
        var thrown = catchThrowable(() -> eventStore.append("account-1",
                                                             EventOrder.NO_EVENTS_PERSISTED,
                                                             List.of(PersistableEvent.from(new AccountEvent("opened again")))));

        // Then
        assertThat(thrown).isInstanceOf(OptimisticAppendToStreamException.class);
        var conflict = (OptimisticAppendToStreamException) thrown;
        assertThat(conflict.aggregateId).isEqualTo("account-1");
        assertThat(conflict.expectedEventOrder).isEqualTo(EventOrder.NO_EVENTS_PERSISTED);
        assertThat(conflict.actualEventOrder).contains(EventOrder.of(1));
        assertThat(eventStore.load("account-1")).hasSize(1);
    }

    @Test
    void verify_that_appending_an_empty_list_is_a_noop() {
        // When
        var result = eventStore.append("account-1", EventOrder.of(42), List.of());

        // Then
        assertThat(result).isEmpty();
        assertThat(eventStore.loadLastEventOrder("account-1")).isEqualTo(EventOrder.NO_EVENTS_PERSISTED);
    }

    @Test
    void verify_that_events_after_an_event_order_can_be_loaded() {
        // Given
        eventStore.append("account-1",
                          EventOrder.NO_EVENTS_PERSISTED,
                          Stream.of("a", "b", "c", "d")
                                .map(value -> PersistableEvent.from(new AccountEvent(value)))
                                .collect(Collectors.toList()));

        // Then
        assertThat(eventStore.loadEventsAfter("account-1", EventOrder.of(2)))
                .extracting(persistedEvent -> persistedEvent.event().description())
                .containsExactly("c", "d");
        assertThat(eventStore.loadEventsAfter("account-1", EventOrder.of(4))).isEmpty();
        assertThat(eventStore.loadEventsAfter("account-1", EventOrder.of(10))).isEmpty();
    }

    @Test
    void verify_that_events_can_be_loaded_in_global_order_across_aggregates() {
        // Given
        eventStore.append("account-1", EventOrder.NO_EVENTS_PERSISTED, List.of(PersistableEvent.from(new AccountEvent("1-a"))));
        eventStore.append("account-2", EventOrder.NO_EVENTS_PERSISTED, List.of(PersistableEvent.from(new AccountEvent("2-a"))));
        eventStore.append("account-1", EventOrder.of(1), List.of(PersistableEvent.from(new AccountEvent("1-b"))));

        // Then
        assertThat(eventStore.loadEventsByGlobalOrder(LongRange.from(GlobalEventOrder.FIRST_GLOBAL_EVENT_ORDER.longValue())))
                .extracting(persistedEvent -> persistedEvent.event().description())
                .containsExactly("1-a", "2-a", "1-b");
        assertThat(eventStore.loadEventsByGlobalOrder(LongRange.between(2, 2)))
                .extracting(persistedEvent -> persistedEvent.event().description())
                .containsExactly("2-a");
        assertThat(eventStore.aggregateIds()).containsExactlyInAnyOrder("account-1", "account-2");
    }

    @Test
    void verify_that_exactly_one_concurrent_append_with_the_same_expected_event_order_wins() throws Exception {
        // Given
        var numberOfWriters = 16;
        var executor        = Executors.newFixedThreadPool(numberOfWriters);
        var startSignal     = new CountDownLatch(1);
        var conflicts       = new AtomicInteger();
        var futures         = new ArrayList<Future<?>>();

        try {
            // When
            for (int i = 0; i < numberOfWriters; i++) {
                var writer = "writer-" + i;
                futures.add(executor.submit(() -> {
                    startSignal.await();
                    try {
                        eventStore.append("account-1",
                                          EventOrder.NO_EVENTS_PERSISTED,
                                          List.of(PersistableEvent.from(new AccountEvent(writer))));
                    } catch (OptimisticAppendToStreamException e) {
                        conflicts.incrementAndGet();
                    }
                    return null;
                }));
            }
            startSignal.countDown();
            for (var future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        // Then
        assertThat(conflicts.get()).isEqualTo(numberOfWriters - 1);
        assertThat(eventStore.load("account-1")).hasSize(1);
        assertThat(eventStore.loadLastEventOrder("account-1")).isEqualTo(EventOrder.FIRST_EVENT_ORDER);
    }

    @Test
    void verify_that_global_event_orders_become_visible_without_gaps_while_different_aggregates_are_appended_concurrently() throws Exception {
        // Given
        var numberOfWriters   = 8;
        var appendsPerWriter  = 200;
        var executor          = Executors.newFixedThreadPool(numberOfWriters);
        var startSignal       = new CountDownLatch(1);
        var writersDone       = new CountDownLatch(numberOfWriters);
        var observedGaps      = new AtomicInteger();
        var futures           = new ArrayList<Future<?>>();

        try {
            // When
            for (int i = 0; i < numberOfWriters; i++) {
                var aggregateId = "account-" + i;
                futures.add(executor.submit(() -> {
                    startSignal.await();
                    try {
                        for (int eventOrder = 0; eventOrder < appendsPerWriter; eventOrder++) {
                            eventStore.append(aggregateId,
                                              EventOrder.of(eventOrder),
                                              List.of(PersistableEvent.from(new AccountEvent(aggregateId))));
                        }
                    } finally {
                        writersDone.countDown();
                    }
                    return null;
                }));
            }
            startSignal.countDown();
            while (writersDone.getCount() > 0) {
                List<Long> visibleGlobalOrders;
                try (var events = eventStore.loadEventsByGlobalOrder(LongRange.from(GlobalEventOrder.FIRST_GLOBAL_EVENT_ORDER.longValue()))) {
                    visibleGlobalOrders = events.map(persistedEvent -> persistedEvent.globalEventOrder().longValue())
                                                .collect(Collectors.toList());
                }
                for (int i = 0; i < visibleGlobalOrders.size(); i++) {
                    if (visibleGlobalOrders.get(i) != i + 1) {
                        observedGaps.incrementAndGet();
                        break;
                    }
                }
            }
            for (var future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        // Then
        assertThat(observedGaps.get()).isZero();
        assertThat(eventStore.loadEventsByGlobalOrder(LongRange.from(1)).count()).isEqualTo((long) numberOfWriters * appendsPerWriter);
    }
}
