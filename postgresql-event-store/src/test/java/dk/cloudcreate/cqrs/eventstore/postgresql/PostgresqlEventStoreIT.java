package dk.cloudcreate.cqrs.eventstore.postgresql;

import dk.cloudcreate.cqrs.common.types.CorrelationId;
import dk.cloudcreate.cqrs.eventstore.OptimisticAppendToStreamException;
import dk.cloudcreate.cqrs.eventstore.eventstream.*;
import dk.cloudcreate.cqrs.eventstore.postgresql.serializer.json.JacksonJSONSerializer;
import dk.cloudcreate.cqrs.eventstore.postgresql.test_data.*;
import dk.cloudcreate.cqrs.eventstore.postgresql.transaction.*;
import dk.cloudcreate.cqrs.eventstore.types.*;
import dk.cloudcreate.essentials.types.LongRange;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.*;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

@Testcontainers
class PostgresqlEventStoreIT {
    private static final AggregateType PRODUCTS = AggregateType.of("Products");

    @Container
    private final PostgreSQLContainer<?> postgreSQLContainer = new PostgreSQLContainer<>("postgres:latest")
            .withDatabaseName("event-store")
            .withUsername("test-user")
            .withPassword("secret-password");

    private JdbiUnitOfWorkFactory                   unitOfWorkFactory;
    private PostgresqlEventStore<ProductEvent>      eventStore;
    private PostgresqlSnapshotStore<ProductState>   snapshotStore;

    @BeforeEach
    void setup() {
        var jdbi = Jdbi.create(postgreSQLContainer.getJdbcUrl(),
                               postgreSQLContainer.getUsername(),
                               postgreSQLContainer.getPassword());
        unitOfWorkFactory = new JdbiUnitOfWorkFactory(jdbi);
        var configuration = EventStreamTableConfiguration.standardConfigurationUsingJackson(PRODUCTS,
                                                                                            JacksonJSONSerializer.createDefaultObjectMapper(),
                                                                                            JSONColumnType.JSONB);
        eventStore = new PostgresqlEventStore<>(unitOfWorkFactory, configuration);
        snapshotStore = new PostgresqlSnapshotStore<>(unitOfWorkFactory, configuration);
    }

    @Test
    void verify_that_appended_events_can_be_loaded_again() {
        // Given
        var correlationId = CorrelationId.random();
        var metaData      = EventMetaData.of("user", "alice").withCorrelationId(correlationId);

        // When
        var appended = eventStore.append("product-1",
                                         EventOrder.NO_EVENTS_PERSISTED,
                                         List.of(PersistableEvent.from(new ProductEvent.ProductAdded("product-1", "Chair", new BigDecimal("49.95")), metaData),
                                                 PersistableEvent.from(new ProductEvent.ProductDiscontinued("product-1", LocalDate.of(2023, 1, 1)), metaData)));

        // Then
        assertThat(appended).extracting(PersistedEvent::eventOrder)
                            .containsExactly(EventOrder.of(1), EventOrder.of(2));
        var loaded = eventStore.load("product-1");
        assertThat(loaded).isEqualTo(appended);
        assertThat(loaded).extracting(PersistedEvent::event)
                          .containsExactly(new ProductEvent.ProductAdded("product-1", "Chair", new BigDecimal("49.95")),
                                           new ProductEvent.ProductDiscontinued("product-1", LocalDate.of(2023, 1, 1)));
        assertThat(loaded.get(0).correlationId()).contains(correlationId);
        assertThat(loaded.get(0).metaData().get("user")).contains("alice");
        assertThat(loaded.get(0).timestamp()).isEqualTo(appended.get(0).timestamp());
        assertThat(eventStore.loadLastEventOrder("product-1")).isEqualTo(EventOrder.of(2));
        assertThat(eventStore.loadEventsAfter("product-1", EventOrder.of(1))).extracting(PersistedEvent::eventOrder)
                                                                            .containsExactly(EventOrder.of(2));
        assertThat(eventStore.load("product-2")).isEmpty();
    }

    @Test
    void verify_that_a_stale_expected_event_order_results_in_an_OptimisticAppendToStreamException() {
        // Given
        eventStore.append("product-1",
                          EventOrder.NO_EVENTS_PERSISTED,
                          List.of(PersistableEvent.from(new ProductEvent.ProductAdded("product-1", "Chair", BigDecimal.TEN))));

        // When
        var thrown = catchThrowable(() -> eventStore.append("product-1",
                                                             EventOrder.NO_EVENTS_PERSISTED,
                                                             List.of(PersistableEvent.from(new ProductEvent.ProductAdded("product-1", "Table", BigDecimal.ONE)))));

        // Then
        assertThat(thrown).isInstanceOf(OptimisticAppendToStreamException.class);
        assertThat(((OptimisticAppendToStreamException) thrown).actualEventOrder).contains(EventOrder.of(1));
        assertThat(eventStore.load("product-1")).hasSize(1);
    }

    @Test
    void verify_that_only_one_of_several_concurrent_appends_with_the_same_expected_event_order_succeeds() throws Exception {
        // Given
        var numberOfWriters = 8;
        var executor        = Executors.newFixedThreadPool(numberOfWriters);
        var startSignal     = new CountDownLatch(1);
        var conflicts       = new AtomicInteger();
        var futures         = new ArrayList<Future<?>>();

        try {
            // When
            for (int i = 0; i < numberOfWriters; i++) {
                var name = "Chair-" + i;
                futures.add(executor.submit(() -> {
                    startSignal.await();
                    try {
                        eventStore.append("product-1",
                                          EventOrder.NO_EVENTS_PERSISTED,
                                          List.of(PersistableEvent.from(new ProductEvent.ProductAdded("product-1", name, BigDecimal.ONE))));
                    } catch (OptimisticAppendToStreamException e) {
                        conflicts.incrementAndGet();
                    }
                    return null;
                }));
            }
            startSignal.countDown();
            for (var future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        // Then
        assertThat(conflicts.get()).isEqualTo(numberOfWriters - 1);
        assertThat(eventStore.load("product-1")).hasSize(1);
    }

    @Test
    void verify_that_events_can_be_loaded_in_global_order() {
        // Given
        eventStore.append("product-1", EventOrder.NO_EVENTS_PERSISTED, List.of(PersistableEvent.from(new ProductEvent.ProductAdded("product-1", "Chair", BigDecimal.ONE))));
        eventStore.append("product-2", EventOrder.NO_EVENTS_PERSISTED, List.of(PersistableEvent.from(new ProductEvent.ProductAdded("product-2", "Table", BigDecimal.ONE))));
        eventStore.append("product-1", EventOrder.of(1), List.of(PersistableEvent.from(new ProductEvent.ProductDiscontinued("product-1", LocalDate.of(2023, 1, 1)))));

        // When
        var allEvents = eventStore.loadEventsByGlobalOrder(LongRange.from(GlobalEventOrder.FIRST_GLOBAL_EVENT_ORDER.longValue()))
                                  .collect(Collectors.toList());

        // Then
        assertThat(allEvents).extracting(persistedEvent -> persistedEvent.event().productId())
                             .containsExactly("product-1", "product-2", "product-1");
        assertThat(allEvents).extracting(persistedEvent -> persistedEvent.globalEventOrder().longValue())
                             .isSorted();
        var secondGlobalOrder = allEvents.get(1).globalEventOrder().longValue();
        assertThat(eventStore.loadEventsByGlobalOrder(LongRange.between(secondGlobalOrder, secondGlobalOrder)))
                .extracting(PersistedEvent::aggregateId)
                .containsExactly("product-2");
    }

    @Test
    void verify_that_events_appended_in_a_rolled_back_unit_of_work_are_not_persisted() {
        // When
        var thrown = catchThrowable(() -> unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            eventStore.append("product-1",
                              EventOrder.NO_EVENTS_PERSISTED,
                              List.of(PersistableEvent.from(new ProductEvent.ProductAdded("product-1", "Chair", BigDecimal.ONE))));
            throw new IllegalStateException("Simulated failure");
        }));

        // Then
        assertThat(thrown).isInstanceOf(IllegalStateException.class);
        assertThat(unitOfWorkFactory.getCurrentUnitOfWork()).isEmpty();
        assertThat(eventStore.load("product-1")).isEmpty();
    }

    @Test
    void verify_that_only_newer_snapshots_replace_the_stored_snapshot() {
        // Given
        assertThat(snapshotStore.saveSnapshot("product-1", new ProductState("Chair", BigDecimal.ONE, false), EventOrder.of(10))).isTrue();

        // When
        var staleSaved = snapshotStore.saveSnapshot("product-1", new ProductState("Old chair", BigDecimal.ONE, false), EventOrder.of(5));
        var newerSaved = snapshotStore.saveSnapshot("product-1", new ProductState("Chair", BigDecimal.TEN, true), EventOrder.of(12));

        // Then
        assertThat(staleSaved).isFalse();
        assertThat(newerSaved).isTrue();
        var snapshot = snapshotStore.loadSnapshot("product-1");
        assertThat(snapshot).isPresent();
        assertThat(snapshot.get().state).isEqualTo(new ProductState("Chair", BigDecimal.TEN, true));
        assertThat(snapshot.get().eventOrderOfLastIncludedEvent).isEqualTo(EventOrder.of(12));

        snapshotStore.deleteSnapshot("product-1");
        assertThat(snapshotStore.loadSnapshot("product-1")).isEmpty();
    }
}
