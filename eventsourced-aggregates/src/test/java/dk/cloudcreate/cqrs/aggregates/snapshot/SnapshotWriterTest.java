package dk.cloudcreate.cqrs.aggregates.snapshot;

import dk.cloudcreate.cqrs.eventstore.eventstream.AggregateType;
import dk.cloudcreate.cqrs.eventstore.inmemory.InMemorySnapshotStore;
import dk.cloudcreate.cqrs.eventstore.snapshot.AggregateSnapshot;
import dk.cloudcreate.cqrs.eventstore.types.EventOrder;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.*;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;

class SnapshotWriterTest {
    private static final AggregateType ORDERS = AggregateType.of("Orders");

    private InMemorySnapshotStore<String> snapshotStore;
    private SnapshotWriter<String>        snapshotWriter;

    @BeforeEach
    void setup() {
        snapshotStore = new InMemorySnapshotStore<>(ORDERS);
        snapshotWriter = new SnapshotWriter<>(snapshotStore, "orders-snapshot");
    }

    @AfterEach
    void cleanup() {
        snapshotWriter.stop();
    }

    @Test
    void verify_that_snapshots_are_written_asynchronously_when_started() {
        // Given
        snapshotWriter.start();
        assertThat(snapshotWriter.isStarted()).isTrue();

        // When
        snapshotWriter.writeSnapshot("order-1", "state-at-10", EventOrder.of(10));

        // Then
        await().atMost(Duration.ofSeconds(5))
               .untilAsserted(() -> assertThat(snapshotStore.loadSnapshot("order-1"))
                       .map(snapshot -> snapshot.state)
                       .contains("state-at-10"));
    }

    @Test
    void verify_that_snapshots_are_skipped_while_not_started() {
        // When
        snapshotWriter.writeSnapshot("order-1", "state-at-3", EventOrder.of(3));
        snapshotWriter.writeSnapshot("order-1", "state-at-4", EventOrder.of(4));

        // Then
        assertThat(snapshotWriter.isStarted()).isFalse();
        assertThat(snapshotStore.loadSnapshot("order-1")).isEmpty();
    }

    @Test
    void verify_that_a_blocked_snapshot_store_doesnt_block_the_caller() throws InterruptedException {
        // Given
        var releaseStore = new CountDownLatch(1);
        var blockingStore = new InMemorySnapshotStore<String>(ORDERS) {
            @Override
            public boolean saveSnapshot(String aggregateId, String state, EventOrder eventOrderOfLastIncludedEvent) {
                try {
                    releaseStore.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return super.saveSnapshot(aggregateId, state, eventOrderOfLastIncludedEvent);
            }
        };
        var writer = new SnapshotWriter<>(blockingStore, "blocking-snapshot");
        writer.start();

        try {
            // When
            var startedAt = System.nanoTime();
            writer.writeSnapshot("order-1", "state-at-2", EventOrder.of(2));
            var elapsed = Duration.ofNanos(System.nanoTime() - startedAt);

            // Then
            assertThat(elapsed).isLessThan(Duration.ofSeconds(1));
            assertThat(blockingStore.loadSnapshot("order-1")).isEmpty();
            releaseStore.countDown();
            await().atMost(Duration.ofSeconds(5))
                   .untilAsserted(() -> assertThat(blockingStore.loadSnapshot("order-1")).isPresent());
        } finally {
            releaseStore.countDown();
            writer.stop();
        }
    }

    @Test
    void verify_that_a_stale_snapshot_never_replaces_a_newer_one() {
        // Given
        snapshotWriter.start();

        // When
        snapshotWriter.writeSnapshot("order-1", "state-at-10", EventOrder.of(10));
        snapshotWriter.writeSnapshot("order-1", "state-at-8", EventOrder.of(8));
        // Stopping waits for the pending writes
        snapshotWriter.stop();

        // Then
        assertThat(snapshotStore.loadSnapshot("order-1")).map(snapshot -> snapshot.state)
                                                          .contains("state-at-10");
    }

    @Test
    void verify_that_failing_snapshot_writes_are_swallowed() {
        // Given
        var failingStore = new InMemorySnapshotStore<String>(ORDERS) {
            @Override
            public boolean saveSnapshot(String aggregateId, String state, EventOrder eventOrderOfLastIncludedEvent) {
                throw new IllegalStateException("Disk full");
            }
        };
        var writer = new SnapshotWriter<>(failingStore, "failing-snapshot");
        writer.start();

        // When
        var thrown = catchThrowable(() -> writer.writeSnapshot("order-1", "state", EventOrder.of(1)));
        writer.stop();

        // Then
        assertThat(thrown).isNull();
        Optional<AggregateSnapshot<String>> snapshot = failingStore.loadSnapshot("order-1");
        assertThat(snapshot).isEmpty();
        assertThat(writer.isStarted()).isFalse();
    }
}
