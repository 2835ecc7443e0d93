package dk.cloudcreate.cqrs.eventstore.inmemory;

import dk.cloudcreate.cqrs.eventstore.SnapshotStore;
import dk.cloudcreate.cqrs.eventstore.eventstream.AggregateType;
import dk.cloudcreate.cqrs.eventstore.snapshot.AggregateSnapshot;
import dk.cloudcreate.cqrs.eventstore.types.EventOrder;
import org.slf4j.*;

import java.time.*;
import java.util.Optional;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * {@link SnapshotStore} that keeps the latest snapshot per aggregate instance in memory.<br>
 * The state instance is stored by reference, so the aggregate state type should be immutable
 *
 * @param <STATE> the aggregate state type
 */
public class InMemorySnapshotStore<STATE> implements SnapshotStore<STATE> {
    private static final Logger log = LoggerFactory.getLogger(InMemorySnapshotStore.class);

    private final AggregateType                                      aggregateType;
    private final Clock                                              clock;
    private final ConcurrentMap<String, AggregateSnapshot<STATE>> snapshots = new ConcurrentHashMap<>();

    public InMemorySnapshotStore(AggregateType aggregateType) {
        this(aggregateType, Clock.systemUTC());
    }

    public InMemorySnapshotStore(AggregateType aggregateType, Clock clock) {
        this.aggregateType = requireNonNull(aggregateType, "No aggregateType provided");
        this.clock = requireNonNull(clock, "No clock provided");
    }

    @Override
    public AggregateType aggregateType() {
        return aggregateType;
    }

    @Override
    public Optional<AggregateSnapshot<STATE>> loadSnapshot(String aggregateId) {
        requireNonNull(aggregateId, "No aggregateId provided");
        return Optional.ofNullable(snapshots.get(aggregateId));
    }

    @Override
    public boolean saveSnapshot(String aggregateId, STATE state, EventOrder eventOrderOfLastIncludedEvent) {
        requireNonNull(aggregateId, "No aggregateId provided");
        requireNonNull(state, "No state provided");
        requireNonNull(eventOrderOfLastIncludedEvent, "No eventOrderOfLastIncludedEvent provided");
        var saved = new AtomicBoolean();
        snapshots.compute(aggregateId, (id, existing) -> {
            if (existing != null && !eventOrderOfLastIncludedEvent.isAfter(existing.eventOrderOfLastIncludedEvent)) {
                return existing;
            }
            saved.set(true);
            return new AggregateSnapshot<>(aggregateType, aggregateId, state, eventOrderOfLastIncludedEvent, OffsetDateTime.now(clock));
        });
        if (saved.get()) {
            log.debug("[{}] Saved snapshot for aggregate with id '{}' at eventOrder {}", aggregateType, aggregateId, eventOrderOfLastIncludedEvent);
        } else {
            log.debug("[{}] Ignored stale snapshot for aggregate with id '{}' at eventOrder {}", aggregateType, aggregateId, eventOrderOfLastIncludedEvent);
        }
        return saved.get();
    }

    @Override
    public void deleteSnapshot(String aggregateId) {
        requireNonNull(aggregateId, "No aggregateId provided");
        snapshots.remove(aggregateId);
    }
}
