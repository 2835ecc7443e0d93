package dk.cloudcreate.cqrs.aggregates;

import dk.cloudcreate.cqrs.eventstore.*;
import dk.cloudcreate.cqrs.eventstore.eventstream.*;
import dk.cloudcreate.cqrs.eventstore.snapshot.AggregateSnapshot;
import dk.cloudcreate.cqrs.eventstore.types.EventOrder;
import org.slf4j.*;

import java.util.*;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Loads and persists the {@link AggregateContext}s of one {@link Aggregate} type.<br>
 * Loading uses the latest snapshot (if a {@link SnapshotStore} is configured and the snapshot is consistent with the event stream)
 * followed by the events appended after the snapshot; otherwise all events are folded into {@link Aggregate#initialState()}.
 * Either way the resulting state is the same.
 *
 * @param <COMMAND> the aggregate command type
 * @param <EVENT>   the aggregate event type
 * @param <STATE>   the aggregate state type
 */
public interface AggregateRepository<COMMAND, EVENT, STATE> {
    static <COMMAND, EVENT, STATE> AggregateRepository<COMMAND, EVENT, STATE> from(Aggregate<COMMAND, EVENT, STATE> aggregate,
                                                                                 EventStore<EVENT> eventStore) {
        return new DefaultAggregateRepository<>(aggregate, eventStore, Optional.empty());
    }

    static <COMMAND, EVENT, STATE> AggregateRepository<COMMAND, EVENT, STATE> from(Aggregate<COMMAND, EVENT, STATE> aggregate,
                                                                                 EventStore<EVENT> eventStore,
                                                                                 Optional<SnapshotStore<STATE>> snapshotStore) {
        return new DefaultAggregateRepository<>(aggregate, eventStore, snapshotStore);
    }

    // -------------------------------------------------------------------------------------------------------------------------------------------------

    /**
     * @param aggregateId the aggregate id
     * @return the aggregate context or {@link Optional#empty()} if no events have been persisted for the aggregate
     */
    Optional<AggregateContext<COMMAND, EVENT, STATE>> tryLoad(String aggregateId);

    /**
     * @throws AggregateNotFoundException if no events have been persisted for the aggregate
     */
    default AggregateContext<COMMAND, EVENT, STATE> load(String aggregateId) {
        return tryLoad(aggregateId).orElseThrow(() -> new AggregateNotFoundException(aggregateId, aggregateType()));
    }

    /**
     * Load the aggregate or, if it has no history, create a context with the {@link Aggregate#initialState()} at version
     * {@link EventOrder#NO_EVENTS_PERSISTED}
     */
    default AggregateContext<COMMAND, EVENT, STATE> loadOrInitialize(String aggregateId) {
        return tryLoad(aggregateId).orElseGet(() -> AggregateContext.initialize(aggregate(), aggregateId));
    }

    /**
     * Fold the full event history into {@link Aggregate#initialState()}, ignoring any snapshot
     */
    AggregateContext<COMMAND, EVENT, STATE> replay(String aggregateId);

    /**
     * Append the context's uncommitted events, expecting the aggregate to still be at {@link AggregateContext#version()}
     *
     * @param context  the aggregate context
     * @param metaData the meta data stored with every event
     * @return the persisted events (empty if the context had no uncommitted events)
     * @throws OptimisticAppendToStreamException if another writer has appended events since the context was loaded
     */
    List<PersistedEvent<EVENT>> persist(AggregateContext<COMMAND, EVENT, STATE> context, EventMetaData metaData);

    Aggregate<COMMAND, EVENT, STATE> aggregate();

    EventStore<EVENT> eventStore();

    Optional<SnapshotStore<STATE>> snapshotStore();

    default AggregateType aggregateType() {
        return aggregate().aggregateType();
    }

    // -------------------------------------------------------------------------------------------------------------------------------------------------

    class DefaultAggregateRepository<COMMAND, EVENT, STATE> implements AggregateRepository<COMMAND, EVENT, STATE> {
        private static final Logger log = LoggerFactory.getLogger(AggregateRepository.class);

        private final Aggregate<COMMAND, EVENT, STATE> aggregate;
        private final EventStore<EVENT>                eventStore;
        private final Optional<SnapshotStore<STATE>>   snapshotStore;

        private DefaultAggregateRepository(Aggregate<COMMAND, EVENT, STATE> aggregate,
                                           EventStore<EVENT> eventStore,
                                           Optional<SnapshotStore<STATE>> snapshotStore) {
            this.aggregate = requireNonNull(aggregate, "You must supply an aggregate");
            this.eventStore = requireNonNull(eventStore, "You must supply an EventStore instance");
            this.snapshotStore = requireNonNull(snapshotStore, "You must supply an Optional snapshotStore");
            if (!aggregate.aggregateType().equals(eventStore.aggregateType())) {
                throw new IllegalArgumentException(msg("The EventStore is configured for aggregateType '{}' but the aggregate has aggregateType '{}'",
                                                       eventStore.aggregateType(),
                                                       aggregate.aggregateType()));
            }
        }

        @Override
        public Optional<AggregateContext<COMMAND, EVENT, STATE>> tryLoad(String aggregateId) {
            requireNonNull(aggregateId, "No aggregateId provided");
            var fromSnapshot = loadSnapshot(aggregateId).flatMap(snapshot -> loadFromSnapshot(aggregateId, snapshot));
            if (fromSnapshot.isPresent()) {
                return fromSnapshot;
            }
            return replayHistory(aggregateId);
        }

        @Override
        public AggregateContext<COMMAND, EVENT, STATE> replay(String aggregateId) {
            requireNonNull(aggregateId, "No aggregateId provided");
            return replayHistory(aggregateId).orElseGet(() -> AggregateContext.initialize(aggregate, aggregateId));
        }

        private Optional<AggregateContext<COMMAND, EVENT, STATE>> replayHistory(String aggregateId) {
            var events = eventStore.load(aggregateId);
            if (events.isEmpty()) {
                log.trace("[{}] Didn't find any events for aggregate with id '{}'", aggregate.aggregateType(), aggregateId);
                return Optional.empty();
            }
            var context = AggregateContext.rehydrate(aggregate,
                                                     aggregateId,
                                                     aggregate.initialState(),
                                                     EventOrder.NO_EVENTS_PERSISTED,
                                                     events);
            log.debug("[{}] Loaded aggregate with id '{}' at version {} by replaying {} event(s)",
                      aggregate.aggregateType(),
                      aggregateId,
                      context.version(),
                      events.size());
            return Optional.of(context);
        }

        private Optional<AggregateSnapshot<STATE>> loadSnapshot(String aggregateId) {
            if (snapshotStore.isEmpty()) {
                return Optional.empty();
            }
            try {
                return snapshotStore.get().loadSnapshot(aggregateId);
            } catch (RuntimeException e) {
                log.warn(msg("[{}] Failed to load snapshot for aggregate with id '{}'. Falling back to replaying all events",
                             aggregate.aggregateType(),
                             aggregateId), e);
                return Optional.empty();
            }
        }

        private Optional<AggregateContext<COMMAND, EVENT, STATE>> loadFromSnapshot(String aggregateId, AggregateSnapshot<STATE> snapshot) {
            var snapshotEventOrder = snapshot.eventOrderOfLastIncludedEvent;
            var suffix             = eventStore.loadEventsAfter(aggregateId, snapshotEventOrder);
            if (suffix.isEmpty()) {
                var lastEventOrder = eventStore.loadLastEventOrder(aggregateId);
                if (!lastEventOrder.equals(snapshotEventOrder)) {
                    log.warn("[{}] Discarding snapshot for aggregate with id '{}' at eventOrder {} since the last persisted eventOrder is {}",
                             aggregate.aggregateType(),
                             aggregateId,
                             snapshotEventOrder,
                             lastEventOrder);
                    return Optional.empty();
                }
            } else if (!suffix.get(0).eventOrder().equals(snapshotEventOrder.increaseAndGet())) {
                log.warn("[{}] Discarding snapshot for aggregate with id '{}' at eventOrder {} since the next persisted event has eventOrder {}",
                         aggregate.aggregateType(),
                         aggregateId,
                         snapshotEventOrder,
                         suffix.get(0).eventOrder());
                return Optional.empty();
            }

            var context = AggregateContext.rehydrate(aggregate,
                                                     aggregateId,
                                                     snapshot.state,
                                                     snapshotEventOrder,
                                                     suffix);
            log.debug("[{}] Loaded aggregate with id '{}' at version {} from snapshot at eventOrder {} and {} event(s)",
                      aggregate.aggregateType(),
                      aggregateId,
                      context.version(),
                      snapshotEventOrder,
                      suffix.size());
            return Optional.of(context);
        }

        @Override
        public List<PersistedEvent<EVENT>> persist(AggregateContext<COMMAND, EVENT, STATE> context, EventMetaData metaData) {
            requireNonNull(context, "No context provided");
            requireNonNull(metaData, "No metaData provided");
            if (!context.hasUncommittedEvents()) {
                log.trace("[{}] No changes detected for aggregate with id '{}'", aggregate.aggregateType(), context.aggregateId());
                return List.of();
            }
            if (log.isTraceEnabled()) {
                log.trace("[{}] Persisting {} event(s) related to aggregate with id '{}' after eventOrder {}: {}",
                          aggregate.aggregateType(),
                          context.uncommittedEvents().size(),
                          context.aggregateId(),
                          context.version(),
                          context.uncommittedEvents().stream()
                                 .map(event -> event.getClass().getSimpleName())
                                 .collect(Collectors.joining(", ")));
            }
            var persistableEvents = context.uncommittedEvents()
                                           .stream()
                                           .map(event -> PersistableEvent.from(event, metaData))
                                           .collect(Collectors.toList());
            var persistedEvents = eventStore.append(context.aggregateId(), context.version(), persistableEvents);
            context.markChangesAsCommitted(persistedEvents);
            return persistedEvents;
        }

        @Override
        public Aggregate<COMMAND, EVENT, STATE> aggregate() {
            return aggregate;
        }

        @Override
        public EventStore<EVENT> eventStore() {
            return eventStore;
        }

        @Override
        public Optional<SnapshotStore<STATE>> snapshotStore() {
            return snapshotStore;
        }

        @Override
        public String toString() {
            return "AggregateRepository{" +
                    "aggregateType=" + aggregate.aggregateType() +
                    ", snapshotStore=" + snapshotStore.isPresent() +
                    '}';
        }
    }
}
