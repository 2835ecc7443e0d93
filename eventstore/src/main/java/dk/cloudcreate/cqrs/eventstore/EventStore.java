package dk.cloudcreate.cqrs.eventstore;

import dk.cloudcreate.cqrs.eventstore.eventstream.*;
import dk.cloudcreate.cqrs.eventstore.types.*;
import dk.cloudcreate.essentials.types.LongRange;

import java.util.List;
import java.util.stream.Stream;

/**
 * Durable, ordered and concurrency safe persistence of the event streams belonging to the aggregate instances of a single {@link AggregateType}.<br>
 * <br>
 * The {@link EventStore} is the sole arbiter of the ordering of events: {@link #append(String, EventOrder, List)} performs
 * an atomic check-and-append (compare-and-swap on the aggregate's current {@link EventOrder}) with respect to any other concurrent
 * append for the same aggregate id. All read operations are side effect free and safe to call concurrently with any other operation.
 *
 * @param <EVENT> the type of event payload persisted in this store
 */
public interface EventStore<EVENT> {
    /**
     * The type of aggregate whose events are persisted in this store
     */
    AggregateType aggregateType();

    /**
     * Load the full committed history of an aggregate instance
     *
     * @param aggregateId the id of the aggregate instance
     * @return the events in ascending {@link PersistedEvent#eventOrder()} (1, 2, 3, ...). If the aggregate has never been
     * written to, an empty list is returned
     */
    default List<PersistedEvent<EVENT>> load(String aggregateId) {
        return loadEventsAfter(aggregateId, EventOrder.NO_EVENTS_PERSISTED);
    }

    /**
     * Load the committed events of an aggregate instance that were appended after the given event order
     * (e.g. the events not included in a snapshot)
     *
     * @param aggregateId      the id of the aggregate instance
     * @param afterEventOrder  only events with an {@link EventOrder} larger than this value are returned
     * @return the events in ascending {@link PersistedEvent#eventOrder()}
     */
    List<PersistedEvent<EVENT>> loadEventsAfter(String aggregateId, EventOrder afterEventOrder);

    /**
     * Get the {@link EventOrder} of the last event persisted for the given aggregate instance
     *
     * @param aggregateId the id of the aggregate instance
     * @return the current version of the aggregate or {@link EventOrder#NO_EVENTS_PERSISTED} if no events have been persisted
     */
    EventOrder loadLastEventOrder(String aggregateId);

    /**
     * Atomically append new events to an aggregate instance's event stream.<br>
     * If the currently persisted {@link EventOrder} equals <code>expectedEventOrder</code> the events are assigned the
     * event orders <code>expectedEventOrder+1 .. expectedEventOrder+events.size()</code> and committed as one unit (all or nothing).
     * Otherwise nothing is persisted and an {@link OptimisticAppendToStreamException} is thrown.
     *
     * @param aggregateId        the id of the aggregate instance
     * @param expectedEventOrder the event order of the last event the caller knows about ({@link EventOrder#NO_EVENTS_PERSISTED} for a new aggregate)
     * @param events             the events to append, in order. An empty list is a no-op that returns an empty list
     * @return the committed events in ascending {@link PersistedEvent#eventOrder()}
     * @throws OptimisticAppendToStreamException if the aggregate's persisted {@link EventOrder} differs from <code>expectedEventOrder</code>
     * @throws AppendToStreamException           in case of a technical failure (nothing was persisted)
     */
    List<PersistedEvent<EVENT>> append(String aggregateId,
                                       EventOrder expectedEventOrder,
                                       List<PersistableEvent<EVENT>> events);

    /**
     * Load all events, across all aggregate instances of this {@link #aggregateType()}, in {@link GlobalEventOrder}.<br>
     * Used to rebuild views and for read-side catch-up
     *
     * @param globalEventOrderRange the range of {@link GlobalEventOrder}s to include
     * @return a stream of events ordered by {@link PersistedEvent#globalEventOrder()}
     */
    Stream<PersistedEvent<EVENT>> loadEventsByGlobalOrder(LongRange globalEventOrderRange);
}
