package dk.cloudcreate.cqrs.aggregates.dispatch;

import dk.cloudcreate.cqrs.eventstore.eventstream.PersistedEvent;

import java.util.List;

/**
 * A read-side consumer of committed events (e.g. a view/projection updater).<br>
 * Receives each committed batch of an aggregate exactly once per successful command in the same process, after the
 * events have been committed to the event store.
 *
 * @param <EVENT> the aggregate event type
 */
@FunctionalInterface
public interface QueryProcessor<EVENT> {
    /**
     * @param aggregateId     the id of the aggregate the events belong to
     * @param committedEvents the committed events, in ascending event order
     */
    void dispatch(String aggregateId, List<PersistedEvent<EVENT>> committedEvents);
}
