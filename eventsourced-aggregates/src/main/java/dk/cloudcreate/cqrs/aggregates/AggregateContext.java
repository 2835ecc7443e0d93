package dk.cloudcreate.cqrs.aggregates;

import dk.cloudcreate.cqrs.eventstore.eventstream.PersistedEvent;
import dk.cloudcreate.cqrs.eventstore.types.EventOrder;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * The in-memory representation of a single aggregate instance during one command invocation: its id, its current
 * state, its version (the {@link EventOrder} of the last persisted event folded into the state) and the events that have
 * been decided, but not yet persisted.<br>
 * An {@link AggregateContext} is never shared between invocations or threads; every invocation loads a fresh one
 *
 * @param <COMMAND> the aggregate command type
 * @param <EVENT>   the aggregate event type
 * @param <STATE>   the aggregate state type
 */
public final class AggregateContext<COMMAND, EVENT, STATE> {
    private final Aggregate<COMMAND, EVENT, STATE> aggregate;
    private final String                           aggregateId;
    private final List<EVENT>                      uncommittedEvents = new ArrayList<>();
    private       EventOrder                       version;
    private       STATE                            state;

    private AggregateContext(Aggregate<COMMAND, EVENT, STATE> aggregate,
                             String aggregateId,
                             STATE state,
                             EventOrder version) {
        this.aggregate = requireNonNull(aggregate, "No aggregate provided");
        this.aggregateId = requireNonNull(aggregateId, "No aggregateId provided");
        this.state = requireNonNull(state, "No state provided");
        this.version = requireNonNull(version, "No version provided");
    }

    /**
     * Create the context of an aggregate instance without any history
     */
    public static <COMMAND, EVENT, STATE> AggregateContext<COMMAND, EVENT, STATE> initialize(Aggregate<COMMAND, EVENT, STATE> aggregate,
                                                                                           String aggregateId) {
        requireNonNull(aggregate, "No aggregate provided");
        return new AggregateContext<>(aggregate, aggregateId, aggregate.initialState(), EventOrder.NO_EVENTS_PERSISTED);
    }

    /**
     * Rebuild an aggregate instance by folding persisted events into a known state
     *
     * @param aggregate    the aggregate
     * @param aggregateId  the aggregate id
     * @param state        the state at <code>version</code> (the initial state or a snapshot)
     * @param version      the version of <code>state</code>
     * @param events       the persisted events following <code>version</code>, in event order
     * @return the rehydrated context
     * @throws AggregateException if the events don't continue <code>version</code> without gaps
     */
    public static <COMMAND, EVENT, STATE> AggregateContext<COMMAND, EVENT, STATE> rehydrate(Aggregate<COMMAND, EVENT, STATE> aggregate,
                                                                                          String aggregateId,
                                                                                          STATE state,
                                                                                          EventOrder version,
                                                                                          List<PersistedEvent<EVENT>> events) {
        requireNonNull(events, "No events provided");
        var context = new AggregateContext<>(aggregate, aggregateId, state, version);
        events.forEach(context::applyPersistedEvent);
        return context;
    }

    private void applyPersistedEvent(PersistedEvent<EVENT> persistedEvent) {
        var expectedEventOrder = version.increaseAndGet();
        if (!persistedEvent.eventOrder().equals(expectedEventOrder)) {
            throw new AggregateException(msg("[{}] Expected event with eventOrder {} for aggregate with id '{}' but got eventOrder {}",
                                             aggregate.aggregateType(),
                                             expectedEventOrder,
                                             aggregateId,
                                             persistedEvent.eventOrder()));
        }
        state = aggregate.apply(state, persistedEvent.event());
        version = expectedEventOrder;
    }

    /**
     * Let the aggregate decide on the command against the current state. The decided events are recorded as uncommitted
     * and folded into the state
     *
     * @param command the command
     * @return the decided events (possibly empty)
     * @throws CommandRejectedException if the aggregate rejected the command
     */
    public List<EVENT> decideAndApply(COMMAND command) {
        requireNonNull(command, "No command provided");
        var events = requireNonNull(aggregate.decide(state, command),
                                    msg("[{}] decide returned null for command {}", aggregate.aggregateType(), command.getClass().getName()));
        for (var event : events) {
            state = aggregate.apply(state, requireNonNull(event, "decide returned a null event"));
        }
        uncommittedEvents.addAll(events);
        return List.copyOf(events);
    }

    /**
     * Called after the uncommitted events have been persisted
     *
     * @param committedEvents the persisted events
     */
    public void markChangesAsCommitted(List<PersistedEvent<EVENT>> committedEvents) {
        requireNonNull(committedEvents, "No committedEvents provided");
        if (committedEvents.size() != uncommittedEvents.size()) {
            throw new AggregateException(msg("[{}] Expected {} committed event(s) for aggregate with id '{}' but got {}",
                                             aggregate.aggregateType(),
                                             uncommittedEvents.size(),
                                             aggregateId,
                                             committedEvents.size()));
        }
        if (!committedEvents.isEmpty()) {
            version = committedEvents.get(committedEvents.size() - 1).eventOrder();
        }
        uncommittedEvents.clear();
    }

    public String aggregateId() {
        return aggregateId;
    }

    public Aggregate<COMMAND, EVENT, STATE> aggregate() {
        return aggregate;
    }

    /**
     * The state including any uncommitted events
     */
    public STATE state() {
        return state;
    }

    /**
     * The {@link EventOrder} of the last persisted event. This is the expected event order used when appending the uncommitted events
     */
    public EventOrder version() {
        return version;
    }

    public boolean isNew() {
        return version.isNoEventsPersisted();
    }

    public List<EVENT> uncommittedEvents() {
        return Collections.unmodifiableList(uncommittedEvents);
    }

    public boolean hasUncommittedEvents() {
        return !uncommittedEvents.isEmpty();
    }

    @Override
    public String toString() {
        return "AggregateContext{" +
                "aggregateType=" + aggregate.aggregateType() +
                ", aggregateId='" + aggregateId + '\'' +
                ", version=" + version +
                ", uncommittedEvents=" + uncommittedEvents.size() +
                '}';
    }
}
