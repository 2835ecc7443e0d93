package dk.cloudcreate.cqrs.eventstore.snapshot;

import dk.cloudcreate.cqrs.eventstore.eventstream.AggregateType;
import dk.cloudcreate.cqrs.eventstore.types.EventOrder;

import java.time.OffsetDateTime;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * A cached fold of an aggregate's state at a given {@link EventOrder}.<br>
 * A snapshot is purely a performance optimization: the state it contains MUST be identical to the result of folding
 * events {@link EventOrder#FIRST_EVENT_ORDER} to {@link #eventOrderOfLastIncludedEvent()} from the aggregate's initial state
 *
 * @param <STATE> the aggregate state type
 */
public final class AggregateSnapshot<STATE> {
    public final AggregateType  aggregateType;
    public final String         aggregateId;
    public final STATE          state;
    /**
     * The event order of the last event that was folded into {@link #state}
     */
    public final EventOrder     eventOrderOfLastIncludedEvent;
    public final OffsetDateTime timestamp;

    public AggregateSnapshot(AggregateType aggregateType,
                             String aggregateId,
                             STATE state,
                             EventOrder eventOrderOfLastIncludedEvent,
                             OffsetDateTime timestamp) {
        this.aggregateType = requireNonNull(aggregateType, "No aggregateType provided");
        this.aggregateId = requireNonNull(aggregateId, "No aggregateId provided");
        this.state = requireNonNull(state, "No state provided");
        this.eventOrderOfLastIncludedEvent = requireNonNull(eventOrderOfLastIncludedEvent, "No eventOrderOfLastIncludedEvent provided");
        this.timestamp = requireNonNull(timestamp, "No timestamp provided");
    }

    @Override
    public String toString() {
        return "AggregateSnapshot{" +
                "aggregateType=" + aggregateType +
                ", aggregateId='" + aggregateId + '\'' +
                ", eventOrderOfLastIncludedEvent=" + eventOrderOfLastIncludedEvent +
                ", timestamp=" + timestamp +
                '}';
    }
}
