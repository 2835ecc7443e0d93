package dk.cloudcreate.cqrs.eventstore;

import dk.cloudcreate.cqrs.eventstore.eventstream.AggregateType;
import dk.cloudcreate.cqrs.eventstore.types.EventOrder;

import java.util.Optional;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown by {@link EventStore#append(String, EventOrder, java.util.List)} when the currently persisted
 * {@link EventOrder} of the aggregate differs from the expected {@link EventOrder}, i.e. another writer appended
 * events between the time the aggregate was loaded and the time the new events were appended.<br>
 * Nothing has been persisted when this exception is thrown and it's always safe to retry the command from a fresh load.
 */
public class OptimisticAppendToStreamException extends EventStoreException {
    public final AggregateType        aggregateType;
    public final String               aggregateId;
    public final EventOrder           expectedEventOrder;
    /**
     * The persisted event order at the time of the conflict, if known to the {@link EventStore}
     */
    public final Optional<EventOrder> actualEventOrder;

    public OptimisticAppendToStreamException(AggregateType aggregateType,
                                             String aggregateId,
                                             EventOrder expectedEventOrder,
                                             Optional<EventOrder> actualEventOrder) {
        this(aggregateType, aggregateId, expectedEventOrder, actualEventOrder, null);
    }

    public OptimisticAppendToStreamException(AggregateType aggregateType,
                                             String aggregateId,
                                             EventOrder expectedEventOrder,
                                             Optional<EventOrder> actualEventOrder,
                                             Throwable cause) {
        super(msg("[{}] Optimistic concurrency conflict for aggregate with id '{}'. Expected persisted eventOrder {} but found {}",
                  aggregateType,
                  aggregateId,
                  expectedEventOrder,
                  actualEventOrder.map(Object::toString).orElse("a newer eventOrder")),
              cause);
        this.aggregateType = requireNonNull(aggregateType, "No aggregateType provided");
        this.aggregateId = requireNonNull(aggregateId, "No aggregateId provided");
        this.expectedEventOrder = requireNonNull(expectedEventOrder, "No expectedEventOrder provided");
        this.actualEventOrder = requireNonNull(actualEventOrder, "No actualEventOrder provided");
    }
}
