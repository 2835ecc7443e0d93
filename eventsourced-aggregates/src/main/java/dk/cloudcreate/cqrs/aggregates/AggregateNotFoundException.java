package dk.cloudcreate.cqrs.aggregates;

import dk.cloudcreate.cqrs.eventstore.eventstream.AggregateType;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

public class AggregateNotFoundException extends AggregateException {
    public final String        aggregateId;
    public final AggregateType aggregateType;

    public AggregateNotFoundException(String aggregateId, AggregateType aggregateType) {
        super(msg("Couldn't find an aggregate with id '{}' belonging to the aggregateType '{}'",
                  aggregateId,
                  aggregateType));
        this.aggregateId = requireNonNull(aggregateId, "You must supply an aggregateId");
        this.aggregateType = requireNonNull(aggregateType, "You must supply an aggregateType");
    }
}
