package dk.cloudcreate.cqrs.eventstore.eventstream;

import dk.cloudcreate.essentials.types.CharSequenceType;

/**
 * The name of a type of aggregate (e.g. "Accounts").<br>
 * All events belonging to aggregate instances of the same {@link AggregateType} are persisted in the same event log,
 * separated by their aggregate id
 */
public class AggregateType extends CharSequenceType<AggregateType> {
    public AggregateType(CharSequence value) {
        super(value);
    }

    public static AggregateType of(CharSequence value) {
        return new AggregateType(value);
    }
}
