package dk.cloudcreate.cqrs.aggregates;

import dk.cloudcreate.cqrs.eventstore.OptimisticAppendToStreamException;
import dk.cloudcreate.cqrs.eventstore.eventstream.AggregateType;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Every attempt to handle a command failed because other writers kept appending events to the same aggregate between
 * load and append. Nothing from the command was persisted
 */
public class ConcurrencyRetriesExhaustedException extends AggregateException {
    public final AggregateType aggregateType;
    public final String        aggregateId;
    /**
     * The total number of attempts (the first attempt plus the retries)
     */
    public final int           attempts;

    public ConcurrencyRetriesExhaustedException(AggregateType aggregateType,
                                                String aggregateId,
                                                int attempts,
                                                OptimisticAppendToStreamException lastConflict) {
        super(msg("[{}] Gave up handling command for aggregate with id '{}' after {} attempt(s) due to concurrent modifications",
                  aggregateType,
                  aggregateId,
                  attempts),
              requireNonNull(lastConflict, "No lastConflict provided"));
        this.aggregateType = requireNonNull(aggregateType, "No aggregateType provided");
        this.aggregateId = requireNonNull(aggregateId, "No aggregateId provided");
        this.attempts = attempts;
    }

    public OptimisticAppendToStreamException lastConflict() {
        return (OptimisticAppendToStreamException) getCause();
    }
}
