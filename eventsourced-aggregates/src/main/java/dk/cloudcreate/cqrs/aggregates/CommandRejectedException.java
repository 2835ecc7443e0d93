package dk.cloudcreate.cqrs.aggregates;

import java.util.Optional;

/**
 * Thrown from {@link Aggregate#decide(Object, Object)} when a command is semantically invalid against the current state.<br>
 * The message is surfaced verbatim to the caller. The rejection is never retried and nothing is persisted or dispatched
 */
public class CommandRejectedException extends AggregateException {
    /**
     * Optional domain specific description of the error (e.g. an error code or a record describing the violation)
     */
    public final Optional<Object> domainError;

    public CommandRejectedException(String message) {
        super(message);
        this.domainError = Optional.empty();
    }

    public CommandRejectedException(String message, Object domainError) {
        super(message);
        this.domainError = Optional.ofNullable(domainError);
    }
}
