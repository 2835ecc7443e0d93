package dk.cloudcreate.cqrs.eventstore.postgresql.transaction;

import dk.cloudcreate.cqrs.eventstore.EventStoreException;

/**
 * Failure to begin, commit or roll back a {@link UnitOfWork}, or an attempt to use a {@link UnitOfWork} in the wrong state
 */
public class UnitOfWorkException extends EventStoreException {
    public UnitOfWorkException(String message) {
        super(message);
    }

    public UnitOfWorkException(String message, Throwable cause) {
        super(message, cause);
    }

    public UnitOfWorkException(Throwable cause) {
        super(cause);
    }
}
