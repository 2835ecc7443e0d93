package dk.cloudcreate.cqrs.eventstore;

/**
 * Technical failure in relation to an {@link EventStore} or {@link SnapshotStore} (I/O, serialization, backend unavailability, ...)
 */
public class EventStoreException extends RuntimeException {
    public EventStoreException(String message) {
        super(message);
    }

    public EventStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public EventStoreException(Throwable cause) {
        super(cause);
    }
}
