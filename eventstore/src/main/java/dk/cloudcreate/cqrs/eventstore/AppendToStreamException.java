package dk.cloudcreate.cqrs.eventstore;

/**
 * A technical failure occurred while appending events. The append is all-or-nothing, so none of the events were persisted
 */
public class AppendToStreamException extends EventStoreException {
    public AppendToStreamException(String msg) {
        super(msg);
    }

    public AppendToStreamException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
