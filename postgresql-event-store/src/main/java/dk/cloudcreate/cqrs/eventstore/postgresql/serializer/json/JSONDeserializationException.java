package dk.cloudcreate.cqrs.eventstore.postgresql.serializer.json;

import dk.cloudcreate.cqrs.eventstore.EventStoreException;

public class JSONDeserializationException extends EventStoreException {
    public JSONDeserializationException(String message) {
        super(message);
    }

    public JSONDeserializationException(String msg, Exception cause) {
        super(msg, cause);
    }
}
