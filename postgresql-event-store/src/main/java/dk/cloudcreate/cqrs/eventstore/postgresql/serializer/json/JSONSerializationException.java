package dk.cloudcreate.cqrs.eventstore.postgresql.serializer.json;

import dk.cloudcreate.cqrs.eventstore.EventStoreException;

public class JSONSerializationException extends EventStoreException {
    public JSONSerializationException(String msg, Exception cause) {
        super(msg, cause);
    }
}
