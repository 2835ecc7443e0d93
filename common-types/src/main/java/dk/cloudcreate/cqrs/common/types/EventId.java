package dk.cloudcreate.cqrs.common.types;

import dk.cloudcreate.essentials.types.CharSequenceType;

import java.util.*;

/**
 * Unique id of a single persisted event
 */
public class EventId extends CharSequenceType<EventId> {
    public EventId(CharSequence value) {
        super(value);
    }

    public static EventId of(CharSequence value) {
        return new EventId(value);
    }

    public static EventId random() {
        return new EventId(UUID.randomUUID().toString());
    }

    /**
     * Convert a potentially <code>null</code> value into an {@link Optional} {@link EventId}
     *
     * @param value the raw value (may be null)
     * @return an {@link Optional} with the {@link EventId} or {@link Optional#empty()} if <code>value</code> was null
     */
    public static Optional<EventId> optionalFrom(CharSequence value) {
        return Optional.ofNullable(value).map(EventId::new);
    }
}
