package dk.cloudcreate.cqrs.eventstore.eventstream;

import dk.cloudcreate.cqrs.common.types.*;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Immutable contextual information persisted together with an event, e.g.
 * <ul>
 *     <li>the id of the command invocation that caused it ({@link #correlationId()})</li>
 *     <li>the id of the event that caused it ({@link #causedByEventId()})</li>
 *     <li>time of commit, user making the change, application version, etc.</li>
 * </ul>
 * The meta data is meant to assist debugging and auditing and is never interpreted by the event store
 */
public final class EventMetaData {
    public static final String CORRELATION_ID_KEY     = "correlationId";
    public static final String CAUSED_BY_EVENT_ID_KEY = "causedByEventId";

    private static final EventMetaData EMPTY = new EventMetaData(Map.of());

    private final Map<String, String> metaData;

    private EventMetaData(Map<String, String> metaData) {
        this.metaData = Collections.unmodifiableMap(new LinkedHashMap<>(metaData));
    }

    public static EventMetaData empty() {
        return EMPTY;
    }

    public static EventMetaData of(Map<String, String> metaData) {
        requireNonNull(metaData, "No metaData provided");
        return metaData.isEmpty() ? EMPTY : new EventMetaData(metaData);
    }

    public static EventMetaData of(String key, String value) {
        return EMPTY.with(key, value);
    }

    /**
     * Create a copy of this meta data with an added (or replaced) entry
     *
     * @param key   the key
     * @param value the value
     * @return the new meta data instance
     */
    public EventMetaData with(String key, String value) {
        requireNonNull(key, "No key provided");
        requireNonNull(value, "No value provided");
        var copy = new LinkedHashMap<>(metaData);
        copy.put(key, value);
        return new EventMetaData(copy);
    }

    public EventMetaData withCorrelationId(CorrelationId correlationId) {
        return with(CORRELATION_ID_KEY, requireNonNull(correlationId, "No correlationId provided").toString());
    }

    public EventMetaData withCausedByEventId(EventId causedByEventId) {
        return with(CAUSED_BY_EVENT_ID_KEY, requireNonNull(causedByEventId, "No causedByEventId provided").toString());
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(metaData.get(key));
    }

    public Optional<CorrelationId> correlationId() {
        return CorrelationId.optionalFrom(metaData.get(CORRELATION_ID_KEY));
    }

    public Optional<EventId> causedByEventId() {
        return EventId.optionalFrom(metaData.get(CAUSED_BY_EVENT_ID_KEY));
    }

    public boolean isEmpty() {
        return metaData.isEmpty();
    }

    /**
     * @return an unmodifiable view of all the meta data entries
     */
    public Map<String, String> asMap() {
        return metaData;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventMetaData)) return false;
        return metaData.equals(((EventMetaData) o).metaData);
    }

    @Override
    public int hashCode() {
        return metaData.hashCode();
    }

    @Override
    public String toString() {
        return "EventMetaData" + metaData;
    }
}
