package dk.cloudcreate.cqrs.eventstore.eventstream;

import dk.cloudcreate.cqrs.common.types.*;
import dk.cloudcreate.cqrs.eventstore.EventStore;
import dk.cloudcreate.cqrs.eventstore.types.*;

import java.time.OffsetDateTime;
import java.util.Optional;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * An immutable event that has been durably appended to an {@link EventStore}.<br>
 * Once persisted an event is never mutated or deleted and it is permanently ordered, by its {@link #eventOrder()},
 * relative to the other events belonging to the same aggregate instance
 *
 * @param <EVENT> the type of event payload
 */
public final class PersistedEvent<EVENT> {
    private final EventId          eventId;
    private final AggregateType    aggregateType;
    private final String           aggregateId;
    private final EventOrder       eventOrder;
    private final GlobalEventOrder globalEventOrder;
    private final EVENT            event;
    private final String           eventType;
    private final OffsetDateTime   timestamp;
    private final EventMetaData    metaData;

    private PersistedEvent(EventId eventId,
                           AggregateType aggregateType,
                           String aggregateId,
                           EventOrder eventOrder,
                           GlobalEventOrder globalEventOrder,
                           EVENT event,
                           String eventType,
                           OffsetDateTime timestamp,
                           EventMetaData metaData) {
        this.eventId = requireNonNull(eventId, "No eventId provided");
        this.aggregateType = requireNonNull(aggregateType, "No aggregateType provided");
        this.aggregateId = requireNonNull(aggregateId, "No aggregateId provided");
        this.eventOrder = requireNonNull(eventOrder, "No eventOrder provided");
        this.globalEventOrder = requireNonNull(globalEventOrder, "No globalEventOrder provided");
        this.event = requireNonNull(event, "No event provided");
        this.eventType = requireNonNull(eventType, "No eventType provided");
        this.timestamp = requireNonNull(timestamp, "No timestamp provided");
        this.metaData = requireNonNull(metaData, "No metaData provided");
    }

    public static <EVENT> PersistedEvent<EVENT> from(EventId eventId,
                                                     AggregateType aggregateType,
                                                     String aggregateId,
                                                     EventOrder eventOrder,
                                                     GlobalEventOrder globalEventOrder,
                                                     EVENT event,
                                                     String eventType,
                                                     OffsetDateTime timestamp,
                                                     EventMetaData metaData) {
        return new PersistedEvent<>(eventId,
                                    aggregateType,
                                    aggregateId,
                                    eventOrder,
                                    globalEventOrder,
                                    event,
                                    eventType,
                                    timestamp,
                                    metaData);
    }

    /**
     * Create the {@link PersistedEvent} that results from appending a {@link PersistableEvent}
     */
    public static <EVENT> PersistedEvent<EVENT> from(PersistableEvent<EVENT> persistableEvent,
                                                     AggregateType aggregateType,
                                                     String aggregateId,
                                                     EventOrder eventOrder,
                                                     GlobalEventOrder globalEventOrder,
                                                     OffsetDateTime timestamp) {
        requireNonNull(persistableEvent, "No persistableEvent provided");
        return new PersistedEvent<>(EventId.random(),
                                    aggregateType,
                                    aggregateId,
                                    eventOrder,
                                    globalEventOrder,
                                    persistableEvent.event(),
                                    persistableEvent.eventType(),
                                    timestamp,
                                    persistableEvent.metaData());
    }

    public EventId eventId() {
        return eventId;
    }

    public AggregateType aggregateType() {
        return aggregateType;
    }

    public String aggregateId() {
        return aggregateId;
    }

    /**
     * The position of this event within its aggregate instance's event stream (aka. the version of the aggregate after this event was applied)
     */
    public EventOrder eventOrder() {
        return eventOrder;
    }

    /**
     * The position of this event across all events belonging to the same {@link AggregateType}
     */
    public GlobalEventOrder globalEventOrder() {
        return globalEventOrder;
    }

    public EVENT event() {
        return event;
    }

    /**
     * The fully qualified class name of the event payload at the time it was persisted
     */
    public String eventType() {
        return eventType;
    }

    public OffsetDateTime timestamp() {
        return timestamp;
    }

    public EventMetaData metaData() {
        return metaData;
    }

    public Optional<CorrelationId> correlationId() {
        return metaData.correlationId();
    }

    public Optional<EventId> causedByEventId() {
        return metaData.causedByEventId();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PersistedEvent)) return false;
        return eventId.equals(((PersistedEvent<?>) o).eventId);
    }

    @Override
    public int hashCode() {
        return eventId.hashCode();
    }

    @Override
    public String toString() {
        return "PersistedEvent{" +
                "aggregateType=" + aggregateType +
                ", aggregateId='" + aggregateId + '\'' +
                ", eventOrder=" + eventOrder +
                ", globalEventOrder=" + globalEventOrder +
                ", eventType=" + eventType +
                ", eventId=" + eventId +
                ", timestamp=" + timestamp +
                '}';
    }
}
