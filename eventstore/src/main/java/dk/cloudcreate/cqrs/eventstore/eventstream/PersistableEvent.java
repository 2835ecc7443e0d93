package dk.cloudcreate.cqrs.eventstore.eventstream;

import dk.cloudcreate.cqrs.eventstore.EventStore;

import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * An event that has been decided, but not yet appended to an {@link EventStore}.<br>
 * The {@link EventStore} is responsible for assigning the event-order, global-order, event-id and timestamp
 * when the event is appended, which turns it into a {@link PersistedEvent}
 *
 * @param <EVENT> the type of event
 */
public final class PersistableEvent<EVENT> {
    private final EVENT         event;
    private final EventMetaData metaData;

    private PersistableEvent(EVENT event, EventMetaData metaData) {
        this.event = requireNonNull(event, "No event provided");
        this.metaData = requireNonNull(metaData, "No metaData provided");
    }

    public static <EVENT> PersistableEvent<EVENT> from(EVENT event, EventMetaData metaData) {
        return new PersistableEvent<>(event, metaData);
    }

    public static <EVENT> PersistableEvent<EVENT> from(EVENT event) {
        return new PersistableEvent<>(event, EventMetaData.empty());
    }

    public EVENT event() {
        return event;
    }

    public EventMetaData metaData() {
        return metaData;
    }

    /**
     * The type name persisted alongside the event, which is the fully qualified class name of the event payload
     */
    public String eventType() {
        return event.getClass().getName();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PersistableEvent)) return false;
        PersistableEvent<?> that = (PersistableEvent<?>) o;
        return event.equals(that.event) && metaData.equals(that.metaData);
    }

    @Override
    public int hashCode() {
        return Objects.hash(event, metaData);
    }

    @Override
    public String toString() {
        return "PersistableEvent{" +
                "eventType=" + eventType() +
                ", metaData=" + metaData +
                '}';
    }
}
