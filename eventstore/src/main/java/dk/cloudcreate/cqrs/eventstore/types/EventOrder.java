package dk.cloudcreate.cqrs.eventstore.types;

import dk.cloudcreate.cqrs.eventstore.eventstream.*;
import dk.cloudcreate.essentials.types.LongType;

/**
 * Each event has its own unique position within the stream of events belonging to a single aggregate instance,
 * also known as the event-order, which defines the order in which the events were appended.<br>
 * <br>
 * This is also commonly called the version or sequence number. The first persisted event has event-order {@link #FIRST_EVENT_ORDER} (1)
 * and every following event increases it by exactly one, without gaps.<br>
 * The event-order of the last persisted event is the current version of the aggregate, which is also
 * the token used for optimistic concurrency control when appending new events (as opposed to the {@link PersistedEvent#globalEventOrder()}
 * which contains the order of ALL events related to a specific {@link AggregateType})
 */
public class EventOrder extends LongType<EventOrder> {
    /**
     * Special value that signifies the no previous events have been persisted in relation to a given aggregate
     */
    public static final EventOrder NO_EVENTS_PERSISTED = EventOrder.of(0);
    /**
     * Special value that contains the {@link EventOrder} of the FIRST Event persisted in context of a given aggregate id
     */
    public static final EventOrder FIRST_EVENT_ORDER   = EventOrder.of(1);

    public EventOrder(Long value) {
        super(value);
    }

    public static EventOrder of(long value) {
        return new EventOrder(value);
    }

    public EventOrder increaseAndGet() {
        return new EventOrder(longValue() + 1);
    }

    public boolean isAfter(EventOrder other) {
        return longValue() > other.longValue();
    }

    public boolean isNoEventsPersisted() {
        return longValue() == NO_EVENTS_PERSISTED.longValue();
    }
}
