package dk.cloudcreate.cqrs.eventstore.inmemory;

import dk.cloudcreate.cqrs.eventstore.*;
import dk.cloudcreate.cqrs.eventstore.eventstream.*;
import dk.cloudcreate.cqrs.eventstore.types.*;
import dk.cloudcreate.essentials.types.LongRange;
import org.slf4j.*;

import java.time.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * {@link EventStore} that keeps all event streams in memory. Suitable for tests and for single process applications
 * that don't require durability.<br>
 * Each aggregate instance's event stream is an immutable list that is replaced atomically per aggregate id, which
 * makes the version check and the append one indivisible operation with respect to other appends for the same aggregate id,
 * while appends for different aggregate ids only serialize the short step that assigns {@link GlobalEventOrder}s.<br>
 * {@link GlobalEventOrder}s are assigned and published under one store wide lock, so an event with a higher global order
 * never becomes visible through {@link #loadEventsByGlobalOrder(LongRange)} before an event with a lower global order.
 *
 * @param <EVENT> the type of event payload
 */
public class InMemoryEventStore<EVENT> implements EventStore<EVENT> {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStore.class);

    private final AggregateType                                      aggregateType;
    private final Clock                                              clock;
    /**
     * Key: aggregate id<br>
     * Value: the immutable list of events persisted for the aggregate, in event order
     */
    private final ConcurrentMap<String, List<PersistedEvent<EVENT>>> streams             = new ConcurrentHashMap<>();
    private final ConcurrentNavigableMap<Long, PersistedEvent<EVENT>> eventsByGlobalOrder = new ConcurrentSkipListMap<>();
    private final ReentrantLock                                      globalOrderLock      = new ReentrantLock();
    private       long                                               lastGlobalEventOrder;

    public InMemoryEventStore(AggregateType aggregateType) {
        this(aggregateType, Clock.systemUTC());
    }

    public InMemoryEventStore(AggregateType aggregateType, Clock clock) {
        this.aggregateType = requireNonNull(aggregateType, "No aggregateType provided");
        this.clock = requireNonNull(clock, "No clock provided");
    }

    @Override
    public AggregateType aggregateType() {
        return aggregateType;
    }

    @Override
    public List<PersistedEvent<EVENT>> loadEventsAfter(String aggregateId, EventOrder afterEventOrder) {
        requireNonNull(aggregateId, "No aggregateId provided");
        requireNonNull(afterEventOrder, "No afterEventOrder provided");
        var stream = streams.getOrDefault(aggregateId, List.of());
        // The event order of the event at index i is i + 1
        var fromIndex = (int) Math.min(Math.max(afterEventOrder.longValue(), 0), stream.size());
        return stream.subList(fromIndex, stream.size());
    }

    @Override
    public EventOrder loadLastEventOrder(String aggregateId) {
        requireNonNull(aggregateId, "No aggregateId provided");
        return EventOrder.of(streams.getOrDefault(aggregateId, List.of()).size());
    }

    @Override
    public List<PersistedEvent<EVENT>> append(String aggregateId,
                                              EventOrder expectedEventOrder,
                                              List<PersistableEvent<EVENT>> events) {
        requireNonNull(aggregateId, "No aggregateId provided");
        requireNonNull(expectedEventOrder, "No expectedEventOrder provided");
        requireNonNull(events, "No events provided");
        if (events.isEmpty()) {
            return List.of();
        }

        var appended = new ArrayList<PersistedEvent<EVENT>>(events.size());
        streams.compute(aggregateId, (id, existingStream) -> {
            var currentStream     = existingStream != null ? existingStream : List.<PersistedEvent<EVENT>>of();
            var currentEventOrder = EventOrder.of(currentStream.size());
            if (!currentEventOrder.equals(expectedEventOrder)) {
                log.debug("[{}] Rejecting append of {} event(s) to aggregate with id '{}'. Expected eventOrder {} but found {}",
                          aggregateType,
                          events.size(),
                          aggregateId,
                          expectedEventOrder,
                          currentEventOrder);
                throw new OptimisticAppendToStreamException(aggregateType,
                                                            aggregateId,
                                                            expectedEventOrder,
                                                            Optional.of(currentEventOrder));
            }

            var timestamp  = OffsetDateTime.now(clock);
            var eventOrder = currentEventOrder;
            globalOrderLock.lock();
            try {
                for (var persistableEvent : events) {
                    eventOrder = eventOrder.increaseAndGet();
                    appended.add(PersistedEvent.from(persistableEvent,
                                                     aggregateType,
                                                     aggregateId,
                                                     eventOrder,
                                                     GlobalEventOrder.of(++lastGlobalEventOrder),
                                                     timestamp));
                }
                appended.forEach(persistedEvent -> eventsByGlobalOrder.put(persistedEvent.globalEventOrder().longValue(), persistedEvent));
            } finally {
                globalOrderLock.unlock();
            }
            var newStream = new ArrayList<PersistedEvent<EVENT>>(currentStream.size() + appended.size());
            newStream.addAll(currentStream);
            newStream.addAll(appended);
            return Collections.unmodifiableList(newStream);
        });

        log.debug("[{}] Appended {} event(s) to aggregate with id '{}'. EventOrder is now {}",
                  aggregateType,
                  appended.size(),
                  aggregateId,
                  appended.get(appended.size() - 1).eventOrder());
        return Collections.unmodifiableList(appended);
    }

    @Override
    public Stream<PersistedEvent<EVENT>> loadEventsByGlobalOrder(LongRange globalEventOrderRange) {
        requireNonNull(globalEventOrderRange, "No globalEventOrderRange provided");
        if (globalEventOrderRange.isClosedRange()) {
            return eventsByGlobalOrder.subMap(globalEventOrderRange.fromInclusive, true,
                                              globalEventOrderRange.toInclusive, true)
                                      .values()
                                      .stream();
        }
        return eventsByGlobalOrder.tailMap(globalEventOrderRange.fromInclusive, true)
                                  .values()
                                  .stream();
    }

    /**
     * @return the aggregate ids of all aggregate instances that have at least one persisted event
     */
    public Set<String> aggregateIds() {
        return Collections.unmodifiableSet(streams.keySet());
    }

    @Override
    public String toString() {
        return "InMemoryEventStore{" +
                "aggregateType=" + aggregateType +
                ", numberOfStreams=" + streams.size() +
                '}';
    }
}
