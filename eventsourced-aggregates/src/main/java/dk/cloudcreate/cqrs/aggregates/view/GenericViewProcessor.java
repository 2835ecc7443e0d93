package dk.cloudcreate.cqrs.aggregates.view;

import dk.cloudcreate.cqrs.aggregates.AggregateIdLocks;
import dk.cloudcreate.cqrs.aggregates.dispatch.QueryProcessor;
import dk.cloudcreate.cqrs.eventstore.EventStore;
import dk.cloudcreate.cqrs.eventstore.eventstream.PersistedEvent;
import dk.cloudcreate.cqrs.eventstore.types.EventOrder;
import dk.cloudcreate.essentials.types.LongRange;
import org.slf4j.*;

import java.util.*;
import java.util.concurrent.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * A {@link QueryProcessor} that maintains one {@link VersionedView} per aggregate instance using a {@link ViewUpdater}.<br>
 * Folding is idempotent: events with an {@link EventOrder} at or below the view's {@link VersionedView#lastAppliedEventOrder}
 * are skipped, so redelivered batches and overlapping catch-up ranges don't change the view.<br>
 * Batches for the same aggregate id are folded one at a time and events are only folded in gap free event order.
 * If a batch doesn't continue the view, the missing events are loaded from the gap filling {@link EventStore} (if configured);
 * otherwise the batch is buffered until the missing events have been received.
 *
 * @param <VIEW>  the view type
 * @param <EVENT> the aggregate event type
 */
public final class GenericViewProcessor<VIEW, EVENT> implements QueryProcessor<EVENT> {
    private static final Logger log = LoggerFactory.getLogger(GenericViewProcessor.class);

    private final ViewRepository<VIEW>          viewRepository;
    private final ViewUpdater<EVENT, VIEW>      viewUpdater;
    private final Optional<EventStore<EVENT>>   gapFillingEventStore;
    private final AggregateIdLocks                                                   aggregateLocks = new AggregateIdLocks();
    /**
     * Key: aggregate id<br>
     * Value: events received ahead of a missing event, keyed by event order
     */
    private final ConcurrentMap<String, NavigableMap<Long, PersistedEvent<EVENT>>> pendingEvents  = new ConcurrentHashMap<>();

    public GenericViewProcessor(ViewRepository<VIEW> viewRepository,
                                ViewUpdater<EVENT, VIEW> viewUpdater) {
        this(viewRepository, viewUpdater, Optional.empty());
    }

    public GenericViewProcessor(ViewRepository<VIEW> viewRepository,
                                ViewUpdater<EVENT, VIEW> viewUpdater,
                                Optional<EventStore<EVENT>> gapFillingEventStore) {
        this.viewRepository = requireNonNull(viewRepository, "No viewRepository provided");
        this.viewUpdater = requireNonNull(viewUpdater, "No viewUpdater provided");
        this.gapFillingEventStore = requireNonNull(gapFillingEventStore, "No gapFillingEventStore provided");
    }

    @Override
    public void dispatch(String aggregateId, List<PersistedEvent<EVENT>> committedEvents) {
        fold(aggregateId, committedEvents);
    }

    /**
     * @return the number of events folded into the view
     */
    private int fold(String aggregateId, List<PersistedEvent<EVENT>> events) {
        requireNonNull(aggregateId, "No aggregateId provided");
        requireNonNull(events, "No events provided");
        return aggregateLocks.withLock(aggregateId, () -> foldWhileLocked(aggregateId, events));
    }

    private int foldWhileLocked(String aggregateId, List<PersistedEvent<EVENT>> events) {
        var current               = viewRepository.load(aggregateId);
        var lastAppliedEventOrder = current.map(v -> v.lastAppliedEventOrder).orElse(EventOrder.NO_EVENTS_PERSISTED);

        // Key: event order
        var candidates = new TreeMap<Long, PersistedEvent<EVENT>>();
        var pending    = pendingEvents.remove(aggregateId);
        if (pending != null) {
            candidates.putAll(pending);
        }
        events.forEach(event -> candidates.put(event.eventOrder().longValue(), event));
        candidates.headMap(lastAppliedEventOrder.longValue(), true).clear();
        if (candidates.isEmpty()) {
            log.trace("[{}] View of aggregate with id '{}' is already at eventOrder {}. Skipping {} event(s)",
                      aggregateTypeOf(events),
                      aggregateId,
                      lastAppliedEventOrder,
                      events.size());
            return 0;
        }

        var nextEventOrder = lastAppliedEventOrder.longValue() + 1;
        if (candidates.firstKey() != nextEventOrder && gapFillingEventStore.isPresent()) {
            log.debug("[{}] View of aggregate with id '{}' is at eventOrder {} but received eventOrder {}. Loading the missing events",
                      aggregateTypeOf(events),
                      aggregateId,
                      lastAppliedEventOrder,
                      candidates.firstKey());
            gapFillingEventStore.get()
                                .loadEventsAfter(aggregateId, lastAppliedEventOrder)
                                .forEach(event -> candidates.put(event.eventOrder().longValue(), event));
        }

        var eventsToApply = new ArrayList<PersistedEvent<EVENT>>();
        while (candidates.containsKey(nextEventOrder)) {
            eventsToApply.add(candidates.remove(nextEventOrder));
            nextEventOrder++;
        }
        if (!candidates.isEmpty()) {
            log.debug("[{}] View of aggregate with id '{}' is waiting for eventOrder {}. Buffering {} later event(s)",
                      aggregateTypeOf(events),
                      aggregateId,
                      nextEventOrder,
                      candidates.size());
            pendingEvents.put(aggregateId, candidates);
        }
        if (eventsToApply.isEmpty()) {
            return 0;
        }

        var view = current.map(v -> v.view).orElseGet(() -> viewUpdater.initialView(aggregateId));
        for (var event : eventsToApply) {
            view = viewUpdater.apply(view, event.event());
        }
        var lastEventOrder = eventsToApply.get(eventsToApply.size() - 1).eventOrder();
        viewRepository.save(aggregateId, VersionedView.of(view, lastEventOrder));
        return eventsToApply.size();
    }

    /**
     * @return the number of events received for the aggregate that can't be folded yet, because an earlier event is missing
     */
    public int numberOfPendingEvents(String aggregateId) {
        requireNonNull(aggregateId, "No aggregateId provided");
        return aggregateLocks.withLock(aggregateId, () -> {
            var pending = pendingEvents.get(aggregateId);
            return pending != null ? pending.size() : 0;
        });
    }

    /**
     * Discard the view of an aggregate instance and fold its full history from the event store
     *
     * @return the rebuilt view or {@link Optional#empty()} if the aggregate has no history
     */
    public Optional<VersionedView<VIEW>> rebuild(String aggregateId, EventStore<EVENT> eventStore) {
        requireNonNull(aggregateId, "No aggregateId provided");
        requireNonNull(eventStore, "No eventStore provided");
        return aggregateLocks.withLock(aggregateId, () -> {
            viewRepository.delete(aggregateId);
            pendingEvents.remove(aggregateId);
            var history = eventStore.load(aggregateId);
            if (history.isEmpty()) {
                return Optional.<VersionedView<VIEW>>empty();
            }
            foldWhileLocked(aggregateId, history);
            log.debug("[{}] Rebuilt view of aggregate with id '{}' from {} event(s)", eventStore.aggregateType(), aggregateId, history.size());
            return viewRepository.load(aggregateId);
        });
    }

    /**
     * Fold all events in the given global order range into the views they belong to
     *
     * @param eventStore            the event store to read from
     * @param globalEventOrderRange the range of global event orders to fold
     * @return the number of events folded (events already reflected in a view aren't counted)
     */
    public long catchUp(EventStore<EVENT> eventStore, LongRange globalEventOrderRange) {
        requireNonNull(eventStore, "No eventStore provided");
        requireNonNull(globalEventOrderRange, "No globalEventOrderRange provided");
        long folded = 0;
        try (var events = eventStore.loadEventsByGlobalOrder(globalEventOrderRange)) {
            var iterator = events.iterator();
            while (iterator.hasNext()) {
                var event = iterator.next();
                folded += fold(event.aggregateId(), List.of(event));
            }
        }
        log.debug("[{}] Caught up {} event(s) in global order range {}", eventStore.aggregateType(), folded, globalEventOrderRange);
        return folded;
    }

    public ViewRepository<VIEW> viewRepository() {
        return viewRepository;
    }

    private static Object aggregateTypeOf(List<? extends PersistedEvent<?>> events) {
        return events.isEmpty() ? "?" : events.get(0).aggregateType();
    }
}
