package dk.cloudcreate.cqrs.aggregates;

import dk.cloudcreate.cqrs.eventstore.EventStore;
import dk.cloudcreate.cqrs.eventstore.eventstream.*;
import dk.cloudcreate.cqrs.eventstore.types.EventOrder;
import dk.cloudcreate.essentials.types.LongRange;

import java.util.List;
import java.util.concurrent.atomic.*;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Delegating {@link EventStore} that lets a test run an action before every append (e.g. a competing writer or a failure)
 */
public class InterceptingEventStore<EVENT> implements EventStore<EVENT> {
    private final EventStore<EVENT>                 delegate;
    private final AtomicInteger                     numberOfAppendCalls = new AtomicInteger();
    private final AtomicReference<Consumer<String>> beforeNextAppend    = new AtomicReference<>();
    private volatile Consumer<String>               beforeEveryAppend;

    public InterceptingEventStore(EventStore<EVENT> delegate) {
        this.delegate = delegate;
    }

    /**
     * Run <code>action</code> (with the aggregate id) once, before the next append reaches the delegate
     */
    public InterceptingEventStore<EVENT> beforeNextAppend(Consumer<String> action) {
        beforeNextAppend.set(action);
        return this;
    }

    public InterceptingEventStore<EVENT> beforeEveryAppend(Consumer<String> action) {
        beforeEveryAppend = action;
        return this;
    }

    public int numberOfAppendCalls() {
        return numberOfAppendCalls.get();
    }

    @Override
    public AggregateType aggregateType() {
        return delegate.aggregateType();
    }

    @Override
    public List<PersistedEvent<EVENT>> loadEventsAfter(String aggregateId, EventOrder afterEventOrder) {
        return delegate.loadEventsAfter(aggregateId, afterEventOrder);
    }

    @Override
    public EventOrder loadLastEventOrder(String aggregateId) {
        return delegate.loadLastEventOrder(aggregateId);
    }

    @Override
    public List<PersistedEvent<EVENT>> append(String aggregateId, EventOrder expectedEventOrder, List<PersistableEvent<EVENT>> events) {
        numberOfAppendCalls.incrementAndGet();
        var once = beforeNextAppend.getAndSet(null);
        if (once != null) {
            once.accept(aggregateId);
        }
        var every = beforeEveryAppend;
        if (every != null) {
            every.accept(aggregateId);
        }
        return delegate.append(aggregateId, expectedEventOrder, events);
    }

    @Override
    public Stream<PersistedEvent<EVENT>> loadEventsByGlobalOrder(LongRange globalEventOrderRange) {
        return delegate.loadEventsByGlobalOrder(globalEventOrderRange);
    }
}
