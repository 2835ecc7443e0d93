package dk.cloudcreate.cqrs.aggregates;

import java.util.concurrent.*;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Mutual exclusion per aggregate id. A lock only exists while a thread holds or waits for it, so the number of
 * locks is bounded by the number of aggregate ids that are being worked on. The locks are reentrant
 */
public final class AggregateIdLocks {
    private final ConcurrentMap<String, CountedLock> locks = new ConcurrentHashMap<>();

    /**
     * Run <code>action</code> while holding the lock for <code>aggregateId</code>
     */
    public <R> R withLock(String aggregateId, Supplier<R> action) {
        requireNonNull(aggregateId, "No aggregateId provided");
        requireNonNull(action, "No action provided");
        var lock = acquire(aggregateId);
        try {
            return action.get();
        } finally {
            release(aggregateId, lock);
        }
    }

    /**
     * The number of aggregate ids that currently have a lock holder or waiter
     */
    public int numberOfActiveLocks() {
        return locks.size();
    }

    private CountedLock acquire(String aggregateId) {
        var lock = locks.compute(aggregateId, (id, existing) -> {
            var counted = existing != null ? existing : new CountedLock();
            counted.users++;
            return counted;
        });
        lock.lock.lock();
        return lock;
    }

    private void release(String aggregateId, CountedLock lock) {
        lock.lock.unlock();
        locks.computeIfPresent(aggregateId, (id, existing) -> --existing.users == 0 ? null : existing);
    }

    private static final class CountedLock {
        private final ReentrantLock lock = new ReentrantLock();
        /**
         * Only read and written inside {@link ConcurrentMap#compute} for the lock's aggregate id
         */
        private       int           users;
    }
}
