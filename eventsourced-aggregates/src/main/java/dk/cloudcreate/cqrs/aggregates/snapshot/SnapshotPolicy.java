package dk.cloudcreate.cqrs.aggregates.snapshot;

import dk.cloudcreate.cqrs.eventstore.types.EventOrder;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * Decides, after a successful append, whether the new aggregate state should be snapshotted
 */
@FunctionalInterface
public interface SnapshotPolicy {
    /**
     * @param previousEventOrder the aggregate version before the append
     * @param currentEventOrder  the aggregate version after the append
     * @return true if a snapshot of the state at <code>currentEventOrder</code> should be written
     */
    boolean shouldSnapshot(EventOrder previousEventOrder, EventOrder currentEventOrder);

    static SnapshotPolicy never() {
        return (previousEventOrder, currentEventOrder) -> false;
    }

    /**
     * Snapshot whenever the appended events <code>[previous+1 .. current]</code> cross a multiple of <code>numberOfEvents</code>.
     * An append of several events therefore can't skip a snapshot boundary
     *
     * @param numberOfEvents the snapshot interval (&gt; 0)
     */
    static SnapshotPolicy everyNEvents(long numberOfEvents) {
        requireTrue(numberOfEvents > 0, "numberOfEvents must be larger than 0");
        return (previousEventOrder, currentEventOrder) -> {
            requireNonNull(previousEventOrder, "No previousEventOrder provided");
            requireNonNull(currentEventOrder, "No currentEventOrder provided");
            return currentEventOrder.longValue() / numberOfEvents > previousEventOrder.longValue() / numberOfEvents;
        };
    }
}
