package dk.cloudcreate.cqrs.eventstore;

import dk.cloudcreate.cqrs.eventstore.eventstream.AggregateType;
import dk.cloudcreate.cqrs.eventstore.snapshot.AggregateSnapshot;
import dk.cloudcreate.cqrs.eventstore.types.EventOrder;

import java.util.Optional;

/**
 * Storage of at most one {@link AggregateSnapshot} per aggregate instance of a single {@link AggregateType}.<br>
 * Snapshots are versioned by their {@link AggregateSnapshot#eventOrderOfLastIncludedEvent}: a snapshot is only
 * overwritten by a snapshot of a later {@link EventOrder}, so a late (stale) write can never replace a newer snapshot.<br>
 * Snapshots are a pure optimization, deleting them must never change externally observable behaviour
 *
 * @param <STATE> the aggregate state type
 */
public interface SnapshotStore<STATE> {
    AggregateType aggregateType();

    /**
     * @param aggregateId the id of the aggregate instance
     * @return the latest snapshot or {@link Optional#empty()} if none exists
     */
    Optional<AggregateSnapshot<STATE>> loadSnapshot(String aggregateId);

    /**
     * Save a snapshot, unless a snapshot with the same or a later {@link EventOrder} already exists
     *
     * @param aggregateId                   the id of the aggregate instance
     * @param state                         the folded state
     * @param eventOrderOfLastIncludedEvent the event order of the last event folded into <code>state</code>
     * @return true if the snapshot was saved, false if it was ignored because an equal or newer snapshot already exists
     */
    boolean saveSnapshot(String aggregateId, STATE state, EventOrder eventOrderOfLastIncludedEvent);

    void deleteSnapshot(String aggregateId);
}
