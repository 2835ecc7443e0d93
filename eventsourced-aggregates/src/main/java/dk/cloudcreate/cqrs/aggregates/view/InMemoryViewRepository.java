package dk.cloudcreate.cqrs.aggregates.view;

import java.util.*;
import java.util.concurrent.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

public final class InMemoryViewRepository<VIEW> implements ViewRepository<VIEW> {
    private final ConcurrentMap<String, VersionedView<VIEW>> views = new ConcurrentHashMap<>();

    @Override
    public Optional<VersionedView<VIEW>> load(String aggregateId) {
        requireNonNull(aggregateId, "No aggregateId provided");
        return Optional.ofNullable(views.get(aggregateId));
    }

    @Override
    public void save(String aggregateId, VersionedView<VIEW> view) {
        requireNonNull(aggregateId, "No aggregateId provided");
        requireNonNull(view, "No view provided");
        views.put(aggregateId, view);
    }

    @Override
    public void delete(String aggregateId) {
        requireNonNull(aggregateId, "No aggregateId provided");
        views.remove(aggregateId);
    }

    public Map<String, VersionedView<VIEW>> all() {
        return Map.copyOf(views);
    }
}
