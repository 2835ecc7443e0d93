package dk.cloudcreate.cqrs.aggregates.view;

import java.util.Optional;

/**
 * Storage of the {@link VersionedView}s maintained by a {@link GenericViewProcessor}, keyed by aggregate id
 *
 * @param <VIEW> the view type
 */
public interface ViewRepository<VIEW> {
    Optional<VersionedView<VIEW>> load(String aggregateId);

    void save(String aggregateId, VersionedView<VIEW> view);

    void delete(String aggregateId);
}
