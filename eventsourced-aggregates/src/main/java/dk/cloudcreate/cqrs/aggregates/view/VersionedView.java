package dk.cloudcreate.cqrs.aggregates.view;

import dk.cloudcreate.cqrs.eventstore.types.EventOrder;

import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * A view of a single aggregate instance together with the {@link EventOrder} of the last event folded into it
 *
 * @param <VIEW> the view type
 */
public final class VersionedView<VIEW> {
    public final VIEW       view;
    public final EventOrder lastAppliedEventOrder;

    public VersionedView(VIEW view, EventOrder lastAppliedEventOrder) {
        this.view = requireNonNull(view, "No view provided");
        this.lastAppliedEventOrder = requireNonNull(lastAppliedEventOrder, "No lastAppliedEventOrder provided");
    }

    public static <VIEW> VersionedView<VIEW> of(VIEW view, EventOrder lastAppliedEventOrder) {
        return new VersionedView<>(view, lastAppliedEventOrder);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VersionedView)) return false;
        VersionedView<?> that = (VersionedView<?>) o;
        return view.equals(that.view) && lastAppliedEventOrder.equals(that.lastAppliedEventOrder);
    }

    @Override
    public int hashCode() {
        return Objects.hash(view, lastAppliedEventOrder);
    }

    @Override
    public String toString() {
        return "VersionedView{" +
                "view=" + view +
                ", lastAppliedEventOrder=" + lastAppliedEventOrder +
                '}';
    }
}
