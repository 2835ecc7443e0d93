package dk.cloudcreate.cqrs.aggregates.view;

import java.util.function.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Folds events into a view, in the same way as an aggregate folds events into its state
 *
 * @param <EVENT> the aggregate event type
 * @param <VIEW>  the view type
 */
public interface ViewUpdater<EVENT, VIEW> {
    VIEW initialView(String aggregateId);

    VIEW apply(VIEW view, EVENT event);

    static <EVENT, VIEW> ViewUpdater<EVENT, VIEW> of(Function<String, VIEW> initialView, BiFunction<VIEW, EVENT, VIEW> apply) {
        requireNonNull(initialView, "No initialView function provided");
        requireNonNull(apply, "No apply function provided");
        return new ViewUpdater<>() {
            @Override
            public VIEW initialView(String aggregateId) {
                return initialView.apply(aggregateId);
            }

            @Override
            public VIEW apply(VIEW view, EVENT event) {
                return apply.apply(view, event);
            }
        };
    }
}
