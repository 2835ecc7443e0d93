package dk.cloudcreate.cqrs.aggregates.dispatch;

import dk.cloudcreate.cqrs.eventstore.eventstream.PersistedEvent;
import org.slf4j.*;

import java.util.List;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Delivers a committed batch to every registered {@link QueryProcessor}, in registration order.<br>
 * A failing processor is reported to the {@link DispatchErrorHandler} and doesn't prevent the remaining processors
 * from receiving the batch. {@link #dispatch(String, List)} never throws
 *
 * @param <EVENT> the aggregate event type
 */
public final class EventDispatcher<EVENT> {
    private static final Logger log = LoggerFactory.getLogger(EventDispatcher.class);

    private final List<QueryProcessor<EVENT>> queryProcessors;
    private final DispatchErrorHandler        errorHandler;

    public EventDispatcher(List<QueryProcessor<EVENT>> queryProcessors, DispatchErrorHandler errorHandler) {
        this.queryProcessors = List.copyOf(requireNonNull(queryProcessors, "No queryProcessors provided"));
        this.errorHandler = requireNonNull(errorHandler, "No errorHandler provided");
    }

    public EventDispatcher(List<QueryProcessor<EVENT>> queryProcessors) {
        this(queryProcessors, DispatchErrorHandler.loggingErrorHandler());
    }

    public void dispatch(String aggregateId, List<PersistedEvent<EVENT>> committedEvents) {
        requireNonNull(aggregateId, "No aggregateId provided");
        requireNonNull(committedEvents, "No committedEvents provided");
        if (committedEvents.isEmpty()) {
            return;
        }
        var batch = List.copyOf(committedEvents);
        for (var queryProcessor : queryProcessors) {
            try {
                log.trace("Dispatching {} event(s) for aggregate with id '{}' to '{}'", batch.size(), aggregateId, queryProcessor);
                queryProcessor.dispatch(aggregateId, batch);
            } catch (Exception e) {
                try {
                    errorHandler.onDispatchError(queryProcessor, aggregateId, batch, e);
                } catch (Exception errorHandlerException) {
                    errorHandlerException.addSuppressed(e);
                    log.error(msg("DispatchErrorHandler '{}' failed while handling a dispatch error for aggregate with id '{}'",
                                  errorHandler,
                                  aggregateId), errorHandlerException);
                }
            }
        }
    }

    public List<QueryProcessor<EVENT>> queryProcessors() {
        return queryProcessors;
    }
}
