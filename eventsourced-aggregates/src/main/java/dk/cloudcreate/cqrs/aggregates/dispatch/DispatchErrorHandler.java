package dk.cloudcreate.cqrs.aggregates.dispatch;

import dk.cloudcreate.cqrs.eventstore.eventstream.PersistedEvent;
import org.slf4j.*;

import java.util.List;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Notified when a {@link QueryProcessor} fails to handle a committed batch. The events are committed regardless,
 * so the handler can only record the failure (e.g. to schedule a view rebuild)
 */
@FunctionalInterface
public interface DispatchErrorHandler {
    void onDispatchError(QueryProcessor<?> queryProcessor,
                         String aggregateId,
                         List<? extends PersistedEvent<?>> committedEvents,
                         Exception cause);

    static DispatchErrorHandler loggingErrorHandler() {
        return LoggingDispatchErrorHandler.INSTANCE;
    }

    final class LoggingDispatchErrorHandler implements DispatchErrorHandler {
        private static final Logger                      log      = LoggerFactory.getLogger(LoggingDispatchErrorHandler.class);
        private static final LoggingDispatchErrorHandler INSTANCE = new LoggingDispatchErrorHandler();

        private LoggingDispatchErrorHandler() {
        }

        @Override
        public void onDispatchError(QueryProcessor<?> queryProcessor,
                                    String aggregateId,
                                    List<? extends PersistedEvent<?>> committedEvents,
                                    Exception cause) {
            log.error(msg("[{}] QueryProcessor '{}' failed to handle {} committed event(s) for aggregate with id '{}'",
                          committedEvents.isEmpty() ? "?" : committedEvents.get(0).aggregateType(),
                          queryProcessor,
                          committedEvents.size(),
                          aggregateId), cause);
        }
    }
}
