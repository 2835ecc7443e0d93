package dk.cloudcreate.cqrs.aggregates.command;

import dk.cloudcreate.cqrs.aggregates.*;
import dk.cloudcreate.cqrs.aggregates.dispatch.*;
import dk.cloudcreate.cqrs.aggregates.snapshot.SnapshotWriter;
import dk.cloudcreate.cqrs.common.Lifecycle;
import dk.cloudcreate.cqrs.common.types.CorrelationId;
import dk.cloudcreate.cqrs.eventstore.*;
import dk.cloudcreate.cqrs.eventstore.eventstream.*;
import dk.cloudcreate.cqrs.eventstore.types.EventOrder;
import org.slf4j.*;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Handles commands for the instances of one {@link Aggregate} type:
 * <ol>
 *     <li>Load the aggregate (snapshot + later events, or full replay)</li>
 *     <li>Let the aggregate decide on the command</li>
 *     <li>Append the decided events, expecting the version that was loaded</li>
 *     <li>Dispatch the committed events to the {@link QueryProcessor}s</li>
 * </ol>
 * If the append loses an optimistic concurrency race, steps 1-3 are repeated against the fresh state, at most
 * {@link CommandProcessorConfiguration#maxConcurrencyRetries} times, after which a {@link ConcurrencyRetriesExhaustedException} is thrown.<br>
 * A {@link CommandRejectedException} or a technical {@link EventStoreException} ends the invocation immediately.<br>
 * Nothing is dispatched before the events are committed, and dispatch or snapshot failures never fail the command.<br>
 * Appending and dispatching are serialized per aggregate id, so every {@link QueryProcessor} receives the batches of an aggregate
 * in commit order (for the commands handled by this {@link CommandProcessor} instance). Loading and deciding run concurrently.<br>
 * <br>
 * The {@link CommandProcessor} is safe to use from many threads concurrently; all per invocation state lives in a fresh {@link AggregateContext}.
 *
 * @param <COMMAND> the aggregate command type
 * @param <EVENT>   the aggregate event type
 * @param <STATE>   the aggregate state type
 */
public final class CommandProcessor<COMMAND, EVENT, STATE> implements Lifecycle {
    private static final Logger log = LoggerFactory.getLogger(CommandProcessor.class);

    private final AggregateRepository<COMMAND, EVENT, STATE> repository;
    private final EventDispatcher<EVENT>                     eventDispatcher;
    private final CommandProcessorConfiguration              configuration;
    private final Optional<SnapshotWriter<STATE>>            snapshotWriter;
    private final AggregateIdLocks                           commitAndDispatchLocks = new AggregateIdLocks();

    public CommandProcessor(Aggregate<COMMAND, EVENT, STATE> aggregate,
                            EventStore<EVENT> eventStore,
                            List<QueryProcessor<EVENT>> queryProcessors) {
        this(aggregate, eventStore, queryProcessors, Optional.empty(), CommandProcessorConfiguration.defaultConfiguration());
    }

    public CommandProcessor(Aggregate<COMMAND, EVENT, STATE> aggregate,
                            EventStore<EVENT> eventStore,
                            List<QueryProcessor<EVENT>> queryProcessors,
                            Optional<SnapshotStore<STATE>> snapshotStore,
                            CommandProcessorConfiguration configuration) {
        requireNonNull(queryProcessors, "No queryProcessors provided");
        requireNonNull(snapshotStore, "No snapshotStore provided");
        this.configuration = requireNonNull(configuration, "No configuration provided");
        this.repository = AggregateRepository.from(aggregate, eventStore, snapshotStore);
        this.eventDispatcher = new EventDispatcher<>(queryProcessors, configuration.dispatchErrorHandler);
        this.snapshotWriter = snapshotStore.map(store -> new SnapshotWriter<>(store, configuration.snapshotThreadNamePrefix));
    }

    @Override
    public void start() {
        snapshotWriter.ifPresent(SnapshotWriter::start);
    }

    @Override
    public void stop() {
        snapshotWriter.ifPresent(SnapshotWriter::stop);
    }

    @Override
    public boolean isStarted() {
        return snapshotWriter.map(SnapshotWriter::isStarted).orElse(true);
    }

    /**
     * Handle a command using a freshly generated {@link CorrelationId}
     *
     * @see #handle(String, Object, EventMetaData)
     */
    public List<PersistedEvent<EVENT>> handle(String aggregateId, COMMAND command) {
        return handle(aggregateId, command, EventMetaData.empty());
    }

    /**
     * Handle a command
     *
     * @param aggregateId the id of the aggregate instance the command targets
     * @param command     the command
     * @param metaData    meta data stored with every event. If it doesn't contain a correlation id a new one is generated,
     *                    so all events of the invocation share one correlation id
     * @return the committed events, or an empty list if the aggregate decided that nothing happened
     * @throws CommandRejectedException              if the aggregate rejected the command (nothing was persisted)
     * @throws ConcurrencyRetriesExhaustedException  if every attempt lost an optimistic concurrency race (nothing was persisted)
     * @throws EventStoreException                   in case of a technical failure (nothing was persisted)
     */
    public List<PersistedEvent<EVENT>> handle(String aggregateId, COMMAND command, EventMetaData metaData) {
        requireNonNull(aggregateId, "No aggregateId provided");
        requireNonNull(command, "No command provided");
        requireNonNull(metaData, "No metaData provided");
        var invocationMetaData = metaData.correlationId().isPresent() ? metaData : metaData.withCorrelationId(CorrelationId.random());

        var maxAttempts = configuration.maxConcurrencyRetries + 1;
        var attempt     = 0;
        while (true) {
            attempt++;
            var context = repository.loadOrInitialize(aggregateId);
            log.trace("[{}] Attempt {}/{}: Deciding on command '{}' for aggregate with id '{}' at version {}",
                      aggregateType(),
                      attempt,
                      maxAttempts,
                      command.getClass().getSimpleName(),
                      aggregateId,
                      context.version());
            var previousVersion = context.version();
            var decidedEvents   = context.decideAndApply(command);
            if (decidedEvents.isEmpty()) {
                log.debug("[{}] Command '{}' for aggregate with id '{}' didn't result in any events",
                          aggregateType(),
                          command.getClass().getSimpleName(),
                          aggregateId);
                return List.of();
            }

            List<PersistedEvent<EVENT>> committedEvents;
            try {
                committedEvents = commitAndDispatchLocks.withLock(aggregateId, () -> commitAndDispatch(context, invocationMetaData));
            } catch (OptimisticAppendToStreamException e) {
                if (attempt >= maxAttempts) {
                    log.warn("[{}] Giving up on command '{}' for aggregate with id '{}' after {} attempt(s): {}",
                             aggregateType(),
                             command.getClass().getSimpleName(),
                             aggregateId,
                             attempt,
                             e.getMessage());
                    throw new ConcurrencyRetriesExhaustedException(aggregateType(), aggregateId, attempt, e);
                }
                log.warn("[{}] Concurrent modification of aggregate with id '{}' detected during attempt {}/{}. Retrying: {}",
                         aggregateType(),
                         aggregateId,
                         attempt,
                         maxAttempts,
                         e.getMessage());
                continue;
            }

            log.debug("[{}] Committed and dispatched {} event(s) for aggregate with id '{}'. Version {} -> {}",
                      aggregateType(),
                      committedEvents.size(),
                      aggregateId,
                      previousVersion,
                      context.version());
            snapshotIfRequired(context, previousVersion);
            return committedEvents;
        }
    }

    /**
     * Must be called while holding the aggregate id's lock in {@link #commitAndDispatchLocks}, which makes the
     * {@link QueryProcessor}s receive the batches of an aggregate in the order they were committed
     */
    private List<PersistedEvent<EVENT>> commitAndDispatch(AggregateContext<COMMAND, EVENT, STATE> context, EventMetaData metaData) {
        var committedEvents = repository.persist(context, metaData);
        eventDispatcher.dispatch(context.aggregateId(), committedEvents);
        return committedEvents;
    }

    private void snapshotIfRequired(AggregateContext<COMMAND, EVENT, STATE> context,
                                    EventOrder previousVersion) {
        if (snapshotWriter.isEmpty()) {
            return;
        }
        try {
            if (configuration.snapshotPolicy.shouldSnapshot(previousVersion, context.version())) {
                snapshotWriter.get().writeSnapshot(context.aggregateId(), context.state(), context.version());
            }
        } catch (RuntimeException e) {
            log.error(msg("[{}] Failed to evaluate the snapshot policy for aggregate with id '{}'", aggregateType(), context.aggregateId()), e);
        }
    }

    public AggregateType aggregateType() {
        return repository.aggregateType();
    }

    public AggregateRepository<COMMAND, EVENT, STATE> repository() {
        return repository;
    }

    public CommandProcessorConfiguration configuration() {
        return configuration;
    }
}
