package dk.cloudcreate.cqrs.aggregates.command;

import dk.cloudcreate.cqrs.common.Lifecycle;
import dk.cloudcreate.cqrs.eventstore.eventstream.*;
import dk.cloudcreate.essentials.shared.concurrent.ThreadFactoryBuilder;
import org.slf4j.*;

import java.util.List;
import java.util.concurrent.*;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Runs the commands submitted to a {@link CommandProcessor} so that commands for the same aggregate id are handled one
 * at a time, in submission order, while commands for different aggregate ids run in parallel on a worker pool.<br>
 * Each aggregate id has a logical mailbox, which only exists while it has pending commands.<br>
 * Serializing the commands for an aggregate id removes optimistic concurrency conflicts between writers in this process;
 * the event store's optimistic check still protects against writers in other processes.
 *
 * @param <COMMAND> the aggregate command type
 * @param <EVENT>   the aggregate event type
 */
public final class SerializedCommandExecutor<COMMAND, EVENT> implements Lifecycle {
    private static final Logger log = LoggerFactory.getLogger(SerializedCommandExecutor.class);

    private final CommandProcessor<COMMAND, EVENT, ?>          commandProcessor;
    private final int                                          numberOfWorkerThreads;
    private final ConcurrentMap<String, CompletableFuture<?>> mailboxes = new ConcurrentHashMap<>();
    private volatile ExecutorService                           workerPool;

    public SerializedCommandExecutor(CommandProcessor<COMMAND, EVENT, ?> commandProcessor, int numberOfWorkerThreads) {
        this.commandProcessor = requireNonNull(commandProcessor, "No commandProcessor provided");
        requireTrue(numberOfWorkerThreads > 0, "numberOfWorkerThreads must be larger than 0");
        this.numberOfWorkerThreads = numberOfWorkerThreads;
    }

    @Override
    public synchronized void start() {
        if (workerPool == null) {
            workerPool = Executors.newFixedThreadPool(numberOfWorkerThreads,
                                                      ThreadFactoryBuilder.builder()
                                                                          .nameFormat(commandProcessor.aggregateType() + "-command-%d")
                                                                          .daemon(true)
                                                                          .build());
            log.info("[{}] Started SerializedCommandExecutor with {} worker thread(s)", commandProcessor.aggregateType(), numberOfWorkerThreads);
        }
    }

    @Override
    public synchronized void stop() {
        if (workerPool != null) {
            workerPool.shutdown();
            try {
                if (!workerPool.awaitTermination(10, TimeUnit.SECONDS)) {
                    log.warn("[{}] Pending commands didn't complete within 10 seconds", commandProcessor.aggregateType());
                    workerPool.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                workerPool.shutdownNow();
            }
            workerPool = null;
            log.info("[{}] Stopped SerializedCommandExecutor", commandProcessor.aggregateType());
        }
    }

    @Override
    public boolean isStarted() {
        return workerPool != null;
    }

    /**
     * Submit a command, which is handled once all previously submitted commands for the same aggregate id have completed
     *
     * @see CommandProcessor#handle(String, Object, EventMetaData)
     */
    public CompletableFuture<List<PersistedEvent<EVENT>>> submit(String aggregateId, COMMAND command, EventMetaData metaData) {
        requireNonNull(aggregateId, "No aggregateId provided");
        requireNonNull(command, "No command provided");
        requireNonNull(metaData, "No metaData provided");
        var executor = workerPool;
        if (executor == null) {
            throw new IllegalStateException(msg("[{}] SerializedCommandExecutor isn't started", commandProcessor.aggregateType()));
        }

        var result = new CompletableFuture<List<PersistedEvent<EVENT>>>();
        CompletableFuture<?> enqueued = mailboxes.compute(aggregateId, (id, previous) -> {
            CompletableFuture<?> predecessor = previous != null ? previous : CompletableFuture.completedFuture(null);
            return predecessor.handle((ignoredResult, ignoredFailure) -> null)
                              .thenRunAsync(() -> handle(aggregateId, command, metaData, result), executor);
        });
        enqueued.whenComplete((ignoredResult, failure) -> {
            mailboxes.remove(aggregateId, enqueued);
            if (failure != null && !result.isDone()) {
                // The worker pool rejected the command
                result.completeExceptionally(failure);
            }
        });
        return result;
    }

    public CompletableFuture<List<PersistedEvent<EVENT>>> submit(String aggregateId, COMMAND command) {
        return submit(aggregateId, command, EventMetaData.empty());
    }

    private void handle(String aggregateId, COMMAND command, EventMetaData metaData, CompletableFuture<List<PersistedEvent<EVENT>>> result) {
        try {
            result.complete(commandProcessor.handle(aggregateId, command, metaData));
        } catch (Throwable e) {
            result.completeExceptionally(e);
        }
    }

    /**
     * The number of aggregate ids with pending commands
     */
    public int numberOfActiveMailboxes() {
        return mailboxes.size();
    }
}
