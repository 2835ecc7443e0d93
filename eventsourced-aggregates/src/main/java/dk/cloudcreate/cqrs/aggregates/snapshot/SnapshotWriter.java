package dk.cloudcreate.cqrs.aggregates.snapshot;

import dk.cloudcreate.cqrs.common.Lifecycle;
import dk.cloudcreate.cqrs.eventstore.SnapshotStore;
import dk.cloudcreate.cqrs.eventstore.types.EventOrder;
import dk.cloudcreate.essentials.shared.concurrent.ThreadFactoryBuilder;
import org.slf4j.*;

import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Best effort, asynchronous writing of aggregate snapshots.<br>
 * While started, snapshots are written on a dedicated single thread, so the command caller is never blocked.
 * When not started, snapshot requests are skipped (a warning is logged once per start/stop cycle).
 * A failing write is logged and otherwise ignored, since a missing snapshot only means that more events are replayed on the next load.
 *
 * @param <STATE> the aggregate state type
 */
public final class SnapshotWriter<STATE> implements Lifecycle {
    private static final Logger log = LoggerFactory.getLogger(SnapshotWriter.class);

    private final SnapshotStore<STATE> snapshotStore;
    private final String               threadNamePrefix;
    private final AtomicBoolean        warnedAboutSkippedSnapshots = new AtomicBoolean();
    private volatile ExecutorService   executorService;

    public SnapshotWriter(SnapshotStore<STATE> snapshotStore, String threadNamePrefix) {
        this.snapshotStore = requireNonNull(snapshotStore, "No snapshotStore provided");
        this.threadNamePrefix = requireNonNull(threadNamePrefix, "No threadNamePrefix provided");
    }

    @Override
    public synchronized void start() {
        if (executorService == null) {
            executorService = Executors.newSingleThreadExecutor(ThreadFactoryBuilder.builder()
                                                                                    .nameFormat(threadNamePrefix + "-%d")
                                                                                    .daemon(true)
                                                                                    .build());
            warnedAboutSkippedSnapshots.set(false);
            log.info("[{}] Started SnapshotWriter", snapshotStore.aggregateType());
        }
    }

    @Override
    public synchronized void stop() {
        if (executorService != null) {
            executorService.shutdown();
            try {
                if (!executorService.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("[{}] Pending snapshot writes didn't complete within 5 seconds", snapshotStore.aggregateType());
                    executorService.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                executorService.shutdownNow();
            }
            executorService = null;
            log.info("[{}] Stopped SnapshotWriter", snapshotStore.aggregateType());
        }
    }

    @Override
    public boolean isStarted() {
        return executorService != null;
    }

    /**
     * Schedule writing a snapshot. Never throws and never blocks the caller
     *
     * @param aggregateId                   the aggregate id
     * @param state                         the state
     * @param eventOrderOfLastIncludedEvent the version of <code>state</code>
     */
    public void writeSnapshot(String aggregateId, STATE state, EventOrder eventOrderOfLastIncludedEvent) {
        requireNonNull(aggregateId, "No aggregateId provided");
        requireNonNull(state, "No state provided");
        requireNonNull(eventOrderOfLastIncludedEvent, "No eventOrderOfLastIncludedEvent provided");
        var executor = executorService;
        if (executor == null) {
            if (warnedAboutSkippedSnapshots.compareAndSet(false, true)) {
                log.warn("[{}] Skipping snapshot of aggregate with id '{}' at eventOrder {} since the SnapshotWriter isn't started",
                         snapshotStore.aggregateType(),
                         aggregateId,
                         eventOrderOfLastIncludedEvent);
            } else {
                log.trace("[{}] Skipping snapshot of aggregate with id '{}' at eventOrder {} since the SnapshotWriter isn't started",
                          snapshotStore.aggregateType(),
                          aggregateId,
                          eventOrderOfLastIncludedEvent);
            }
            return;
        }
        try {
            executor.execute(() -> write(aggregateId, state, eventOrderOfLastIncludedEvent));
        } catch (RejectedExecutionException e) {
            log.warn(msg("[{}] Skipped snapshot of aggregate with id '{}' at eventOrder {} since the SnapshotWriter is stopping",
                         snapshotStore.aggregateType(),
                         aggregateId,
                         eventOrderOfLastIncludedEvent), e);
        }
    }

    private void write(String aggregateId, STATE state, EventOrder eventOrderOfLastIncludedEvent) {
        try {
            var saved = snapshotStore.saveSnapshot(aggregateId, state, eventOrderOfLastIncludedEvent);
            log.debug("[{}] {} snapshot of aggregate with id '{}' at eventOrder {}",
                      snapshotStore.aggregateType(),
                      saved ? "Saved" : "Ignored stale",
                      aggregateId,
                      eventOrderOfLastIncludedEvent);
        } catch (RuntimeException e) {
            log.error(msg("[{}] Failed to save snapshot of aggregate with id '{}' at eventOrder {}",
                          snapshotStore.aggregateType(),
                          aggregateId,
                          eventOrderOfLastIncludedEvent), e);
        }
    }
}
