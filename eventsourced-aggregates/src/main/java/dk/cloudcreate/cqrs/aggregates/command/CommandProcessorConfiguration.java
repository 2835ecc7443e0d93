package dk.cloudcreate.cqrs.aggregates.command;

import dk.cloudcreate.cqrs.aggregates.dispatch.DispatchErrorHandler;
import dk.cloudcreate.cqrs.aggregates.snapshot.SnapshotPolicy;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * Configuration of a {@link CommandProcessor}
 */
public final class CommandProcessorConfiguration {
    public static final int DEFAULT_MAX_CONCURRENCY_RETRIES = 3;

    /**
     * The number of times a command is retried (reload, re-decide, re-append) after losing an optimistic concurrency race.
     * The total number of attempts is <code>maxConcurrencyRetries + 1</code>
     */
    public final int                  maxConcurrencyRetries;
    public final SnapshotPolicy       snapshotPolicy;
    public final String               snapshotThreadNamePrefix;
    public final DispatchErrorHandler dispatchErrorHandler;

    private CommandProcessorConfiguration(Builder builder) {
        this.maxConcurrencyRetries = builder.maxConcurrencyRetries;
        this.snapshotPolicy = builder.snapshotPolicy;
        this.snapshotThreadNamePrefix = builder.snapshotThreadNamePrefix;
        this.dispatchErrorHandler = builder.dispatchErrorHandler;
    }

    public static CommandProcessorConfiguration defaultConfiguration() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "CommandProcessorConfiguration{" +
                "maxConcurrencyRetries=" + maxConcurrencyRetries +
                ", snapshotPolicy=" + snapshotPolicy +
                ", snapshotThreadNamePrefix='" + snapshotThreadNamePrefix + '\'' +
                ", dispatchErrorHandler=" + dispatchErrorHandler +
                '}';
    }

    public static final class Builder {
        private int                  maxConcurrencyRetries    = DEFAULT_MAX_CONCURRENCY_RETRIES;
        private SnapshotPolicy       snapshotPolicy           = SnapshotPolicy.never();
        private String               snapshotThreadNamePrefix = "snapshot-writer";
        private DispatchErrorHandler dispatchErrorHandler     = DispatchErrorHandler.loggingErrorHandler();

        private Builder() {
        }

        public Builder maxConcurrencyRetries(int maxConcurrencyRetries) {
            requireTrue(maxConcurrencyRetries >= 0, "maxConcurrencyRetries must be 0 or larger");
            this.maxConcurrencyRetries = maxConcurrencyRetries;
            return this;
        }

        public Builder snapshotPolicy(SnapshotPolicy snapshotPolicy) {
            this.snapshotPolicy = requireNonNull(snapshotPolicy, "No snapshotPolicy provided");
            return this;
        }

        public Builder snapshotThreadNamePrefix(String snapshotThreadNamePrefix) {
            this.snapshotThreadNamePrefix = requireNonNull(snapshotThreadNamePrefix, "No snapshotThreadNamePrefix provided");
            return this;
        }

        public Builder dispatchErrorHandler(DispatchErrorHandler dispatchErrorHandler) {
            this.dispatchErrorHandler = requireNonNull(dispatchErrorHandler, "No dispatchErrorHandler provided");
            return this;
        }

        public CommandProcessorConfiguration build() {
            return new CommandProcessorConfiguration(this);
        }
    }
}
