package dk.cloudcreate.cqrs.aggregates.testing;

import dk.cloudcreate.cqrs.aggregates.*;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Given/When/Then testing of an {@link Aggregate}'s decision logic without any event store:
 * <pre>{@code
 * AggregateTestFixture.forAggregate(new BankAccount())
 *                     .given(new AccountOpened("Acc-1", "Alice"))
 *                     .when(new Deposit("Acc-1", 100))
 *                     .thenExpectEvents(new AmountDeposited("Acc-1", 100));
 * }</pre>
 * The given events are folded into {@link Aggregate#initialState()} using {@link Aggregate#apply(Object, Object)}.
 * Failed expectations throw an {@link AssertionError}
 *
 * @param <COMMAND> the aggregate command type
 * @param <EVENT>   the aggregate event type
 * @param <STATE>   the aggregate state type
 */
public final class AggregateTestFixture<COMMAND, EVENT, STATE> {
    private final Aggregate<COMMAND, EVENT, STATE> aggregate;
    private final List<EVENT>                      givenEvents = new ArrayList<>();

    private AggregateTestFixture(Aggregate<COMMAND, EVENT, STATE> aggregate) {
        this.aggregate = requireNonNull(aggregate, "No aggregate provided");
    }

    public static <COMMAND, EVENT, STATE> AggregateTestFixture<COMMAND, EVENT, STATE> forAggregate(Aggregate<COMMAND, EVENT, STATE> aggregate) {
        return new AggregateTestFixture<>(aggregate);
    }

    public AggregateTestFixture<COMMAND, EVENT, STATE> givenNoPreviousEvents() {
        givenEvents.clear();
        return this;
    }

    @SafeVarargs
    public final AggregateTestFixture<COMMAND, EVENT, STATE> given(EVENT... events) {
        return given(Arrays.asList(events));
    }

    public AggregateTestFixture<COMMAND, EVENT, STATE> given(List<EVENT> events) {
        requireNonNull(events, "No events provided");
        givenEvents.addAll(events);
        return this;
    }

    public ResultValidator when(COMMAND command) {
        requireNonNull(command, "No command provided");
        var state = aggregate.initialState();
        for (var event : givenEvents) {
            state = aggregate.apply(state, event);
        }
        try {
            var events = requireNonNull(aggregate.decide(state, command), "decide returned null");
            var resultingState = state;
            for (var event : events) {
                resultingState = aggregate.apply(resultingState, event);
            }
            return new ResultValidator(command, List.copyOf(events), resultingState, null);
        } catch (CommandRejectedException e) {
            return new ResultValidator(command, List.of(), state, e);
        }
    }

    /**
     * Expectations on the outcome of {@link #when(Object)}
     */
    public final class ResultValidator {
        private final COMMAND                  command;
        private final List<EVENT>              events;
        private final STATE                    state;
        private final CommandRejectedException rejection;

        private ResultValidator(COMMAND command, List<EVENT> events, STATE state, CommandRejectedException rejection) {
            this.command = command;
            this.events = events;
            this.state = state;
            this.rejection = rejection;
        }

        @SafeVarargs
        public final ResultValidator thenExpectEvents(EVENT... expectedEvents) {
            return thenExpectEvents(Arrays.asList(expectedEvents));
        }

        public ResultValidator thenExpectEvents(List<EVENT> expectedEvents) {
            requireNoRejection();
            if (!events.equals(expectedEvents)) {
                throw new AssertionError(msg("[{}] Expected command {} to result in events {} but got {}",
                                             aggregate.aggregateType(),
                                             command,
                                             expectedEvents,
                                             events));
            }
            return this;
        }

        public ResultValidator thenExpectNoEvents() {
            return thenExpectEvents(List.of());
        }

        public ResultValidator thenExpectRejection(String expectedMessage) {
            if (rejection == null) {
                throw new AssertionError(msg("[{}] Expected command {} to be rejected with '{}' but it resulted in events {}",
                                             aggregate.aggregateType(),
                                             command,
                                             expectedMessage,
                                             events));
            }
            if (!Objects.equals(rejection.getMessage(), expectedMessage)) {
                throw new AssertionError(msg("[{}] Expected command {} to be rejected with '{}' but it was rejected with '{}'",
                                             aggregate.aggregateType(),
                                             command,
                                             expectedMessage,
                                             rejection.getMessage()));
            }
            return this;
        }

        /**
         * @param expectedState the expected state after folding the given and the resulting events
         */
        public ResultValidator thenExpectState(STATE expectedState) {
            if (!Objects.equals(state, expectedState)) {
                throw new AssertionError(msg("[{}] Expected state {} after command {} but got {}",
                                             aggregate.aggregateType(),
                                             expectedState,
                                             command,
                                             state));
            }
            return this;
        }

        public List<EVENT> events() {
            return events;
        }

        public STATE state() {
            return state;
        }

        public Optional<CommandRejectedException> rejection() {
            return Optional.ofNullable(rejection);
        }

        private void requireNoRejection() {
            if (rejection != null) {
                throw new AssertionError(msg("[{}] Command {} was unexpectedly rejected with '{}'",
                                             aggregate.aggregateType(),
                                             command,
                                             rejection.getMessage()));
            }
        }
    }
}
