package dk.cloudcreate.cqrs.aggregates;

import dk.cloudcreate.cqrs.eventstore.eventstream.AggregateType;
import dk.cloudcreate.essentials.shared.reflection.Reflector;

import java.util.List;

/**
 * The decision and state transition logic of one type of aggregate.<br>
 * Both {@link #decide(Object, Object)} and {@link #apply(Object, Object)} must be pure functions of their arguments (no I/O, no clock,
 * no random values and no mutation of the state passed in), which makes replaying the persisted events deterministic and allows
 * command handling to be tested without any event store (see <code>AggregateTestFixture</code>).<br>
 * <br>
 * Commands and events are best modelled as <code>sealed</code> interfaces with one record per variant, so adding a variant forces
 * every aggregate that handles the type to be revisited.
 *
 * @param <COMMAND> the root type of the commands the aggregate can decide on
 * @param <EVENT>   the root type of the events the aggregate emits
 * @param <STATE>   the aggregate state type
 */
public interface Aggregate<COMMAND, EVENT, STATE> {
    /**
     * The aggregate type, which also names the event stream the aggregate's events are persisted in
     */
    AggregateType aggregateType();

    Class<STATE> stateType();

    /**
     * The state of an aggregate instance without any history (version {@link dk.cloudcreate.cqrs.eventstore.types.EventOrder#NO_EVENTS_PERSISTED}).<br>
     * The default implementation creates a new {@link #stateType()} instance using its zero-argument constructor.
     */
    default STATE initialState() {
        return Reflector.reflectOn(stateType()).newInstance();
    }

    /**
     * Validate the command against the current state and decide what happened
     *
     * @param state   the current state
     * @param command the command
     * @return the events that describe what happened, in order. An empty list means that nothing happened
     * @throws CommandRejectedException if the command isn't valid against the current state
     */
    List<EVENT> decide(STATE state, COMMAND command);

    /**
     * Fold a single event into the state. Must handle every event type the aggregate has ever emitted and must never fail
     *
     * @param state the current state
     * @param event the event
     * @return the new state
     */
    STATE apply(STATE state, EVENT event);
}
