package dk.cloudcreate.cqrs.eventstore.types;

import dk.cloudcreate.cqrs.eventstore.eventstream.*;
import dk.cloudcreate.essentials.types.LongType;

/**
 * The global order of a {@link PersistedEvent} across ALL aggregate instances that share the same {@link AggregateType}.<br>
 * The global order is assigned at append time and is used when rebuilding views from the complete history of an {@link AggregateType}
 */
public class GlobalEventOrder extends LongType<GlobalEventOrder> {
    /**
     * Special value that contains the {@link GlobalEventOrder} of the FIRST Event persisted in context of a given {@link AggregateType}
     */
    public static final GlobalEventOrder FIRST_GLOBAL_EVENT_ORDER = GlobalEventOrder.of(1);

    public GlobalEventOrder(Long value) {
        super(value);
    }

    public static GlobalEventOrder of(long value) {
        return new GlobalEventOrder(value);
    }
}
