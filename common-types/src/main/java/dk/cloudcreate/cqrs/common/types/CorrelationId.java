package dk.cloudcreate.cqrs.common.types;

import dk.cloudcreate.essentials.types.CharSequenceType;

import java.util.*;

/**
 * Correlates all events caused by the same command invocation (and anything that invocation caused in turn)
 */
public class CorrelationId extends CharSequenceType<CorrelationId> {
    public CorrelationId(CharSequence value) {
        super(value);
    }

    public static CorrelationId of(CharSequence value) {
        return new CorrelationId(value);
    }

    public static CorrelationId random() {
        return new CorrelationId(UUID.randomUUID().toString());
    }

    public static Optional<CorrelationId> optionalFrom(CharSequence value) {
        return Optional.ofNullable(value).map(CorrelationId::new);
    }
}
