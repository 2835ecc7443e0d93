package dk.cloudcreate.cqrs.eventstore.postgresql;

import java.util.List;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The column names used in an event stream table
 */
public class EventStreamTableColumnNames {
    public final String globalOrderColumn;
    public final String aggregateIdColumn;
    public final String eventOrderColumn;
    public final String eventIdColumn;
    public final String causedByEventIdColumn;
    public final String correlationIdColumn;
    public final String eventTypeColumn;
    public final String timestampColumn;
    public final String eventPayloadColumn;
    public final String eventMetaDataColumn;

    public EventStreamTableColumnNames(String globalOrderColumn,
                                       String aggregateIdColumn,
                                       String eventOrderColumn,
                                       String eventIdColumn,
                                       String causedByEventIdColumn,
                                       String correlationIdColumn,
                                       String eventTypeColumn,
                                       String timestampColumn,
                                       String eventPayloadColumn,
                                       String eventMetaDataColumn) {
        this.globalOrderColumn = requireNonNull(globalOrderColumn, "No globalOrderColumn provided");
        this.aggregateIdColumn = requireNonNull(aggregateIdColumn, "No aggregateIdColumn provided");
        this.eventOrderColumn = requireNonNull(eventOrderColumn, "No eventOrderColumn provided");
        this.eventIdColumn = requireNonNull(eventIdColumn, "No eventIdColumn provided");
        this.causedByEventIdColumn = requireNonNull(causedByEventIdColumn, "No causedByEventIdColumn provided");
        this.correlationIdColumn = requireNonNull(correlationIdColumn, "No correlationIdColumn provided");
        this.eventTypeColumn = requireNonNull(eventTypeColumn, "No eventTypeColumn provided");
        this.timestampColumn = requireNonNull(timestampColumn, "No timestampColumn provided");
        this.eventPayloadColumn = requireNonNull(eventPayloadColumn, "No eventPayloadColumn provided");
        this.eventMetaDataColumn = requireNonNull(eventMetaDataColumn, "No eventMetaDataColumn provided");
    }

    public static EventStreamTableColumnNames defaultColumnNames() {
        return new EventStreamTableColumnNames("global_order",
                                               "aggregate_id",
                                               "event_order",
                                               "event_id",
                                               "caused_by_event_id",
                                               "correlation_id",
                                               "event_type",
                                               "timestamp",
                                               "event_payload",
                                               "event_metadata");
    }

    List<String> allColumnNames() {
        return List.of(globalOrderColumn,
                       aggregateIdColumn,
                       eventOrderColumn,
                       eventIdColumn,
                       causedByEventIdColumn,
                       correlationIdColumn,
                       eventTypeColumn,
                       timestampColumn,
                       eventPayloadColumn,
                       eventMetaDataColumn);
    }
}
