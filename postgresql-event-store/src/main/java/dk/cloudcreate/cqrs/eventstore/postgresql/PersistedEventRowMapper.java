package dk.cloudcreate.cqrs.eventstore.postgresql;

import dk.cloudcreate.cqrs.common.types.EventId;
import dk.cloudcreate.cqrs.eventstore.EventStoreException;
import dk.cloudcreate.cqrs.eventstore.eventstream.PersistedEvent;
import dk.cloudcreate.cqrs.eventstore.types.*;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.*;
import java.time.OffsetDateTime;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Maps a row in an event stream table to a {@link PersistedEvent}, deserializing the event payload into the Java type
 * stored in the event type column
 *
 * @param <EVENT> the type of event payload
 */
class PersistedEventRowMapper<EVENT> implements RowMapper<PersistedEvent<EVENT>> {
    private final EventStreamTableConfiguration config;
    private final EventStreamTableColumnNames   columnNames;

    PersistedEventRowMapper(EventStreamTableConfiguration configuration) {
        this.config = requireNonNull(configuration, "No EventStream configuration provided");
        this.columnNames = configuration.eventStreamTableColumnNames;
    }

    @Override
    public PersistedEvent<EVENT> map(ResultSet rs, StatementContext ctx) throws SQLException {
        var eventType = rs.getString(columnNames.eventTypeColumn);
        if (eventType == null || eventType.isBlank()) {
            throw new EventStoreException(msg("[{}] Row: {} - Column '{}' was empty or blank",
                                              config.aggregateType,
                                              rs.getRow(),
                                              columnNames.eventTypeColumn));
        }
        EVENT event = config.jsonSerializer.deserialize(rs.getString(columnNames.eventPayloadColumn), eventType);
        return PersistedEvent.from(EventId.of(rs.getString(columnNames.eventIdColumn)),
                                   config.aggregateType,
                                   rs.getString(columnNames.aggregateIdColumn),
                                   EventOrder.of(rs.getLong(columnNames.eventOrderColumn)),
                                   GlobalEventOrder.of(rs.getLong(columnNames.globalOrderColumn)),
                                   event,
                                   eventType,
                                   rs.getObject(columnNames.timestampColumn, OffsetDateTime.class),
                                   config.jsonSerializer.deserializeMetaData(rs.getString(columnNames.eventMetaDataColumn)));
    }
}
