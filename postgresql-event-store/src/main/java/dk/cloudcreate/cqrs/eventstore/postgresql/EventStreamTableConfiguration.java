package dk.cloudcreate.cqrs.eventstore.postgresql;

import com.fasterxml.jackson.databind.ObjectMapper;
import dk.cloudcreate.cqrs.eventstore.eventstream.AggregateType;
import dk.cloudcreate.cqrs.eventstore.postgresql.serializer.json.*;

import java.util.Objects;
import java.util.regex.Pattern;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Configuration of the tables used to persist the events and snapshots of a single {@link AggregateType}
 */
public class EventStreamTableConfiguration {
    private static final Pattern VALID_SQL_IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]{0,62}");

    public final AggregateType               aggregateType;
    /**
     * The name of the table that contains the events of all aggregate instances of the {@link #aggregateType}
     */
    public final String                      eventStreamTableName;
    public final EventStreamTableColumnNames eventStreamTableColumnNames;
    /**
     * The name of the table that contains the latest snapshot of each aggregate instance of the {@link #aggregateType}
     */
    public final String                      snapshotTableName;
    public final JSONColumnType              jsonColumnType;
    /**
     * The JDBC fetch size used when loading events
     */
    public final int                         queryFetchSize;
    public final JSONSerializer              jsonSerializer;

    public EventStreamTableConfiguration(AggregateType aggregateType,
                                         String eventStreamTableName,
                                         EventStreamTableColumnNames eventStreamTableColumnNames,
                                         String snapshotTableName,
                                         JSONColumnType jsonColumnType,
                                         int queryFetchSize,
                                         JSONSerializer jsonSerializer) {
        this.aggregateType = requireNonNull(aggregateType, "No aggregateType provided");
        this.eventStreamTableName = requireValidSqlIdentifier(requireNonNull(eventStreamTableName, "No eventStreamTableName provided").toLowerCase());
        this.eventStreamTableColumnNames = requireNonNull(eventStreamTableColumnNames, "No eventStreamTableColumnNames provided");
        this.snapshotTableName = requireValidSqlIdentifier(requireNonNull(snapshotTableName, "No snapshotTableName provided").toLowerCase());
        this.jsonColumnType = requireNonNull(jsonColumnType, "No jsonColumnType provided");
        requireTrue(queryFetchSize > 0, "queryFetchSize must be > 0");
        this.queryFetchSize = queryFetchSize;
        this.jsonSerializer = requireNonNull(jsonSerializer, "No jsonSerializer provided");
        eventStreamTableColumnNames.allColumnNames().forEach(EventStreamTableConfiguration::requireValidSqlIdentifier);
    }

    /**
     * Standard configuration, with the tables <code>{aggregate-type}_events</code> and <code>{aggregate-type}_snapshots</code>,
     * the default column names and a {@link JacksonJSONSerializer}
     *
     * @param aggregateType  the aggregate type
     * @param objectMapper   the jackson object mapper used to serialize and deserialize events, meta data and snapshots
     * @param jsonColumnType the column type for all JSON columns
     * @return the configuration
     */
    public static EventStreamTableConfiguration standardConfigurationUsingJackson(AggregateType aggregateType,
                                                                                  ObjectMapper objectMapper,
                                                                                  JSONColumnType jsonColumnType) {
        requireNonNull(aggregateType, "No aggregateType provided");
        return new EventStreamTableConfiguration(aggregateType,
                                                 aggregateType + "_events",
                                                 EventStreamTableColumnNames.defaultColumnNames(),
                                                 aggregateType + "_snapshots",
                                                 jsonColumnType,
                                                 100,
                                                 new JacksonJSONSerializer(objectMapper));
    }

    private static String requireValidSqlIdentifier(String identifier) {
        if (!VALID_SQL_IDENTIFIER.matcher(identifier).matches()) {
            throw new IllegalArgumentException(msg("'{}' isn't a valid table or column name", identifier));
        }
        return identifier;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventStreamTableConfiguration)) return false;
        return aggregateType.equals(((EventStreamTableConfiguration) o).aggregateType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregateType);
    }

    @Override
    public String toString() {
        return "EventStreamTableConfiguration{" +
                "aggregateType=" + aggregateType +
                ", eventStreamTableName='" + eventStreamTableName + '\'' +
                ", snapshotTableName='" + snapshotTableName + '\'' +
                ", jsonColumnType=" + jsonColumnType +
                '}';
    }
}
