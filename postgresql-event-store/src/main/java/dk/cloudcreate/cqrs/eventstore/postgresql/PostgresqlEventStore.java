package dk.cloudcreate.cqrs.eventstore.postgresql;

import dk.cloudcreate.cqrs.common.types.EventId;
import dk.cloudcreate.cqrs.eventstore.*;
import dk.cloudcreate.cqrs.eventstore.eventstream.*;
import dk.cloudcreate.cqrs.eventstore.postgresql.transaction.*;
import dk.cloudcreate.cqrs.eventstore.types.*;
import dk.cloudcreate.essentials.types.LongRange;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.statement.PreparedBatch;
import org.slf4j.*;

import java.sql.SQLException;
import java.time.*;
import java.time.temporal.ChronoUnit;
import java.util.*;
import java.util.stream.Stream;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.NamedArgumentBinding.arg;
import static dk.cloudcreate.essentials.shared.MessageFormatter.*;

/**
 * Postgresql {@link EventStore} that persists the events of all aggregate instances of one {@link AggregateType}
 * in a single table (see {@link EventStreamTableConfiguration#eventStreamTableName}).<br>
 * The table has a <code>UNIQUE(aggregate_id, event_order)</code> constraint, so two concurrent appends with the same expected
 * {@link EventOrder} can never both succeed: the loser fails with a unique key violation, which is reported as an
 * {@link OptimisticAppendToStreamException}.<br>
 * The {@link GlobalEventOrder} is assigned by the database (identity column).
 *
 * @param <EVENT> the type of event payload
 */
public class PostgresqlEventStore<EVENT> implements EventStore<EVENT> {
    private static final Logger log                        = LoggerFactory.getLogger(PostgresqlEventStore.class);
    private static final String UNIQUE_VIOLATION_SQL_STATE = "23505";

    private final JdbiUnitOfWorkFactory          unitOfWorkFactory;
    private final EventStreamTableConfiguration  configuration;
    private final EventStreamTableColumnNames    columnNames;
    private final Clock                          clock;
    private final PersistedEventRowMapper<EVENT> rowMapper;
    private final String                         insertSql;
    private final String                         lastEventOrderSql;
    private final String                         loadEventsAfterSql;

    public PostgresqlEventStore(JdbiUnitOfWorkFactory unitOfWorkFactory,
                                EventStreamTableConfiguration configuration) {
        this(unitOfWorkFactory, configuration, Clock.systemUTC());
    }

    public PostgresqlEventStore(JdbiUnitOfWorkFactory unitOfWorkFactory,
                                EventStreamTableConfiguration configuration,
                                Clock clock) {
        this.unitOfWorkFactory = requireNonNull(unitOfWorkFactory, "No unitOfWorkFactory provided");
        this.configuration = requireNonNull(configuration, "No configuration provided");
        this.clock = requireNonNull(clock, "No clock provided");
        this.columnNames = configuration.eventStreamTableColumnNames;
        this.rowMapper = new PersistedEventRowMapper<>(configuration);

        insertSql = bind("INSERT INTO {:tableName} (\n" +
                                 "       {:aggregateIdColumn}, {:eventOrderColumn}, {:eventIdColumn}, {:causedByEventIdColumn}, {:correlationIdColumn},\n" +
                                 "       {:eventTypeColumn}, {:timestampColumn}, {:eventPayloadColumn}, {:eventMetaDataColumn}\n" +
                                 "   ) VALUES (\n" +
                                 "       :aggregateId, :eventOrder, :eventId, :causedByEventId, :correlationId,\n" +
                                 "       :eventType, :timestamp, CAST(:eventPayload AS {:jsonType}), CAST(:eventMetaData AS {:jsonType})\n" +
                                 "   )",
                         arg("tableName", configuration.eventStreamTableName),
                         arg("aggregateIdColumn", columnNames.aggregateIdColumn),
                         arg("eventOrderColumn", columnNames.eventOrderColumn),
                         arg("eventIdColumn", columnNames.eventIdColumn),
                         arg("causedByEventIdColumn", columnNames.causedByEventIdColumn),
                         arg("correlationIdColumn", columnNames.correlationIdColumn),
                         arg("eventTypeColumn", columnNames.eventTypeColumn),
                         arg("timestampColumn", columnNames.timestampColumn),
                         arg("eventPayloadColumn", columnNames.eventPayloadColumn),
                         arg("eventMetaDataColumn", columnNames.eventMetaDataColumn),
                         arg("jsonType", configuration.jsonColumnType));
        lastEventOrderSql = bind("SELECT COALESCE(MAX({:eventOrderColumn}), 0) FROM {:tableName} WHERE {:aggregateIdColumn} = :aggregateId",
                                 arg("tableName", configuration.eventStreamTableName),
                                 arg("eventOrderColumn", columnNames.eventOrderColumn),
                                 arg("aggregateIdColumn", columnNames.aggregateIdColumn));
        loadEventsAfterSql = bind("SELECT * FROM {:tableName} WHERE {:aggregateIdColumn} = :aggregateId AND {:eventOrderColumn} > :afterEventOrder\n" +
                                          "   ORDER BY {:eventOrderColumn} ASC",
                                  arg("tableName", configuration.eventStreamTableName),
                                  arg("eventOrderColumn", columnNames.eventOrderColumn),
                                  arg("aggregateIdColumn", columnNames.aggregateIdColumn));

        initializeEventStreamTable();
    }

    private void initializeEventStreamTable() {
        log.info("[{}] Initializing EventStream storage in table '{}'", configuration.aggregateType, configuration.eventStreamTableName);
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            var existingTable = unitOfWork.handle()
                                          .select("SELECT to_regclass(?)", configuration.eventStreamTableName)
                                          .mapTo(String.class)
                                          .findOne();
            if (existingTable.isEmpty()) {
                createEventStreamTable(unitOfWork.handle());
            }
        });
    }

    private void createEventStreamTable(Handle handle) {
        log.info("[{}] Creating event-stream table '{}'", configuration.aggregateType, configuration.eventStreamTableName);
        handle.execute(bind("CREATE TABLE IF NOT EXISTS {:tableName} (\n" +
                                    "            {:globalOrderColumn} bigint GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,\n" +
                                    "            {:aggregateIdColumn} text NOT NULL,\n" +
                                    "            {:eventOrderColumn} bigint NOT NULL,\n" +
                                    "            {:eventIdColumn} text NOT NULL,\n" +
                                    "            {:causedByEventIdColumn} text,\n" +
                                    "            {:correlationIdColumn} text,\n" +
                                    "            {:eventTypeColumn} text NOT NULL,\n" +
                                    "            {:timestampColumn} TIMESTAMP WITH TIME ZONE NOT NULL,\n" +
                                    "            {:eventPayloadColumn} {:jsonType} NOT NULL,\n" +
                                    "            {:eventMetaDataColumn} {:jsonType} NOT NULL,\n" +
                                    "          UNIQUE ({:aggregateIdColumn}, {:eventOrderColumn}),\n" +
                                    "          UNIQUE ({:eventIdColumn})\n" +
                                    "        )",
                            arg("tableName", configuration.eventStreamTableName),
                            arg("globalOrderColumn", columnNames.globalOrderColumn),
                            arg("aggregateIdColumn", columnNames.aggregateIdColumn),
                            arg("eventOrderColumn", columnNames.eventOrderColumn),
                            arg("eventIdColumn", columnNames.eventIdColumn),
                            arg("causedByEventIdColumn", columnNames.causedByEventIdColumn),
                            arg("correlationIdColumn", columnNames.correlationIdColumn),
                            arg("eventTypeColumn", columnNames.eventTypeColumn),
                            arg("timestampColumn", columnNames.timestampColumn),
                            arg("eventPayloadColumn", columnNames.eventPayloadColumn),
                            arg("eventMetaDataColumn", columnNames.eventMetaDataColumn),
                            arg("jsonType", configuration.jsonColumnType)));
    }

    @Override
    public AggregateType aggregateType() {
        return configuration.aggregateType;
    }

    public EventStreamTableConfiguration getConfiguration() {
        return configuration;
    }

    @Override
    public List<PersistedEvent<EVENT>> loadEventsAfter(String aggregateId, EventOrder afterEventOrder) {
        requireNonNull(aggregateId, "No aggregateId provided");
        requireNonNull(afterEventOrder, "No afterEventOrder provided");
        var events = unitOfWorkFactory.withUnitOfWork(unitOfWork -> unitOfWork.handle()
                                                                               .createQuery(loadEventsAfterSql)
                                                                               .bind("aggregateId", aggregateId)
                                                                               .bind("afterEventOrder", afterEventOrder.longValue())
                                                                               .setFetchSize(configuration.queryFetchSize)
                                                                               .map(rowMapper)
                                                                               .list());
        log.debug("[{}] Loaded {} event(s) after eventOrder {} for aggregate with id '{}'",
                  configuration.aggregateType,
                  events.size(),
                  afterEventOrder,
                  aggregateId);
        return events;
    }

    @Override
    public EventOrder loadLastEventOrder(String aggregateId) {
        requireNonNull(aggregateId, "No aggregateId provided");
        return unitOfWorkFactory.withUnitOfWork(unitOfWork -> loadLastEventOrder(unitOfWork.handle(), aggregateId));
    }

    private EventOrder loadLastEventOrder(Handle handle, String aggregateId) {
        return EventOrder.of(handle.createQuery(lastEventOrderSql)
                                   .bind("aggregateId", aggregateId)
                                   .mapTo(Long.class)
                                   .one());
    }

    @Override
    public List<PersistedEvent<EVENT>> append(String aggregateId,
                                              EventOrder expectedEventOrder,
                                              List<PersistableEvent<EVENT>> events) {
        requireNonNull(aggregateId, "No aggregateId provided");
        requireNonNull(expectedEventOrder, "No expectedEventOrder provided");
        requireNonNull(events, "No events provided");
        if (events.isEmpty()) {
            return List.of();
        }

        try {
            var persistedEvents = unitOfWorkFactory.withUnitOfWork(unitOfWork -> appendInUnitOfWork(unitOfWork.handle(),
                                                                                                     aggregateId,
                                                                                                     expectedEventOrder,
                                                                                                     events));
            log.debug("[{}] Appended {} event(s) to aggregate with id '{}'. EventOrder is now {}",
                      configuration.aggregateType,
                      persistedEvents.size(),
                      aggregateId,
                      persistedEvents.get(persistedEvents.size() - 1).eventOrder());
            return persistedEvents;
        } catch (OptimisticAppendToStreamException e) {
            throw e;
        } catch (RuntimeException e) {
            if (isUniqueKeyViolation(e)) {
                log.debug("[{}] Unique key violation while appending {} event(s) to aggregate with id '{}' after eventOrder {}",
                          configuration.aggregateType,
                          events.size(),
                          aggregateId,
                          expectedEventOrder);
                throw new OptimisticAppendToStreamException(configuration.aggregateType,
                                                            aggregateId,
                                                            expectedEventOrder,
                                                            Optional.empty(),
                                                            e);
            }
            throw new AppendToStreamException(msg("[{}] Failed to Append {} Events to Stream related to aggregate with id '{}'",
                                                  configuration.aggregateType,
                                                  events.size(),
                                                  aggregateId), e);
        }
    }

    private List<PersistedEvent<EVENT>> appendInUnitOfWork(Handle handle,
                                                           String aggregateId,
                                                           EventOrder expectedEventOrder,
                                                           List<PersistableEvent<EVENT>> events) {
        var actualEventOrder = loadLastEventOrder(handle, aggregateId);
        if (!actualEventOrder.equals(expectedEventOrder)) {
            throw new OptimisticAppendToStreamException(configuration.aggregateType,
                                                        aggregateId,
                                                        expectedEventOrder,
                                                        Optional.of(actualEventOrder));
        }

        var timestamp  = OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC).truncatedTo(ChronoUnit.MICROS);
        var batch      = handle.prepareBatch(insertSql);
        var eventOrder = expectedEventOrder;
        var eventIds   = new ArrayList<EventId>(events.size());
        for (var persistableEvent : events) {
            eventOrder = eventOrder.increaseAndGet();
            var eventId = EventId.random();
            eventIds.add(eventId);
            addEventToBatch(batch, aggregateId, eventId, eventOrder, persistableEvent, timestamp);
        }

        var globalOrders = batch.executeAndReturnGeneratedKeys(columnNames.globalOrderColumn)
                                .mapTo(Long.class)
                                .list();
        if (globalOrders.size() != events.size()) {
            throw new AppendToStreamException(msg("[{}] Expected {} generated global orders when appending to aggregate with id '{}' but got {}",
                                                  configuration.aggregateType,
                                                  events.size(),
                                                  aggregateId,
                                                  globalOrders.size()));
        }

        var persistedEvents = new ArrayList<PersistedEvent<EVENT>>(events.size());
        eventOrder = expectedEventOrder;
        for (int i = 0; i < events.size(); i++) {
            var persistableEvent = events.get(i);
            eventOrder = eventOrder.increaseAndGet();
            persistedEvents.add(PersistedEvent.from(eventIds.get(i),
                                                    configuration.aggregateType,
                                                    aggregateId,
                                                    eventOrder,
                                                    GlobalEventOrder.of(globalOrders.get(i)),
                                                    persistableEvent.event(),
                                                    persistableEvent.eventType(),
                                                    timestamp,
                                                    persistableEvent.metaData()));
        }
        return persistedEvents;
    }

    private void addEventToBatch(PreparedBatch batch,
                                 String aggregateId,
                                 EventId eventId,
                                 EventOrder eventOrder,
                                 PersistableEvent<EVENT> persistableEvent,
                                 OffsetDateTime timestamp) {
        var metaData = persistableEvent.metaData();
        batch.bind("aggregateId", aggregateId)
             .bind("eventOrder", eventOrder.longValue())
             .bind("eventId", eventId.toString())
             .bind("causedByEventId", metaData.causedByEventId().map(Object::toString).orElse(null))
             .bind("correlationId", metaData.correlationId().map(Object::toString).orElse(null))
             .bind("eventType", persistableEvent.eventType())
             .bind("timestamp", timestamp)
             .bind("eventPayload", configuration.jsonSerializer.serialize(persistableEvent.event()))
             .bind("eventMetaData", configuration.jsonSerializer.serializeMetaData(metaData))
             .add();
    }

    @Override
    public Stream<PersistedEvent<EVENT>> loadEventsByGlobalOrder(LongRange globalEventOrderRange) {
        requireNonNull(globalEventOrderRange, "No globalEventOrderRange provided");
        var sql = bind("SELECT * FROM {:tableName} WHERE {:globalOrderColumn} >= :fromInclusive{:toInclusiveCondition}\n" +
                               "   ORDER BY {:globalOrderColumn} ASC",
                       arg("tableName", configuration.eventStreamTableName),
                       arg("globalOrderColumn", columnNames.globalOrderColumn),
                       arg("toInclusiveCondition", globalEventOrderRange.isClosedRange() ?
                                                   " AND " + columnNames.globalOrderColumn + " <= :toInclusive" :
                                                   ""));
        List<PersistedEvent<EVENT>> events = unitOfWorkFactory.withUnitOfWork(unitOfWork -> {
            var query = unitOfWork.handle()
                                  .createQuery(sql)
                                  .bind("fromInclusive", globalEventOrderRange.fromInclusive)
                                  .setFetchSize(configuration.queryFetchSize);
            if (globalEventOrderRange.isClosedRange()) {
                query.bind("toInclusive", globalEventOrderRange.toInclusive);
            }
            return query.map(rowMapper).list();
        });
        log.debug("[{}] Loaded {} event(s) in global order range {}", configuration.aggregateType, events.size(), globalEventOrderRange);
        return events.stream();
    }

    private static boolean isUniqueKeyViolation(Throwable e) {
        var cause = e;
        while (cause != null) {
            if (cause instanceof SQLException) {
                // Batch failures report the failing statement through the chain of next exceptions
                var sqlException = (SQLException) cause;
                while (sqlException != null) {
                    if (UNIQUE_VIOLATION_SQL_STATE.equals(sqlException.getSQLState())) {
                        return true;
                    }
                    sqlException = sqlException.getNextException();
                }
            }
            cause = cause.getCause() == cause ? null : cause.getCause();
        }
        return false;
    }
}
