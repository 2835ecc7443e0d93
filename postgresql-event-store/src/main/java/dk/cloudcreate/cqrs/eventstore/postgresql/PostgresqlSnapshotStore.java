package dk.cloudcreate.cqrs.eventstore.postgresql;

import dk.cloudcreate.cqrs.eventstore.*;
import dk.cloudcreate.cqrs.eventstore.eventstream.AggregateType;
import dk.cloudcreate.cqrs.eventstore.postgresql.transaction.JdbiUnitOfWorkFactory;
import dk.cloudcreate.cqrs.eventstore.snapshot.AggregateSnapshot;
import dk.cloudcreate.cqrs.eventstore.types.EventOrder;
import org.slf4j.*;

import java.sql.*;
import java.time.*;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.NamedArgumentBinding.arg;
import static dk.cloudcreate.essentials.shared.MessageFormatter.*;

/**
 * Postgresql {@link SnapshotStore} that keeps one row per aggregate instance in the table {@link EventStreamTableConfiguration#snapshotTableName}.<br>
 * A snapshot row is only inserted or updated if its event order is greater than the event order of the stored row
 *
 * @param <STATE> the aggregate state type
 */
public class PostgresqlSnapshotStore<STATE> implements SnapshotStore<STATE> {
    private static final Logger log = LoggerFactory.getLogger(PostgresqlSnapshotStore.class);

    private final JdbiUnitOfWorkFactory         unitOfWorkFactory;
    private final EventStreamTableConfiguration configuration;
    private final Clock                         clock;
    private final String                        upsertSql;
    private final String                        loadSql;
    private final String                        deleteSql;

    public PostgresqlSnapshotStore(JdbiUnitOfWorkFactory unitOfWorkFactory,
                                   EventStreamTableConfiguration configuration) {
        this(unitOfWorkFactory, configuration, Clock.systemUTC());
    }

    public PostgresqlSnapshotStore(JdbiUnitOfWorkFactory unitOfWorkFactory,
                                   EventStreamTableConfiguration configuration,
                                   Clock clock) {
        this.unitOfWorkFactory = requireNonNull(unitOfWorkFactory, "No unitOfWorkFactory provided");
        this.configuration = requireNonNull(configuration, "No configuration provided");
        this.clock = requireNonNull(clock, "No clock provided");

        upsertSql = bind("INSERT INTO {:tableName} (aggregate_id, event_order, state_type, state, timestamp)\n" +
                                 "   VALUES (:aggregateId, :eventOrder, :stateType, CAST(:state AS {:jsonType}), :timestamp)\n" +
                                 "   ON CONFLICT (aggregate_id) DO UPDATE SET\n" +
                                 "       event_order = EXCLUDED.event_order,\n" +
                                 "       state_type = EXCLUDED.state_type,\n" +
                                 "       state = EXCLUDED.state,\n" +
                                 "       timestamp = EXCLUDED.timestamp\n" +
                                 "   WHERE {:tableName}.event_order < EXCLUDED.event_order",
                         arg("tableName", configuration.snapshotTableName),
                         arg("jsonType", configuration.jsonColumnType));
        loadSql = bind("SELECT event_order, state_type, state, timestamp FROM {:tableName} WHERE aggregate_id = :aggregateId",
                       arg("tableName", configuration.snapshotTableName));
        deleteSql = bind("DELETE FROM {:tableName} WHERE aggregate_id = :aggregateId",
                         arg("tableName", configuration.snapshotTableName));

        initializeSnapshotTable();
    }

    private void initializeSnapshotTable() {
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            log.info("[{}] Ensuring snapshot table '{}' exists", configuration.aggregateType, configuration.snapshotTableName);
            unitOfWork.handle().execute(bind("CREATE TABLE IF NOT EXISTS {:tableName} (\n" +
                                                     "            aggregate_id text PRIMARY KEY,\n" +
                                                     "            event_order bigint NOT NULL,\n" +
                                                     "            state_type text NOT NULL,\n" +
                                                     "            state {:jsonType} NOT NULL,\n" +
                                                     "            timestamp TIMESTAMP WITH TIME ZONE NOT NULL\n" +
                                                     "        )",
                                             arg("tableName", configuration.snapshotTableName),
                                             arg("jsonType", configuration.jsonColumnType)));
        });
    }

    @Override
    public AggregateType aggregateType() {
        return configuration.aggregateType;
    }

    @Override
    public Optional<AggregateSnapshot<STATE>> loadSnapshot(String aggregateId) {
        requireNonNull(aggregateId, "No aggregateId provided");
        try {
            return unitOfWorkFactory.withUnitOfWork(unitOfWork -> unitOfWork.handle()
                                                                             .createQuery(loadSql)
                                                                             .bind("aggregateId", aggregateId)
                                                                             .map((rs, ctx) -> mapSnapshot(aggregateId, rs))
                                                                             .findOne());
        } catch (EventStoreException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EventStoreException(msg("[{}] Failed to load snapshot for aggregate with id '{}'", configuration.aggregateType, aggregateId), e);
        }
    }

    private AggregateSnapshot<STATE> mapSnapshot(String aggregateId, ResultSet rs) throws SQLException {
        STATE state = configuration.jsonSerializer.deserialize(rs.getString("state"), rs.getString("state_type"));
        return new AggregateSnapshot<>(configuration.aggregateType,
                                       aggregateId,
                                       state,
                                       EventOrder.of(rs.getLong("event_order")),
                                       rs.getObject("timestamp", OffsetDateTime.class));
    }

    @Override
    public boolean saveSnapshot(String aggregateId, STATE state, EventOrder eventOrderOfLastIncludedEvent) {
        requireNonNull(aggregateId, "No aggregateId provided");
        requireNonNull(state, "No state provided");
        requireNonNull(eventOrderOfLastIncludedEvent, "No eventOrderOfLastIncludedEvent provided");
        try {
            int changes = unitOfWorkFactory.withUnitOfWork(unitOfWork -> unitOfWork.handle()
                                                                                     .createUpdate(upsertSql)
                                                                                     .bind("aggregateId", aggregateId)
                                                                                     .bind("eventOrder", eventOrderOfLastIncludedEvent.longValue())
                                                                                     .bind("stateType", state.getClass().getName())
                                                                                     .bind("state", configuration.jsonSerializer.serialize(state))
                                                                                     .bind("timestamp", OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC).truncatedTo(ChronoUnit.MICROS))
                                                                                     .execute());
            if (changes == 1) {
                log.debug("[{}] Saved snapshot for aggregate with id '{}' at eventOrder {}", configuration.aggregateType, aggregateId, eventOrderOfLastIncludedEvent);
                return true;
            }
            log.debug("[{}] Ignored stale snapshot for aggregate with id '{}' at eventOrder {}", configuration.aggregateType, aggregateId, eventOrderOfLastIncludedEvent);
            return false;
        } catch (EventStoreException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EventStoreException(msg("[{}] Failed to save snapshot for aggregate with id '{}' at eventOrder {}",
                                              configuration.aggregateType,
                                              aggregateId,
                                              eventOrderOfLastIncludedEvent), e);
        }
    }

    @Override
    public void deleteSnapshot(String aggregateId) {
        requireNonNull(aggregateId, "No aggregateId provided");
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> unitOfWork.handle()
                                                                  .createUpdate(deleteSql)
                                                                  .bind("aggregateId", aggregateId)
                                                                  .execute());
    }
}
