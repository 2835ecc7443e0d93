package dk.cloudcreate.cqrs.eventstore.postgresql;

/**
 * The Postgresql column type used for the JSON columns (event payload, event meta data and snapshot state)
 */
public enum JSONColumnType {
    JSON,
    JSONB
}
