package dk.cloudcreate.cqrs.eventstore.postgresql.transaction;

/**
 * The life cycle states of a {@link UnitOfWork}
 */
public enum UnitOfWorkStatus {
    /**
     * Created, but the underlying database transaction hasn't begun yet
     */
    Ready(false),
    /**
     * The underlying database transaction has begun
     */
    Started(false),
    Committed(true),
    RolledBack(true),
    /**
     * The {@link UnitOfWork} can only be completed by rolling it back
     */
    MarkedForRollbackOnly(false);

    public final boolean isCompleted;

    UnitOfWorkStatus(boolean isCompleted) {
        this.isCompleted = isCompleted;
    }

    public boolean isCompleted() {
        return isCompleted;
    }
}
