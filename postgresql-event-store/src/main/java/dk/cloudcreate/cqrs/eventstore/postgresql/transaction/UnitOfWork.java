package dk.cloudcreate.cqrs.eventstore.postgresql.transaction;

import org.jdbi.v3.core.Handle;

/**
 * A single database transaction, exposed through its Jdbi {@link Handle}.<br>
 * All rows written through the {@link #handle()} become visible together when the {@link UnitOfWork} is committed,
 * or not at all if it's rolled back
 */
public interface UnitOfWork {
    /**
     * Start the {@link UnitOfWork} and begin the underlying transaction
     */
    void start();

    /**
     * Commit the underlying transaction - see {@link UnitOfWorkStatus#Committed}.<br>
     * If the {@link UnitOfWork} has been marked as rollback only, it's rolled back instead
     */
    void commit();

    /**
     * Roll back the underlying transaction - see {@link UnitOfWorkStatus#RolledBack}
     *
     * @param cause the cause of the rollback (may be null)
     */
    void rollback(Exception cause);

    default void rollback() {
        rollback(getCauseOfRollback());
    }

    UnitOfWorkStatus status();

    /**
     * @return the Jdbi handle bound to the underlying transaction
     * @throws UnitOfWorkException if the {@link UnitOfWork} isn't active
     */
    Handle handle();

    /**
     * The cause of a rollback or a {@link #markAsRollbackOnly(Exception)}
     */
    Exception getCauseOfRollback();

    void markAsRollbackOnly(Exception cause);

    default void markAsRollbackOnly() {
        markAsRollbackOnly(null);
    }
}
