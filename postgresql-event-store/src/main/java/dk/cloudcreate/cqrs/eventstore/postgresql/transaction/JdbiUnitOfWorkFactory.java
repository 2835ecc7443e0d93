package dk.cloudcreate.cqrs.eventstore.postgresql.transaction;

import org.jdbi.v3.core.*;
import org.slf4j.*;

import java.util.Optional;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * {@link UnitOfWorkFactory} that manages the database transaction itself using a Jdbi {@link Handle} per {@link UnitOfWork}.<br>
 * The active {@link UnitOfWork} is bound to the thread that created it.
 */
public class JdbiUnitOfWorkFactory implements UnitOfWorkFactory<JdbiUnitOfWorkFactory.JdbiUnitOfWork> {
    private static final Logger log = LoggerFactory.getLogger(JdbiUnitOfWorkFactory.class);

    private final Jdbi                        jdbi;
    private final ThreadLocal<JdbiUnitOfWork> unitOfWorks = new ThreadLocal<>();

    public JdbiUnitOfWorkFactory(Jdbi jdbi) {
        this.jdbi = requireNonNull(jdbi, "No jdbi instance provided");
    }

    public Jdbi getJdbi() {
        return jdbi;
    }

    @Override
    public JdbiUnitOfWork getRequiredUnitOfWork() {
        return getCurrentUnitOfWork().orElseThrow(() -> new UnitOfWorkException("No active UnitOfWork"));
    }

    @Override
    public JdbiUnitOfWork getOrCreateNewUnitOfWork() {
        var unitOfWork = unitOfWorks.get();
        if (unitOfWork == null) {
            unitOfWork = new JdbiUnitOfWork(this);
            unitOfWork.start();
            unitOfWorks.set(unitOfWork);
        }
        return unitOfWork;
    }

    @Override
    public Optional<JdbiUnitOfWork> getCurrentUnitOfWork() {
        return Optional.ofNullable(unitOfWorks.get());
    }

    private void removeUnitOfWork() {
        unitOfWorks.remove();
    }

    public static class JdbiUnitOfWork implements UnitOfWork {
        private final JdbiUnitOfWorkFactory unitOfWorkFactory;
        private       UnitOfWorkStatus      status;
        private       Exception             causeOfRollback;
        private       Handle                handle;

        private JdbiUnitOfWork(JdbiUnitOfWorkFactory unitOfWorkFactory) {
            this.unitOfWorkFactory = requireNonNull(unitOfWorkFactory, "No unitOfWorkFactory provided");
            this.status = UnitOfWorkStatus.Ready;
        }

        @Override
        public void start() {
            if (status == UnitOfWorkStatus.Ready || status.isCompleted()) {
                log.trace("Starting UnitOfWork with initial status {}", status);
                handle = unitOfWorkFactory.jdbi.open();
                handle.begin();
                status = UnitOfWorkStatus.Started;
            } else if (status == UnitOfWorkStatus.Started) {
                log.warn("The UnitOfWork was already started");
            } else {
                close();
                throw new UnitOfWorkException(msg("Cannot start a UnitOfWork with status {}", status));
            }
        }

        @Override
        public void commit() {
            if (status == UnitOfWorkStatus.MarkedForRollbackOnly) {
                log.debug("Rolling back UnitOfWork marked for rollback only instead of committing it");
                rollback(causeOfRollback);
                return;
            }
            if (status != UnitOfWorkStatus.Started) {
                throw new UnitOfWorkException(msg("Cannot commit a UnitOfWork with status {}", status));
            }
            try {
                handle.commit();
                status = UnitOfWorkStatus.Committed;
            } catch (RuntimeException e) {
                log.debug("Failed to commit UnitOfWork", e);
                rollback(e);
                throw new UnitOfWorkException("Failed to commit UnitOfWork", e);
            } finally {
                close();
            }
        }

        @Override
        public void rollback(Exception cause) {
            if (status.isCompleted()) {
                log.trace("UnitOfWork was already completed with status {}", status);
                return;
            }
            causeOfRollback = cause;
            try {
                if (handle != null) {
                    handle.rollback();
                }
                status = UnitOfWorkStatus.RolledBack;
            } catch (RuntimeException e) {
                throw new UnitOfWorkException("Failed to roll back UnitOfWork", e);
            } finally {
                close();
            }
        }

        @Override
        public UnitOfWorkStatus status() {
            return status;
        }

        @Override
        public Handle handle() {
            if (handle == null || status.isCompleted()) {
                throw new UnitOfWorkException(msg("No active transaction. UnitOfWork status is {}", status));
            }
            return handle;
        }

        @Override
        public Exception getCauseOfRollback() {
            return causeOfRollback;
        }

        @Override
        public void markAsRollbackOnly(Exception cause) {
            status = UnitOfWorkStatus.MarkedForRollbackOnly;
            causeOfRollback = cause;
        }

        private void close() {
            unitOfWorkFactory.removeUnitOfWork();
            if (handle != null) {
                handle.close();
                handle = null;
            }
        }
    }
}
