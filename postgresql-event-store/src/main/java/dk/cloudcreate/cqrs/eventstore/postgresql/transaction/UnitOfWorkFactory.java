package dk.cloudcreate.cqrs.eventstore.postgresql.transaction;

import dk.cloudcreate.essentials.shared.functional.*;
import org.slf4j.*;

import java.util.Optional;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Creates and tracks the {@link UnitOfWork} associated with the calling thread.<br>
 * {@link #usingUnitOfWork(CheckedConsumer)} and {@link #withUnitOfWork(CheckedFunction)} join an already active
 * {@link UnitOfWork}, otherwise they create one and commit it (or roll it back on failure) when the callback returns.
 *
 * @param <UOW> the type of {@link UnitOfWork}
 */
public interface UnitOfWorkFactory<UOW extends UnitOfWork> {
    Logger unitOfWorkLog = LoggerFactory.getLogger(UnitOfWorkFactory.class);

    /**
     * @return the active {@link UnitOfWork}
     * @throws UnitOfWorkException if no {@link UnitOfWork} is active
     */
    UOW getRequiredUnitOfWork();

    /**
     * @return the active {@link UnitOfWork} or a newly started one
     */
    UOW getOrCreateNewUnitOfWork();

    Optional<UOW> getCurrentUnitOfWork();

    /**
     * Run <code>unitOfWorkConsumer</code> inside a {@link UnitOfWork}.<br>
     * {@link RuntimeException}s thrown by the consumer are rethrown as is (after the rollback), checked exceptions
     * are wrapped in a {@link UnitOfWorkException}
     */
    default void usingUnitOfWork(CheckedConsumer<UOW> unitOfWorkConsumer) {
        requireNonNull(unitOfWorkConsumer, "No unitOfWorkConsumer provided");
        withUnitOfWork(unitOfWork -> {
            unitOfWorkConsumer.accept(unitOfWork);
            return null;
        });
    }

    /**
     * Run <code>unitOfWorkFunction</code> inside a {@link UnitOfWork} and return its result.<br>
     * {@link RuntimeException}s thrown by the function are rethrown as is (after the rollback), checked exceptions
     * are wrapped in a {@link UnitOfWorkException}
     */
    default <R> R withUnitOfWork(CheckedFunction<UOW, R> unitOfWorkFunction) {
        requireNonNull(unitOfWorkFunction, "No unitOfWorkFunction provided");
        var existingUnitOfWork = getCurrentUnitOfWork();
        var unitOfWork = existingUnitOfWork.orElseGet(() -> {
            unitOfWorkLog.trace("Creating a new UnitOfWork as there wasn't an existing UnitOfWork");
            return getOrCreateNewUnitOfWork();
        });
        try {
            var result = unitOfWorkFunction.apply(unitOfWork);
            if (existingUnitOfWork.isEmpty()) {
                unitOfWorkLog.trace("Committing the UnitOfWork created by this withUnitOfWork call");
                unitOfWork.commit();
            } else {
                unitOfWorkLog.trace("NestedUnitOfWork: Won't commit the UnitOfWork as it wasn't created by this withUnitOfWork call");
            }
            return result;
        } catch (Exception e) {
            if (existingUnitOfWork.isEmpty()) {
                unitOfWorkLog.debug("Rolling back the UnitOfWork created by this withUnitOfWork call");
                if (!unitOfWork.status().isCompleted()) {
                    unitOfWork.rollback(e);
                }
            } else {
                unitOfWorkLog.debug("NestedUnitOfWork: Marking UnitOfWork as rollback only as it wasn't created by this withUnitOfWork call");
                unitOfWork.markAsRollbackOnly(e);
            }
            if (e instanceof RuntimeException) {
                throw (RuntimeException) e;
            }
            throw new UnitOfWorkException(e);
        }
    }
}
