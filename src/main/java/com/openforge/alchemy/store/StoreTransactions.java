package com.openforge.alchemy.store;

import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * Transaction boundary for every store operation.
 *
 * Call graph:
 *
 *   write(op, work)
 *     └─ storeWriteRetry            (re-runs the whole transaction on lock contention)
 *           └─ TransactionTemplate  (commit or roll back as one unit)
 *                 └─ work.get()
 *
 * Exceptions leaving this class are always {@link StoreException}; Spring's
 * DataAccessException hierarchy is translated here so that callers never see
 * JPA or JDBC types. When a transaction is already active the work simply
 * joins it and errors propagate untranslated to the outermost boundary, which
 * is the only place where a retry is meaningful.
 */
@Slf4j
@Component
public class StoreTransactions {

    private final TransactionTemplate template;
    private final Retry               storeWriteRetry;

    public StoreTransactions(PlatformTransactionManager transactionManager, Retry storeWriteRetry) {
        this.template        = new TransactionTemplate(transactionManager);
        this.storeWriteRetry = storeWriteRetry;
    }

    /** Runs {@code work} in its own transaction, retrying on transient lock failures. */
    public <T> T write(String operation, Supplier<T> work) {
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            return work.get();
        }
        Supplier<T> transactional = () -> template.execute(status -> work.get());
        return translate(operation, Retry.decorateSupplier(storeWriteRetry, transactional));
    }

    public void execute(String operation, Runnable work) {
        write(operation, () -> {
            work.run();
            return null;
        });
    }

    /**
     * Runs {@code work} inside a transaction so that it sees one consistent
     * snapshot. Not marked read-only: the SQLite driver refuses to flip the
     * read-only flag on an open connection.
     */
    public <T> T read(String operation, Supplier<T> work) {
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            return work.get();
        }
        return translate(operation, () -> template.execute(status -> work.get()));
    }

    /**
     * Runs {@code work} in a transaction that is always rolled back. Used for
     * dry runs: the work executes exactly as it would for real, and its
     * result describes changes that are then discarded.
     *
     * @throws IllegalStateException when called inside another transaction
     */
    public <T> T rehearse(String operation, Supplier<T> work) {
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            throw new IllegalStateException(operation + ": a dry run cannot join an active transaction");
        }
        return translate(operation, () -> template.execute(status -> {
            status.setRollbackOnly();
            return work.get();
        }));
    }

    private <T> T translate(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (StoreException e) {
            throw e;
        } catch (TransientDataAccessException
                 | DataAccessResourceFailureException
                 | CannotCreateTransactionException e) {
            log.warn("[Store] {} failed, storage unavailable: {}", operation, e.getMessage());
            throw StoreException.unavailable("%s: storage unavailable (%s)".formatted(operation, e.getMessage()), e);
        } catch (DataIntegrityViolationException e) {
            log.warn("[Store] {} violated a constraint: {}", operation, e.getMostSpecificCause().getMessage());
            throw new StoreException(StoreErrorKind.CONFLICT,
                    "%s: constraint violation (%s)".formatted(operation, e.getMostSpecificCause().getMessage()), e);
        }
    }
}
