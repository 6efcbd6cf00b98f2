package com.flagship.escrow_engine.persistence;

import com.flagship.escrow_engine.error.DeadlineExceededException;
import com.flagship.escrow_engine.error.StoreUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.function.Supplier;

/**
 * The engine's single atomic boundary.
 *
 * Every public engine operation runs its work through here: the caller's deadline
 * becomes the transaction timeout, and transient infrastructure failures are
 * translated to {@link StoreUnavailableException} so callers know a retry is safe.
 * Anything thrown from the work rolls the whole unit back.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TransactionRunner {

    private final PlatformTransactionManager transactionManager;
    private final Clock clock;

    public <T> T inTransaction(Deadline deadline, Supplier<T> work) {
        return execute(deadline, false, work);
    }

    public <T> T readOnly(Deadline deadline, Supplier<T> work) {
        return execute(deadline, true, work);
    }

    private <T> T execute(Deadline deadline, boolean readOnly, Supplier<T> work) {
        if (deadline.isExpired(clock)) {
            throw new DeadlineExceededException("Deadline passed before the call started");
        }

        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setTimeout(deadline.remainingSeconds(clock));
        template.setReadOnly(readOnly);

        try {
            return template.execute(status -> {
                T result = work.get();
                if (deadline.isExpired(clock)) {
                    // Rolls back: the caller has already given up on this call.
                    throw new DeadlineExceededException("Deadline passed before commit");
                }
                return result;
            });
        } catch (TransactionTimedOutException | QueryTimeoutException e) {
            if (deadline.isExpired(clock)) {
                throw new DeadlineExceededException("Deadline passed while waiting on the store");
            }
            throw new StoreUnavailableException("Store timed out", e);
        } catch (TransientDataAccessException
                 | DataAccessResourceFailureException
                 | RecoverableDataAccessException
                 | CannotCreateTransactionException e) {
            log.warn("Transient store failure: {}", e.getMessage());
            throw new StoreUnavailableException("Store temporarily unavailable", e);
        }
    }
}
