package com.logicleaf.dealmatch.store;

import com.mongodb.MongoException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * Wraps the work in a MongoDB transaction and retries the whole transaction when a concurrent
 * writer got there first, either by bumping the listing version or by a server-side write
 * conflict labelled {@code TransientTransactionError}. Gives up after the configured number of
 * attempts and rethrows the last conflict.
 */
@Slf4j
@Component
public class MongoListingUnitOfWork implements ListingUnitOfWork {

    private final TransactionTemplate transactionTemplate;
    private final int maxAttempts;

    public MongoListingUnitOfWork(PlatformTransactionManager transactionManager,
            @Value("${marketplace.listing.cas-max-attempts:3}") int maxAttempts) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    @Override
    public <T> T execute(Supplier<T> work) {
        for (int attempt = 1; ; attempt++) {
            try {
                return transactionTemplate.execute(status -> work.get());
            } catch (DataAccessException e) {
                if (!isConflict(e) || attempt >= maxAttempts) {
                    throw e;
                }
                log.warn("Concurrent listing update detected (attempt {}/{}): {}", attempt, maxAttempts,
                        e.getMessage());
            }
        }
    }

    static boolean isConflict(DataAccessException e) {
        if (e instanceof OptimisticLockingFailureException) {
            return true;
        }
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof MongoException
                    && ((MongoException) cause).hasErrorLabel(MongoException.TRANSIENT_TRANSACTION_ERROR_LABEL)) {
                return true;
            }
        }
        return false;
    }
}
