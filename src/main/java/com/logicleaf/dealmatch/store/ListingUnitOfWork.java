package com.logicleaf.dealmatch.store;

import java.util.function.Supplier;

/**
 * Runs one logical listing transition (listing write plus ledger append) as a single atomic
 * unit.
 */
public interface ListingUnitOfWork {

    <T> T execute(Supplier<T> work);
}
