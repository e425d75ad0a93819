package com.logicleaf.dealmatch.store;

import com.logicleaf.dealmatch.model.Listing;

import java.util.List;
import java.util.Optional;

public interface ListingStore {

    Optional<Listing> findById(String listingId);

    /**
     * @throws com.logicleaf.dealmatch.exception.ResourceNotFoundException if the listing does not exist
     */
    Listing getById(String listingId);

    List<Listing> findBySellerId(String sellerId);

    /**
     * Listings that target the buyer, most recently updated first.
     */
    List<Listing> findByTargetedBuyer(String buyerId);

    Listing save(Listing listing);

    /**
     * Loads the listing, applies the mutation and, if it reports a change, writes the listing
     * back only if nobody else wrote it in between.
     *
     * @throws org.springframework.dao.OptimisticLockingFailureException when the stored version moved on
     */
    <T> T compareAndSwap(String listingId, ListingMutation<T> mutation);
}
