package com.logicleaf.dealmatch.store;

import com.logicleaf.dealmatch.exception.ResourceNotFoundException;
import com.logicleaf.dealmatch.model.Listing;
import com.logicleaf.dealmatch.repository.ListingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class MongoListingStore implements ListingStore {

    private final ListingRepository listingRepository;

    @Override
    public Optional<Listing> findById(String listingId) {
        return listingRepository.findById(listingId);
    }

    @Override
    public Listing getById(String listingId) {
        return listingRepository.findById(listingId)
                .orElseThrow(() -> new ResourceNotFoundException("Listing with ID \"" + listingId + "\" not found"));
    }

    @Override
    public List<Listing> findBySellerId(String sellerId) {
        return listingRepository.findBySellerId(sellerId);
    }

    @Override
    public List<Listing> findByTargetedBuyer(String buyerId) {
        return listingRepository.findByTargetedBuyersContainingOrderByTimelineUpdatedAtDesc(buyerId);
    }

    @Override
    public Listing save(Listing listing) {
        return listingRepository.save(listing);
    }

    @Override
    public <T> T compareAndSwap(String listingId, ListingMutation<T> mutation) {
        Listing listing = getById(listingId);
        Long readVersion = listing.getVersion();

        ListingMutation.Outcome<T> outcome = mutation.apply(listing);
        if (outcome.changed()) {
            // @Version turns a stale write into OptimisticLockingFailureException
            listingRepository.save(listing);
            log.debug("Listing {} written over version {}", listingId, readVersion);
        }
        return outcome.value();
    }
}
