package com.logicleaf.dealmatch.service;

import com.logicleaf.dealmatch.exception.BadRequestException;
import com.logicleaf.dealmatch.model.BuyerBucket;
import com.logicleaf.dealmatch.model.InvitationResponse;
import com.logicleaf.dealmatch.model.InvitationStatus;
import com.logicleaf.dealmatch.model.Listing;
import com.logicleaf.dealmatch.model.ListingStatus;
import com.logicleaf.dealmatch.store.ListingStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * What a buyer sees: their deals split into active, pending, rejected and completed tabs.
 */
@Service
@RequiredArgsConstructor
public class BuyerDealViewService {

    static final Comparator<Listing> MOST_RECENTLY_UPDATED = Comparator.comparing(Listing::updatedAt,
            Comparator.nullsLast(Comparator.<Instant>naturalOrder().reversed()));

    private final ListingStore listingStore;

    /**
     * The single tab this listing belongs to for the buyer, or empty when the buyer should not
     * see it at all (never targeted, or a completed deal they were not active on).
     */
    public Optional<BuyerBucket> bucketFor(Listing listing, String buyerId) {
        boolean interested = listing.isInterested(buyerId);
        if (listing.getStatus() == ListingStatus.COMPLETED) {
            return interested ? Optional.of(BuyerBucket.COMPLETED) : Optional.empty();
        }
        if (interested) {
            return Optional.of(BuyerBucket.ACTIVE);
        }
        if (!listing.isTargeted(buyerId)) {
            return Optional.empty();
        }
        InvitationResponse response = listing.invitationFor(buyerId)
                .map(InvitationStatus::getResponse)
                .orElse(null);
        return Optional.of(response == InvitationResponse.REJECTED ? BuyerBucket.REJECTED : BuyerBucket.PENDING);
    }

    public List<Listing> listingsForBuyer(String buyerId, BuyerBucket bucket) {
        if (bucket == null) {
            throw new BadRequestException("A bucket of active, pending, rejected or completed is required");
        }
        return listingStore.findByTargetedBuyer(buyerId).stream()
                .filter(listing -> bucketFor(listing, buyerId).filter(bucket::equals).isPresent())
                .sorted(MOST_RECENTLY_UPDATED)
                .toList();
    }

    public Map<BuyerBucket, Long> countsForBuyer(String buyerId) {
        Map<BuyerBucket, Long> counts = new EnumMap<>(BuyerBucket.class);
        for (BuyerBucket bucket : BuyerBucket.values()) {
            counts.put(bucket, 0L);
        }
        for (Listing listing : listingStore.findByTargetedBuyer(buyerId)) {
            bucketFor(listing, buyerId).ifPresent(bucket -> counts.merge(bucket, 1L, Long::sum));
        }
        return counts;
    }
}
