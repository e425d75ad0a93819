package com.logicleaf.dealmatch.service;

import com.logicleaf.dealmatch.dto.InteractionSummaryDTO;
import com.logicleaf.dealmatch.dto.RecentActionDTO;
import com.logicleaf.dealmatch.model.BuyerCriteriaProfile;
import com.logicleaf.dealmatch.model.EngagementStatus;
import com.logicleaf.dealmatch.model.InteractionRecord;
import com.logicleaf.dealmatch.model.InteractionType;
import com.logicleaf.dealmatch.model.Listing;
import com.logicleaf.dealmatch.repository.InteractionRecordRepository;
import com.logicleaf.dealmatch.store.CriteriaStore;
import com.logicleaf.dealmatch.store.ListingStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Append-only log of what buyers (and sellers closing a deal) did on each listing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InteractionLedgerService {

    static final Set<InteractionType> BUYER_ACTIONS =
            Set.of(InteractionType.INTEREST, InteractionType.REJECTED, InteractionType.VIEW);

    private final InteractionRecordRepository interactionRecordRepository;
    private final ListingStore listingStore;
    private final CriteriaStore criteriaStore;

    @Value("${marketplace.ledger.recent-actions-limit:20}")
    private int defaultRecentLimit;

    public InteractionRecord append(String listingId, String buyerId, InteractionType type, String notes,
            Map<String, String> metadata, Instant timestamp) {
        InteractionRecord record = InteractionRecord.builder()
                .listingId(listingId)
                .buyerId(buyerId)
                .interactionType(type)
                .timestamp(timestamp)
                .notes(notes)
                .metadata(metadata != null ? new LinkedHashMap<>(metadata) : Map.of())
                .build();
        InteractionRecord saved = interactionRecordRepository.insert(record);
        log.debug("Ledger {} appended for listing {} buyer {}", type, listingId, buyerId);
        return saved;
    }

    public List<InteractionRecord> historyForListing(String listingId) {
        return interactionRecordRepository.findByListingIdOrderByTimestampDesc(listingId);
    }

    public List<InteractionRecord> historyForBuyer(String listingId, String buyerId) {
        return interactionRecordRepository.findByListingIdAndBuyerIdOrderByTimestampDesc(listingId, buyerId);
    }

    /**
     * Status implied by the buyer's latest ledger record. Used for buyers that interacted with a
     * listing before they were ever written into its invitation map.
     */
    public Optional<EngagementStatus> currentStatusFromLedger(String listingId, String buyerId) {
        return interactionRecordRepository.findFirstByListingIdAndBuyerIdOrderByTimestampDesc(listingId, buyerId)
                .map(record -> record.getInteractionType().toEngagementStatus());
    }

    public List<RecentActionDTO> recentForSeller(String sellerId) {
        return recentForSeller(sellerId, defaultRecentLimit);
    }

    /**
     * Latest buyer actions across all of the seller's listings, newest first.
     */
    public List<RecentActionDTO> recentForSeller(String sellerId, int limit) {
        Map<String, Listing> listings = listingStore.findBySellerId(sellerId).stream()
                .collect(Collectors.toMap(Listing::getId, Function.identity()));
        if (listings.isEmpty() || limit <= 0) {
            return List.of();
        }

        List<InteractionRecord> records = interactionRecordRepository
                .findByListingIdInAndInteractionTypeInOrderByTimestampDesc(listings.keySet(), BUYER_ACTIONS,
                        PageRequest.of(0, limit));

        Set<String> buyerIds = records.stream()
                .map(InteractionRecord::getBuyerId)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        Map<String, BuyerCriteriaProfile> profiles = criteriaStore.findProfiles(buyerIds);

        return records.stream().map(record -> {
            Listing listing = listings.get(record.getListingId());
            BuyerCriteriaProfile profile = record.getBuyerId() != null ? profiles.get(record.getBuyerId()) : null;
            return RecentActionDTO.builder()
                    .recordId(record.getId())
                    .listingId(record.getListingId())
                    .listingTitle(listing != null ? listing.getTitle() : null)
                    .buyerId(record.getBuyerId())
                    .buyerName(profile != null ? profile.getBuyerName() : null)
                    .buyerCompany(profile != null ? profile.getCompanyName() : null)
                    .interactionType(record.getInteractionType())
                    .timestamp(record.getTimestamp())
                    .notes(record.getNotes())
                    .actionDescription(record.getInteractionType().actionDescription())
                    .actionColor(actionColor(record.getInteractionType()))
                    .build();
        }).toList();
    }

    public InteractionSummaryDTO summaryForListing(String listingId) {
        List<InteractionRecord> records = historyForListing(listingId);

        Map<InteractionType, Long> counts = new EnumMap<>(InteractionType.class);
        Map<InteractionType, Long> uniqueByType = new EnumMap<>(InteractionType.class);
        for (InteractionType type : InteractionType.values()) {
            counts.put(type, records.stream().filter(r -> r.getInteractionType() == type).count());
            uniqueByType.put(type, records.stream()
                    .filter(r -> r.getInteractionType() == type)
                    .map(InteractionRecord::getBuyerId)
                    .filter(Objects::nonNull)
                    .distinct()
                    .count());
        }

        long uniqueBuyers = records.stream()
                .map(InteractionRecord::getBuyerId)
                .filter(Objects::nonNull)
                .distinct()
                .count();

        return InteractionSummaryDTO.builder()
                .listingId(listingId)
                .totalInteractions(records.size())
                .uniqueBuyers(uniqueBuyers)
                .countsByType(counts)
                .uniqueBuyersByType(uniqueByType)
                .build();
    }

    private static String actionColor(InteractionType type) {
        return switch (type) {
            case INTEREST -> "green";
            case REJECTED -> "red";
            case VIEW -> "yellow";
            default -> "gray";
        };
    }
}
