package com.logicleaf.dealmatch.service;

import com.logicleaf.dealmatch.dto.ActivityDTO;
import com.logicleaf.dealmatch.dto.BuyerStatusEntryDTO;
import com.logicleaf.dealmatch.dto.ConsistencyWarning;
import com.logicleaf.dealmatch.dto.DailyActivityDTO;
import com.logicleaf.dealmatch.dto.DetailedActivityDTO;
import com.logicleaf.dealmatch.dto.EngagementDashboardDTO;
import com.logicleaf.dealmatch.dto.EngagementStatDTO;
import com.logicleaf.dealmatch.dto.InterestedBuyerDTO;
import com.logicleaf.dealmatch.dto.ListingStatisticsDTO;
import com.logicleaf.dealmatch.dto.StatusSummaryDTO;
import com.logicleaf.dealmatch.dto.TopListingDTO;
import com.logicleaf.dealmatch.model.BuyerCriteriaProfile;
import com.logicleaf.dealmatch.model.EngagementStatus;
import com.logicleaf.dealmatch.model.InteractionRecord;
import com.logicleaf.dealmatch.model.InteractionType;
import com.logicleaf.dealmatch.model.InvitationStatus;
import com.logicleaf.dealmatch.model.Listing;
import com.logicleaf.dealmatch.model.ListingStatus;
import com.logicleaf.dealmatch.repository.InteractionRecordRepository;
import com.logicleaf.dealmatch.store.CriteriaStore;
import com.logicleaf.dealmatch.store.ListingStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read-side aggregations over listings and the interaction ledger for seller dashboards.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReportingService {

    static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);

    private static final int RECENT_INTERACTIONS = 5;

    private final ListingStore listingStore;
    private final InteractionRecordRepository interactionRecordRepository;
    private final CriteriaStore criteriaStore;
    private final ConsistencyChecker consistencyChecker;
    private final Clock clock;

    @Value("${marketplace.reporting.dashboard-window-days:30}")
    private int dashboardWindowDays;

    @Value("${marketplace.reporting.top-listings:5}")
    private int topListings;

    /**
     * Buyers of a listing split into active, pending and rejected. The invitation map decides
     * for every buyer it contains; buyers only known from the ledger are placed by their latest
     * interaction. Inconsistencies are reported on the result instead of failing the call.
     */
    public StatusSummaryDTO statusSummary(String listingId) {
        Listing listing = listingStore.getById(listingId);
        List<ConsistencyWarning> warnings = consistencyChecker.check(listing);
        boolean degraded = !warnings.isEmpty();

        Map<String, List<InteractionRecord>> historyByBuyer = byBuyer(
                interactionRecordRepository.findByListingIdOrderByTimestampDesc(listingId));

        Map<String, EngagementStatus> statuses = new LinkedHashMap<>();
        Set<String> ledgerOnly = new LinkedHashSet<>();
        listing.getInvitationStatus().forEach((buyerId, invitation) -> {
            EngagementStatus status = fromInvitation(invitation);
            if (status != null) {
                statuses.put(buyerId, status);
            }
        });
        historyByBuyer.forEach((buyerId, records) -> {
            if (!listing.getInvitationStatus().containsKey(buyerId)) {
                statuses.put(buyerId, records.get(0).getInteractionType().toEngagementStatus());
                ledgerOnly.add(buyerId);
            }
        });

        Map<String, BuyerCriteriaProfile> profiles;
        try {
            profiles = criteriaStore.findProfiles(statuses.keySet());
        } catch (DataAccessException e) {
            log.warn("Buyer profiles unavailable for listing {} status summary", listingId, e);
            profiles = Map.of();
            degraded = true;
        }

        List<BuyerStatusEntryDTO> active = new ArrayList<>();
        List<BuyerStatusEntryDTO> pending = new ArrayList<>();
        List<BuyerStatusEntryDTO> rejected = new ArrayList<>();
        for (Map.Entry<String, EngagementStatus> entry : statuses.entrySet()) {
            String buyerId = entry.getKey();
            BuyerStatusEntryDTO dto = statusEntry(buyerId, profiles.get(buyerId),
                    historyByBuyer.getOrDefault(buyerId, List.of()), ledgerOnly.contains(buyerId));
            switch (entry.getValue()) {
                case ACCEPTED, COMPLETED -> active.add(dto);
                case PENDING -> pending.add(dto);
                case REJECTED -> rejected.add(dto);
            }
        }

        return StatusSummaryDTO.builder()
                .listing(listing)
                .active(active)
                .pending(pending)
                .rejected(rejected)
                .totalTargeted(statuses.size())
                .totalActive(active.size())
                .totalPending(pending.size())
                .totalRejected(rejected.size())
                .consistencyWarnings(warnings)
                .degraded(degraded)
                .build();
    }

    public EngagementDashboardDTO engagementDashboard(String sellerId) {
        List<Listing> listings = listingStore.findBySellerId(sellerId);
        Map<String, Listing> listingsById = listings.stream()
                .collect(Collectors.toMap(Listing::getId, Function.identity()));
        ListingStatisticsDTO overview = statistics(sellerId, listings);
        if (listingsById.isEmpty()) {
            return EngagementDashboardDTO.builder()
                    .overview(overview)
                    .engagementStats(List.of())
                    .recentActivity(List.of())
                    .topListings(List.of())
                    .build();
        }

        List<InteractionRecord> records = interactionRecordRepository.findByListingIdIn(listingsById.keySet());

        List<EngagementStatDTO> stats = new ArrayList<>();
        Map<InteractionType, List<InteractionRecord>> byType = records.stream()
                .collect(Collectors.groupingBy(InteractionRecord::getInteractionType));
        byType.forEach((type, typed) -> stats.add(EngagementStatDTO.builder()
                .interactionType(type)
                .count(typed.size())
                .uniqueBuyers(distinctBuyers(typed))
                .build()));
        stats.sort(Comparator.comparing(EngagementStatDTO::getInteractionType));

        Instant since = clock.instant().truncatedTo(ChronoUnit.DAYS).minus(dashboardWindowDays, ChronoUnit.DAYS);
        List<InteractionRecord> recent = interactionRecordRepository
                .findByListingIdInAndTimestampGreaterThanEqual(listingsById.keySet(), since);

        return EngagementDashboardDTO.builder()
                .overview(overview)
                .engagementStats(stats)
                .recentActivity(dailySeries(recent))
                .topListings(topListings(records, listingsById))
                .totalActivations(countOf(records, InteractionType.INTEREST))
                .totalRejections(countOf(records, InteractionType.REJECTED))
                .totalViews(countOf(records, InteractionType.VIEW))
                .uniqueEngagedBuyers(distinctBuyers(records))
                .build();
    }

    public DetailedActivityDTO detailedActivity(String listingId) {
        Listing listing = listingStore.getById(listingId);
        List<InteractionRecord> records = interactionRecordRepository.findByListingIdOrderByTimestampDesc(listingId);
        Map<String, BuyerCriteriaProfile> profiles = criteriaStore.findProfiles(buyerIds(records));

        List<ActivityDTO> activities = records.stream().map(record -> {
            BuyerCriteriaProfile profile = record.getBuyerId() != null ? profiles.get(record.getBuyerId()) : null;
            return ActivityDTO.builder()
                    .recordId(record.getId())
                    .buyerId(record.getBuyerId())
                    .buyerName(profile != null ? profile.getBuyerName() : null)
                    .buyerEmail(profile != null ? profile.getBuyerEmail() : null)
                    .buyerCompany(profile != null ? profile.getCompanyName() : null)
                    .companyType(profile != null ? profile.getCompanyType() : null)
                    .interactionType(record.getInteractionType())
                    .timestamp(record.getTimestamp())
                    .notes(record.getNotes())
                    .metadata(record.getMetadata())
                    .actionDescription(record.getInteractionType().actionDescription())
                    .build();
        }).toList();

        return DetailedActivityDTO.builder()
                .listing(listing)
                .activities(activities)
                .totalActivated(countOf(records, InteractionType.INTEREST))
                .totalRejected(countOf(records, InteractionType.REJECTED))
                .totalPending(countOf(records, InteractionType.VIEW))
                .uniqueBuyers(distinctBuyers(records))
                .build();
    }

    /**
     * Currently interested buyers with their latest interactions, most recently engaged first.
     */
    public List<InterestedBuyerDTO> interestedBuyerDetails(String listingId) {
        Listing listing = listingStore.getById(listingId);
        if (listing.getInterestedBuyers().isEmpty()) {
            return List.of();
        }
        Map<String, BuyerCriteriaProfile> profiles = criteriaStore.findProfiles(listing.getInterestedBuyers());

        List<InterestedBuyerDTO> buyers = new ArrayList<>();
        for (String buyerId : listing.getInterestedBuyers()) {
            List<InteractionRecord> history = interactionRecordRepository
                    .findByListingIdAndBuyerIdOrderByTimestampDesc(listingId, buyerId);
            List<InteractionRecord> latest = history.stream().limit(RECENT_INTERACTIONS).toList();
            BuyerCriteriaProfile profile = profiles.get(buyerId);
            buyers.add(InterestedBuyerDTO.builder()
                    .buyerId(buyerId)
                    .buyerName(profile != null ? profile.getBuyerName() : null)
                    .buyerEmail(profile != null ? profile.getBuyerEmail() : null)
                    .companyName(profile != null ? profile.getCompanyName() : null)
                    .companyType(profile != null ? profile.getCompanyType() : null)
                    .lastInteraction(latest.isEmpty() ? null : latest.get(0).getTimestamp())
                    .totalInteractions(history.size())
                    .recentInteractions(latest)
                    .build());
        }
        buyers.sort(Comparator.comparing(InterestedBuyerDTO::getLastInteraction,
                Comparator.nullsLast(Comparator.<Instant>naturalOrder().reversed())));
        return buyers;
    }

    public ListingStatisticsDTO listingStatistics(String sellerId) {
        return statistics(sellerId, listingStore.findBySellerId(sellerId));
    }

    private static ListingStatisticsDTO statistics(String sellerId, List<Listing> listings) {
        return ListingStatisticsDTO.builder()
                .sellerId(sellerId)
                .totalDeals(listings.size())
                .draftDeals(listings.stream().filter(l -> l.getStatus() == ListingStatus.DRAFT).count())
                .activeDeals(listings.stream().filter(l -> l.getStatus() == ListingStatus.ACTIVE).count())
                .completedDeals(listings.stream().filter(l -> l.getStatus() == ListingStatus.COMPLETED).count())
                .totalInterested(listings.stream().mapToLong(l -> l.getInterestedBuyers().size()).sum())
                .build();
    }

    private static List<DailyActivityDTO> dailySeries(List<InteractionRecord> records) {
        Map<String, DailyActivityDTO> days = new TreeMap<>();
        for (InteractionRecord record : records) {
            DailyActivityDTO day = days.computeIfAbsent(DAY.format(record.getTimestamp()),
                    date -> DailyActivityDTO.builder().date(date).build());
            switch (record.getInteractionType()) {
                case INTEREST -> day.setActivations(day.getActivations() + 1);
                case REJECTED -> day.setRejections(day.getRejections() + 1);
                case VIEW -> day.setViews(day.getViews() + 1);
                default -> {
                }
            }
        }
        return new ArrayList<>(days.values());
    }

    private List<TopListingDTO> topListings(List<InteractionRecord> records, Map<String, Listing> listingsById) {
        return records.stream()
                .collect(Collectors.groupingBy(InteractionRecord::getListingId))
                .entrySet().stream()
                .map(entry -> {
                    List<InteractionRecord> perListing = entry.getValue();
                    long activations = countOf(perListing, InteractionType.INTEREST);
                    Listing listing = listingsById.get(entry.getKey());
                    return TopListingDTO.builder()
                            .listingId(entry.getKey())
                            .listingTitle(listing != null ? listing.getTitle() : null)
                            .totalInteractions(perListing.size())
                            .activations(activations)
                            .uniqueBuyers(distinctBuyers(perListing))
                            .engagementRate(activations * 100.0 / perListing.size())
                            .build();
                })
                .sorted(Comparator.comparingDouble(TopListingDTO::getEngagementRate).reversed()
                        .thenComparing(TopListingDTO::getListingId))
                .limit(topListings)
                .toList();
    }

    private static BuyerStatusEntryDTO statusEntry(String buyerId, BuyerCriteriaProfile profile,
            List<InteractionRecord> history, boolean ledgerOnly) {
        return BuyerStatusEntryDTO.builder()
                .buyerId(buyerId)
                .buyerName(profile != null ? profile.getBuyerName() : "Unknown")
                .buyerEmail(profile != null ? profile.getBuyerEmail() : null)
                .buyerCompany(profile != null ? profile.getCompanyName() : null)
                .companyType(profile != null ? profile.getCompanyType() : null)
                .ledgerOnly(ledgerOnly)
                .lastInteraction(history.isEmpty() ? null : history.get(0).getTimestamp())
                .totalInteractions(history.size())
                .interactions(history.stream().limit(RECENT_INTERACTIONS).toList())
                .build();
    }

    private static EngagementStatus fromInvitation(InvitationStatus invitation) {
        if (invitation == null || invitation.getResponse() == null) {
            return null;
        }
        return switch (invitation.getResponse()) {
            case ACCEPTED -> EngagementStatus.ACCEPTED;
            case PENDING, REQUESTED -> EngagementStatus.PENDING;
            case REJECTED -> EngagementStatus.REJECTED;
        };
    }

    // keeps newest-first order within each buyer
    private static Map<String, List<InteractionRecord>> byBuyer(List<InteractionRecord> records) {
        return records.stream()
                .filter(r -> r.getBuyerId() != null)
                .collect(Collectors.groupingBy(InteractionRecord::getBuyerId, LinkedHashMap::new,
                        Collectors.toList()));
    }

    private static Set<String> buyerIds(Collection<InteractionRecord> records) {
        return records.stream()
                .map(InteractionRecord::getBuyerId)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
    }

    private static long distinctBuyers(Collection<InteractionRecord> records) {
        return buyerIds(records).size();
    }

    private static long countOf(Collection<InteractionRecord> records, InteractionType type) {
        return records.stream().filter(r -> r.getInteractionType() == type).count();
    }
}
