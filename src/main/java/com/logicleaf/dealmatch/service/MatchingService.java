package com.logicleaf.dealmatch.service;

import com.logicleaf.dealmatch.dto.MatchResult;
import com.logicleaf.dealmatch.model.BuyerCriteriaProfile;
import com.logicleaf.dealmatch.model.Listing;
import com.logicleaf.dealmatch.store.CriteriaStore;
import com.logicleaf.dealmatch.store.ListingStore;
import com.logicleaf.dealmatch.store.ProfileFilter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

@Slf4j
@Service
@RequiredArgsConstructor
public class MatchingService {

    public static final int MIN_MATCH_PERCENTAGE = 35;

    static final Comparator<MatchResult> RANKING = Comparator
            .comparingInt(MatchResult::getMatchPercentage).reversed()
            .thenComparing(MatchResult::getBuyerId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final ListingStore listingStore;
    private final CriteriaStore criteriaStore;
    private final BuyerMatchScorer scorer;
    private final GeographyHierarchy geographyHierarchy;

    /**
     * Buyers whose criteria fit the listing, best match first.
     */
    public List<MatchResult> findMatchingBuyers(String listingId) {
        Listing listing = listingStore.getById(listingId);
        Set<String> geographies = geographyHierarchy.expand(listing.getGeographySelection());

        ProfileFilter filter = ProfileFilter.builder()
                .countries(geographies)
                .industrySector(listing.getIndustrySector())
                .build();

        List<MatchResult> matches;
        try (Stream<BuyerCriteriaProfile> candidates = criteriaStore.streamCandidates(filter)) {
            matches = rank(listing, candidates, geographies);
        }
        log.info("Listing {} matched {} buyers at or above {}%", listingId, matches.size(), MIN_MATCH_PERCENTAGE);
        return matches;
    }

    public MatchResult scoreBuyer(String listingId, String buyerId) {
        Listing listing = listingStore.getById(listingId);
        return scorer.score(listing, criteriaStore.getProfile(buyerId));
    }

    public MatchResult score(Listing listing, BuyerCriteriaProfile profile) {
        return scorer.score(listing, profile);
    }

    public List<MatchResult> rank(Listing listing, Collection<BuyerCriteriaProfile> candidates) {
        return rank(listing, candidates.stream(), geographyHierarchy.expand(listing.getGeographySelection()));
    }

    private List<MatchResult> rank(Listing listing, Stream<BuyerCriteriaProfile> candidates, Set<String> geographies) {
        return candidates
                .map(profile -> scorer.score(listing, profile, geographies))
                .filter(MatchResult::isEligible)
                .filter(result -> result.getMatchPercentage() >= MIN_MATCH_PERCENTAGE)
                .sorted(RANKING)
                .toList();
    }
}
