package com.logicleaf.dealmatch.support;

import com.logicleaf.dealmatch.model.BuyerCriteriaProfile;
import com.logicleaf.dealmatch.model.BuyerPreferences;
import com.logicleaf.dealmatch.model.Listing;
import com.logicleaf.dealmatch.model.ListingStatus;
import com.logicleaf.dealmatch.model.RewardLevel;
import com.logicleaf.dealmatch.model.TargetCriteria;
import com.logicleaf.dealmatch.model.Timeline;

import java.time.Instant;
import java.util.List;

public final class Fixtures {

    public static final Instant NOW = Instant.parse("2024-05-20T10:15:30Z");
    public static final String SELLER = "seller-1";

    private Fixtures() {
    }

    public static Listing activeListing(String id) {
        return Listing.builder()
                .id(id)
                .version(0L)
                .sellerId(SELLER)
                .title("Listing " + id)
                .status(ListingStatus.ACTIVE)
                .rewardLevel(RewardLevel.BLOOM)
                .isPublic(true)
                .industrySector("SaaS")
                .geographySelection("France")
                .timeline(Timeline.builder().createdAt(NOW.minusSeconds(3600)).updatedAt(NOW.minusSeconds(3600))
                        .publishedAt(NOW.minusSeconds(3600)).build())
                .build();
    }

    public static BuyerCriteriaProfile profile(String buyerId, List<String> countries, List<String> sectors) {
        return BuyerCriteriaProfile.builder()
                .id("profile-" + buyerId)
                .buyerId(buyerId)
                .buyerName("Buyer " + buyerId)
                .buyerEmail(buyerId + "@example.com")
                .companyName("Company " + buyerId)
                .companyType("Private Equity")
                .targetCriteria(TargetCriteria.builder().countries(countries).industrySectors(sectors).build())
                .preferences(BuyerPreferences.builder().build())
                .build();
    }
}
