package com.logicleaf.dealmatch.service;

import com.logicleaf.dealmatch.dto.GateFailure;
import com.logicleaf.dealmatch.dto.MatchResult;
import com.logicleaf.dealmatch.model.BusinessModel;
import com.logicleaf.dealmatch.model.BuyerCriteriaProfile;
import com.logicleaf.dealmatch.model.BuyerFit;
import com.logicleaf.dealmatch.model.BuyerPreferences;
import com.logicleaf.dealmatch.model.FinancialDetails;
import com.logicleaf.dealmatch.model.Listing;
import com.logicleaf.dealmatch.model.RewardLevel;
import com.logicleaf.dealmatch.model.TargetCriteria;
import com.logicleaf.dealmatch.support.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BuyerMatchScorerTest {

    private BuyerMatchScorer scorer;
    private Listing listing;

    @BeforeEach
    void setUp() {
        scorer = new BuyerMatchScorer(new GeographyHierarchy());
        listing = Fixtures.activeListing("deal-1");
    }

    @Test
    void zeroEbitdaFailsProfitabilityMinimumAndScoresFortyThreePercent() {
        listing.setFinancialDetails(FinancialDetails.builder().trailingEbitdaAmount(0.0).build());
        listing.setYearsInBusiness(null);
        listing.setStakePercentage(30.0);
        listing.setCompanyTypes(List.of("Strategic Acquirer"));
        listing.setBuyerFit(BuyerFit.builder()
                .capitalAvailability(List.of("Need to raise"))
                .minTransactionSize(1_000_000.0)
                .minPriorAcquisitions(3)
                .build());

        BuyerCriteriaProfile profile = Fixtures.profile("buyer-1", List.of("France"), List.of("SaaS"));
        profile.setCapitalEntity("Ready to deploy immediately");
        profile.getTargetCriteria().setEbitdaMin(0.0);
        profile.getTargetCriteria().setEbitdaMax(1_000_000.0);
        profile.getTargetCriteria().setRevenueGrowth(10.0);
        profile.getTargetCriteria().setMinYearsInBusiness(5);
        profile.getTargetCriteria().setMinStakePercent(51.0);

        MatchResult result = scorer.score(listing, profile);

        assertTrue(result.isEligible());
        assertEquals(0, result.getBreakdown().getEbitdaMatch());
        assertEquals(BuyerMatchScorer.REVENUE_WEIGHT, result.getBreakdown().getRevenueMatch());
        assertEquals(28, result.getTotalMatchScore());
        assertEquals(43, result.getMatchPercentage());
    }

    @Test
    void positiveEbitdaPassesProfitabilityMinimum() {
        listing.setFinancialDetails(FinancialDetails.builder().trailingEbitdaAmount(1.0).build());
        BuyerCriteriaProfile profile = Fixtures.profile("buyer-1", List.of("France"), List.of("SaaS"));
        profile.getTargetCriteria().setEbitdaMin(0.0);

        assertEquals(BuyerMatchScorer.EBITDA_WEIGHT, scorer.score(listing, profile).getBreakdown().getEbitdaMatch());
    }

    @Test
    void stoppedBuyerIsIneligibleEvenWhenEverythingElseMatches() {
        BuyerCriteriaProfile profile = Fixtures.profile("buyer-1", List.of("France"), List.of("SaaS"));
        profile.setPreferences(BuyerPreferences.builder().stopSendingDeals(true).build());

        MatchResult result = scorer.score(listing, profile);

        assertFalse(result.isEligible());
        assertEquals(GateFailure.STOPPED_SENDING_DEALS, result.getGateFailure());
        assertEquals(0, result.getMatchPercentage());
    }

    @Test
    void geographyMatchesThroughContinent() {
        BuyerCriteriaProfile continentBuyer = Fixtures.profile("buyer-1", List.of("Europe"), List.of("SaaS"));
        BuyerCriteriaProfile otherBuyer = Fixtures.profile("buyer-2", List.of("Japan"), List.of("SaaS"));

        assertTrue(scorer.score(listing, continentBuyer).isEligible());
        assertEquals(GateFailure.GEOGRAPHY_MISMATCH, scorer.score(listing, otherBuyer).getGateFailure());
    }

    @Test
    void industryOutsideBuyerSectorsFailsGate() {
        BuyerCriteriaProfile profile = Fixtures.profile("buyer-1", List.of("France"), List.of("Healthcare"));

        assertEquals(GateFailure.INDUSTRY_MISMATCH, scorer.score(listing, profile).getGateFailure());
    }

    @Test
    void marketedDealOptOutOnlyAppliesToSeedListings() {
        BuyerCriteriaProfile profile = Fixtures.profile("buyer-1", List.of("France"), List.of("SaaS"));
        profile.setPreferences(BuyerPreferences.builder().doNotSendMarketedDeals(true).build());

        assertTrue(scorer.score(listing, profile).isEligible());

        listing.setRewardLevel(RewardLevel.SEED);
        assertEquals(GateFailure.MARKETED_DEAL_OPT_OUT, scorer.score(listing, profile).getGateFailure());
    }

    @Test
    void businessModelScoresPerMatchingModel() {
        listing.setBusinessModel(BusinessModel.builder().recurringRevenue(true).assetLight(true).assetHeavy(true)
                .build());
        BuyerCriteriaProfile profile = Fixtures.profile("buyer-1", List.of("France"), List.of("SaaS"));
        profile.getTargetCriteria().setPreferredBusinessModels(
                List.of(BusinessModel.RECURRING_REVENUE, BusinessModel.ASSET_LIGHT, BusinessModel.PROJECT_BASED));

        assertEquals(6, scorer.score(listing, profile).getBreakdown().getBusinessModelMatch());
    }

    @Test
    void revenueBoundsAreInclusiveAndMissingRevenueCountsAsZero() {
        BuyerCriteriaProfile profile = Fixtures.profile("buyer-1", List.of("France"), List.of("SaaS"));
        profile.getTargetCriteria().setRevenueMin(1_000_000.0);
        profile.getTargetCriteria().setRevenueMax(5_000_000.0);

        assertEquals(0, scorer.score(listing, profile).getBreakdown().getRevenueMatch());

        listing.setFinancialDetails(FinancialDetails.builder().trailingRevenueAmount(5_000_000.0).build());
        assertEquals(BuyerMatchScorer.REVENUE_WEIGHT, scorer.score(listing, profile).getBreakdown().getRevenueMatch());
    }

    @Test
    void stakeMatchesWhenEitherSideIsMissing() {
        BuyerCriteriaProfile profile = Fixtures.profile("buyer-1", List.of("France"), List.of("SaaS"));
        profile.getTargetCriteria().setMinStakePercent(51.0);
        listing.setStakePercentage(null);

        assertEquals(BuyerMatchScorer.STAKE_PERCENTAGE_WEIGHT,
                scorer.score(listing, profile).getBreakdown().getStakePercentageMatch());
    }

    @Test
    void percentageNeverExceedsOneHundred() {
        listing.setBusinessModel(BusinessModel.builder().recurringRevenue(true).projectBased(true).assetLight(true)
                .assetHeavy(true).build());
        listing.setFinancialDetails(FinancialDetails.builder().trailingRevenueAmount(2_000_000.0)
                .trailingEbitdaAmount(500_000.0).avgRevenueGrowth(12.0).build());
        BuyerCriteriaProfile profile = Fixtures.profile("buyer-1", List.of("France"), List.of("SaaS"));
        profile.setTargetCriteria(TargetCriteria.builder()
                .countries(List.of("France"))
                .industrySectors(List.of("SaaS"))
                .preferredBusinessModels(List.of(BusinessModel.RECURRING_REVENUE, BusinessModel.PROJECT_BASED,
                        BusinessModel.ASSET_LIGHT, BusinessModel.ASSET_HEAVY))
                .build());

        MatchResult result = scorer.score(listing, profile);

        assertEquals(80, result.getTotalMatchScore());
        assertEquals(100, result.getMatchPercentage());
        assertNull(result.getGateFailure());
    }

    @Test
    void percentageRoundsHalfUp() {
        assertEquals(0, BuyerMatchScorer.toPercentage(0));
        assertEquals(35, BuyerMatchScorer.toPercentage(23));
        assertEquals(34, BuyerMatchScorer.toPercentage(22));
        assertEquals(100, BuyerMatchScorer.toPercentage(65));
    }
}
