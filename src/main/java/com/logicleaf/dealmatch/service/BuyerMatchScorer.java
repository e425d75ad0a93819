package com.logicleaf.dealmatch.service;

import com.logicleaf.dealmatch.dto.CriteriaDetails;
import com.logicleaf.dealmatch.dto.GateFailure;
import com.logicleaf.dealmatch.dto.MatchResult;
import com.logicleaf.dealmatch.dto.ScoreBreakdown;
import com.logicleaf.dealmatch.model.BusinessModel;
import com.logicleaf.dealmatch.model.BuyerCriteriaProfile;
import com.logicleaf.dealmatch.model.BuyerFit;
import com.logicleaf.dealmatch.model.BuyerPreferences;
import com.logicleaf.dealmatch.model.FinancialDetails;
import com.logicleaf.dealmatch.model.Listing;
import com.logicleaf.dealmatch.model.RewardLevel;
import com.logicleaf.dealmatch.model.TargetCriteria;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Scores one buyer profile against one listing.
 *
 * <p>Mandatory gate first: buyers who stopped receiving deals, who do not target the listing's
 * geography (expanded through {@link GeographyHierarchy}) or industry, and, for SEED listings,
 * buyers who opted out of marketed deals are not eligible and get no score. Everyone else is
 * scored on twelve all-or-nothing factors, reported against {@value #MAX_SCORE} points. Missing bounds
 * are wildcards, with one exception: a buyer EBITDA minimum of exactly 0 means "profitable",
 * so the listing EBITDA must be strictly positive.
 */
@Component
@RequiredArgsConstructor
public class BuyerMatchScorer {

    public static final int INDUSTRY_WEIGHT = 10;
    public static final int GEOGRAPHY_WEIGHT = 10;
    public static final int REVENUE_WEIGHT = 8;
    public static final int EBITDA_WEIGHT = 8;
    public static final int REVENUE_GROWTH_WEIGHT = 5;
    public static final int YEARS_WEIGHT = 5;
    public static final int BUSINESS_MODEL_WEIGHT_EACH = 3;
    public static final int CAPITAL_AVAILABILITY_WEIGHT = 4;
    public static final int COMPANY_TYPE_WEIGHT = 4;
    public static final int MIN_TRANSACTION_SIZE_WEIGHT = 5;
    public static final int PRIOR_ACQUISITIONS_WEIGHT = 5;
    public static final int STAKE_PERCENTAGE_WEIGHT = 4;

    // Percentage divisor. The weights above add up to 80, so strong matches are capped at 100%.
    public static final int MAX_SCORE = 65;

    private final GeographyHierarchy geographyHierarchy;

    public MatchResult score(Listing listing, BuyerCriteriaProfile profile) {
        return score(listing, profile, geographyHierarchy.expand(listing.getGeographySelection()));
    }

    /**
     * Same as {@link #score(Listing, BuyerCriteriaProfile)} with the listing geography already
     * expanded, so a ranking pass expands it once.
     */
    public MatchResult score(Listing listing, BuyerCriteriaProfile profile, Set<String> expandedGeographies) {
        GateFailure gateFailure = checkGate(listing, profile, expandedGeographies);
        MatchResult.MatchResultBuilder result = MatchResult.builder()
                .buyerId(profile.getBuyerId())
                .buyerName(profile.getBuyerName())
                .buyerEmail(profile.getBuyerEmail())
                .companyName(profile.getCompanyName())
                .companyType(profile.getCompanyType())
                .capitalEntity(profile.getCapitalEntity())
                .criteriaDetails(criteriaDetails(listing));

        if (gateFailure != null) {
            return result.eligible(false)
                    .gateFailure(gateFailure)
                    .totalMatchScore(0)
                    .matchPercentage(0)
                    .breakdown(new ScoreBreakdown())
                    .build();
        }

        ScoreBreakdown breakdown = scoreFactors(listing, profile);
        int total = breakdown.total();
        return result.eligible(true)
                .totalMatchScore(total)
                .matchPercentage(toPercentage(total))
                .breakdown(breakdown)
                .build();
    }

    static int toPercentage(int totalScore) {
        return (int) Math.min(100, Math.round(totalScore * 100.0 / MAX_SCORE));
    }

    GateFailure checkGate(Listing listing, BuyerCriteriaProfile profile, Set<String> expandedGeographies) {
        BuyerPreferences preferences = profile.getPreferences();
        if (preferences != null && Boolean.TRUE.equals(preferences.getStopSendingDeals())) {
            return GateFailure.STOPPED_SENDING_DEALS;
        }

        TargetCriteria criteria = profile.getTargetCriteria();
        List<String> countries = criteria != null ? criteria.getCountries() : null;
        if (countries == null || countries.stream().noneMatch(expandedGeographies::contains)) {
            return GateFailure.GEOGRAPHY_MISMATCH;
        }

        List<String> sectors = criteria.getIndustrySectors();
        if (listing.getIndustrySector() == null || sectors == null || !sectors.contains(listing.getIndustrySector())) {
            return GateFailure.INDUSTRY_MISMATCH;
        }

        if (listing.getRewardLevel() == RewardLevel.SEED && preferences != null
                && Boolean.TRUE.equals(preferences.getDoNotSendMarketedDeals())) {
            return GateFailure.MARKETED_DEAL_OPT_OUT;
        }
        return null;
    }

    private ScoreBreakdown scoreFactors(Listing listing, BuyerCriteriaProfile profile) {
        TargetCriteria criteria = profile.getTargetCriteria();
        FinancialDetails financials = listing.getFinancialDetails() != null
                ? listing.getFinancialDetails()
                : new FinancialDetails();
        BuyerFit buyerFit = listing.getBuyerFit() != null ? listing.getBuyerFit() : new BuyerFit();

        double revenue = orZero(financials.getTrailingRevenueAmount());
        double ebitda = orZero(financials.getTrailingEbitdaAmount());
        double growth = orZero(financials.getAvgRevenueGrowth());

        return ScoreBreakdown.builder()
                .industryMatch(INDUSTRY_WEIGHT)
                .geographyMatch(GEOGRAPHY_WEIGHT)
                .revenueMatch(withinRange(revenue, criteria.getRevenueMin(), criteria.getRevenueMax())
                        ? REVENUE_WEIGHT : 0)
                .ebitdaMatch(ebitdaMatches(ebitda, criteria.getEbitdaMin(), criteria.getEbitdaMax())
                        ? EBITDA_WEIGHT : 0)
                .revenueGrowthMatch(atLeast(growth, criteria.getRevenueGrowth()) ? REVENUE_GROWTH_WEIGHT : 0)
                .yearsMatch(atLeast(orZero(listing.getYearsInBusiness()), toDouble(criteria.getMinYearsInBusiness()))
                        ? YEARS_WEIGHT : 0)
                .businessModelMatch(businessModelPoints(listing.getBusinessModel(),
                        criteria.getPreferredBusinessModels()))
                .capitalAvailabilityMatch(allowedOrUnrestricted(profile.getCapitalEntity(),
                        buyerFit.getCapitalAvailability()) ? CAPITAL_AVAILABILITY_WEIGHT : 0)
                .companyTypeMatch(allowedOrUnrestricted(profile.getCompanyType(), listing.getCompanyTypes())
                        ? COMPANY_TYPE_WEIGHT : 0)
                .minTransactionSizeMatch(atLeast(orZero(profile.getAverageDealSize()), buyerFit.getMinTransactionSize())
                        ? MIN_TRANSACTION_SIZE_WEIGHT : 0)
                .priorAcquisitionsMatch(atLeast(orZero(profile.getDealsCompletedLast5Years()),
                        toDouble(buyerFit.getMinPriorAcquisitions())) ? PRIOR_ACQUISITIONS_WEIGHT : 0)
                .stakePercentageMatch(stakeMatches(listing.getStakePercentage(), criteria.getMinStakePercent())
                        ? STAKE_PERCENTAGE_WEIGHT : 0)
                .build();
    }

    private static boolean withinRange(double value, Double min, Double max) {
        return (min == null || value >= min) && (max == null || value <= max);
    }

    private static boolean ebitdaMatches(double ebitda, Double min, Double max) {
        boolean lower;
        if (min == null) {
            lower = true;
        } else if (min == 0) {
            lower = ebitda > 0;
        } else {
            lower = ebitda >= min;
        }
        return lower && (max == null || ebitda <= max);
    }

    private static boolean atLeast(double value, Double minimum) {
        return minimum == null || value >= minimum;
    }

    private static boolean stakeMatches(Double offered, Double minimum) {
        return offered == null || minimum == null || offered >= minimum;
    }

    private static boolean allowedOrUnrestricted(String value, Collection<String> allowed) {
        return allowed == null || allowed.isEmpty() || (value != null && allowed.contains(value));
    }

    private static int businessModelPoints(BusinessModel model, List<String> preferred) {
        if (model == null || preferred == null || preferred.isEmpty()) {
            return 0;
        }
        int points = 0;
        if (model.isRecurringRevenue() && preferred.contains(BusinessModel.RECURRING_REVENUE)) {
            points += BUSINESS_MODEL_WEIGHT_EACH;
        }
        if (model.isProjectBased() && preferred.contains(BusinessModel.PROJECT_BASED)) {
            points += BUSINESS_MODEL_WEIGHT_EACH;
        }
        if (model.isAssetLight() && preferred.contains(BusinessModel.ASSET_LIGHT)) {
            points += BUSINESS_MODEL_WEIGHT_EACH;
        }
        if (model.isAssetHeavy() && preferred.contains(BusinessModel.ASSET_HEAVY)) {
            points += BUSINESS_MODEL_WEIGHT_EACH;
        }
        return points;
    }

    private static CriteriaDetails criteriaDetails(Listing listing) {
        FinancialDetails financials = listing.getFinancialDetails();
        BuyerFit buyerFit = listing.getBuyerFit();
        return CriteriaDetails.builder()
                .dealIndustry(listing.getIndustrySector())
                .dealGeography(listing.getGeographySelection())
                .dealRevenue(financials != null ? financials.getTrailingRevenueAmount() : null)
                .dealEbitda(financials != null ? financials.getTrailingEbitdaAmount() : null)
                .dealAvgRevenueGrowth(financials != null ? financials.getAvgRevenueGrowth() : null)
                .dealYearsInBusiness(listing.getYearsInBusiness())
                .dealStakePercentage(listing.getStakePercentage())
                .dealCompanyType(listing.getCompanyTypes())
                .dealCapitalAvailability(buyerFit != null ? buyerFit.getCapitalAvailability() : null)
                .dealMinTransactionSize(buyerFit != null ? buyerFit.getMinTransactionSize() : null)
                .dealMinPriorAcquisitions(buyerFit != null ? buyerFit.getMinPriorAcquisitions() : null)
                .build();
    }

    private static double orZero(Number value) {
        return value != null ? value.doubleValue() : 0.0;
    }

    private static Double toDouble(Integer value) {
        return value != null ? value.doubleValue() : null;
    }
}
