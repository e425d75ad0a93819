package com.logicleaf.dealmatch.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Points awarded per factor. A factor either scores its full weight or zero, except the
 * business model factor which adds up per matching model.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoreBreakdown {
    private int industryMatch;
    private int geographyMatch;
    private int revenueMatch;
    private int ebitdaMatch;
    private int revenueGrowthMatch;
    private int yearsMatch;
    private int businessModelMatch;
    private int capitalAvailabilityMatch;
    private int companyTypeMatch;
    private int minTransactionSizeMatch;
    private int priorAcquisitionsMatch;
    private int stakePercentageMatch;

    public int total() {
        return industryMatch + geographyMatch + revenueMatch + ebitdaMatch + revenueGrowthMatch + yearsMatch
                + businessModelMatch + capitalAvailabilityMatch + companyTypeMatch + minTransactionSizeMatch
                + priorAcquisitionsMatch + stakePercentageMatch;
    }
}
