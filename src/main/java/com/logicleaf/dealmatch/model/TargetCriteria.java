package com.logicleaf.dealmatch.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TargetCriteria {
    private List<String> countries;
    private List<String> industrySectors;
    // null bounds are no constraint
    private Double revenueMin;
    private Double revenueMax;
    private Double ebitdaMin;
    private Double ebitdaMax;
    private Double transactionSizeMin;
    private Double transactionSizeMax;
    // minimum average revenue growth, percent
    private Double revenueGrowth;
    private Integer minYearsInBusiness;
    private Double minStakePercent;
    private List<String> preferredBusinessModels;
}
