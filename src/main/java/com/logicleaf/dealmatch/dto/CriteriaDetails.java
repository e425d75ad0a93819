package com.logicleaf.dealmatch.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CriteriaDetails {
    private String dealIndustry;
    private String dealGeography;
    private Double dealRevenue;
    private Double dealEbitda;
    private Double dealAvgRevenueGrowth;
    private Integer dealYearsInBusiness;
    private Double dealStakePercentage;
    private List<String> dealCompanyType;
    private List<String> dealCapitalAvailability;
    private Double dealMinTransactionSize;
    private Integer dealMinPriorAcquisitions;
}
