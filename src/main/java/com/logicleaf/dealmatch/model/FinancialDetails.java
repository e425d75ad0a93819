package com.logicleaf.dealmatch.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FinancialDetails {
    private Double trailingRevenueAmount;
    private Double trailingEbitdaAmount;
    // percent
    private Double avgRevenueGrowth;
    private Double askingPrice;
    private Double finalSalePrice;
}
