package com.logicleaf.dealmatch.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ListingStatisticsDTO {
    private String sellerId;
    private long totalDeals;
    private long draftDeals;
    private long activeDeals;
    private long completedDeals;
    private long totalInterested;
}
