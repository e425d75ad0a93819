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
public class EngagementDashboardDTO {
    private ListingStatisticsDTO overview;
    private List<EngagementStatDTO> engagementStats;
    private List<DailyActivityDTO> recentActivity;
    private List<TopListingDTO> topListings;
    private long totalActivations;
    private long totalRejections;
    private long totalViews;
    private long uniqueEngagedBuyers;
}
