package com.logicleaf.dealmatch.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TopListingDTO {
    private String listingId;
    private String listingTitle;
    private long totalInteractions;
    private long activations;
    private long uniqueBuyers;
    private double engagementRate;
}
