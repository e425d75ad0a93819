package com.logicleaf.dealmatch.dto;

import com.logicleaf.dealmatch.model.InteractionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InteractionSummaryDTO {
    private String listingId;
    private long totalInteractions;
    private long uniqueBuyers;
    // every interaction type is present, zero when unused
    private Map<InteractionType, Long> countsByType;
    private Map<InteractionType, Long> uniqueBuyersByType;
}
