package com.logicleaf.dealmatch.dto;

import com.logicleaf.dealmatch.model.InteractionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecentActionDTO {
    private String recordId;
    private String listingId;
    private String listingTitle;
    private String buyerId;
    private String buyerName;
    private String buyerCompany;
    private InteractionType interactionType;
    private Instant timestamp;
    private String notes;
    private String actionDescription;
    private String actionColor;
}
