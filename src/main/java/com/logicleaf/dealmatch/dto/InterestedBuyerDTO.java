package com.logicleaf.dealmatch.dto;

import com.logicleaf.dealmatch.model.InteractionRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InterestedBuyerDTO {
    private String buyerId;
    private String buyerName;
    private String buyerEmail;
    private String companyName;
    private String companyType;
    private Instant lastInteraction;
    private long totalInteractions;
    private List<InteractionRecord> recentInteractions;
}
