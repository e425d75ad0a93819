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
public class BuyerStatusEntryDTO {
    private String buyerId;
    private String buyerName;
    private String buyerEmail;
    private String buyerCompany;
    private String companyType;
    // true when the status came from the ledger because the invitation map has no entry
    private boolean ledgerOnly;
    private Instant lastInteraction;
    private long totalInteractions;
    private List<InteractionRecord> interactions;
}
