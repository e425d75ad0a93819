package com.logicleaf.dealmatch.dto;

import com.logicleaf.dealmatch.model.Listing;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatusSummaryDTO {
    private Listing listing;
    private List<BuyerStatusEntryDTO> active;
    private List<BuyerStatusEntryDTO> pending;
    private List<BuyerStatusEntryDTO> rejected;
    private long totalTargeted;
    private long totalActive;
    private long totalPending;
    private long totalRejected;
    private List<ConsistencyWarning> consistencyWarnings;
    // set when the listing is inconsistent or buyer enrichment could not be loaded
    private boolean degraded;
}
