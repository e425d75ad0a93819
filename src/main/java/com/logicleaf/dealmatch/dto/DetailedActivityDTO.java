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
public class DetailedActivityDTO {
    private Listing listing;
    private List<ActivityDTO> activities;
    private long totalActivated;
    private long totalRejected;
    private long totalPending;
    private long uniqueBuyers;
}
