package com.logicleaf.dealmatch.dto;

import com.logicleaf.dealmatch.model.InteractionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EngagementStatDTO {
    private InteractionType interactionType;
    private long count;
    private long uniqueBuyers;
}
