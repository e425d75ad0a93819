package com.logicleaf.dealmatch.dto;

import com.logicleaf.dealmatch.model.InteractionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActivityDTO {
    private String recordId;
    private String buyerId;
    private String buyerName;
    private String buyerEmail;
    private String buyerCompany;
    private String companyType;
    private InteractionType interactionType;
    private Instant timestamp;
    private String notes;
    private Map<String, String> metadata;
    private String actionDescription;
}
