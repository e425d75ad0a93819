package com.logicleaf.dealmatch.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatchResult {
    private String buyerId;
    private String buyerName;
    private String buyerEmail;
    private String companyName;
    private String companyType;
    private String capitalEntity;

    private boolean eligible;
    private GateFailure gateFailure;

    private int totalMatchScore;
    private int matchPercentage;

    private ScoreBreakdown breakdown;
    private CriteriaDetails criteriaDetails;
}
