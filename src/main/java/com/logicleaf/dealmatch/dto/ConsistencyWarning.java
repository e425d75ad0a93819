package com.logicleaf.dealmatch.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConsistencyWarning {

    public enum Kind {
        INTERESTED_WITHOUT_ACCEPTANCE,
        ACCEPTED_NOT_INTERESTED,
        INTERESTED_NEVER_ACTIVE,
        INVITATION_NOT_TARGETED
    }

    private String listingId;
    private String buyerId;
    private Kind kind;
    private String message;
}
