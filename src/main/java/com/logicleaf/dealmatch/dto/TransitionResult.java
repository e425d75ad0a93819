package com.logicleaf.dealmatch.dto;

import com.logicleaf.dealmatch.model.InteractionRecord;
import com.logicleaf.dealmatch.model.InvitationResponse;
import com.logicleaf.dealmatch.model.InvitationStatus;
import com.logicleaf.dealmatch.model.Listing;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of one invitation transition. {@code tracking} is null when the call changed nothing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransitionResult {
    private Listing listing;
    private String buyerId;
    private InvitationResponse previousResponse;
    private InvitationStatus invitation;
    private InteractionRecord tracking;
    private boolean changed;
    private String message;
}
