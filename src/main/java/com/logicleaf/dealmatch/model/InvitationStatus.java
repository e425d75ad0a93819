package com.logicleaf.dealmatch.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvitationStatus {
    private Instant invitedAt;
    private Instant respondedAt;
    private InvitationResponse response;
    private ActorRole decisionBy;
    private String notes;
}
