package com.logicleaf.dealmatch.model;

public enum InvitationResponse {
    PENDING,
    REQUESTED,
    ACCEPTED,
    REJECTED
}
