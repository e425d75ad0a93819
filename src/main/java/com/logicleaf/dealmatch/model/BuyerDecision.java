package com.logicleaf.dealmatch.model;

/**
 * Decision a buyer (or an admin on their behalf) takes on a listing.
 */
public enum BuyerDecision {
    ACTIVE(InvitationResponse.ACCEPTED),
    PENDING(InvitationResponse.PENDING),
    REJECTED(InvitationResponse.REJECTED);

    private final InvitationResponse response;

    BuyerDecision(InvitationResponse response) {
        this.response = response;
    }

    public InvitationResponse toResponse() {
        return response;
    }

    public String label() {
        return name().toLowerCase();
    }
}
