package com.logicleaf.dealmatch.model;

public enum InteractionType {
    VIEW("Set as Pending"),
    INTEREST("Activated Deal"),
    REJECTED("Rejected Deal"),
    COMPLETED("Deal Completed");

    private final String actionDescription;

    InteractionType(String actionDescription) {
        this.actionDescription = actionDescription;
    }

    public String actionDescription() {
        return actionDescription;
    }

    public static InteractionType forResponse(InvitationResponse response) {
        return switch (response) {
            case ACCEPTED -> INTEREST;
            case REJECTED -> REJECTED;
            case PENDING, REQUESTED -> VIEW;
        };
    }

    public EngagementStatus toEngagementStatus() {
        return switch (this) {
            case INTEREST -> EngagementStatus.ACCEPTED;
            case REJECTED -> EngagementStatus.REJECTED;
            case VIEW -> EngagementStatus.PENDING;
            case COMPLETED -> EngagementStatus.COMPLETED;
        };
    }
}
