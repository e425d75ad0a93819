package com.logicleaf.dealmatch.model;

public enum ListingStatus {
    DRAFT,
    ACTIVE,
    COMPLETED
}
