package com.logicleaf.dealmatch.model;

/**
 * Tabs a buyer sees on their dashboard. Derived from a listing, never stored.
 */
public enum BuyerBucket {
    ACTIVE,
    PENDING,
    REJECTED,
    COMPLETED
}
