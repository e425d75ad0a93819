package com.logicleaf.dealmatch.model;

/**
 * Status of a buyer on a listing as reconstructed from the interaction ledger.
 */
public enum EngagementStatus {
    PENDING,
    ACCEPTED,
    REJECTED,
    COMPLETED
}
