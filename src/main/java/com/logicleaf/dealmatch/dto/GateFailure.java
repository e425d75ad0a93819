package com.logicleaf.dealmatch.dto;

/**
 * Mandatory clause a buyer profile failed. A profile failing any of them is never scored.
 */
public enum GateFailure {
    STOPPED_SENDING_DEALS,
    GEOGRAPHY_MISMATCH,
    INDUSTRY_MISMATCH,
    MARKETED_DEAL_OPT_OUT
}
