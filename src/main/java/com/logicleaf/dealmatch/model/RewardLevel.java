package com.logicleaf.dealmatch.model;

public enum RewardLevel {
    SEED, // already marketed elsewhere
    BLOOM,
    FRUIT
}
