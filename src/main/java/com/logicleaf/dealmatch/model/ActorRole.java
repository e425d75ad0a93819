package com.logicleaf.dealmatch.model;

public enum ActorRole {
    SELLER,
    BUYER,
    ADMIN
}
