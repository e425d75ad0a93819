package com.logicleaf.dealmatch.model;

import lombok.Value;

/**
 * Already-authenticated caller of a core operation.
 */
@Value
public class Actor {
    String id;
    ActorRole role;

    public static Actor seller(String sellerId) {
        return new Actor(sellerId, ActorRole.SELLER);
    }

    public static Actor buyer(String buyerId) {
        return new Actor(buyerId, ActorRole.BUYER);
    }

    public static Actor admin(String adminId) {
        return new Actor(adminId, ActorRole.ADMIN);
    }

    public boolean isAdmin() {
        return role == ActorRole.ADMIN;
    }

    public boolean isBuyer(String buyerId) {
        return role == ActorRole.BUYER && id != null && id.equals(buyerId);
    }

    public boolean isSeller(String sellerId) {
        return role == ActorRole.SELLER && id != null && id.equals(sellerId);
    }
}
