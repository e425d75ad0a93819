package com.logicleaf.dealmatch.service;

import com.logicleaf.dealmatch.exception.PermissionDeniedException;
import com.logicleaf.dealmatch.model.Actor;
import com.logicleaf.dealmatch.model.Listing;

final class ListingPermissions {

    private ListingPermissions() {
    }

    static void requireOwnerOrAdmin(Listing listing, Actor actor) {
        if (actor == null || !(actor.isAdmin() || actor.isSeller(listing.getSellerId()))) {
            throw new PermissionDeniedException("You don't have permission to modify this deal");
        }
    }

    static void requireBuyerOrAdmin(String buyerId, Actor actor) {
        if (actor == null || !(actor.isAdmin() || actor.isBuyer(buyerId))) {
            throw new PermissionDeniedException("You can only act on your own invitations");
        }
    }

    static void requireAdmin(Actor actor) {
        if (actor == null || !actor.isAdmin()) {
            throw new PermissionDeniedException("Only an admin can override a buyer's status");
        }
    }
}
