package com.logicleaf.dealmatch.exception;

/**
 * The actor is authenticated but not allowed to touch this listing, e.g. a buyer responding
 * to a listing that never targeted them or a seller acting on somebody else's listing.
 */
public class PermissionDeniedException extends RuntimeException {
    public PermissionDeniedException(String message) {
        super(message);
    }
}
