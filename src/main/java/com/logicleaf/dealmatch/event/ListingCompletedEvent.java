package com.logicleaf.dealmatch.event;

import com.logicleaf.dealmatch.model.ActorRole;

import java.time.Instant;

public record ListingCompletedEvent(
        String eventType,
        String listingId,
        String sellerId,
        String actorId,
        ActorRole actorRole,
        Instant occurredAt,
        Double finalSalePrice,
        String winningBuyerId)
        implements DomainEvent {
}
