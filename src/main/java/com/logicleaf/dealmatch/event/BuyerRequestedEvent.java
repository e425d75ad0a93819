package com.logicleaf.dealmatch.event;

import com.logicleaf.dealmatch.model.ActorRole;

import java.time.Instant;

public record BuyerRequestedEvent(
        String eventType,
        String listingId,
        String sellerId,
        String actorId,
        ActorRole actorRole,
        Instant occurredAt,
        String buyerId,
        String listingTitle)
        implements DomainEvent {
}
