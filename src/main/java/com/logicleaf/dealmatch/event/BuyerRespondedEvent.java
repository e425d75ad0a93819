package com.logicleaf.dealmatch.event;

import com.logicleaf.dealmatch.model.ActorRole;
import com.logicleaf.dealmatch.model.InvitationResponse;

import java.time.Instant;

public record BuyerRespondedEvent(
        String eventType,
        String listingId,
        String sellerId,
        String actorId,
        ActorRole actorRole,
        Instant occurredAt,
        String buyerId,
        InvitationResponse previousResponse,
        InvitationResponse response)
        implements DomainEvent {
}
