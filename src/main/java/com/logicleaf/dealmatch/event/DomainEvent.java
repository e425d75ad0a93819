package com.logicleaf.dealmatch.event;

import com.logicleaf.dealmatch.model.ActorRole;

import java.time.Instant;

/**
 * Events published through Spring's ApplicationEventPublisher once a listing transition has been
 * applied. Implementations are records holding ids and values only, never documents, so a
 * notifier can act on them after the transaction has committed.
 */
public sealed interface DomainEvent
        permits BuyerTargetedEvent, BuyerRequestedEvent, BuyerRespondedEvent, ListingCompletedEvent {

    String eventType();

    String listingId();

    String sellerId();

    String actorId();

    ActorRole actorRole();

    Instant occurredAt();
}
