package com.logicleaf.dealmatch.service;

import com.logicleaf.dealmatch.event.ListingCompletedEvent;
import com.logicleaf.dealmatch.exception.BadRequestException;
import com.logicleaf.dealmatch.exception.InvalidTransitionException;
import com.logicleaf.dealmatch.model.Actor;
import com.logicleaf.dealmatch.model.FinancialDetails;
import com.logicleaf.dealmatch.model.InteractionType;
import com.logicleaf.dealmatch.model.Listing;
import com.logicleaf.dealmatch.model.ListingStatus;
import com.logicleaf.dealmatch.model.Timeline;
import com.logicleaf.dealmatch.store.ListingMutation.Outcome;
import com.logicleaf.dealmatch.store.ListingStore;
import com.logicleaf.dealmatch.store.ListingUnitOfWork;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;

/**
 * Draft -> Active -> Completed. Repeating a transition that already happened is a no-op,
 * going backwards or skipping Active is refused.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ListingLifecycleService {

    private final ListingStore listingStore;
    private final ListingUnitOfWork unitOfWork;
    private final InteractionLedgerService ledger;
    private final ApplicationEventPublisher events;
    private final Clock clock;

    public Listing createDraft(Listing draft, Actor actor) {
        if (draft == null || draft.getSellerId() == null) {
            throw new BadRequestException("A listing needs an owning seller");
        }
        ListingPermissions.requireOwnerOrAdmin(draft, actor);

        Instant now = clock.instant();
        draft.setId(null);
        draft.setVersion(null);
        draft.setStatus(ListingStatus.DRAFT);
        draft.setTargetedBuyers(new LinkedHashSet<>());
        draft.setInterestedBuyers(new LinkedHashSet<>());
        draft.setEverActiveBuyers(new LinkedHashSet<>());
        draft.setInvitationStatus(new LinkedHashMap<>());
        draft.setTimeline(Timeline.builder().createdAt(now).updatedAt(now).build());

        Listing saved = listingStore.save(draft);
        log.info("Listing {} created as draft for seller {}", saved.getId(), saved.getSellerId());
        return saved;
    }

    public Listing publish(String listingId, Actor actor) {
        Instant now = clock.instant();
        Listing published = unitOfWork.execute(() -> listingStore.<Listing>compareAndSwap(listingId, listing -> {
            ListingPermissions.requireOwnerOrAdmin(listing, actor);
            Timeline timeline = timelineOf(listing);
            switch (listing.getStatus()) {
                case COMPLETED -> throw new InvalidTransitionException(ListingStatus.COMPLETED.name(),
                        ListingStatus.ACTIVE.name(), "A completed deal cannot be published again");
                case ACTIVE -> {
                    if (timeline.getPublishedAt() != null) {
                        return Outcome.unchanged(listing);
                    }
                }
                default -> listing.setStatus(ListingStatus.ACTIVE);
            }
            timeline.setPublishedAt(now);
            listing.touch(now);
            return Outcome.changed(listing);
        }));
        log.info("Listing {} is {} (published {})", listingId, published.getStatus(),
                published.getTimeline().getPublishedAt());
        return published;
    }

    /**
     * Closes an active listing, records the sale and appends a listing-level ledger record.
     * A winning buyer, when given, must be one of the listing's interested buyers.
     */
    public Listing complete(String listingId, Double finalSalePrice, String winningBuyerId, String notes,
            Actor actor) {
        Instant now = clock.instant();
        Completion completion = unitOfWork.execute(() -> {
            Completion applied = listingStore.<Completion>compareAndSwap(listingId, listing -> {
                ListingPermissions.requireOwnerOrAdmin(listing, actor);
                Timeline timeline = timelineOf(listing);
                if (listing.getStatus() == ListingStatus.DRAFT) {
                    throw new InvalidTransitionException(ListingStatus.DRAFT.name(), ListingStatus.COMPLETED.name(),
                            "Publish the deal before closing it");
                }
                if (listing.getStatus() == ListingStatus.COMPLETED && timeline.getCompletedAt() != null) {
                    return Outcome.unchanged(new Completion(listing, false));
                }
                if (winningBuyerId != null && !listing.isInterested(winningBuyerId)) {
                    throw new BadRequestException("Winning buyer " + winningBuyerId
                            + " is not an active buyer on this deal");
                }
                listing.setStatus(ListingStatus.COMPLETED);
                timeline.setCompletedAt(now);
                if (finalSalePrice != null) {
                    if (listing.getFinancialDetails() == null) {
                        listing.setFinancialDetails(new FinancialDetails());
                    }
                    listing.getFinancialDetails().setFinalSalePrice(finalSalePrice);
                }
                listing.touch(now);
                return Outcome.changed(new Completion(listing, true));
            });
            if (applied.completedNow()) {
                Map<String, String> metadata = new LinkedHashMap<>();
                if (finalSalePrice != null) {
                    metadata.put("finalSalePrice", String.valueOf(finalSalePrice));
                }
                if (winningBuyerId != null) {
                    metadata.put("winningBuyerId", winningBuyerId);
                }
                metadata.put("actorRole", actor.getRole().name().toLowerCase());
                ledger.append(listingId, winningBuyerId, InteractionType.COMPLETED,
                        notes == null || notes.isBlank() ? "Deal closed by seller" : notes, metadata, now);
            }
            return applied;
        });

        Listing listing = completion.listing();
        if (completion.completedNow()) {
            events.publishEvent(new ListingCompletedEvent("listing.completed", listing.getId(),
                    listing.getSellerId(), actor.getId(), actor.getRole(), now, finalSalePrice, winningBuyerId));
            log.info("Listing {} completed, final sale price {}", listingId, finalSalePrice);
        } else {
            log.debug("Listing {} already completed, nothing to do", listingId);
        }
        return listing;
    }

    private static Timeline timelineOf(Listing listing) {
        if (listing.getTimeline() == null) {
            listing.setTimeline(new Timeline());
        }
        return listing.getTimeline();
    }

    private record Completion(Listing listing, boolean completedNow) {
    }
}
