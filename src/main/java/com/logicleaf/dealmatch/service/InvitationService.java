package com.logicleaf.dealmatch.service;

import com.logicleaf.dealmatch.dto.TargetingResult;
import com.logicleaf.dealmatch.dto.TransitionResult;
import com.logicleaf.dealmatch.event.BuyerRequestedEvent;
import com.logicleaf.dealmatch.event.BuyerRespondedEvent;
import com.logicleaf.dealmatch.event.BuyerTargetedEvent;
import com.logicleaf.dealmatch.exception.BadRequestException;
import com.logicleaf.dealmatch.exception.InvalidTransitionException;
import com.logicleaf.dealmatch.exception.PermissionDeniedException;
import com.logicleaf.dealmatch.model.Actor;
import com.logicleaf.dealmatch.model.BuyerDecision;
import com.logicleaf.dealmatch.model.InteractionRecord;
import com.logicleaf.dealmatch.model.InteractionType;
import com.logicleaf.dealmatch.model.InvitationResponse;
import com.logicleaf.dealmatch.model.InvitationStatus;
import com.logicleaf.dealmatch.model.Listing;
import com.logicleaf.dealmatch.model.ListingStatus;
import com.logicleaf.dealmatch.store.ListingMutation.Outcome;
import com.logicleaf.dealmatch.store.ListingStore;
import com.logicleaf.dealmatch.store.ListingUnitOfWork;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Owns the per-buyer invitation lifecycle of a listing.
 *
 * <p>Every transition reloads the listing, applies the change to the invitation map and the
 * membership sets in one step, writes the listing back under its version and appends the
 * matching ledger record, all inside one unit of work. Events go out only after the unit of
 * work succeeded.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InvitationService {

    private final ListingStore listingStore;
    private final ListingUnitOfWork unitOfWork;
    private final InteractionLedgerService ledger;
    private final ApplicationEventPublisher events;
    private final Clock clock;

    /**
     * Makes buyers eligible to respond. Buyers already targeted keep their current invitation.
     */
    public TargetingResult target(String listingId, Collection<String> buyerIds, Actor actor) {
        if (buyerIds == null) {
            throw new BadRequestException("buyerIds must not be null");
        }
        Set<String> requested = new LinkedHashSet<>();
        buyerIds.stream().filter(Objects::nonNull).map(String::trim).filter(id -> !id.isEmpty())
                .forEach(requested::add);

        Instant now = clock.instant();
        TargetingResult result = unitOfWork.execute(() -> listingStore.<TargetingResult>compareAndSwap(listingId,
                listing -> {
            ListingPermissions.requireOwnerOrAdmin(listing, actor);
            List<String> added = new ArrayList<>();
            List<String> existing = new ArrayList<>();
            for (String buyerId : requested) {
                if (listing.addTarget(buyerId, now)) {
                    added.add(buyerId);
                } else {
                    existing.add(buyerId);
                }
            }
            if (!added.isEmpty()) {
                listing.touch(now);
            }
            TargetingResult targeting = TargetingResult.builder()
                    .listing(listing)
                    .newlyTargeted(added)
                    .alreadyTargeted(existing)
                    .build();
            return added.isEmpty() ? Outcome.unchanged(targeting) : Outcome.changed(targeting);
        }));

        Listing listing = result.getListing();
        for (String buyerId : result.getNewlyTargeted()) {
            events.publishEvent(new BuyerTargetedEvent("buyer.targeted", listing.getId(), listing.getSellerId(),
                    actor.getId(), actor.getRole(), now, buyerId, listing.getTitle()));
        }
        log.info("Listing {} targeted {} new buyers ({} already targeted)", listingId,
                result.getNewlyTargeted().size(), result.getAlreadyTargeted().size());
        return result;
    }

    /**
     * A targeted buyer (or an admin acting for them) moves the listing to active, pending or
     * rejected.
     */
    public TransitionResult respond(String listingId, String buyerId, BuyerDecision decision, String notes,
            Actor actor) {
        ListingPermissions.requireBuyerOrAdmin(buyerId, actor);
        requireDecision(decision);
        return transition(listingId, buyerId, decision.toResponse(), decision.label(),
                notesOrDefault(notes, "Deal status changed to " + decision.label()), actor,
                listing -> {
                    if (!listing.isTargeted(buyerId)) {
                        throw new PermissionDeniedException("You are not targeted for this deal");
                    }
                });
    }

    /**
     * Same effect as {@link #respond} without the targeting check. A buyer that was never
     * targeted becomes targeted so the invitation map never holds strangers.
     */
    public TransitionResult adminOverride(String listingId, String buyerId, BuyerDecision decision, String notes,
            Actor actor) {
        ListingPermissions.requireAdmin(actor);
        requireDecision(decision);
        return transition(listingId, buyerId, decision.toResponse(), decision.label(),
                notesOrDefault(notes, "Status set to " + decision.label() + " by admin"), actor, listing -> {
                });
    }

    /**
     * A buyer asks for access to a public listing that is not targeting them yet. Repeated
     * requests, or requests from buyers already targeted, leave the listing untouched.
     */
    public TransitionResult requestAccess(String listingId, String buyerId, String notes, Actor actor) {
        ListingPermissions.requireBuyerOrAdmin(buyerId, actor);
        Instant now = clock.instant();
        String requestNotes = notesOrDefault(notes, "Buyer requested access");

        TransitionResult result = unitOfWork.execute(() -> {
            TransitionResult applied = listingStore.compareAndSwap(listingId, listing -> {
                if (!listing.isPublic()) {
                    throw new PermissionDeniedException("This deal is not open to marketplace requests");
                }
                if (listing.getStatus() == ListingStatus.COMPLETED) {
                    throw new InvalidTransitionException(listing.getStatus().name(), InvitationResponse.REQUESTED.name(),
                            "Cannot request access to a completed deal");
                }
                if (listing.isTargeted(buyerId)) {
                    InvitationStatus current = listing.invitationFor(buyerId).orElse(null);
                    return Outcome.unchanged(TransitionResult.builder()
                            .listing(listing)
                            .buyerId(buyerId)
                            .previousResponse(current != null ? current.getResponse() : null)
                            .invitation(current)
                            .changed(false)
                            .message("Buyer already has access to this deal")
                            .build());
                }
                InvitationStatus invitation = listing.addRequest(buyerId, requestNotes, now);
                listing.touch(now);
                return Outcome.changed(TransitionResult.builder()
                        .listing(listing)
                        .buyerId(buyerId)
                        .invitation(invitation)
                        .changed(true)
                        .message("Access requested")
                        .build());
            });
            if (applied.isChanged()) {
                applied.setTracking(ledger.append(listingId, buyerId, InteractionType.VIEW, requestNotes,
                        metadata("requested", null, actor), now));
            }
            return applied;
        });

        if (result.isChanged()) {
            Listing listing = result.getListing();
            events.publishEvent(new BuyerRequestedEvent("buyer.requested", listing.getId(), listing.getSellerId(),
                    actor.getId(), actor.getRole(), now, buyerId, listing.getTitle()));
            log.info("Buyer {} requested access to listing {}", buyerId, listingId);
        } else {
            log.debug("Buyer {} already targeted by listing {}, request ignored", buyerId, listingId);
        }
        return result;
    }

    /**
     * The owning seller accepts or declines a buyer's pending request.
     */
    public TransitionResult reviewRequest(String listingId, String buyerId, boolean approve, String notes,
            Actor actor) {
        InvitationResponse response = approve ? InvitationResponse.ACCEPTED : InvitationResponse.REJECTED;
        return transition(listingId, buyerId, response, approve ? "active" : "rejected",
                notesOrDefault(notes, approve ? "Request accepted" : "Request declined"), actor, listing -> {
                    ListingPermissions.requireOwnerOrAdmin(listing, actor);
                    InvitationResponse current = listing.invitationFor(buyerId)
                            .map(InvitationStatus::getResponse)
                            .orElse(null);
                    if (current != InvitationResponse.REQUESTED) {
                        throw new InvalidTransitionException(String.valueOf(current), response.name(),
                                "Buyer " + buyerId + " has no open request on this deal");
                    }
                });
    }

    private TransitionResult transition(String listingId, String buyerId, InvitationResponse response,
            String statusLabel, String notes, Actor actor, Consumer<Listing> guard) {
        Instant now = clock.instant();

        TransitionResult result = unitOfWork.execute(() -> {
            TransitionResult applied = listingStore.compareAndSwap(listingId, listing -> {
                guard.accept(listing);
                InvitationResponse previous = listing.invitationFor(buyerId)
                        .map(InvitationStatus::getResponse)
                        .orElse(null);
                InvitationStatus updated = listing.applyResponse(buyerId, response, actor.getRole(), notes, now);
                listing.touch(now);
                return Outcome.changed(TransitionResult.builder()
                        .listing(listing)
                        .buyerId(buyerId)
                        .previousResponse(previous)
                        .invitation(updated)
                        .changed(true)
                        .message("Deal status updated to " + statusLabel)
                        .build());
            });
            InteractionRecord tracking = ledger.append(listingId, buyerId, InteractionType.forResponse(response),
                    notes, metadata(statusLabel, applied.getPreviousResponse(), actor), now);
            applied.setTracking(tracking);
            return applied;
        });

        Listing listing = result.getListing();
        events.publishEvent(new BuyerRespondedEvent("buyer.responded", listing.getId(), listing.getSellerId(),
                actor.getId(), actor.getRole(), now, buyerId, result.getPreviousResponse(), response));
        log.info("Listing {} buyer {} moved {} -> {} by {}", listingId, buyerId, result.getPreviousResponse(),
                response, actor.getRole());
        return result;
    }

    private static Map<String, String> metadata(String status, InvitationResponse previous, Actor actor) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("status", status);
        if (previous != null) {
            metadata.put("previousStatus", previous.name().toLowerCase());
        }
        metadata.put("actorRole", actor.getRole().name().toLowerCase());
        if (actor.getId() != null) {
            metadata.put("actorId", actor.getId());
        }
        return metadata;
    }

    private static void requireDecision(BuyerDecision decision) {
        if (decision == null) {
            throw new BadRequestException("A decision of active, pending or rejected is required");
        }
    }

    private static String notesOrDefault(String notes, String fallback) {
        return notes == null || notes.isBlank() ? fallback : notes;
    }
}
