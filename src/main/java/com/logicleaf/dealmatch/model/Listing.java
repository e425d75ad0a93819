package com.logicleaf.dealmatch.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A sell-side acquisition opportunity together with the invitation state of every buyer it
 * was shown to.
 *
 * <p>{@code interestedBuyers} mirrors the ACCEPTED entries of {@code invitationStatus} and
 * {@code everActiveBuyers} only ever grows. Both are maintained exclusively by
 * {@link #addTarget}, {@link #addRequest} and {@link #applyResponse} so that a single
 * in-memory mutation keeps the map and the sets in step.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "listings")
public class Listing {

    @Id
    private String id;

    @Version
    private Long version;

    @Indexed
    private String sellerId;
    private String title;

    @Builder.Default
    private ListingStatus status = ListingStatus.DRAFT;
    private RewardLevel rewardLevel;
    private boolean isPublic;

    private String industrySector;
    private String geographySelection;
    private Integer yearsInBusiness;
    private Double stakePercentage;
    private BusinessModel businessModel;
    private FinancialDetails financialDetails;
    private BuyerFit buyerFit;
    private List<String> companyTypes;

    @Indexed
    @Builder.Default
    private Set<String> targetedBuyers = new LinkedHashSet<>();
    @Builder.Default
    private Set<String> interestedBuyers = new LinkedHashSet<>();
    @Builder.Default
    private Set<String> everActiveBuyers = new LinkedHashSet<>();
    @Builder.Default
    private Map<String, InvitationStatus> invitationStatus = new LinkedHashMap<>();

    @Builder.Default
    private Timeline timeline = new Timeline();

    public boolean isTargeted(String buyerId) {
        return targetedBuyers.contains(buyerId);
    }

    public boolean isInterested(String buyerId) {
        return interestedBuyers.contains(buyerId);
    }

    public Optional<InvitationStatus> invitationFor(String buyerId) {
        return Optional.ofNullable(invitationStatus.get(buyerId));
    }

    /**
     * Targets a buyer with a fresh PENDING invitation.
     *
     * @return false if the buyer was already targeted, in which case nothing changes
     */
    public boolean addTarget(String buyerId, Instant now) {
        if (!targetedBuyers.add(buyerId)) {
            return false;
        }
        invitationStatus.put(buyerId, InvitationStatus.builder()
                .invitedAt(now)
                .response(InvitationResponse.PENDING)
                .build());
        return true;
    }

    /**
     * Records a buyer-initiated request on a listing that was not targeting them.
     */
    public InvitationStatus addRequest(String buyerId, String notes, Instant now) {
        targetedBuyers.add(buyerId);
        InvitationStatus requested = InvitationStatus.builder()
                .invitedAt(now)
                .respondedAt(now)
                .response(InvitationResponse.REQUESTED)
                .decisionBy(ActorRole.BUYER)
                .notes(notes)
                .build();
        invitationStatus.put(buyerId, requested);
        return requested;
    }

    /**
     * Writes a response into the invitation map and updates the membership sets in the same
     * step. Buyers that are not yet targeted become targeted.
     */
    public InvitationStatus applyResponse(String buyerId, InvitationResponse response, ActorRole decisionBy,
            String notes, Instant now) {
        targetedBuyers.add(buyerId);
        InvitationStatus current = invitationStatus.get(buyerId);
        InvitationStatus updated = InvitationStatus.builder()
                .invitedAt(current != null && current.getInvitedAt() != null ? current.getInvitedAt() : now)
                .respondedAt(now)
                .response(response)
                .decisionBy(decisionBy)
                .notes(notes)
                .build();
        invitationStatus.put(buyerId, updated);

        if (response == InvitationResponse.ACCEPTED) {
            interestedBuyers.add(buyerId);
            everActiveBuyers.add(buyerId);
        } else {
            interestedBuyers.remove(buyerId);
        }
        return updated;
    }

    public void touch(Instant now) {
        if (timeline == null) {
            timeline = new Timeline();
        }
        timeline.setUpdatedAt(now);
    }

    public Instant updatedAt() {
        return timeline != null ? timeline.getUpdatedAt() : null;
    }
}
