package com.logicleaf.dealmatch.service;

import com.logicleaf.dealmatch.dto.ConsistencyWarning;
import com.logicleaf.dealmatch.dto.ConsistencyWarning.Kind;
import com.logicleaf.dealmatch.model.InvitationResponse;
import com.logicleaf.dealmatch.model.InvitationStatus;
import com.logicleaf.dealmatch.model.Listing;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reports listings whose stored sets drifted from the invitation map. Reads only; repairs are
 * left to an operator.
 */
@Slf4j
@Component
public class ConsistencyChecker {

    public List<ConsistencyWarning> check(Listing listing) {
        List<ConsistencyWarning> warnings = new ArrayList<>();
        Map<String, InvitationStatus> invitations = listing.getInvitationStatus();

        for (String buyerId : listing.getInterestedBuyers()) {
            InvitationStatus invitation = invitations.get(buyerId);
            if (invitation == null || invitation.getResponse() != InvitationResponse.ACCEPTED) {
                warnings.add(warning(listing, buyerId, Kind.INTERESTED_WITHOUT_ACCEPTANCE,
                        "Buyer is interested but invitation is "
                                + (invitation == null ? "missing" : invitation.getResponse())));
            }
            if (!listing.getEverActiveBuyers().contains(buyerId)) {
                warnings.add(warning(listing, buyerId, Kind.INTERESTED_NEVER_ACTIVE,
                        "Interested buyer missing from everActiveBuyers"));
            }
        }

        invitations.forEach((buyerId, invitation) -> {
            if (invitation != null && invitation.getResponse() == InvitationResponse.ACCEPTED
                    && !listing.isInterested(buyerId)) {
                warnings.add(warning(listing, buyerId, Kind.ACCEPTED_NOT_INTERESTED,
                        "Invitation accepted but buyer not in interestedBuyers"));
            }
            if (!listing.isTargeted(buyerId)) {
                warnings.add(warning(listing, buyerId, Kind.INVITATION_NOT_TARGETED,
                        "Invitation exists for a buyer that is not targeted"));
            }
        });

        warnings.forEach(w -> log.warn("Listing {} inconsistent for buyer {}: {}", w.getListingId(),
                w.getBuyerId(), w.getMessage()));
        return warnings;
    }

    private static ConsistencyWarning warning(Listing listing, String buyerId, Kind kind, String message) {
        return ConsistencyWarning.builder()
                .listingId(listing.getId())
                .buyerId(buyerId)
                .kind(kind)
                .message(message)
                .build();
    }
}
