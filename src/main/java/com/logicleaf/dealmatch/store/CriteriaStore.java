package com.logicleaf.dealmatch.store;

import com.logicleaf.dealmatch.model.BuyerCriteriaProfile;

import java.util.Collection;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Read-only access to buyer acquisition criteria.
 */
public interface CriteriaStore {

    /**
     * @throws com.logicleaf.dealmatch.exception.ResourceNotFoundException if the buyer has no profile
     */
    BuyerCriteriaProfile getProfile(String buyerId);

    /**
     * Profiles keyed by buyer id; buyers without a profile are simply absent.
     */
    Map<String, BuyerCriteriaProfile> findProfiles(Collection<String> buyerIds);

    /**
     * Candidate profiles for matching. The caller must close the stream.
     */
    Stream<BuyerCriteriaProfile> streamCandidates(ProfileFilter filter);
}
