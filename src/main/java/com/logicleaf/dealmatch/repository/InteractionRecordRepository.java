package com.logicleaf.dealmatch.repository;

import com.logicleaf.dealmatch.model.InteractionRecord;
import com.logicleaf.dealmatch.model.InteractionType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface InteractionRecordRepository extends MongoRepository<InteractionRecord, String> {
    List<InteractionRecord> findByListingIdOrderByTimestampDesc(String listingId);

    List<InteractionRecord> findByListingIdAndBuyerIdOrderByTimestampDesc(String listingId, String buyerId);

    Optional<InteractionRecord> findFirstByListingIdAndBuyerIdOrderByTimestampDesc(String listingId, String buyerId);

    List<InteractionRecord> findByListingIdInAndInteractionTypeInOrderByTimestampDesc(Collection<String> listingIds,
            Collection<InteractionType> types, Pageable pageable);

    List<InteractionRecord> findByListingIdIn(Collection<String> listingIds);

    List<InteractionRecord> findByListingIdInAndTimestampGreaterThanEqual(Collection<String> listingIds,
            Instant since);
}
