package com.logicleaf.dealmatch.repository;

import com.logicleaf.dealmatch.model.Listing;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ListingRepository extends MongoRepository<Listing, String> {
    List<Listing> findBySellerId(String sellerId);

    List<Listing> findByTargetedBuyersContainingOrderByTimelineUpdatedAtDesc(String buyerId);
}
