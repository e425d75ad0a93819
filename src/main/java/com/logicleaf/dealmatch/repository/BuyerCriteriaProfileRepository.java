package com.logicleaf.dealmatch.repository;

import com.logicleaf.dealmatch.model.BuyerCriteriaProfile;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

@Repository
public interface BuyerCriteriaProfileRepository extends MongoRepository<BuyerCriteriaProfile, String> {
    Optional<BuyerCriteriaProfile> findByBuyerId(String buyerId);

    List<BuyerCriteriaProfile> findByBuyerIdIn(Collection<String> buyerIds);

    Stream<BuyerCriteriaProfile> findByTargetCriteriaCountriesInAndTargetCriteriaIndustrySectorsIn(
            Collection<String> countries, Collection<String> industrySectors);
}
