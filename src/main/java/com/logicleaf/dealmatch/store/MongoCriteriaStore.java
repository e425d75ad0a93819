package com.logicleaf.dealmatch.store;

import com.logicleaf.dealmatch.exception.ResourceNotFoundException;
import com.logicleaf.dealmatch.model.BuyerCriteriaProfile;
import com.logicleaf.dealmatch.repository.BuyerCriteriaProfileRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Component
@RequiredArgsConstructor
public class MongoCriteriaStore implements CriteriaStore {

    private final BuyerCriteriaProfileRepository profileRepository;

    @Override
    public BuyerCriteriaProfile getProfile(String buyerId) {
        return profileRepository.findByBuyerId(buyerId)
                .orElseThrow(() -> new ResourceNotFoundException("Buyer profile not found for buyer " + buyerId));
    }

    @Override
    public Map<String, BuyerCriteriaProfile> findProfiles(Collection<String> buyerIds) {
        if (buyerIds.isEmpty()) {
            return Map.of();
        }
        return profileRepository.findByBuyerIdIn(buyerIds).stream()
                .collect(Collectors.toMap(BuyerCriteriaProfile::getBuyerId, Function.identity(), (a, b) -> a));
    }

    @Override
    public Stream<BuyerCriteriaProfile> streamCandidates(ProfileFilter filter) {
        if (filter.getCountries() == null || filter.getCountries().isEmpty() || filter.getIndustrySector() == null) {
            return Stream.empty();
        }
        return profileRepository.findByTargetCriteriaCountriesInAndTargetCriteriaIndustrySectorsIn(
                filter.getCountries(), List.of(filter.getIndustrySector()));
    }
}
