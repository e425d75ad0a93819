package com.logicleaf.dealmatch.service;

import com.logicleaf.dealmatch.dto.InteractionSummaryDTO;
import com.logicleaf.dealmatch.dto.RecentActionDTO;
import com.logicleaf.dealmatch.model.BuyerCriteriaProfile;
import com.logicleaf.dealmatch.model.EngagementStatus;
import com.logicleaf.dealmatch.model.InteractionRecord;
import com.logicleaf.dealmatch.model.InteractionType;
import com.logicleaf.dealmatch.repository.InteractionRecordRepository;
import com.logicleaf.dealmatch.store.CriteriaStore;
import com.logicleaf.dealmatch.store.ListingStore;
import com.logicleaf.dealmatch.support.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class InteractionLedgerServiceTest {

    @Mock
    private InteractionRecordRepository interactionRecordRepository;

    @Mock
    private ListingStore listingStore;

    @Mock
    private CriteriaStore criteriaStore;

    @InjectMocks
    private InteractionLedgerService ledger;

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(ledger, "defaultRecentLimit", 20);
    }

    @Test
    void appendInsertsImmutableRecord() {
        when(interactionRecordRepository.insert(any(InteractionRecord.class))).thenAnswer(inv -> inv.getArgument(0));

        InteractionRecord record = ledger.append("deal-1", "b1", InteractionType.INTEREST, "note",
                Map.of("status", "active"), Fixtures.NOW);

        assertEquals("deal-1", record.getListingId());
        assertEquals(InteractionType.INTEREST, record.getInteractionType());
        assertEquals("active", record.getMetadata().get("status"));
        verify(interactionRecordRepository).insert(any(InteractionRecord.class));
    }

    @Test
    void currentStatusComesFromLatestRecord() {
        when(interactionRecordRepository.findFirstByListingIdAndBuyerIdOrderByTimestampDesc("deal-1", "b1"))
                .thenReturn(Optional.of(record("r1", "b1", InteractionType.COMPLETED)));
        when(interactionRecordRepository.findFirstByListingIdAndBuyerIdOrderByTimestampDesc("deal-1", "b2"))
                .thenReturn(Optional.empty());

        assertEquals(Optional.of(EngagementStatus.COMPLETED), ledger.currentStatusFromLedger("deal-1", "b1"));
        assertEquals(Optional.empty(), ledger.currentStatusFromLedger("deal-1", "b2"));
    }

    @Test
    void recentActionsAreLimitedToBuyerActionsAndEnriched() {
        when(listingStore.findBySellerId(Fixtures.SELLER)).thenReturn(List.of(Fixtures.activeListing("deal-1")));
        ArgumentCaptor<Collection<InteractionType>> types = ArgumentCaptor.forClass(Collection.class);
        ArgumentCaptor<Pageable> page = ArgumentCaptor.forClass(Pageable.class);
        when(interactionRecordRepository.findByListingIdInAndInteractionTypeInOrderByTimestampDesc(anyCollection(),
                types.capture(), page.capture()))
                .thenReturn(List.of(record("r2", "b1", InteractionType.REJECTED),
                        record("r1", "b1", InteractionType.INTEREST)));
        BuyerCriteriaProfile profile = Fixtures.profile("b1", List.of("France"), List.of("SaaS"));
        when(criteriaStore.findProfiles(anyCollection())).thenReturn(Map.of("b1", profile));

        List<RecentActionDTO> actions = ledger.recentForSeller(Fixtures.SELLER);

        assertEquals(20, page.getValue().getPageSize());
        assertTrue(types.getValue().containsAll(List.of(InteractionType.INTEREST, InteractionType.REJECTED,
                InteractionType.VIEW)));
        assertEquals(3, types.getValue().size());
        assertEquals("Rejected Deal", actions.get(0).getActionDescription());
        assertEquals("red", actions.get(0).getActionColor());
        assertEquals("Activated Deal", actions.get(1).getActionDescription());
        assertEquals("Listing deal-1", actions.get(0).getListingTitle());
        assertEquals("Company b1", actions.get(0).getBuyerCompany());
    }

    @Test
    void sellerWithoutListingsHasNoRecentActions() {
        when(listingStore.findBySellerId("nobody")).thenReturn(List.of());

        assertTrue(ledger.recentForSeller("nobody", 5).isEmpty());
        verifyNoInteractions(interactionRecordRepository, criteriaStore);
    }

    @Test
    void summaryZeroFillsEveryType() {
        when(interactionRecordRepository.findByListingIdOrderByTimestampDesc(eq("deal-1"))).thenReturn(List.of(
                record("r3", "b2", InteractionType.INTEREST),
                record("r2", "b1", InteractionType.INTEREST),
                record("r1", "b1", InteractionType.VIEW)));

        InteractionSummaryDTO summary = ledger.summaryForListing("deal-1");

        assertEquals(3, summary.getTotalInteractions());
        assertEquals(2, summary.getUniqueBuyers());
        assertEquals(2L, summary.getCountsByType().get(InteractionType.INTEREST));
        assertEquals(2L, summary.getUniqueBuyersByType().get(InteractionType.INTEREST));
        assertEquals(0L, summary.getCountsByType().get(InteractionType.REJECTED));
        assertEquals(0L, summary.getCountsByType().get(InteractionType.COMPLETED));
    }

    private static InteractionRecord record(String id, String buyerId, InteractionType type) {
        return InteractionRecord.builder()
                .id(id)
                .listingId("deal-1")
                .buyerId(buyerId)
                .interactionType(type)
                .timestamp(Fixtures.NOW)
                .build();
    }
}
