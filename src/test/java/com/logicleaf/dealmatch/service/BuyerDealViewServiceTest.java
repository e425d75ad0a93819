package com.logicleaf.dealmatch.service;

import com.logicleaf.dealmatch.model.Actor;
import com.logicleaf.dealmatch.model.BuyerBucket;
import com.logicleaf.dealmatch.model.BuyerDecision;
import com.logicleaf.dealmatch.model.Listing;
import com.logicleaf.dealmatch.model.ListingStatus;
import com.logicleaf.dealmatch.model.Timeline;
import com.logicleaf.dealmatch.store.DirectUnitOfWork;
import com.logicleaf.dealmatch.store.InMemoryListingStore;
import com.logicleaf.dealmatch.support.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ExtendWith(MockitoExtension.class)
class BuyerDealViewServiceTest {

    private static final Actor OWNER = Actor.seller(Fixtures.SELLER);

    @Mock
    private InteractionLedgerService ledger;

    @Mock
    private ApplicationEventPublisher events;

    private InMemoryListingStore listingStore;
    private InvitationService invitationService;
    private BuyerDealViewService viewService;
    private final ConsistencyChecker consistencyChecker = new ConsistencyChecker();

    @BeforeEach
    void setUp() {
        listingStore = new InMemoryListingStore();
        invitationService = new InvitationService(listingStore, new DirectUnitOfWork(), ledger, events,
                Clock.fixed(Fixtures.NOW, ZoneOffset.UTC));
        viewService = new BuyerDealViewService(listingStore);
    }

    @Test
    void everyTargetedBuyerLandsInExactlyOneBucketAfterAnySequence() {
        listingStore.save(Fixtures.activeListing("deal-1"));
        List<String> buyers = List.of("b1", "b2", "b3");
        invitationService.target("deal-1", buyers, OWNER);
        BuyerDecision[] decisions = BuyerDecision.values();
        Random random = new Random(42);

        for (int step = 0; step < 60; step++) {
            String buyer = buyers.get(random.nextInt(buyers.size()));
            BuyerDecision decision = decisions[random.nextInt(decisions.length)];
            if (random.nextBoolean()) {
                invitationService.respond("deal-1", buyer, decision, null, Actor.buyer(buyer));
            } else {
                invitationService.adminOverride("deal-1", buyer, decision, null, Actor.admin("admin-1"));
            }

            Listing listing = listingStore.getById("deal-1");
            assertTrue(consistencyChecker.check(listing).isEmpty());
            for (String b : buyers) {
                Optional<BuyerBucket> bucket = viewService.bucketFor(listing, b);
                assertTrue(bucket.isPresent());
                long tabsShowingListing = Arrays.stream(BuyerBucket.values())
                        .filter(tab -> viewService.listingsForBuyer(b, tab).contains(listing))
                        .count();
                assertEquals(1, tabsShowingListing);
            }
        }
    }

    @Test
    void bucketsFollowResponses() {
        listingStore.save(Fixtures.activeListing("deal-1"));
        invitationService.target("deal-1", List.of("b1", "b2", "b3"), OWNER);
        invitationService.respond("deal-1", "b1", BuyerDecision.ACTIVE, null, Actor.buyer("b1"));
        invitationService.respond("deal-1", "b2", BuyerDecision.REJECTED, null, Actor.buyer("b2"));

        Listing listing = listingStore.getById("deal-1");
        assertEquals(Optional.of(BuyerBucket.ACTIVE), viewService.bucketFor(listing, "b1"));
        assertEquals(Optional.of(BuyerBucket.REJECTED), viewService.bucketFor(listing, "b2"));
        assertEquals(Optional.of(BuyerBucket.PENDING), viewService.bucketFor(listing, "b3"));
        assertEquals(Optional.empty(), viewService.bucketFor(listing, "stranger"));
    }

    @Test
    void completedListingsOnlyShowToInterestedBuyers() {
        listingStore.save(Fixtures.activeListing("deal-1"));
        invitationService.target("deal-1", List.of("b1", "b2"), OWNER);
        invitationService.respond("deal-1", "b1", BuyerDecision.ACTIVE, null, Actor.buyer("b1"));
        listingStore.getById("deal-1").setStatus(ListingStatus.COMPLETED);

        Listing listing = listingStore.getById("deal-1");
        assertEquals(Optional.of(BuyerBucket.COMPLETED), viewService.bucketFor(listing, "b1"));
        assertEquals(Optional.empty(), viewService.bucketFor(listing, "b2"));
        assertEquals(List.of(listing), viewService.listingsForBuyer("b1", BuyerBucket.COMPLETED));
        assertTrue(viewService.listingsForBuyer("b2", BuyerBucket.PENDING).isEmpty());
    }

    @Test
    void listingsAreOrderedByMostRecentUpdate() {
        Listing older = Fixtures.activeListing("deal-old");
        older.setTimeline(Timeline.builder().updatedAt(Fixtures.NOW.minusSeconds(7200)).build());
        Listing newer = Fixtures.activeListing("deal-new");
        newer.setTimeline(Timeline.builder().updatedAt(Fixtures.NOW.minusSeconds(60)).build());
        older.addTarget("b1", Fixtures.NOW);
        newer.addTarget("b1", Fixtures.NOW);
        listingStore.save(older);
        listingStore.save(newer);

        List<Listing> pending = viewService.listingsForBuyer("b1", BuyerBucket.PENDING);

        assertEquals(List.of("deal-new", "deal-old"), pending.stream().map(Listing::getId).toList());
        Map<BuyerBucket, Long> counts = viewService.countsForBuyer("b1");
        assertEquals(2L, counts.get(BuyerBucket.PENDING));
        assertEquals(0L, counts.get(BuyerBucket.ACTIVE));
    }
}
