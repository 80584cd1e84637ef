/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.conversation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;

import io.quarkus.test.junit.QuarkusTest;
import villagecompute.tradebot.BaseConversationTest;
import villagecompute.tradebot.api.types.ActionType;
import villagecompute.tradebot.api.types.OutboundAction;
import villagecompute.tradebot.data.models.ConversationKind;
import villagecompute.tradebot.data.models.ConversationState;
import villagecompute.tradebot.data.models.Listing;
import villagecompute.tradebot.data.models.ListingStatus;

/**
 * Owner mark-sold and delete flows.
 */
@QuarkusTest
class ListingStatusConversationTest extends BaseConversationTest {

    @Test
    void testMarkSold() {
        Listing listing = seedListing(SELLER, "Road bike", "300.00", "sports");

        List<OutboundAction> prompt = select(SELLER, "mark_sold:" + listing.id);

        assertType(ActionType.PROMPT, prompt);
        assertEquals("Mark \"Road bike\" as sold?", prompt.get(0).content());
        assertEquals(ConversationKind.LISTING_STATUS, session(SELLER).orElseThrow().kind());
        assertEquals(ConversationState.CONFIRM, session(SELLER).orElseThrow().state());

        List<OutboundAction> actions = select(SELLER, "confirm:yes");

        assertType(ActionType.CONFIRMATION, actions);
        Listing stored = store.findListing(listing.id).orElseThrow();
        assertEquals(ListingStatus.SOLD, stored.status);
        assertTrue(session(SELLER).isEmpty());
        assertTrue(store.recentAudit(10, null, null).isEmpty(), "owner actions are not moderation");
    }

    @Test
    void testSoldListingLeavesSearch() {
        Listing listing = seedListing(SELLER, "Road bike", "300.00", "sports");
        seedListing(SELLER, "Kids bike", "40.00", "sports");
        select(SELLER, "mark_sold:" + listing.id);
        send(SELLER, "yes");

        send(BUYER, "/search");
        send(BUYER, "bike");
        send(BUYER, "all");
        send(BUYER, "skip");
        String result = send(BUYER, "skip").get(0).content();

        assertTrue(result.startsWith("Found 1 listing:"), result);
        assertFalse(result.contains("Road bike"));
    }

    @Test
    void testOwnerDeletesListing() {
        Listing listing = seedListing(SELLER, "Old sofa", "50.00", "home");

        List<OutboundAction> prompt = select(SELLER, "delete_listing:" + listing.id);
        assertEquals("Delete \"Old sofa\"? This cannot be undone.", prompt.get(0).content());
        List<OutboundAction> actions = select(SELLER, "confirm:yes");

        assertType(ActionType.CONFIRMATION, actions);
        assertEquals(ListingStatus.DELETED, store.findListing(listing.id).orElseThrow().status);
        assertType(ActionType.NOTICE, select(SELLER, "mark_sold:" + listing.id));
    }

    @Test
    void testOtherUserCannotChangeListing() {
        Listing listing = seedListing(SELLER, "Old sofa", "50.00", "home");

        List<OutboundAction> sold = select(BUYER, "mark_sold:" + listing.id);
        List<OutboundAction> deleted = select(BUYER, "delete_listing:" + listing.id);

        assertType(ActionType.NOTICE, sold);
        assertEquals("You can only change your own listings.", sold.get(0).content());
        assertType(ActionType.NOTICE, deleted);
        assertTrue(session(BUYER).isEmpty());
        assertEquals(ListingStatus.ACTIVE, store.findListing(listing.id).orElseThrow().status);
    }

    @Test
    void testAlreadySoldIsRefused() {
        Listing listing = seedListing(SELLER, "Road bike", "300.00", "sports");
        Listing stored = store.findListing(listing.id).orElseThrow();
        stored.markSold(Instant.now());
        store.updateListing(stored);

        List<OutboundAction> actions = select(SELLER, "mark_sold:" + listing.id);

        assertType(ActionType.NOTICE, actions);
        assertEquals("That listing is already marked as sold.", actions.get(0).content());
        assertTrue(session(SELLER).isEmpty());
    }

    @Test
    void testDecliningKeepsListing() {
        Listing listing = seedListing(SELLER, "Road bike", "300.00", "sports");
        select(SELLER, "delete_listing:" + listing.id);

        assertType(ActionType.ERROR, send(SELLER, "maybe"));
        assertEquals(ConversationState.CONFIRM, session(SELLER).orElseThrow().state());
        List<OutboundAction> actions = send(SELLER, "no");

        assertType(ActionType.NOTICE, actions);
        assertEquals(ListingStatus.ACTIVE, store.findListing(listing.id).orElseThrow().status);
        assertTrue(session(SELLER).isEmpty());
    }

    @Test
    void testListingDeletedBeforeConfirmation() {
        Listing listing = seedListing(SELLER, "Road bike", "300.00", "sports");
        select(SELLER, "mark_sold:" + listing.id);
        Listing stored = store.findListing(listing.id).orElseThrow();
        stored.markDeleted(Instant.now());
        store.updateListing(stored);

        List<OutboundAction> actions = select(SELLER, "confirm:yes");

        assertType(ActionType.ERROR, actions);
        assertEquals("That item is no longer available.", actions.get(0).content());
        assertEquals(ListingStatus.DELETED, store.findListing(listing.id).orElseThrow().status);
    }
}
