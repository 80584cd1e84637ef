/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.conversation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.quarkus.test.junit.QuarkusTest;
import villagecompute.tradebot.BaseConversationTest;
import villagecompute.tradebot.api.types.ActionType;
import villagecompute.tradebot.api.types.OutboundAction;
import villagecompute.tradebot.data.models.AuditEntry;
import villagecompute.tradebot.data.models.ConversationState;
import villagecompute.tradebot.data.models.Listing;
import villagecompute.tradebot.data.models.ListingStatus;
import villagecompute.tradebot.data.models.MarketplaceUser;
import villagecompute.tradebot.data.models.Review;
import villagecompute.tradebot.data.models.Role;
import villagecompute.tradebot.data.models.Warning;
import villagecompute.tradebot.data.models.WarningSeverity;

/**
 * Admin conversations from start signal to audited mutation.
 */
@QuarkusTest
class AdminConversationsTest extends BaseConversationTest {

    @BeforeEach
    void seedUsers() {
        store.saveUser(MarketplaceUser.create(SELLER, Role.NONE, Instant.now()));
        store.saveUser(MarketplaceUser.create(BUYER, Role.NONE, Instant.now()));
    }

    @Test
    void testBlockByTextCommand() {
        send(BUYER, "/search");

        assertType(ActionType.PROMPT, send(ADMIN, "/block"));
        assertEquals(ConversationState.TARGET_USER, session(ADMIN).orElseThrow().state());
        send(ADMIN, "#" + BUYER);
        List<OutboundAction> actions = send(ADMIN, "Repeated spam");

        assertType(ActionType.CONFIRMATION, actions);
        assertEquals("User #" + BUYER + " has been blocked.", actions.get(0).content());
        assertFalse(store.findUser(BUYER).orElseThrow().active);
        assertTrue(session(BUYER).isEmpty(), "blocked user's session must be discarded");

        AuditEntry entry = store.recentAudit(10, null, null).get(0);
        assertEquals("block_user", entry.action());
        assertEquals("Repeated spam", entry.detail().get("reason"));
    }

    @Test
    void testBlockRejectsSelfAndAlreadyBlocked() {
        select(ADMIN, "admin_block");

        assertType(ActionType.ERROR, send(ADMIN, String.valueOf(ADMIN)));

        MarketplaceUser buyer = store.findUser(BUYER).orElseThrow();
        buyer.block("earlier");
        store.saveUser(buyer);
        List<OutboundAction> actions = send(ADMIN, String.valueOf(BUYER));

        assertType(ActionType.ERROR, actions);
        assertEquals("User #" + BUYER + " is already blocked.", actions.get(0).content());
        assertEquals(ConversationState.TARGET_USER, session(ADMIN).orElseThrow().state());
    }

    @Test
    void testBlockUnknownUser() {
        select(ADMIN, "admin_block");

        List<OutboundAction> actions = send(ADMIN, "987654");

        assertEquals("User #987654 was not found.", actions.get(0).content());
    }

    @Test
    void testModeratorWarnsUser() {
        select(MODERATOR, "admin_warn:" + SELLER);
        assertEquals(ConversationState.SEVERITY, session(MODERATOR).orElseThrow().state());

        assertType(ActionType.ERROR, select(MODERATOR, "severity:extreme"));
        select(MODERATOR, "severity:medium");
        List<OutboundAction> actions = send(MODERATOR, "Misleading photos");

        assertType(ActionType.CONFIRMATION, actions);
        Warning warning = store.warnings().get(0);
        assertEquals(SELLER, warning.userId);
        assertEquals(MODERATOR, warning.adminId);
        assertEquals(WarningSeverity.MEDIUM, warning.severity);
        assertNotNull(warning.expiresAt);
        assertEquals(1, store.findUser(SELLER).orElseThrow().warningCount);
        assertEquals("warn_user", store.recentAudit(10, null, null).get(0).action());
    }

    @Test
    void testDeleteListingAfterConfirmation() {
        Listing listing = seedListing(SELLER, "Fake tickets", "60.00", "other");

        select(ADMIN, "admin_delete:" + listing.id);
        send(ADMIN, "Fraudulent listing");
        assertEquals(ConversationState.CONFIRM, session(ADMIN).orElseThrow().state());
        List<OutboundAction> actions = select(ADMIN, "confirm:yes");

        assertType(ActionType.CONFIRMATION, actions);
        assertEquals(ListingStatus.DELETED, store.findListing(listing.id).orElseThrow().status);
        AuditEntry entry = store.recentAudit(10, null, null).get(0);
        assertEquals("delete_listing", entry.action());
        assertEquals(listing.id, entry.targetId());
    }

    @Test
    void testDeleteDeclinedLeavesListing() {
        Listing listing = seedListing(SELLER, "Fake tickets", "60.00", "other");

        select(ADMIN, "admin_delete:" + listing.id);
        send(ADMIN, "Fraudulent listing");
        List<OutboundAction> actions = send(ADMIN, "no");

        assertType(ActionType.NOTICE, actions);
        assertEquals(ListingStatus.ACTIVE, store.findListing(listing.id).orElseThrow().status);
        assertTrue(store.recentAudit(10, null, null).isEmpty());
        assertTrue(session(ADMIN).isEmpty());
    }

    @Test
    void testModeratorCannotDelete() {
        List<OutboundAction> actions = send(MODERATOR, "/delete");

        assertType(ActionType.ERROR, actions);
        assertTrue(session(MODERATOR).isEmpty());
    }

    @Test
    void testDeletedListingCannotBeFlagged() {
        Listing listing = seedListing(SELLER, "Old bike", "60.00", "sports");
        Listing stored = store.findListing(listing.id).orElseThrow();
        stored.markDeleted(Instant.now());
        store.updateListing(stored);

        select(MODERATOR, "admin_flag");
        List<OutboundAction> actions = send(MODERATOR, String.valueOf(listing.id));

        assertType(ActionType.ERROR, actions);
        assertEquals(ConversationState.TARGET_LISTING, session(MODERATOR).orElseThrow().state());
    }

    @Test
    void testFilterBlockedUsers() {
        MarketplaceUser buyer = store.findUser(BUYER).orElseThrow();
        buyer.block("spam");
        store.saveUser(buyer);

        send(ADMIN, "/filter");
        select(ADMIN, "scope:users");
        List<OutboundAction> actions = select(ADMIN, "filter:blocked");

        assertType(ActionType.RESULT, actions);
        String result = actions.get(0).content();
        assertTrue(result.contains("#" + BUYER + " none BLOCKED"), result);
        assertFalse(result.contains("#" + SELLER + " "));
        assertTrue(session(ADMIN).isEmpty());
        assertTrue(store.recentAudit(10, null, null).isEmpty(), "filtering is not audited");
    }

    @Test
    void testFilterFlaggedListings() {
        Listing listing = seedListing(SELLER, "Replica bag", "30.00", "clothing");
        seedListing(SELLER, "Plain bag", "20.00", "clothing");
        Listing stored = store.findListing(listing.id).orElseThrow();
        stored.flag("Counterfeit", Instant.now());
        store.updateListing(stored);

        send(MODERATOR, "/filter");
        send(MODERATOR, "listings");
        String result = send(MODERATOR, "flagged").get(0).content();

        assertTrue(result.contains("Replica bag"));
        assertTrue(result.contains("flagged: Counterfeit"));
        assertFalse(result.contains("Plain bag"));
    }

    @Test
    void testModeratorCannotViewUsersOrAudit() {
        send(MODERATOR, "/filter");

        List<OutboundAction> users = select(MODERATOR, "scope:users");
        assertType(ActionType.ERROR, users);
        List<OutboundAction> audit = select(MODERATOR, "scope:audit");
        assertType(ActionType.ERROR, audit);
        assertEquals(ConversationState.SCOPE, session(MODERATOR).orElseThrow().state());
    }

    @Test
    void testFilterAuditByAction() {
        Listing listing = seedListing(SELLER, "Odd item", "5.00", "other");
        select(MODERATOR, "admin_flag:" + listing.id);
        send(MODERATOR, "Needs review");

        send(SUPER_ADMIN, "/filter");
        send(SUPER_ADMIN, "audit");
        String result = send(SUPER_ADMIN, "flag_listing").get(0).content();

        assertTrue(result.startsWith("Audit log (flag_listing):"), result);
        assertTrue(result.contains("flag_listing listing#" + listing.id), result);
    }

    @Test
    void testFilterRejectsCriteriaOfOtherScope() {
        send(ADMIN, "/filter");
        send(ADMIN, "users");

        List<OutboundAction> actions = send(ADMIN, "flagged");

        assertType(ActionType.ERROR, actions);
        assertEquals(ConversationState.CRITERIA, session(ADMIN).orElseThrow().state());
    }

    @Test
    void testDeleteReviewAfterConfirmation() {
        Review review = seedReview(2);

        select(ADMIN, "admin_review_delete:" + review.id);
        assertEquals(ConversationState.CONFIRM, session(ADMIN).orElseThrow().state());
        List<OutboundAction> actions = select(ADMIN, "confirm:yes");

        assertType(ActionType.CONFIRMATION, actions);
        assertEquals("Review #" + review.id + " has been removed.", actions.get(0).content());
        assertTrue(store.findReview(review.id).isEmpty());
        assertTrue(session(ADMIN).isEmpty());

        AuditEntry entry = store.recentAudit(10, null, null).get(0);
        assertEquals("review_delete", entry.action());
        assertEquals("review", entry.targetType());
        assertEquals(review.id, entry.targetId());
        assertEquals(SELLER, ((Number) entry.detail().get("seller_id")).longValue());
        assertEquals(BUYER, ((Number) entry.detail().get("reviewer_id")).longValue());
        assertEquals(2, ((Number) entry.detail().get("rating")).intValue());
    }

    @Test
    void testModeratorDeletesReviewByTextCommand() {
        Review review = seedReview(1);

        assertType(ActionType.PROMPT, send(MODERATOR, "/deletereview"));
        assertEquals(ConversationState.TARGET_REVIEW, session(MODERATOR).orElseThrow().state());
        assertType(ActionType.ERROR, send(MODERATOR, "987654"));
        send(MODERATOR, "#" + review.id);
        assertType(ActionType.CONFIRMATION, send(MODERATOR, "yes"));

        assertTrue(store.findReview(review.id).isEmpty());
    }

    @Test
    void testDeleteReviewDeclinedLeavesReview() {
        Review review = seedReview(3);

        select(ADMIN, "admin_review_delete:" + review.id);
        List<OutboundAction> actions = select(ADMIN, "confirm:no");

        assertType(ActionType.NOTICE, actions);
        assertTrue(store.findReview(review.id).isPresent());
        assertTrue(store.recentAudit(10, null, null).isEmpty());
        assertTrue(session(ADMIN).isEmpty());
    }

    @Test
    void testReviewRemovedBeforeConfirmation() {
        Review review = seedReview(5);

        select(ADMIN, "admin_review_delete:" + review.id);
        store.deleteReview(review.id);
        List<OutboundAction> actions = select(ADMIN, "confirm:yes");

        assertType(ActionType.ERROR, actions);
        assertEquals("That item is no longer available.", actions.get(0).content());
        assertTrue(session(ADMIN).isEmpty());
        assertTrue(store.recentAudit(10, null, null).isEmpty());
    }

    @Test
    void testUserWithoutRoleCannotDeleteReviews() {
        Review review = seedReview(1);

        List<OutboundAction> actions = select(SELLER, "admin_review_delete:" + review.id);

        assertType(ActionType.ERROR, actions);
        assertTrue(session(SELLER).isEmpty());
        assertTrue(store.findReview(review.id).isPresent());
    }

    @Test
    void testFilterSoldListings() {
        Listing sold = seedListing(SELLER, "Sold lamp", "15.00", "home");
        seedListing(SELLER, "Unsold lamp", "15.00", "home");
        Listing stored = store.findListing(sold.id).orElseThrow();
        stored.markSold(Instant.now());
        store.updateListing(stored);

        send(ADMIN, "/filter");
        send(ADMIN, "listings");
        List<OutboundAction> actions = send(ADMIN, "sold");

        assertType(ActionType.RESULT, actions);
        assertTrue(actions.get(0).content().contains("Sold lamp"));
        assertFalse(actions.get(0).content().contains("Unsold lamp"));
    }

    private Review seedReview(int rating) {
        Listing listing = seedListing(SELLER, "Desk chair", "40.00", "home");
        Review review = new Review();
        review.listingId = listing.id;
        review.sellerId = SELLER;
        review.reviewerId = BUYER;
        review.rating = rating;
        review.comment = "Rude and late";
        return store.createReview(review);
    }
}
