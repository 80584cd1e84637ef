/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.conversation;

import villagecompute.tradebot.api.types.InboundEvent;
import villagecompute.tradebot.api.types.Selection;
import villagecompute.tradebot.data.models.ConversationState;
import villagecompute.tradebot.data.models.Listing;
import villagecompute.tradebot.data.models.ListingStatus;
import villagecompute.tradebot.data.models.MarketplaceUser;
import villagecompute.tradebot.data.models.Review;

import java.util.Map;
import java.util.Optional;

/**
 * Target resolution shared by the admin conversations.
 */
final class AdminTargets {

    static final String TARGET_USER_ID = "target_user_id";
    static final String TARGET_LISTING_ID = "target_listing_id";
    static final String TARGET_REVIEW_ID = "target_review_id";
    static final String REASON = "reason";

    static final int REASON_MIN = 3;
    static final int REASON_MAX = 500;

    private AdminTargets() {
    }

    /**
     * Start plan for {@code tag} or {@code tag:<id>}: the id, when present, is fed as the first input.
     */
    static StartPlan beginAt(RuleContext context, Selection selection,
            ConversationState targetState) {
        if (selection != null && selection.arity() == 1) {
            return StartPlan.feeding(targetState, InboundEvent.text(context.principal().id(), selection.param(0)));
        }
        return StartPlan.at(targetState);
    }

    /**
     * Accepts the id of an existing user other than the actor.
     */
    static Validation user(RuleContext context, InboundEvent event) {
        Optional<Long> id = Inputs.id(event);
        if (id.isEmpty()) {
            return Validation.reject("Please send the numeric user id.");
        }
        long userId = id.get();
        if (userId == context.principal().id()) {
            return Validation.reject("You cannot target yourself.");
        }
        Optional<MarketplaceUser> user = context.lookup("find_user", store -> store.findUser(userId));
        if (user.isEmpty()) {
            return Validation.reject("User #" + userId + " was not found.");
        }
        return Validation.accept(userId);
    }

    /**
     * Accepts the id of an existing listing that has not been deleted.
     */
    static Validation listing(RuleContext context, InboundEvent event) {
        Optional<Long> id = Inputs.id(event);
        if (id.isEmpty()) {
            return Validation.reject("Please send the numeric listing id.");
        }
        long listingId = id.get();
        Optional<Listing> listing = context.lookup("find_listing", store -> store.findListing(listingId));
        if (listing.isEmpty() || listing.get().status == ListingStatus.DELETED) {
            return Validation.reject("Listing #" + listingId + " was not found.");
        }
        return Validation.accept(listingId);
    }

    /**
     * Accepts the id of an existing review.
     */
    static Validation review(RuleContext context, InboundEvent event) {
        Optional<Long> id = Inputs.id(event);
        if (id.isEmpty()) {
            return Validation.reject("Please send the numeric review id.");
        }
        long reviewId = id.get();
        Optional<Review> review = context.lookup("find_review", store -> store.findReview(reviewId));
        if (review.isEmpty()) {
            return Validation.reject("Review #" + reviewId + " was not found.");
        }
        return Validation.accept(reviewId);
    }

    static Validation reason(InboundEvent event) {
        return Inputs.boundedText(event, "reason", REASON_MIN, REASON_MAX);
    }

    static long targetUser(Map<String, Object> payload) {
        return (Long) payload.get(TARGET_USER_ID);
    }

    static long targetListing(Map<String, Object> payload) {
        return (Long) payload.get(TARGET_LISTING_ID);
    }

    static long targetReview(Map<String, Object> payload) {
        return (Long) payload.get(TARGET_REVIEW_ID);
    }
}
