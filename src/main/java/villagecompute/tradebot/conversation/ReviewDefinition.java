/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.conversation;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;
import villagecompute.tradebot.api.types.InboundEvent;
import villagecompute.tradebot.api.types.Selection;
import villagecompute.tradebot.conversation.SelectionSignature.ParamType;
import villagecompute.tradebot.data.models.ConversationKind;
import villagecompute.tradebot.data.models.Listing;
import villagecompute.tradebot.data.models.Review;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static villagecompute.tradebot.data.models.ConversationState.COMMENT;
import static villagecompute.tradebot.data.models.ConversationState.RATING;

/**
 * Seller review left by a buyer, entered with {@code leave_review:<listingId>}.
 */
@ApplicationScoped
public class ReviewDefinition implements ConversationDefinition {

    private static final Logger LOG = Logger.getLogger(ReviewDefinition.class);

    private static final ConversationKind KIND = ConversationKind.REVIEW;

    static final String SELLER_ID = "seller_id";
    static final String RATING_KEY = "rating";
    static final String COMMENT_KEY = "comment";
    static final int COMMENT_MAX = 500;

    @Override
    public ConversationKind kind() {
        return KIND;
    }

    @Override
    public List<SelectionSignature> startSignatures() {
        return List.of(SelectionSignature.of("leave_review", ParamType.NUMBER));
    }

    @Override
    public StartPlan begin(RuleContext context, Selection selection) {
        long listingId = selection.number(0);
        Optional<Listing> listing = context.lookup("find_listing", store -> store.findListing(listingId));
        if (listing.isEmpty()) {
            return StartPlan.rejected("Listing #" + listingId + " was not found.");
        }
        if (listing.get().isOwnedBy(context.principal().id())) {
            return StartPlan.rejected("You cannot review your own listing.");
        }
        Map<String, Object> seed = new LinkedHashMap<>();
        seed.put(ListingFields.LISTING_ID, listingId);
        seed.put(SELLER_ID, listing.get().sellerId);
        return StartPlan.at(RATING, seed);
    }

    @Override
    public List<StateRule> rules() {
        return List.of(
                StateRule.input(KIND, RATING).prompt("How would you rate the seller, from 1 to 5?")
                        .suggest("rating:1", "rating:2", "rating:3", "rating:4", "rating:5")
                        .validate((ctx, event) -> rating(event)).storesAs(RATING_KEY).then(COMMENT).build(),
                StateRule.input(KIND, COMMENT).prompt("Add a comment (up to 500 characters), or \"skip\".")
                        .suggest(Inputs.SKIP)
                        .validate((ctx, event) -> Inputs.isSkip(event)
                                ? Validation.accept(null)
                                : Inputs.boundedText(event, "comment", 1, COMMENT_MAX))
                        .storesAs(COMMENT_KEY).completesWith(Completion.commit(this::save)).build());
    }

    static Validation rating(InboundEvent event) {
        Optional<String> choice = Inputs.choice(event, RATING_KEY);
        if (choice.isPresent() && choice.get().matches("[1-5]")) {
            return Validation.accept(Integer.parseInt(choice.get()));
        }
        return Validation.reject("Please choose a rating from 1 to 5.");
    }

    private String save(RuleContext context, Map<String, Object> payload) {
        Review review = new Review();
        review.listingId = (Long) payload.get(ListingFields.LISTING_ID);
        review.sellerId = (Long) payload.get(SELLER_ID);
        review.reviewerId = context.principal().id();
        review.rating = (Integer) payload.get(RATING_KEY);
        review.comment = (String) payload.get(COMMENT_KEY);
        review.createdAt = context.now();
        Review stored = context.store().createReview(review);
        LOG.infof("Review %d (%d stars) left by %d for seller %d", stored.id, stored.rating, stored.reviewerId,
                stored.sellerId);
        return "Thanks! Your " + stored.rating + "-star review has been saved.";
    }
}
