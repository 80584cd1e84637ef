/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.conversation;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;
import villagecompute.tradebot.api.types.Selection;
import villagecompute.tradebot.conversation.SelectionSignature.ParamType;
import villagecompute.tradebot.data.models.ConversationKind;
import villagecompute.tradebot.data.models.Listing;
import villagecompute.tradebot.data.models.ListingStatus;
import villagecompute.tradebot.data.models.Session;
import villagecompute.tradebot.exceptions.ResourceNotFoundException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static villagecompute.tradebot.data.models.ConversationState.CONFIRM;

/**
 * Owner actions on their own listing, both confirmed before they are applied.
 *
 * <p>
 * <b>Entry Points:</b>
 * <ul>
 * <li>{@code mark_sold:<listingId>} - the listing leaves search as sold</li>
 * <li>{@code delete_listing:<listingId>} - the listing is soft-deleted</li>
 * </ul>
 */
@ApplicationScoped
public class ListingStatusDefinition implements ConversationDefinition {

    private static final Logger LOG = Logger.getLogger(ListingStatusDefinition.class);

    private static final ConversationKind KIND = ConversationKind.LISTING_STATUS;

    static final String MARK_SOLD = "mark_sold";
    static final String DELETE = "delete_listing";
    static final String ACTION_KEY = "owner_action";

    @Override
    public ConversationKind kind() {
        return KIND;
    }

    @Override
    public List<SelectionSignature> startSignatures() {
        return List.of(SelectionSignature.of(MARK_SOLD, ParamType.NUMBER),
                SelectionSignature.of(DELETE, ParamType.NUMBER));
    }

    @Override
    public StartPlan begin(RuleContext context, Selection selection) {
        long listingId = selection.number(0);
        Optional<Listing> listing = context.lookup("find_listing", store -> store.findListing(listingId));
        if (listing.isEmpty() || listing.get().status == ListingStatus.DELETED) {
            return StartPlan.rejected("Listing #" + listingId + " was not found.");
        }
        if (!listing.get().isOwnedBy(context.principal().id())) {
            LOG.warnf("Principal %d tried %s on listing %d owned by %d", context.principal().id(), selection.tag(),
                    listingId, listing.get().sellerId);
            return StartPlan.rejected("You can only change your own listings.");
        }
        if (selection.is(MARK_SOLD) && listing.get().status == ListingStatus.SOLD) {
            return StartPlan.rejected("That listing is already marked as sold.");
        }
        Map<String, Object> seed = new LinkedHashMap<>();
        seed.put(ListingFields.LISTING_ID, listingId);
        seed.put(ListingFields.TITLE, listing.get().title);
        seed.put(ACTION_KEY, selection.tag());
        return StartPlan.at(CONFIRM, seed);
    }

    @Override
    public List<StateRule> rules() {
        return List.of(StateRule.input(KIND, CONFIRM).prompt(ListingStatusDefinition::confirmPrompt)
                .suggest("confirm:yes", "confirm:no").validate((ctx, event) -> Inputs.confirm(event))
                .completesWith(Completion.commit(this::apply)).build());
    }

    private static String confirmPrompt(Session session) {
        String title = session.get(ListingFields.TITLE);
        if (MARK_SOLD.equals(session.get(ACTION_KEY))) {
            return "Mark \"" + title + "\" as sold?";
        }
        return "Delete \"" + title + "\"? This cannot be undone.";
    }

    private String apply(RuleContext context, Map<String, Object> payload) {
        long listingId = (Long) payload.get(ListingFields.LISTING_ID);
        Listing listing = context.store().findListing(listingId)
                .filter(found -> found.status != ListingStatus.DELETED)
                .filter(found -> found.isOwnedBy(context.principal().id()))
                .orElseThrow(() -> new ResourceNotFoundException("Listing not found: " + listingId));
        boolean sold = MARK_SOLD.equals(payload.get(ACTION_KEY));
        if (sold) {
            listing.markSold(context.now());
        } else {
            listing.markDeleted(context.now());
        }
        context.store().updateListing(listing);
        LOG.infof("Listing %d %s by owner %d", listingId, sold ? "marked sold" : "deleted", context.principal().id());
        return sold
                ? "\"" + listing.title + "\" is marked as sold. Congratulations on the sale!"
                : "\"" + listing.title + "\" has been deleted.";
    }
}
