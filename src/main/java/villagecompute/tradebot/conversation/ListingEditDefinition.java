/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.conversation;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.tradebot.api.types.Selection;
import villagecompute.tradebot.config.MarketplaceSettings;
import villagecompute.tradebot.conversation.SelectionSignature.ParamType;
import villagecompute.tradebot.data.models.ConversationKind;
import villagecompute.tradebot.data.models.ConversationState;
import villagecompute.tradebot.data.models.Listing;
import villagecompute.tradebot.data.models.ListingStatus;
import villagecompute.tradebot.exceptions.ResourceNotFoundException;
import villagecompute.tradebot.util.Prices;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Edits one field of an owned listing, entered with {@code edit_field:<field>:<listingId>}.
 *
 * <p>
 * Each state is terminal: the new value is validated with the same rule as creation and written immediately. The
 * photos state collects media and replaces the listing's photos on the first non-media input.
 */
@ApplicationScoped
public class ListingEditDefinition implements ConversationDefinition {

    private static final Logger LOG = Logger.getLogger(ListingEditDefinition.class);

    private static final ConversationKind KIND = ConversationKind.LISTING_EDIT;

    private static final Map<String, ConversationState> FIELDS = Map.of(ListingFields.TITLE, ConversationState.TITLE,
            ListingFields.DESCRIPTION, ConversationState.DESCRIPTION, ListingFields.PRICE, ConversationState.PRICE,
            ListingFields.CATEGORY, ConversationState.CATEGORY, ListingFields.PHOTOS, ConversationState.PHOTOS);

    @Inject
    MarketplaceSettings settings;

    @Override
    public ConversationKind kind() {
        return KIND;
    }

    @Override
    public List<SelectionSignature> startSignatures() {
        return List.of(SelectionSignature.of("edit_field", ParamType.WORD, ParamType.NUMBER));
    }

    @Override
    public StartPlan begin(RuleContext context, Selection selection) {
        ConversationState state = FIELDS.get(selection.param(0));
        if (state == null) {
            return StartPlan.rejected("That field cannot be edited.");
        }
        long listingId = selection.number(1);
        Optional<Listing> listing = context.lookup("find_listing", store -> store.findListing(listingId));
        if (listing.isEmpty() || listing.get().status == ListingStatus.DELETED) {
            return StartPlan.rejected("Listing #" + listingId + " was not found.");
        }
        if (!listing.get().isOwnedBy(context.principal().id())) {
            LOG.warnf("Principal %d tried to edit listing %d owned by %d", context.principal().id(), listingId,
                    listing.get().sellerId);
            return StartPlan.rejected("You can only edit your own listings.");
        }
        return StartPlan.at(state, Map.of(ListingFields.LISTING_ID, listingId));
    }

    @Override
    public List<StateRule> rules() {
        return List.of(
                StateRule.input(KIND, ConversationState.TITLE).prompt("Enter the new title (3-100 characters).")
                        .validate((ctx, event) -> ListingFields.title(event)).storesAs(ListingFields.TITLE)
                        .completesWith(update(ListingFields.TITLE)).build(),
                StateRule.input(KIND, ConversationState.DESCRIPTION)
                        .prompt("Enter the new description (up to 2000 characters), or \"skip\" to clear it.")
                        .suggest(Inputs.SKIP).validate((ctx, event) -> ListingFields.description(event))
                        .storesAs(ListingFields.DESCRIPTION).completesWith(update(ListingFields.DESCRIPTION)).build(),
                StateRule.input(KIND, ConversationState.PRICE)
                        .prompt(session -> "Enter the new price (" + Prices.format(settings.minPrice()) + " to "
                                + Prices.format(settings.maxPrice()) + ").")
                        .validate((ctx, event) -> ListingFields.price(event, settings)).storesAs(ListingFields.PRICE)
                        .completesWith(update(ListingFields.PRICE)).build(),
                StateRule.input(KIND, ConversationState.CATEGORY).prompt("Choose the new category.")
                        .suggest(settings.categories().stream().map(id -> ListingFields.CATEGORY + ":" + id).toList())
                        .validate((ctx, event) -> ListingFields.category(event, settings))
                        .storesAs(ListingFields.CATEGORY).completesWith(update(ListingFields.CATEGORY)).build(),
                StateRule.input(KIND, ConversationState.PHOTOS)
                        .prompt(session -> "Send up to " + settings.maxPhotos() + " new photos ("
                                + ListingFields.photos(session.payload()).size()
                                + " so far), then \"done\" to replace the current ones.")
                        .suggest(Inputs.DONE)
                        .validate((ctx, event) -> ListingFields.photo(event, ctx.payload(), settings.maxPhotos()))
                        .applies(ListingFields::appendPhoto)
                        .next((payload, value) -> ((ListingFields.PhotoInput) value).isDone()
                                ? Transition.terminal()
                                : Transition.to(ConversationState.PHOTOS))
                        .completesWith(update(ListingFields.PHOTOS)).build());
    }

    private static Completion update(String field) {
        return Completion.commit((context, payload) -> {
            long listingId = (Long) payload.get(ListingFields.LISTING_ID);
            Listing listing = context.store().findListing(listingId)
                    .filter(found -> found.status != ListingStatus.DELETED)
                    .orElseThrow(() -> new ResourceNotFoundException("Listing not found: " + listingId));
            ListingFields.applyField(listing, field, payload);
            listing.updatedAt = context.now();
            context.store().updateListing(listing);
            LOG.infof("Listing %d field %s updated by %d", listingId, field, context.principal().id());
            return "Listing #" + listingId + " updated: " + field + ".";
        });
    }
}
