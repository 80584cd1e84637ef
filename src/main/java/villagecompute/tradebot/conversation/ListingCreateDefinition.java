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
import villagecompute.tradebot.data.models.ConversationKind;
import villagecompute.tradebot.data.models.Listing;
import villagecompute.tradebot.data.models.Session;
import villagecompute.tradebot.util.Prices;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static villagecompute.tradebot.data.models.ConversationState.CATEGORY;
import static villagecompute.tradebot.data.models.ConversationState.CONFIRM;
import static villagecompute.tradebot.data.models.ConversationState.DESCRIPTION;
import static villagecompute.tradebot.data.models.ConversationState.LOCATION;
import static villagecompute.tradebot.data.models.ConversationState.PHOTOS;
import static villagecompute.tradebot.data.models.ConversationState.PRICE;
import static villagecompute.tradebot.data.models.ConversationState.TITLE;

/**
 * Seven-step listing creation: title, description, price, category, photos, location, confirmation.
 *
 * <p>
 * The listing is written on confirmation only; answering "no" discards everything collected.
 */
@ApplicationScoped
public class ListingCreateDefinition implements ConversationDefinition {

    private static final Logger LOG = Logger.getLogger(ListingCreateDefinition.class);

    private static final ConversationKind KIND = ConversationKind.LISTING_CREATE;

    @Inject
    MarketplaceSettings settings;

    @Override
    public ConversationKind kind() {
        return KIND;
    }

    @Override
    public List<SelectionSignature> startSignatures() {
        return List.of(SelectionSignature.of("sell"));
    }

    @Override
    public List<String> textAliases() {
        return List.of("/sell");
    }

    @Override
    public StartPlan begin(RuleContext context, Selection selection) {
        return StartPlan.at(TITLE);
    }

    @Override
    public List<StateRule> rules() {
        return List.of(
                StateRule.input(KIND, TITLE)
                        .prompt("Step 1/7: What are you selling? Enter a title (3-100 characters).")
                        .validate((ctx, event) -> ListingFields.title(event)).storesAs(ListingFields.TITLE)
                        .then(DESCRIPTION).build(),
                StateRule.input(KIND, DESCRIPTION)
                        .prompt("Step 2/7: Describe the item (up to 2000 characters), or send \"skip\".")
                        .suggest(Inputs.SKIP).validate((ctx, event) -> ListingFields.description(event))
                        .storesAs(ListingFields.DESCRIPTION).then(PRICE).build(),
                StateRule.input(KIND, PRICE)
                        .prompt(session -> "Step 3/7: Enter the price in dollars (" + Prices.format(settings.minPrice())
                                + " to " + Prices.format(settings.maxPrice()) + ").")
                        .validate((ctx, event) -> ListingFields.price(event, settings)).storesAs(ListingFields.PRICE)
                        .then(CATEGORY).build(),
                StateRule.input(KIND, CATEGORY).prompt("Step 4/7: Choose a category.")
                        .suggest(settings.categories().stream().map(id -> ListingFields.CATEGORY + ":" + id).toList())
                        .validate((ctx, event) -> ListingFields.category(event, settings))
                        .storesAs(ListingFields.CATEGORY).then(PHOTOS).build(),
                StateRule.input(KIND, PHOTOS).prompt(this::photoPrompt).suggest(Inputs.DONE)
                        .validate((ctx, event) -> ListingFields.photo(event, ctx.payload(), settings.maxPhotos()))
                        .applies(ListingFields::appendPhoto)
                        .next((payload, value) -> ((ListingFields.PhotoInput) value).isDone()
                                ? Transition.to(LOCATION)
                                : Transition.to(PHOTOS))
                        .build(),
                StateRule.input(KIND, LOCATION)
                        .prompt("Step 6/7: Where is the item located? (up to 100 characters, or \"skip\")")
                        .suggest(Inputs.SKIP).validate((ctx, event) -> ListingFields.location(event))
                        .storesAs(ListingFields.LOCATION).then(CONFIRM).build(),
                StateRule.input(KIND, CONFIRM).prompt(this::summary).suggest("confirm:yes", "confirm:no")
                        .validate((ctx, event) -> Inputs.confirm(event))
                        .completesWith(Completion.commit(this::createListing)).build());
    }

    private String photoPrompt(Session session) {
        int count = ListingFields.photos(session.payload()).size();
        if (count == 0) {
            return "Step 5/7: Send up to " + settings.maxPhotos() + " photos, or \"done\" to continue without photos.";
        }
        return "Photo " + count + "/" + settings.maxPhotos() + " added. Send another or \"done\" to continue.";
    }

    private String summary(Session session) {
        Map<String, Object> payload = session.payload();
        StringBuilder text = new StringBuilder("Step 7/7: Please review your listing.\n");
        text.append("Title: ").append(payload.get(ListingFields.TITLE)).append('\n');
        String description = (String) payload.getOrDefault(ListingFields.DESCRIPTION, "");
        if (!description.isEmpty()) {
            text.append("Description: ").append(description).append('\n');
        }
        text.append("Price: ").append(Prices.format((BigDecimal) payload.get(ListingFields.PRICE))).append('\n');
        text.append("Category: ").append(payload.get(ListingFields.CATEGORY)).append('\n');
        text.append("Photos: ").append(ListingFields.photos(payload).size()).append('\n');
        if (payload.containsKey(ListingFields.LOCATION)) {
            text.append("Location: ").append(payload.get(ListingFields.LOCATION)).append('\n');
        }
        return text.append("Publish it?").toString();
    }

    private String createListing(RuleContext context, Map<String, Object> payload) {
        Listing listing = new Listing();
        listing.sellerId = context.principal().id();
        listing.title = (String) payload.get(ListingFields.TITLE);
        listing.description = (String) payload.getOrDefault(ListingFields.DESCRIPTION, "");
        listing.price = (BigDecimal) payload.get(ListingFields.PRICE);
        listing.category = (String) payload.get(ListingFields.CATEGORY);
        listing.photos = new ArrayList<>(ListingFields.photos(payload));
        listing.location = (String) payload.get(ListingFields.LOCATION);
        listing.createdAt = context.now();
        listing.updatedAt = context.now();
        Listing created = context.store().createListing(listing);
        LOG.infof("Listing %d created by seller %d in %s", created.id, created.sellerId, created.category);
        return "Your listing \"" + created.title + "\" is live (#" + created.id + ").";
    }
}
