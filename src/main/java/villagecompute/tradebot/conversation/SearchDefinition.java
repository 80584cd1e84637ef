/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.conversation;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.tradebot.api.types.InboundEvent;
import villagecompute.tradebot.api.types.Selection;
import villagecompute.tradebot.config.MarketplaceSettings;
import villagecompute.tradebot.data.models.ConversationKind;
import villagecompute.tradebot.data.models.Listing;
import villagecompute.tradebot.data.store.ListingPage;
import villagecompute.tradebot.data.store.ListingQuery;
import villagecompute.tradebot.util.Prices;
import villagecompute.tradebot.util.Texts;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static villagecompute.tradebot.data.models.ConversationState.CATEGORY_FILTER;
import static villagecompute.tradebot.data.models.ConversationState.EXECUTE;
import static villagecompute.tradebot.data.models.ConversationState.KEYWORD;
import static villagecompute.tradebot.data.models.ConversationState.MAX_PRICE;
import static villagecompute.tradebot.data.models.ConversationState.MIN_PRICE;

/**
 * Buyer search: keyword, category, price range, then an automatic read-only query.
 *
 * <p>
 * Every filter accepts "skip". The query never goes through the moderation dispatcher and leaves no audit trail.
 */
@ApplicationScoped
public class SearchDefinition implements ConversationDefinition {

    private static final ConversationKind KIND = ConversationKind.SEARCH;

    static final String KEYWORD_KEY = "keyword";
    static final String CATEGORY_KEY = "category";
    static final String MIN_PRICE_KEY = "min_price";
    static final String MAX_PRICE_KEY = "max_price";
    static final int KEYWORD_MIN = 2;
    static final int KEYWORD_MAX = 100;

    @Inject
    MarketplaceSettings settings;

    @Override
    public ConversationKind kind() {
        return KIND;
    }

    @Override
    public List<SelectionSignature> startSignatures() {
        return List.of(SelectionSignature.of("search"));
    }

    @Override
    public List<String> textAliases() {
        return List.of("/search");
    }

    @Override
    public StartPlan begin(RuleContext context, Selection selection) {
        return StartPlan.at(KEYWORD);
    }

    @Override
    public List<StateRule> rules() {
        return List.of(
                StateRule.input(KIND, KEYWORD).prompt("What are you looking for? Send a keyword, or \"skip\".")
                        .suggest(Inputs.SKIP).validate((ctx, event) -> keyword(event)).storesAs(KEYWORD_KEY)
                        .then(CATEGORY_FILTER).build(),
                StateRule.input(KIND, CATEGORY_FILTER).prompt("Filter by category, or \"all\".")
                        .suggest(categorySuggestions()).validate((ctx, event) -> category(event))
                        .storesAs(CATEGORY_KEY).then(MIN_PRICE).build(),
                StateRule.input(KIND, MIN_PRICE).prompt("Minimum price, or \"skip\".").suggest(Inputs.SKIP)
                        .validate((ctx, event) -> Inputs.isSkip(event)
                                ? Validation.accept(null)
                                : ListingFields.price(event, BigDecimal.ZERO, settings.maxPrice()))
                        .storesAs(MIN_PRICE_KEY).then(MAX_PRICE).build(),
                StateRule.input(KIND, MAX_PRICE).prompt("Maximum price, or \"skip\".").suggest(Inputs.SKIP)
                        .validate((ctx, event) -> maxPrice(event, ctx.payload())).storesAs(MAX_PRICE_KEY)
                        .then(EXECUTE).build(),
                StateRule.automatic(KIND, EXECUTE).completesWith(Completion.query(this::execute)).build());
    }

    private List<String> categorySuggestions() {
        List<String> suggestions = new ArrayList<>();
        suggestions.add(CATEGORY_KEY + ":all");
        settings.categories().forEach(id -> suggestions.add(CATEGORY_KEY + ":" + id));
        return suggestions;
    }

    private Validation keyword(InboundEvent event) {
        if (Inputs.isSkip(event)) {
            return Validation.accept(null);
        }
        return Inputs.boundedText(event, "keyword", KEYWORD_MIN, KEYWORD_MAX);
    }

    private Validation category(InboundEvent event) {
        if (Inputs.isSkip(event)) {
            return Validation.accept(null);
        }
        Optional<String> choice = Inputs.choice(event, CATEGORY_KEY);
        if (choice.isPresent() && "all".equals(choice.get())) {
            return Validation.accept(null);
        }
        return ListingFields.category(event, settings);
    }

    private Validation maxPrice(InboundEvent event, Map<String, Object> payload) {
        if (Inputs.isSkip(event)) {
            return Validation.accept(null);
        }
        Validation price = ListingFields.price(event, BigDecimal.ZERO, settings.maxPrice());
        BigDecimal min = (BigDecimal) payload.get(MIN_PRICE_KEY);
        if (price.isAccepted() && min != null && ((BigDecimal) price.value()).compareTo(min) < 0) {
            return Validation.reject("The maximum price cannot be below the minimum of " + Prices.format(min) + ".");
        }
        return price;
    }

    private String execute(RuleContext context, Map<String, Object> payload) {
        ListingQuery query = new ListingQuery((String) payload.get(KEYWORD_KEY), (String) payload.get(CATEGORY_KEY),
                (BigDecimal) payload.get(MIN_PRICE_KEY), (BigDecimal) payload.get(MAX_PRICE_KEY), 1,
                settings.searchPageSize());
        ListingPage page = context.lookup("search_listings", store -> store.searchListings(query));
        if (page.items().isEmpty()) {
            return "No listings found. Try different filters.";
        }
        StringBuilder text = new StringBuilder("Found ").append(page.total())
                .append(page.total() == 1 ? " listing" : " listings").append(":\n");
        int position = 1;
        for (Listing listing : page.items()) {
            text.append(position++).append(". ").append(Texts.truncate(listing.title, 50)).append(" - ")
                    .append(Prices.format(listing.price)).append(" (").append(listing.category).append(") #")
                    .append(listing.id).append('\n');
        }
        if (page.hasMore()) {
            text.append("Showing the first ").append(page.items().size()).append(". Narrow your search to see more.");
        }
        return text.toString().trim();
    }
}
