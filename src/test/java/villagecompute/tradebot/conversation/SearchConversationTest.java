/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.conversation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.List;

import org.junit.jupiter.api.Test;

import io.quarkus.test.junit.QuarkusTest;
import villagecompute.tradebot.BaseConversationTest;
import villagecompute.tradebot.api.types.ActionType;
import villagecompute.tradebot.api.types.OutboundAction;
import villagecompute.tradebot.data.models.ConversationState;
import villagecompute.tradebot.data.models.Listing;
import villagecompute.tradebot.data.models.Session;

@QuarkusTest
class SearchConversationTest extends BaseConversationTest {

    @Test
    void testSearchWithAllFilters() {
        seedListing(SELLER, "Road bike", "300.00", "sports");
        seedListing(SELLER, "Kids bike", "40.00", "sports");
        seedListing(SELLER, "Bike lock", "15.00", "other");
        seedListing(SELLER, "Sofa", "200.00", "home");

        send(BUYER, "/search");
        send(BUYER, "bike");
        select(BUYER, "category:sports");
        send(BUYER, "30");
        List<OutboundAction> actions = send(BUYER, "350");

        assertType(ActionType.RESULT, actions);
        String result = actions.get(0).content();
        assertTrue(result.startsWith("Found 2 listings:"), result);
        assertTrue(result.contains("Road bike"));
        assertTrue(result.contains("Kids bike"));
        assertFalse(result.contains("Bike lock"));
        assertTrue(session(BUYER).isEmpty());
    }

    @Test
    void testSkippingEveryFilterMatchesAllActive() {
        seedListing(SELLER, "Lamp", "20.00", "home");
        Listing hidden = seedListing(SELLER, "Hidden lamp", "25.00", "home");
        hidden.flag("spam", hidden.createdAt);
        store.updateListing(hidden);

        select(BUYER, "search");
        send(BUYER, "skip");
        select(BUYER, "category:all");
        send(BUYER, "skip");
        List<OutboundAction> actions = send(BUYER, "skip");

        assertType(ActionType.RESULT, actions);
        assertTrue(actions.get(0).content().startsWith("Found 1 listing:"));
        assertFalse(actions.get(0).content().contains("Hidden lamp"));
    }

    @Test
    void testNoResults() {
        send(BUYER, "/search");
        send(BUYER, "piano");
        send(BUYER, "all");
        send(BUYER, "skip");
        List<OutboundAction> actions = send(BUYER, "skip");

        assertEquals("No listings found. Try different filters.", actions.get(0).content());
    }

    @Test
    void testResultsArePaged() {
        for (int i = 1; i <= 7; i++) {
            seedListing(SELLER, "Chair " + i, "10.00", "home");
        }
        send(BUYER, "/search");
        send(BUYER, "chair");
        send(BUYER, "home");
        send(BUYER, "skip");
        String result = send(BUYER, "skip").get(0).content();

        assertTrue(result.startsWith("Found 7 listings:"));
        assertTrue(result.contains("Showing the first 5."));
    }

    @Test
    void testMaxBelowMinIsRejected() {
        send(BUYER, "/search");
        send(BUYER, "skip");
        send(BUYER, "all");
        send(BUYER, "100");

        List<OutboundAction> actions = send(BUYER, "50");

        assertType(ActionType.ERROR, actions);
        Session session = session(BUYER).orElseThrow();
        assertEquals(ConversationState.MAX_PRICE, session.state());
        assertEquals(new BigDecimal("100.00"), session.payload().get(SearchDefinition.MIN_PRICE_KEY));
    }

    @Test
    void testUnknownCategoryIsRejected() {
        send(BUYER, "/search");
        send(BUYER, "skip");

        List<OutboundAction> actions = send(BUYER, "spaceships");

        assertType(ActionType.ERROR, actions);
        assertEquals(ConversationState.CATEGORY_FILTER, session(BUYER).orElseThrow().state());
    }
}
