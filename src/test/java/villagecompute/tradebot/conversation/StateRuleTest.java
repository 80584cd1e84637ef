/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.conversation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;

import org.junit.jupiter.api.Test;

import villagecompute.tradebot.data.models.ConversationKind;
import villagecompute.tradebot.data.models.ConversationState;

class StateRuleTest {

    @Test
    void testStoresAsSkipsNullValues() {
        StateRule rule = StateRule.input(ConversationKind.SEARCH, ConversationState.KEYWORD)
                .validate((ctx, event) -> Validation.accept(null)).storesAs("keyword")
                .then(ConversationState.CATEGORY_FILTER).build();

        assertEquals(Map.of(), rule.apply(Map.of(), null));
        assertEquals(Map.of("keyword", "bike"), rule.apply(Map.of(), "bike"));
        assertEquals(ConversationState.CATEGORY_FILTER, rule.next(Map.of(), "bike").state());
        assertFalse(rule.isTerminal());
    }

    @Test
    void testTerminalRuleDefaultsToCompletion() {
        StateRule rule = StateRule.input(ConversationKind.MESSAGING, ConversationState.BODY)
                .validate((ctx, event) -> Validation.accept("hi")).storesAs("body")
                .completesWith(Completion.commit((ctx, payload) -> "sent")).build();

        assertTrue(rule.isTerminal());
        assertTrue(rule.isMutating());
        assertTrue(rule.next(Map.of(), "hi").isTerminal());
    }

    @Test
    void testQueryIsNotMutating() {
        StateRule rule = StateRule.automatic(ConversationKind.SEARCH, ConversationState.EXECUTE)
                .completesWith(Completion.query((ctx, payload) -> "results")).build();

        assertFalse(rule.awaitsInput());
        assertFalse(rule.isMutating());
    }

    @Test
    void testInvalidDeclarationsFail() {
        assertThrows(IllegalStateException.class,
                () -> StateRule.automatic(ConversationKind.SEARCH, ConversationState.KEYWORD).build());
        assertThrows(IllegalStateException.class,
                () -> StateRule.input(ConversationKind.SEARCH, ConversationState.KEYWORD).build());
        assertThrows(IllegalStateException.class, () -> StateRule.input(ConversationKind.SEARCH,
                ConversationState.KEYWORD).validate((ctx, event) -> Validation.accept(null)).build());
    }
}
