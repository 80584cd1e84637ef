/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.conversation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;

import org.junit.jupiter.api.Test;

import villagecompute.tradebot.api.types.InboundEvent;
import villagecompute.tradebot.api.types.Selection;
import villagecompute.tradebot.conversation.SelectionSignature.ParamType;

class InputsTest {

    @Test
    void testChoiceFromSelectionOrText() {
        assertEquals(Optional.of("electronics"), Inputs.choice(InboundEvent.selection(1L, "category:electronics"),
                "category"));
        assertEquals(Optional.of("books"), Inputs.choice(InboundEvent.text(1L, " Books "), "category"));
        assertTrue(Inputs.choice(InboundEvent.selection(1L, "rating:4"), "category").isEmpty());
    }

    @Test
    void testConfirm() {
        assertTrue(Inputs.confirm(InboundEvent.text(1L, "yes")).isAccepted());
        assertTrue(Inputs.confirm(InboundEvent.selection(1L, "confirm:yes")).isAccepted());
        assertEquals(Validation.Outcome.DISCARDED, Inputs.confirm(InboundEvent.selection(1L, "confirm:no")).outcome());
        assertEquals(Validation.Outcome.REJECTED, Inputs.confirm(InboundEvent.text(1L, "maybe")).outcome());
    }

    @Test
    void testId() {
        assertEquals(Optional.of(123L), Inputs.id(InboundEvent.text(1L, "#123")));
        assertTrue(Inputs.id(InboundEvent.text(1L, "-4")).isEmpty());
        assertTrue(Inputs.id(InboundEvent.text(1L, "abc")).isEmpty());
    }

    @Test
    void testSkip() {
        assertTrue(Inputs.isSkip(InboundEvent.text(1L, "Skip")));
        assertTrue(Inputs.isSkip(InboundEvent.selection(1L, "skip")));
        assertFalse(Inputs.isSkip(InboundEvent.text(1L, "skipper")));
    }

    @Test
    void testSelectionSignatureShape() {
        SelectionSignature signature = SelectionSignature.of("edit_field", ParamType.WORD, ParamType.NUMBER);

        assertTrue(signature.matches(Selection.parse("edit_field:price:12")));
        assertFalse(signature.matches(Selection.parse("edit_field:12:price")));
        assertFalse(signature.matches(Selection.parse("edit_field:price")));
        assertFalse(signature.matches(Selection.parse("edit_field:price:0")));
    }
}
