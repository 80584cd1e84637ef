/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.conversation;

import villagecompute.tradebot.data.models.ConversationState;

/**
 * Where a conversation goes after an accepted input: another state of the same kind, or completion.
 */
public record Transition(ConversationState state) {

    private static final Transition TERMINAL = new Transition(null);

    public static Transition to(ConversationState state) {
        if (state == null) {
            throw new IllegalArgumentException("state is required; use terminal() to complete");
        }
        return new Transition(state);
    }

    public static Transition terminal() {
        return TERMINAL;
    }

    public boolean isTerminal() {
        return state == null;
    }
}
