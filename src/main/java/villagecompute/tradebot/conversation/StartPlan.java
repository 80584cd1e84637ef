/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.conversation;

import villagecompute.tradebot.api.types.InboundEvent;
import villagecompute.tradebot.data.models.ConversationState;

import java.util.Map;

/**
 * How a conversation begins: at which state, with which seeded payload, and optionally with a first input fed
 * straight into that state. A rejected plan creates no session.
 */
public final class StartPlan {

    private final ConversationState state;
    private final Map<String, Object> seed;
    private final InboundEvent firstInput;
    private final String rejection;

    private StartPlan(ConversationState state, Map<String, Object> seed, InboundEvent firstInput,
            String rejection) {
        this.state = state;
        this.seed = seed == null ? Map.of() : seed;
        this.firstInput = firstInput;
        this.rejection = rejection;
    }

    public static StartPlan at(ConversationState state) {
        return new StartPlan(state, Map.of(), null, null);
    }

    public static StartPlan at(ConversationState state, Map<String, Object> seed) {
        return new StartPlan(state, seed, null, null);
    }

    public static StartPlan feeding(ConversationState state, InboundEvent firstInput) {
        return new StartPlan(state, Map.of(), firstInput, null);
    }

    public static StartPlan rejected(String message) {
        return new StartPlan(null, Map.of(), null, message);
    }

    public boolean isRejected() {
        return rejection != null;
    }

    public ConversationState state() {
        return state;
    }

    public Map<String, Object> seed() {
        return seed;
    }

    public InboundEvent firstInput() {
        return firstInput;
    }

    public String rejection() {
        return rejection;
    }
}
