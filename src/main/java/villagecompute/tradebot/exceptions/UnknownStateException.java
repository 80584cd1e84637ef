/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.exceptions;

import villagecompute.tradebot.data.models.ConversationKind;
import villagecompute.tradebot.data.models.ConversationState;

/**
 * Thrown when no rule is registered for a {@code (kind, state)} pair.
 *
 * <p>
 * This is a programming defect, not a user error. It must never be caught and ignored; the controller logs it at
 * FATAL and answers with a generic apology.
 */
public class UnknownStateException extends RuntimeException {

    private final ConversationKind kind;
    private final ConversationState state;

    public UnknownStateException(ConversationKind kind, ConversationState state) {
        super("No rule registered for " + kind + "/" + state);
        this.kind = kind;
        this.state = state;
    }

    public ConversationKind getKind() {
        return kind;
    }

    public ConversationState getState() {
        return state;
    }
}
