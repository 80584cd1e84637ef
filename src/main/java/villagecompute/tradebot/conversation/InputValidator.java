/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.conversation;

import villagecompute.tradebot.api.types.InboundEvent;

@FunctionalInterface
public interface InputValidator {

    /**
     * Validates an input. Must not mutate the store; lookups go through {@link RuleContext#lookup}.
     */
    Validation validate(RuleContext context, InboundEvent event);
}
