/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.conversation;

import java.util.Map;

@FunctionalInterface
public interface PayloadApplier {

    /**
     * Returns the payload after folding in an accepted value. The given payload is read-only.
     */
    Map<String, Object> apply(Map<String, Object> payload, Object value);
}
