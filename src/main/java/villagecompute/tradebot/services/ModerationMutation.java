/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.services;

import villagecompute.tradebot.data.store.MarketplaceDataStore;

/**
 * The state change a moderation action applies to the data store.
 */
@FunctionalInterface
public interface ModerationMutation {

    void apply(MarketplaceDataStore store);
}
