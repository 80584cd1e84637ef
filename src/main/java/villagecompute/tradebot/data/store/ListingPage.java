/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.data.store;

import villagecompute.tradebot.data.models.Listing;

import java.util.List;

public record ListingPage(List<Listing> items, long total, int page, int pageSize) {

    public ListingPage {
        items = List.copyOf(items);
    }

    public boolean hasMore() {
        return (long) page * pageSize < total;
    }
}
