/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.data.store;

import java.math.BigDecimal;

/**
 * Search filters collected by the search conversation. Null fields are not applied.
 */
public record ListingQuery(String keyword, String category, BigDecimal minPrice, BigDecimal maxPrice, int page,
        int pageSize) {

    public ListingQuery {
        if (page < 1) {
            throw new IllegalArgumentException("page must be >= 1");
        }
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be >= 1");
        }
    }

    public int offset() {
        return (page - 1) * pageSize;
    }
}
