/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.data.models;

import java.time.Instant;

public class Review {

    public Long id;

    public long listingId;

    public long sellerId;

    public long reviewerId;

    public int rating;

    public String comment;

    public Instant createdAt;
}
