/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.data.models;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Marketplace listing as exchanged with the data store.
 *
 * <p>
 * <b>Lifecycle:</b> created {@link ListingStatus#ACTIVE} by the listing-create conversation, moved to
 * {@link ListingStatus#FLAGGED} or {@link ListingStatus#DELETED} by moderation. Deletion is soft.
 */
public class Listing {

    public Long id;

    public long sellerId;

    public String title;

    public String description;

    public BigDecimal price;

    public String category;

    public List<String> photos = new ArrayList<>();

    public String location;

    public ListingStatus status = ListingStatus.ACTIVE;

    public String flagReason;

    public long views;

    public Instant createdAt;

    public Instant updatedAt;

    public boolean isOwnedBy(long principalId) {
        return sellerId == principalId;
    }

    /**
     * Marks the listing flagged by moderation.
     */
    public void flag(String reason, Instant now) {
        this.status = ListingStatus.FLAGGED;
        this.flagReason = reason;
        this.updatedAt = now;
    }

    /**
     * Marks the listing sold by its owner; it leaves search results.
     */
    public void markSold(Instant now) {
        this.status = ListingStatus.SOLD;
        this.updatedAt = now;
    }

    /**
     * Soft-deletes the listing; it disappears from search but stays addressable for audit.
     */
    public void markDeleted(Instant now) {
        this.status = ListingStatus.DELETED;
        this.updatedAt = now;
    }

    public Listing copy() {
        Listing copy = new Listing();
        copy.id = id;
        copy.sellerId = sellerId;
        copy.title = title;
        copy.description = description;
        copy.price = price;
        copy.category = category;
        copy.photos = new ArrayList<>(photos);
        copy.location = location;
        copy.status = status;
        copy.flagReason = flagReason;
        copy.views = views;
        copy.createdAt = createdAt;
        copy.updatedAt = updatedAt;
        return copy;
    }
}
