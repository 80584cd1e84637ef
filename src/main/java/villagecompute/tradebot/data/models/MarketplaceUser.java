/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.data.models;

import java.time.Instant;

/**
 * User record held by the data store. Created on first contact and never deleted; blocking sets
 * {@code active = false}.
 */
public class MarketplaceUser {

    public long id;

    public String displayName;

    public Role role = Role.NONE;

    public boolean active = true;

    public String blockReason;

    public String phone;

    public String location;

    public String bio;

    public int warningCount;

    public Instant createdAt;

    public static MarketplaceUser create(long id, Role role, Instant now) {
        MarketplaceUser user = new MarketplaceUser();
        user.id = id;
        user.displayName = "user" + id;
        user.role = role;
        user.createdAt = now;
        return user;
    }

    public Principal toPrincipal() {
        return new Principal(id, role, active);
    }

    public void block(String reason) {
        this.active = false;
        this.blockReason = reason;
    }

    public void unblock() {
        this.active = true;
        this.blockReason = null;
    }

    public MarketplaceUser copy() {
        MarketplaceUser copy = new MarketplaceUser();
        copy.id = id;
        copy.displayName = displayName;
        copy.role = role;
        copy.active = active;
        copy.blockReason = blockReason;
        copy.phone = phone;
        copy.location = location;
        copy.bio = bio;
        copy.warningCount = warningCount;
        copy.createdAt = createdAt;
        return copy;
    }
}
