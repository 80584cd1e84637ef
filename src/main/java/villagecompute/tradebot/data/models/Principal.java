/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.data.models;

import java.util.Objects;

/**
 * Identity driving a conversation: an ordinary user or an admin.
 *
 * <p>
 * Blocked principals carry {@code active = false}; they hold no valid session and are denied every permission.
 */
public record Principal(long id, Role role, boolean active) {

    public Principal {
        Objects.requireNonNull(role, "role is required");
    }

    public static Principal user(long id) {
        return new Principal(id, Role.NONE, true);
    }
}
