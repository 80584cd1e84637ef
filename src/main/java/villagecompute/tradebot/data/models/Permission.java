/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.data.models;

import java.util.Arrays;
import java.util.Optional;

/**
 * Named capability checked by {@link villagecompute.tradebot.services.PermissionService}.
 */
public enum Permission {

    MANAGE_USERS("manage_users"),
    MANAGE_LISTINGS("manage_listings"),
    MANAGE_TRANSACTIONS("manage_transactions"),
    VIEW_ANALYTICS("view_analytics"),
    MANAGE_ADMINS("manage_admins"),
    VIEW_AUDIT_LOG("view_audit_log"),
    EDIT_ANY_LISTING("edit_any_listing"),
    DELETE_ANY_LISTING("delete_any_listing"),
    BLOCK_USERS("block_users"),
    WARN_USERS("warn_users");

    private final String key;

    Permission(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /**
     * Looks up a permission by its exact key. Unknown keys resolve to empty so callers can fail closed.
     */
    public static Optional<Permission> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(permission -> permission.key.equals(key)).findFirst();
    }
}
