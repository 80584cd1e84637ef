/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.data.models;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Administrative role carried by a {@link Principal}.
 *
 * <p>
 * Roles look hierarchical but are not: each role owns an independently declared permission set in
 * {@link villagecompute.tradebot.services.RolePermissions}. Never derive one role's capabilities from another's.
 */
public enum Role {

    NONE("none"), MODERATOR("moderator"), ADMIN("admin"), SUPER_ADMIN("super_admin");

    private final String key;

    Role(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /**
     * Resolves a role from its configuration key (case-insensitive, dashes accepted for underscores).
     *
     * @param key
     *            role key such as {@code super_admin} or {@code moderator}
     * @return matching role, empty when unknown
     */
    public static Optional<Role> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values()).filter(role -> role.key.equals(normalized)).findFirst();
    }
}
