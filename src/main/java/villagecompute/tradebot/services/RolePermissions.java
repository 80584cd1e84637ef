/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.services;

import villagecompute.tradebot.data.models.Permission;
import villagecompute.tradebot.data.models.Role;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Static role to permission table.
 *
 * <p>
 * Each role lists its permissions explicitly; no role inherits from another.
 *
 * <ul>
 * <li><b>super_admin:</b> every permission</li>
 * <li><b>admin:</b> every permission except {@code manage_admins}</li>
 * <li><b>moderator:</b> {@code manage_listings}, {@code warn_users}, {@code view_analytics},
 * {@code edit_any_listing}</li>
 * <li><b>none:</b> nothing</li>
 * </ul>
 */
public final class RolePermissions {

    private static final Map<Role, Set<Permission>> TABLE;

    static {
        Map<Role, Set<Permission>> table = new EnumMap<>(Role.class);
        table.put(Role.NONE, EnumSet.noneOf(Permission.class));
        table.put(Role.MODERATOR, EnumSet.of(Permission.MANAGE_LISTINGS, Permission.WARN_USERS,
                Permission.VIEW_ANALYTICS, Permission.EDIT_ANY_LISTING));
        table.put(Role.ADMIN,
                EnumSet.of(Permission.MANAGE_USERS, Permission.MANAGE_LISTINGS, Permission.MANAGE_TRANSACTIONS,
                        Permission.VIEW_ANALYTICS, Permission.VIEW_AUDIT_LOG, Permission.EDIT_ANY_LISTING,
                        Permission.DELETE_ANY_LISTING, Permission.BLOCK_USERS, Permission.WARN_USERS));
        table.put(Role.SUPER_ADMIN, EnumSet.allOf(Permission.class));
        table.replaceAll((role, permissions) -> Collections.unmodifiableSet(permissions));
        TABLE = Collections.unmodifiableMap(table);
    }

    private RolePermissions() {
    }

    public static Set<Permission> of(Role role) {
        return TABLE.getOrDefault(role, Set.of());
    }

    public static boolean grants(Role role, Permission permission) {
        return of(role).contains(permission);
    }
}
