/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.services;

import villagecompute.tradebot.data.models.Permission;

import java.util.Map;
import java.util.Optional;

/**
 * Privileged action tags and the permission each requires.
 */
public final class ModerationActions {

    public static final String BLOCK_USER = "block_user";
    public static final String UNBLOCK_USER = "unblock_user";
    public static final String WARN_USER = "warn_user";
    public static final String FLAG_LISTING = "flag_listing";
    public static final String DELETE_LISTING = "delete_listing";
    public static final String DELETE_REVIEW = "review_delete";
    public static final String GRANT_ROLE = "grant_role";

    public static final String TARGET_USER = "user";
    public static final String TARGET_LISTING = "listing";
    public static final String TARGET_REVIEW = "review";

    private static final Map<String, Permission> REQUIRED = Map.of(BLOCK_USER, Permission.MANAGE_USERS, UNBLOCK_USER,
            Permission.MANAGE_USERS, WARN_USER, Permission.WARN_USERS, FLAG_LISTING, Permission.MANAGE_LISTINGS,
            DELETE_LISTING, Permission.DELETE_ANY_LISTING, DELETE_REVIEW, Permission.MANAGE_LISTINGS, GRANT_ROLE,
            Permission.MANAGE_ADMINS);

    private ModerationActions() {
    }

    public static Optional<Permission> requiredPermission(String action) {
        return Optional.ofNullable(REQUIRED.get(action));
    }
}
