/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

import org.junit.jupiter.api.Test;

import villagecompute.tradebot.data.models.Permission;
import villagecompute.tradebot.data.models.Role;

class RolePermissionsTest {

    @Test
    void testSuperAdminHoldsEveryPermission() {
        assertEquals(EnumSet.allOf(Permission.class), RolePermissions.of(Role.SUPER_ADMIN));
    }

    @Test
    void testAdminHoldsAllButManageAdmins() {
        Set<Permission> admin = RolePermissions.of(Role.ADMIN);

        assertEquals(Permission.values().length - 1, admin.size());
        assertFalse(admin.contains(Permission.MANAGE_ADMINS));
    }

    @Test
    void testModeratorSet() {
        assertEquals(EnumSet.of(Permission.MANAGE_LISTINGS, Permission.WARN_USERS, Permission.VIEW_ANALYTICS,
                Permission.EDIT_ANY_LISTING), RolePermissions.of(Role.MODERATOR));
        assertFalse(RolePermissions.grants(Role.MODERATOR, Permission.MANAGE_USERS));
        assertFalse(RolePermissions.grants(Role.MODERATOR, Permission.DELETE_ANY_LISTING));
    }

    @Test
    void testNoneHoldsNothing() {
        assertTrue(RolePermissions.of(Role.NONE).isEmpty());
    }

    @Test
    void testReviewRemovalNeedsListingManagement() {
        assertEquals(Optional.of(Permission.MANAGE_LISTINGS),
                ModerationActions.requiredPermission(ModerationActions.DELETE_REVIEW));
        assertTrue(RolePermissions.grants(Role.MODERATOR, Permission.MANAGE_LISTINGS));
    }
}
