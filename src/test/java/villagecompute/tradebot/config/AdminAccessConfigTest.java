/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import villagecompute.tradebot.config.AdminAccessConfig.AdminConfigurationException;
import villagecompute.tradebot.data.models.Role;

/**
 * Unit tests for {@link AdminAccessConfig} parsing.
 */
class AdminAccessConfigTest {

    private static AdminAccessConfig config(List<Long> allowList, List<String> roles) {
        AdminAccessConfig config = new AdminAccessConfig();
        config.allowList = Optional.ofNullable(allowList);
        config.roleAssignments = Optional.ofNullable(roles);
        config.init();
        return config;
    }

    @Test
    void testParsesAllowListAndRoles() {
        AdminAccessConfig config = config(List.of(1L, 2L), List.of("1=super_admin", " 2 = Moderator "));

        assertTrue(config.isAllowListed(1L));
        assertTrue(config.isAllowListed(2L));
        assertFalse(config.isAllowListed(3L));
        assertEquals(Role.SUPER_ADMIN, config.initialRole(1L));
        assertEquals(Role.MODERATOR, config.initialRole(2L));
        assertEquals(Role.NONE, config.initialRole(3L));
    }

    @Test
    void testEmptyConfigurationAllowsNobody() {
        AdminAccessConfig config = config(null, null);

        assertFalse(config.isAllowListed(1L));
        assertEquals(Role.NONE, config.initialRole(1L));
    }

    @Test
    void testRoleForIdOutsideAllowListIsKept() {
        AdminAccessConfig config = config(List.of(1L), List.of("9=admin"));

        assertFalse(config.isAllowListed(9L));
        assertEquals(Role.ADMIN, config.initialRole(9L));
    }

    @Test
    void testMalformedEntryFailsStartup() {
        assertThrows(AdminConfigurationException.class, () -> config(List.of(1L), List.of("1:admin")));
        assertThrows(AdminConfigurationException.class, () -> config(List.of(1L), List.of("abc=admin")));
        assertThrows(AdminConfigurationException.class, () -> config(List.of(1L), List.of("1=owner")));
    }
}
