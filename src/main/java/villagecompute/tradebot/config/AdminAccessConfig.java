/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.config;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.tradebot.data.models.Role;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Environment-level admin access: the allow-list of identities that may ever act as admins and their initial roles.
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code tradebot.admin.allow-list} - comma-separated principal ids (default: none)</li>
 * <li>{@code tradebot.admin.roles} - comma-separated {@code id=role} pairs, role one of moderator, admin,
 * super_admin</li>
 * </ul>
 *
 * <p>
 * A malformed role entry fails start-up. A role configured for an id missing from the allow-list is kept but logged:
 * such a principal is denied every permission until allow-listed.
 */
@ApplicationScoped
public class AdminAccessConfig {

    private static final Logger LOG = Logger.getLogger(AdminAccessConfig.class);

    @ConfigProperty(
            name = "tradebot.admin.allow-list")
    Optional<List<Long>> allowList;

    @ConfigProperty(
            name = "tradebot.admin.roles")
    Optional<List<String>> roleAssignments;

    private Set<Long> allowed = Set.of();
    private Map<Long, Role> roles = Map.of();

    @PostConstruct
    void init() {
        allowed = Set.copyOf(new HashSet<>(allowList.orElse(List.of())));

        Map<Long, Role> parsed = new HashMap<>();
        for (String assignment : roleAssignments.orElse(List.of())) {
            String[] parts = assignment.trim().split("=");
            if (parts.length != 2) {
                throw new AdminConfigurationException("Invalid tradebot.admin.roles entry: " + assignment);
            }
            long id;
            try {
                id = Long.parseLong(parts[0].trim());
            } catch (NumberFormatException e) {
                throw new AdminConfigurationException("Invalid principal id in tradebot.admin.roles: " + assignment, e);
            }
            Role role = Role.fromKey(parts[1]).orElseThrow(
                    () -> new AdminConfigurationException("Unknown role in tradebot.admin.roles: " + assignment));
            if (!allowed.contains(id)) {
                LOG.warnf("Role %s configured for principal %d which is not allow-listed; it will be denied",
                        role.getKey(), id);
            }
            parsed.put(id, role);
        }
        roles = Collections.unmodifiableMap(parsed);
        LOG.infof("Admin access configured: %d allow-listed principals, %d role assignments", allowed.size(),
                roles.size());
    }

    public boolean isAllowListed(long principalId) {
        return allowed.contains(principalId);
    }

    /**
     * Role a previously unseen principal starts with.
     */
    public Role initialRole(long principalId) {
        return roles.getOrDefault(principalId, Role.NONE);
    }

    /**
     * Exception thrown when admin access configuration is invalid.
     */
    public static class AdminConfigurationException extends RuntimeException {

        public AdminConfigurationException(String message) {
            super(message);
        }

        public AdminConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
