/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.tradebot.config.AdminAccessConfig;
import villagecompute.tradebot.data.models.Permission;
import villagecompute.tradebot.data.models.Principal;
import villagecompute.tradebot.data.models.Role;

import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a principal may perform a privileged action.
 *
 * <p>
 * A principal is authorized for a permission only when all of the following hold:
 * <ol>
 * <li>the principal is on the configured admin allow-list</li>
 * <li>the principal's role is not {@code none} and the principal is active</li>
 * <li>the permission is in the role's permission set</li>
 * </ol>
 *
 * <p>
 * Authorization is a pure read: it never writes and never consults the session store. Unknown permission names are
 * denied.
 */
@ApplicationScoped
public class PermissionService {

    private static final Logger LOG = Logger.getLogger(PermissionService.class);

    @Inject
    AdminAccessConfig adminAccess;

    public boolean authorize(Principal principal, Permission permission) {
        if (principal == null || permission == null) {
            return false;
        }
        if (!adminAccess.isAllowListed(principal.id())) {
            return false;
        }
        if (principal.role() == Role.NONE || !principal.active()) {
            return false;
        }
        return RolePermissions.grants(principal.role(), permission);
    }

    /**
     * Authorizes by permission name, denying names that match no known permission.
     */
    public boolean authorize(Principal principal, String permissionName) {
        Optional<Permission> permission = Permission.fromKey(permissionName);
        if (permission.isEmpty()) {
            LOG.warnf("Denied unknown permission '%s' for principal %d", permissionName,
                    principal == null ? -1 : principal.id());
            return false;
        }
        return authorize(principal, permission.get());
    }

    public boolean isAdmin(Principal principal) {
        return principal != null && adminAccess.isAllowListed(principal.id()) && principal.role() != Role.NONE
                && principal.active();
    }

    /**
     * Effective permissions, empty unless {@link #isAdmin(Principal)}.
     */
    public Set<Permission> permissionsOf(Principal principal) {
        return isAdmin(principal) ? RolePermissions.of(principal.role()) : Set.of();
    }
}
