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
import villagecompute.tradebot.data.models.MarketplaceUser;
import villagecompute.tradebot.data.models.Principal;
import villagecompute.tradebot.data.store.MarketplaceDataStore;

import java.time.Instant;
import java.util.Optional;

/**
 * Resolves the acting {@link Principal} for an inbound event, registering unseen users on first contact.
 */
@ApplicationScoped
public class PrincipalService {

    private static final Logger LOG = Logger.getLogger(PrincipalService.class);

    @Inject
    MarketplaceDataStore store;

    @Inject
    BoundedStoreExecutor storeCalls;

    @Inject
    AdminAccessConfig adminAccess;

    /**
     * @throws villagecompute.tradebot.exceptions.StorageException
     *             if the store cannot be reached
     */
    public Principal resolve(long principalId) {
        return storeCalls.call("resolve_principal", () -> {
            Optional<MarketplaceUser> existing = store.findUser(principalId);
            if (existing.isPresent()) {
                return existing.get().toPrincipal();
            }
            MarketplaceUser created = store
                    .saveUser(MarketplaceUser.create(principalId, adminAccess.initialRole(principalId), Instant.now()));
            LOG.infof("Registered user %d with role %s", principalId, created.role.getKey());
            return created.toPrincipal();
        });
    }
}
