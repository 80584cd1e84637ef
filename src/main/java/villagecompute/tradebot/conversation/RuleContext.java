/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.conversation;

import villagecompute.tradebot.data.models.Principal;
import villagecompute.tradebot.data.models.Session;
import villagecompute.tradebot.data.store.MarketplaceDataStore;
import villagecompute.tradebot.services.BoundedStoreExecutor;

import java.time.Instant;
import java.util.Map;
import java.util.function.Function;

/**
 * What a rule may see while handling one event: the acting principal, the current session and bounded access to the
 * data store.
 */
public final class RuleContext {

    private final Principal principal;
    private final Session session;
    private final MarketplaceDataStore store;
    private final BoundedStoreExecutor storeCalls;
    private final Instant now;

    public RuleContext(Principal principal, Session session, MarketplaceDataStore store,
            BoundedStoreExecutor storeCalls, Instant now) {
        this.principal = principal;
        this.session = session;
        this.store = store;
        this.storeCalls = storeCalls;
        this.now = now;
    }

    public Principal principal() {
        return principal;
    }

    /**
     * Current session, null while a conversation is being started.
     */
    public Session session() {
        return session;
    }

    public Map<String, Object> payload() {
        return session == null ? Map.of() : session.payload();
    }

    public Instant now() {
        return now;
    }

    /**
     * Runs a read against the store under the store timeout.
     *
     * @throws villagecompute.tradebot.exceptions.StorageException
     *             if the store fails or times out
     */
    public <T> T lookup(String operation, Function<MarketplaceDataStore, T> query) {
        return storeCalls.call(operation, () -> query.apply(store));
    }

    /**
     * Direct store access for commit steps, which the controller already runs under the store timeout.
     */
    public MarketplaceDataStore store() {
        return store;
    }
}
