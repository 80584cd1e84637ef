/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.services;

import villagecompute.tradebot.data.models.Session;

import java.util.Optional;

/**
 * Holds at most one live {@link Session} per principal.
 *
 * <p>
 * Implementations throw {@link villagecompute.tradebot.exceptions.SessionStoreException} when unavailable. Callers
 * serialize access per principal through {@link PrincipalLocks}.
 */
public interface SessionStore {

    Optional<Session> find(long principalId);

    /**
     * Stores the session, replacing any existing session of the same principal.
     */
    void put(Session session);

    void delete(long principalId);

    /**
     * Approximate number of live sessions.
     */
    long size();
}
