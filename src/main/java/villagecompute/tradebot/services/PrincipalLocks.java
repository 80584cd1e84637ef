/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.services;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.concurrent.locks.ReentrantLock;

/**
 * One lock per principal so that events of the same principal are handled one at a time while different principals
 * proceed in parallel.
 *
 * <p>
 * Locks are weakly held and disappear once no thread references them.
 */
@ApplicationScoped
public class PrincipalLocks {

    private final LoadingCache<Long, ReentrantLock> locks = Caffeine.newBuilder().weakValues()
            .build(id -> new ReentrantLock());

    public ReentrantLock lockFor(long principalId) {
        return locks.get(principalId);
    }
}
