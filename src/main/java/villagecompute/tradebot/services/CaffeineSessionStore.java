/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.services;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.tradebot.data.models.Session;
import villagecompute.tradebot.exceptions.SessionStoreException;

import java.time.Duration;
import java.util.Optional;

/**
 * In-process session store backed by a Caffeine cache.
 *
 * <p>
 * Entries expire {@code tradebot.session.ttl} after their last write. The conversation controller also compares
 * {@link Session#updatedAt()} against the TTL itself so an expiry is reported to the user instead of silently
 * starting over.
 */
@ApplicationScoped
public class CaffeineSessionStore implements SessionStore {

    private static final Logger LOG = Logger.getLogger(CaffeineSessionStore.class);

    private static final long MAX_SESSIONS = 100_000;

    @ConfigProperty(
            name = "tradebot.session.ttl",
            defaultValue = "30m")
    Duration ttl;

    private Cache<Long, Session> sessions;

    @PostConstruct
    void init() {
        // Grace period so the controller sees the expired session and can tell the user
        sessions = Caffeine.newBuilder().expireAfterWrite(ttl.multipliedBy(2)).maximumSize(MAX_SESSIONS).build();
        LOG.infof("Session store initialized: ttl=%s, maxSessions=%d", ttl, MAX_SESSIONS);
    }

    @Override
    public Optional<Session> find(long principalId) {
        try {
            return Optional.ofNullable(sessions.getIfPresent(principalId));
        } catch (RuntimeException e) {
            throw new SessionStoreException("Failed to read session for principal " + principalId, e);
        }
    }

    @Override
    public void put(Session session) {
        try {
            sessions.put(session.principalId(), session);
        } catch (RuntimeException e) {
            throw new SessionStoreException("Failed to write session for principal " + session.principalId(), e);
        }
    }

    @Override
    public void delete(long principalId) {
        sessions.invalidate(principalId);
    }

    @Override
    public long size() {
        return sessions.estimatedSize();
    }

    /**
     * Runs pending evictions. Exposed for tests and housekeeping.
     */
    public void cleanUp() {
        sessions.cleanUp();
    }
}
