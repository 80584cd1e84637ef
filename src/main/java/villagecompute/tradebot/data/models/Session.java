/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.data.models;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Live, resumable state of one principal's in-progress conversation.
 *
 * <p>
 * Sessions are immutable; every advance yields a new instance. The payload keeps insertion order so the collected
 * steps read in the order they were answered.
 */
public record Session(long principalId, ConversationKind kind, ConversationState state, Map<String, Object> payload,
        Instant createdAt, Instant updatedAt) {

    public Session {
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(state, "state is required");
        Objects.requireNonNull(createdAt, "createdAt is required");
        Objects.requireNonNull(updatedAt, "updatedAt is required");
        payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload == null ? Map.of() : payload));
    }

    public static Session start(long principalId, ConversationKind kind, ConversationState state,
            Map<String, Object> seed, Instant now) {
        return new Session(principalId, kind, state, seed, now, now);
    }

    public Session advance(ConversationState nextState, Map<String, Object> nextPayload, Instant now) {
        return new Session(principalId, kind, nextState, nextPayload, createdAt, now);
    }

    public boolean isExpired(Instant now, Duration ttl) {
        return updatedAt.plus(ttl).isBefore(now);
    }

    @SuppressWarnings("unchecked")
    public <T> T get(String key) {
        return (T) payload.get(key);
    }

    public boolean has(String key) {
        return payload.containsKey(key);
    }
}
