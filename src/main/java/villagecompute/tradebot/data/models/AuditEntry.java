/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.data.models;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable record of an authorized, successfully applied moderation mutation.
 *
 * <p>
 * <b>Field mapping:</b>
 * <ul>
 * <li>{@code id} - assigned by the data store on append (null before)</li>
 * <li>{@code actor_id} - principal who performed the action</li>
 * <li>{@code action} - action tag, e.g. {@code flag_listing}</li>
 * <li>{@code target_type} / {@code target_id} - what the action touched</li>
 * <li>{@code detail} - free-form structured context (reason, severity, ...)</li>
 * </ul>
 */
public record AuditEntry(@JsonProperty("id") Long id,

        @JsonProperty("actor_id") long actorId,

        @JsonProperty("action") String action,

        @JsonProperty("target_type") String targetType,

        @JsonProperty("target_id") Long targetId,

        @JsonProperty("detail") Map<String, Object> detail,

        @JsonProperty("created_at") Instant createdAt) {

    public AuditEntry {
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(createdAt, "createdAt is required");
        detail = Collections.unmodifiableMap(new LinkedHashMap<>(detail == null ? Map.of() : detail));
    }

    public AuditEntry withId(long assignedId) {
        return new AuditEntry(assignedId, actorId, action, targetType, targetId, detail, createdAt);
    }
}
