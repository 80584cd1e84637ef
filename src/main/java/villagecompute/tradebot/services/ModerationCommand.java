/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.services;

import villagecompute.tradebot.data.models.Principal;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Request to perform one privileged action.
 *
 * @param actor
 *            principal performing the action
 * @param action
 *            action tag, e.g. {@code block_user}
 * @param targetType
 *            {@code user} or {@code listing}
 * @param targetId
 *            id of the target entity
 * @param detail
 *            action parameters copied into the audit entry (reason, severity, ...)
 */
public record ModerationCommand(Principal actor, String action, String targetType, long targetId,
        Map<String, Object> detail) {

    public ModerationCommand {
        Objects.requireNonNull(actor, "actor is required");
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(targetType, "targetType is required");
        detail = Collections.unmodifiableMap(new LinkedHashMap<>(detail == null ? Map.of() : detail));
    }
}
