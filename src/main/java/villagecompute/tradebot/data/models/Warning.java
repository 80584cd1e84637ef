/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.data.models;

import java.time.Instant;

/**
 * Moderation warning issued to a user by an admin.
 *
 * <p>
 * Created by the {@code warn_user} moderation action. {@code expiresAt} stays null unless a lifetime is configured for
 * the severity.
 */
public class Warning {

    public Long id;

    public long userId;

    public long adminId;

    public String reason;

    public WarningSeverity severity;

    public boolean active;

    public Instant createdAt;

    public Instant expiresAt;

    /**
     * Whether the warning still counts against the user at the given instant.
     */
    public boolean isActiveAt(Instant now) {
        return active && (expiresAt == null || expiresAt.isAfter(now));
    }
}
