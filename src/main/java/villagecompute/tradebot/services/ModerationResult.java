/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.services;

import villagecompute.tradebot.data.models.AuditEntry;

/**
 * Outcome of {@link ModerationDispatcher#dispatch(ModerationCommand, ModerationMutation)}.
 *
 * @param status
 *            what happened
 * @param command
 *            the dispatched command
 * @param auditEntry
 *            stored audit entry when {@link Status#APPLIED}, null otherwise
 * @param message
 *            user-facing explanation for non-applied outcomes
 */
public record ModerationResult(Status status, ModerationCommand command, AuditEntry auditEntry, String message) {

    public enum Status {
        /** Mutation and audit entry both written. */
        APPLIED,
        /** Permission denied; nothing written. */
        FORBIDDEN,
        /** Mutation failed; nothing written. */
        STORAGE_ERROR,
        /** Mutation written but audit entry lost. */
        AUDIT_FAILED
    }

    public static ModerationResult applied(ModerationCommand command, AuditEntry entry) {
        return new ModerationResult(Status.APPLIED, command, entry, null);
    }

    public static ModerationResult forbidden(ModerationCommand command, String message) {
        return new ModerationResult(Status.FORBIDDEN, command, null, message);
    }

    public static ModerationResult storageError(ModerationCommand command, String message) {
        return new ModerationResult(Status.STORAGE_ERROR, command, null, message);
    }

    public static ModerationResult auditFailed(ModerationCommand command, String message) {
        return new ModerationResult(Status.AUDIT_FAILED, command, null, message);
    }

    public boolean isApplied() {
        return status == Status.APPLIED;
    }

    /**
     * Whether the mutation reached the store.
     */
    public boolean mutated() {
        return status == Status.APPLIED || status == Status.AUDIT_FAILED;
    }
}
