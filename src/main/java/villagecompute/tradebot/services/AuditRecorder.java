/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.services;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.tradebot.data.models.AuditEntry;
import villagecompute.tradebot.data.models.Permission;
import villagecompute.tradebot.data.models.Principal;
import villagecompute.tradebot.data.store.MarketplaceDataStore;
import villagecompute.tradebot.exceptions.AuditWriteException;
import villagecompute.tradebot.exceptions.ForbiddenException;
import villagecompute.tradebot.exceptions.StorageException;

import java.time.Instant;
import java.util.List;

/**
 * Writes and reads the append-only admin audit log.
 *
 * <p>
 * Entries are only written for moderation actions that were applied (and, when {@code tradebot.audit.record-denied}
 * is enabled, for denied attempts). Reading the log requires {@link Permission#VIEW_AUDIT_LOG}.
 *
 * <p>
 * The detail map must serialize to JSON; an entry whose detail cannot be serialized is never written.
 */
@ApplicationScoped
public class AuditRecorder {

    private static final Logger LOG = Logger.getLogger(AuditRecorder.class);

    static final String DENIED_PREFIX = "denied:";
    static final int MAX_PAGE = 100;

    @Inject
    MarketplaceDataStore store;

    @Inject
    BoundedStoreExecutor storeCalls;

    @Inject
    PermissionService permissions;

    @Inject
    ObjectMapper objectMapper;

    /**
     * Records an applied moderation action.
     *
     * @return the stored entry
     * @throws AuditWriteException
     *             if the entry could not be written
     */
    public AuditEntry record(ModerationCommand command) {
        AuditEntry entry = toEntry(command.action(), command);
        try {
            return storeCalls.call("append_audit", () -> store.appendAudit(entry));
        } catch (StorageException e) {
            throw new AuditWriteException("Failed to write audit entry for " + command.action(), e);
        }
    }

    /**
     * Records an applied moderation action on the caller's thread. Used inside a store transaction that already
     * runs under the store timeout.
     */
    AuditEntry recordWithin(MarketplaceDataStore transactionalStore, ModerationCommand command) {
        try {
            return transactionalStore.appendAudit(toEntry(command.action(), command));
        } catch (AuditWriteException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AuditWriteException("Failed to write audit entry for " + command.action(), e);
        }
    }

    /**
     * Records a denied attempt as {@code denied:<action>}. Failures are logged, never raised: the caller has already
     * refused the action.
     */
    public void recordDenied(ModerationCommand command) {
        try {
            AuditEntry entry = toEntry(DENIED_PREFIX + command.action(), command);
            storeCalls.call("append_audit", () -> store.appendAudit(entry));
        } catch (AuditWriteException | StorageException e) {
            LOG.errorf(e, "Failed to record denied %s attempt by principal %d", command.action(),
                    command.actor().id());
        }
    }

    /**
     * Most recent entries first.
     *
     * @param viewer
     *            principal reading the log
     * @param limit
     *            maximum entries, capped at 100
     * @param actorId
     *            optional actor filter
     * @param action
     *            optional action tag filter
     * @throws ForbiddenException
     *             if the viewer lacks {@code view_audit_log}
     */
    public List<AuditEntry> recent(Principal viewer, int limit, Long actorId, String action) {
        requireViewer(viewer);
        int capped = Math.max(1, Math.min(limit, MAX_PAGE));
        return storeCalls.call("recent_audit", () -> store.recentAudit(capped, actorId, action));
    }

    /**
     * Entries touching a target, most recent first.
     *
     * @throws ForbiddenException
     *             if the viewer lacks {@code view_audit_log}
     */
    public List<AuditEntry> search(Principal viewer, String targetType, Long targetId, int limit, int offset) {
        requireViewer(viewer);
        int capped = Math.max(1, Math.min(limit, MAX_PAGE));
        int start = Math.max(0, offset);
        return storeCalls.call("search_audit", () -> store.searchAudit(targetType, targetId, capped, start));
    }

    /**
     * One-line rendering of an entry for admin views.
     */
    public String describe(AuditEntry entry) {
        StringBuilder line = new StringBuilder().append('#').append(entry.id()).append(' ').append(entry.createdAt())
                .append(" by ").append(entry.actorId()).append(": ").append(entry.action());
        if (entry.targetType() != null) {
            line.append(' ').append(entry.targetType()).append('#').append(entry.targetId());
        }
        if (!entry.detail().isEmpty()) {
            line.append(' ').append(detailJson(entry));
        }
        return line.toString();
    }

    String detailJson(AuditEntry entry) {
        try {
            return objectMapper.writeValueAsString(entry.detail());
        } catch (JsonProcessingException e) {
            throw new AuditWriteException("Audit detail is not serializable for " + entry.action(), e);
        }
    }

    private AuditEntry toEntry(String action, ModerationCommand command) {
        AuditEntry entry = new AuditEntry(null, command.actor().id(), action, command.targetType(),
                command.targetId(), command.detail(), Instant.now());
        detailJson(entry);
        return entry;
    }

    private void requireViewer(Principal viewer) {
        if (!permissions.authorize(viewer, Permission.VIEW_AUDIT_LOG)) {
            LOG.warnf("Principal %d denied audit log access", viewer == null ? -1 : viewer.id());
            throw new ForbiddenException("You do not have permission to view the audit log.");
        }
    }
}
