/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.tradebot.data.models.AuditEntry;
import villagecompute.tradebot.data.models.Permission;
import villagecompute.tradebot.data.store.MarketplaceDataStore;
import villagecompute.tradebot.exceptions.AuditWriteException;
import villagecompute.tradebot.exceptions.ResourceNotFoundException;
import villagecompute.tradebot.exceptions.StorageException;
import villagecompute.tradebot.observability.LoggingConfig;
import villagecompute.tradebot.observability.ObservabilityMetrics;

import java.util.Locale;
import java.util.Optional;

/**
 * Single path through which every privileged action runs.
 *
 * <p>
 * <b>Dispatch Order:</b>
 * <ol>
 * <li>Resolve the permission required by the action tag (unknown tags are forbidden)</li>
 * <li>Authorize the actor; on denial nothing is written</li>
 * <li>Apply the mutation to the data store under the store timeout; on failure no audit entry is written</li>
 * <li>Append the audit entry; a failure here leaves the mutation in place and is logged at FATAL</li>
 * </ol>
 *
 * <p>
 * When the data store supports transactions, steps 3 and 4 commit together and an audit failure rolls the mutation
 * back.
 *
 * @see ModerationActions for the action to permission table
 * @see AuditRecorder
 */
@ApplicationScoped
public class ModerationDispatcher {

    private static final Logger LOG = Logger.getLogger(ModerationDispatcher.class);

    static final String FORBIDDEN_MESSAGE = "You do not have permission to perform this action.";
    static final String STORAGE_MESSAGE = "The action could not be completed right now. Please try again.";
    static final String AUDIT_FAILED_MESSAGE = "The action was applied, but it could not be recorded in the audit log. "
            + "Operators have been alerted.";

    @Inject
    PermissionService permissions;

    @Inject
    AuditRecorder auditRecorder;

    @Inject
    MarketplaceDataStore store;

    @Inject
    BoundedStoreExecutor storeCalls;

    @Inject
    ObservabilityMetrics metrics;

    @ConfigProperty(
            name = "tradebot.audit.record-denied",
            defaultValue = "false")
    boolean recordDenied;

    public ModerationResult dispatch(ModerationCommand command, ModerationMutation mutation) {
        LoggingConfig.setModerationAction(command.action());
        try {
            Optional<Permission> required = ModerationActions.requiredPermission(command.action());
            if (required.isEmpty() || !permissions.authorize(command.actor(), required.get())) {
                return deny(command);
            }
            ModerationResult result = store.supportsTransactions()
                    ? applyTransactional(command, mutation)
                    : applyThenAudit(command, mutation);
            metrics.recordModerationAction(command.action(), result.status().name().toLowerCase(Locale.ROOT));
            return result;
        } finally {
            LoggingConfig.clearModerationAction();
        }
    }

    private ModerationResult deny(ModerationCommand command) {
        LOG.warnf("Denied %s on %s %d for principal %d (role=%s)", command.action(), command.targetType(),
                command.targetId(), command.actor().id(), command.actor().role().getKey());
        metrics.recordModerationAction(command.action(), "forbidden");
        if (recordDenied) {
            auditRecorder.recordDenied(command);
        }
        return ModerationResult.forbidden(command, FORBIDDEN_MESSAGE);
    }

    private ModerationResult applyThenAudit(ModerationCommand command, ModerationMutation mutation) {
        try {
            storeCalls.run(command.action(), () -> mutation.apply(store));
        } catch (ResourceNotFoundException e) {
            LOG.warnf("%s target %s %d vanished before commit", command.action(), command.targetType(),
                    command.targetId());
            return ModerationResult.storageError(command, "The target no longer exists.");
        } catch (StorageException e) {
            LOG.errorf(e, "Mutation %s on %s %d failed", command.action(), command.targetType(), command.targetId());
            return ModerationResult.storageError(command, STORAGE_MESSAGE);
        }

        try {
            AuditEntry entry = auditRecorder.record(command);
            LOG.infof("Applied %s on %s %d by principal %d (audit #%d)", command.action(), command.targetType(),
                    command.targetId(), command.actor().id(), entry.id());
            return ModerationResult.applied(command, entry);
        } catch (AuditWriteException e) {
            LOG.fatalf(e, "AUDIT LOST: %s on %s %d by principal %d was applied but not recorded", command.action(),
                    command.targetType(), command.targetId(), command.actor().id());
            metrics.recordInternalFault("audit_write");
            return ModerationResult.auditFailed(command, AUDIT_FAILED_MESSAGE);
        }
    }

    private ModerationResult applyTransactional(ModerationCommand command, ModerationMutation mutation) {
        try {
            AuditEntry entry = storeCalls.call(command.action(), () -> store.inTransaction(() -> {
                mutation.apply(store);
                return auditRecorder.recordWithin(store, command);
            }));
            LOG.infof("Applied %s on %s %d by principal %d (audit #%d)", command.action(), command.targetType(),
                    command.targetId(), command.actor().id(), entry.id());
            return ModerationResult.applied(command, entry);
        } catch (ResourceNotFoundException e) {
            return ModerationResult.storageError(command, "The target no longer exists.");
        } catch (StorageException e) {
            LOG.errorf(e, "Transaction for %s on %s %d rolled back", command.action(), command.targetType(),
                    command.targetId());
            return ModerationResult.storageError(command, STORAGE_MESSAGE);
        }
    }
}
