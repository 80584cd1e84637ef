/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.function.Supplier;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import villagecompute.tradebot.data.models.AuditEntry;
import villagecompute.tradebot.data.models.Permission;
import villagecompute.tradebot.data.models.Principal;
import villagecompute.tradebot.data.models.Role;
import villagecompute.tradebot.data.store.MarketplaceDataStore;
import villagecompute.tradebot.exceptions.AuditWriteException;
import villagecompute.tradebot.exceptions.StorageException;
import villagecompute.tradebot.observability.ObservabilityMetrics;

/**
 * Unit tests for {@link ModerationDispatcher} ordering: permission, then mutation, then audit.
 */
class ModerationDispatcherTest {

    private static final Principal ADMIN = new Principal(100L, Role.ADMIN, true);
    private static final Principal MODERATOR = new Principal(300L, Role.MODERATOR, true);

    @Mock
    PermissionService permissions;

    @Mock
    AuditRecorder auditRecorder;

    @Mock
    MarketplaceDataStore store;

    @Mock
    ObservabilityMetrics metrics;

    @Mock
    ModerationMutation mutation;

    private ModerationDispatcher dispatcher;
    private BoundedStoreExecutor storeCalls;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        storeCalls = new BoundedStoreExecutor();
        storeCalls.timeout = Duration.ofMillis(500);
        storeCalls.init();

        dispatcher = new ModerationDispatcher();
        dispatcher.permissions = permissions;
        dispatcher.auditRecorder = auditRecorder;
        dispatcher.store = store;
        dispatcher.storeCalls = storeCalls;
        dispatcher.metrics = metrics;

        when(permissions.authorize(ADMIN, Permission.MANAGE_USERS)).thenReturn(true);
        when(permissions.authorize(ADMIN, Permission.MANAGE_LISTINGS)).thenReturn(true);
        when(permissions.authorize(MODERATOR, Permission.MANAGE_USERS)).thenReturn(false);
    }

    @AfterEach
    void tearDown() {
        storeCalls.shutdown();
    }

    private static ModerationCommand block(Principal actor) {
        return new ModerationCommand(actor, ModerationActions.BLOCK_USER, ModerationActions.TARGET_USER, 42L,
                Map.of("reason", "spam"));
    }

    private static AuditEntry entry(ModerationCommand command) {
        return new AuditEntry(1L, command.actor().id(), command.action(), command.targetType(), command.targetId(),
                command.detail(), Instant.now());
    }

    @Test
    void testForbiddenWritesNothing() {
        ModerationResult result = dispatcher.dispatch(block(MODERATOR), mutation);

        assertEquals(ModerationResult.Status.FORBIDDEN, result.status());
        assertNull(result.auditEntry());
        verifyNoInteractions(mutation);
        verifyNoInteractions(auditRecorder);
        verify(metrics).recordModerationAction(ModerationActions.BLOCK_USER, "forbidden");
    }

    @Test
    void testForbiddenRecordsDeniedAttemptWhenEnabled() {
        dispatcher.recordDenied = true;
        ModerationCommand command = block(MODERATOR);

        dispatcher.dispatch(command, mutation);

        verifyNoInteractions(mutation);
        verify(auditRecorder).recordDenied(command);
        verify(auditRecorder, never()).record(any());
    }

    @Test
    void testUnknownActionIsForbidden() {
        ModerationCommand command = new ModerationCommand(ADMIN, "nuke_user", ModerationActions.TARGET_USER, 42L,
                Map.of());

        ModerationResult result = dispatcher.dispatch(command, mutation);

        assertEquals(ModerationResult.Status.FORBIDDEN, result.status());
        verifyNoInteractions(mutation);
    }

    @Test
    void testAppliedMutatesOnceThenAuditsOnce() {
        ModerationCommand command = block(ADMIN);
        when(auditRecorder.record(command)).thenReturn(entry(command));

        ModerationResult result = dispatcher.dispatch(command, mutation);

        assertEquals(ModerationResult.Status.APPLIED, result.status());
        assertNotNull(result.auditEntry());
        InOrder order = inOrder(mutation, auditRecorder);
        order.verify(mutation).apply(store);
        order.verify(auditRecorder).record(command);
        order.verifyNoMoreInteractions();
        verify(metrics).recordModerationAction(ModerationActions.BLOCK_USER, "applied");
    }

    @Test
    void testMutationFailureSkipsAudit() {
        ModerationCommand command = block(ADMIN);
        doThrow(new IllegalStateException("connection reset")).when(mutation).apply(store);

        ModerationResult result = dispatcher.dispatch(command, mutation);

        assertEquals(ModerationResult.Status.STORAGE_ERROR, result.status());
        verifyNoInteractions(auditRecorder);
    }

    @Test
    void testMutationTimeoutSkipsAudit() {
        ModerationCommand command = block(ADMIN);
        ModerationMutation slow = s -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };

        ModerationResult result = dispatcher.dispatch(command, slow);

        assertEquals(ModerationResult.Status.STORAGE_ERROR, result.status());
        verifyNoInteractions(auditRecorder);
    }

    @Test
    void testAuditFailureAfterMutationIsReported() {
        ModerationCommand command = block(ADMIN);
        when(auditRecorder.record(command)).thenThrow(new AuditWriteException("disk full"));

        ModerationResult result = dispatcher.dispatch(command, mutation);

        assertEquals(ModerationResult.Status.AUDIT_FAILED, result.status());
        verify(mutation).apply(store);
        verify(metrics).recordInternalFault("audit_write");
    }

    @Test
    @SuppressWarnings("unchecked")
    void testTransactionalStoreCommitsMutationAndAuditTogether() {
        ModerationCommand command = block(ADMIN);
        when(store.supportsTransactions()).thenReturn(true);
        when(store.inTransaction(any())).thenAnswer(invocation -> ((Supplier<Object>) invocation.getArgument(0)).get());
        when(auditRecorder.recordWithin(store, command)).thenReturn(entry(command));

        ModerationResult result = dispatcher.dispatch(command, mutation);

        assertEquals(ModerationResult.Status.APPLIED, result.status());
        InOrder order = inOrder(mutation, auditRecorder);
        order.verify(mutation).apply(store);
        order.verify(auditRecorder).recordWithin(store, command);
        verify(auditRecorder, never()).record(any());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testTransactionalAuditFailureRollsBackAsStorageError() {
        ModerationCommand command = block(ADMIN);
        when(store.supportsTransactions()).thenReturn(true);
        when(store.inTransaction(any())).thenAnswer(invocation -> ((Supplier<Object>) invocation.getArgument(0)).get());
        when(auditRecorder.recordWithin(eq(store), any())).thenThrow(new AuditWriteException("constraint"));

        ModerationResult result = dispatcher.dispatch(command, mutation);

        assertEquals(ModerationResult.Status.STORAGE_ERROR, result.status());
        verify(metrics, never()).recordInternalFault(any());
    }

    @Test
    void testStorageExceptionFromExecutorIsStorageError() {
        BoundedStoreExecutor failing = mock(BoundedStoreExecutor.class);
        doThrow(new StorageException("down")).when(failing).run(any(), any());
        dispatcher.storeCalls = failing;

        ModerationResult result = dispatcher.dispatch(block(ADMIN), mutation);

        assertEquals(ModerationResult.Status.STORAGE_ERROR, result.status());
        verifyNoInteractions(auditRecorder);
    }
}
