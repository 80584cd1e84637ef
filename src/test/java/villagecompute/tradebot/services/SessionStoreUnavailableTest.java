/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;

import java.util.List;

import jakarta.inject.Inject;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.quarkus.test.InjectMock;
import io.quarkus.test.junit.QuarkusTest;
import villagecompute.tradebot.api.types.ActionType;
import villagecompute.tradebot.api.types.InboundEvent;
import villagecompute.tradebot.api.types.OutboundAction;
import villagecompute.tradebot.data.models.Session;
import villagecompute.tradebot.data.store.InMemoryMarketplaceDataStore;
import villagecompute.tradebot.exceptions.SessionStoreException;

/**
 * Session store outages: reads fail open as "no session", writes surface as an unavailable error.
 */
@QuarkusTest
class SessionStoreUnavailableTest {

    private static final long BUYER = 20L;

    @InjectMock
    SessionStore sessions;

    @Inject
    InMemoryMarketplaceDataStore store;

    @Inject
    ConversationController controller;

    @BeforeEach
    void setUp() {
        store.clear();
        when(sessions.find(anyLong())).thenThrow(new SessionStoreException("cache offline"));
    }

    @Test
    void testUnreadableSessionIsTreatedAsAbsent() {
        List<OutboundAction> actions = controller.handle(InboundEvent.text(BUYER, "bike"));

        assertEquals(ActionType.NOTICE, actions.get(0).type());
        assertEquals(ConversationController.NO_ACTIVE_OPERATION, actions.get(0).content());
    }

    @Test
    void testStartStillPromptsWhenReadsFail() {
        List<OutboundAction> actions = controller.handle(InboundEvent.text(BUYER, "/search"));

        assertEquals(ActionType.PROMPT, actions.get(0).type());
    }

    @Test
    void testWriteFailureIsReportedAsUnavailable() {
        doThrow(new SessionStoreException("cache offline")).when(sessions).put(any(Session.class));

        List<OutboundAction> actions = controller.handle(InboundEvent.text(BUYER, "/search"));

        assertEquals(ActionType.ERROR, actions.get(0).type());
        assertEquals(ConversationController.UNAVAILABLE, actions.get(0).content());
    }
}
