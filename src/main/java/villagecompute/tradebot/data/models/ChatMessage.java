/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.data.models;

import java.time.Instant;

/**
 * Buyer/seller message persisted by the messaging conversation.
 */
public class ChatMessage {

    public Long id;

    public long senderId;

    public long receiverId;

    public Long listingId;

    public String body;

    public Instant createdAt;
}
