/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.api.types;

/**
 * Intent of an {@link OutboundAction}; the transport decides how to render each.
 */
public enum ActionType {
    /** Asks for the next input of the active state. */
    PROMPT,
    /** Input rejected or operation failed; no state advanced. */
    ERROR,
    /** A commit or moderation action succeeded. */
    CONFIRMATION,
    /** Informational: cancellation, no active operation, expired session. */
    NOTICE,
    /** Read-only output such as search results. */
    RESULT
}
