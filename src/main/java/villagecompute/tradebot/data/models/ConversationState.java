/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.data.models;

/**
 * Step identifiers shared across conversation kinds. Which states are valid for a kind is declared by the
 * {@link villagecompute.tradebot.services.StateMachineRegistry}.
 */
public enum ConversationState {
    // listing create / edit
    TITLE, DESCRIPTION, PRICE, CATEGORY, PHOTOS, LOCATION, CONFIRM,
    // search
    KEYWORD, CATEGORY_FILTER, MIN_PRICE, MAX_PRICE, EXECUTE,
    // messaging
    RECIPIENT_CONTEXT, BODY,
    // profile
    PHONE, BIO,
    // reviews
    RATING, COMMENT,
    // admin flows
    TARGET_USER, TARGET_LISTING, TARGET_REVIEW, SEVERITY, REASON, SCOPE, CRITERIA
}
