/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.data.models;

/**
 * Category of multi-step flow a {@link Session} belongs to.
 */
public enum ConversationKind {

    LISTING_CREATE("listing_create", false),
    LISTING_EDIT("listing_edit", false),
    LISTING_STATUS("listing_status", false),
    SEARCH("search", false),
    MESSAGING("messaging", false),
    PROFILE_EDIT("profile_edit", false),
    REVIEW("review", false),
    ADMIN_BLOCK("admin_block", true),
    ADMIN_WARN("admin_warn", true),
    ADMIN_FLAG("admin_flag", true),
    ADMIN_DELETE("admin_delete", true),
    ADMIN_REVIEW_DELETE("admin_review_delete", true),
    ADMIN_FILTER("admin_filter", true);

    private final String key;
    private final boolean admin;

    ConversationKind(String key, boolean admin) {
        this.key = key;
        this.admin = admin;
    }

    public String getKey() {
        return key;
    }

    /**
     * Admin kinds are only startable by admin principals and route their mutations through the moderation
     * dispatcher.
     */
    public boolean isAdmin() {
        return admin;
    }
}
