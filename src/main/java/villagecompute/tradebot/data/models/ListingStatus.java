/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.data.models;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum ListingStatus {

    ACTIVE("active"), SOLD("sold"), FLAGGED("flagged"), DELETED("deleted");

    private final String key;

    ListingStatus(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static Optional<ListingStatus> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(status -> status.key.equals(normalized)).findFirst();
    }
}
