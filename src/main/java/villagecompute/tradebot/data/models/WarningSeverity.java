/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.data.models;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum WarningSeverity {

    LOW("low"), MEDIUM("medium"), HIGH("high");

    private final String key;

    WarningSeverity(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static Optional<WarningSeverity> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(severity -> severity.key.equals(normalized)).findFirst();
    }
}
