/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.data.store;

import java.util.Arrays;
import java.util.Optional;

public enum UserFilter {

    ALL("all"), ACTIVE("active"), BLOCKED("blocked");

    private final String key;

    UserFilter(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static Optional<UserFilter> fromKey(String key) {
        return Arrays.stream(values()).filter(filter -> filter.key.equals(key)).findFirst();
    }
}
