/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.conversation;

import java.util.Map;

@FunctionalInterface
public interface Successor {

    Transition next(Map<String, Object> payload, Object value);
}
