/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Reply produced by the conversation core. Keyboard construction from {@code suggestedInputs} is up to the
 * transport.
 */
public record OutboundAction(@JsonProperty("principal_id") long principalId,

        @JsonProperty("type") ActionType type,

        @JsonProperty("content") String content,

        @JsonProperty("suggested_inputs") List<String> suggestedInputs) {

    public OutboundAction {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(content, "content is required");
        suggestedInputs = suggestedInputs == null ? List.of() : List.copyOf(suggestedInputs);
    }

    public static OutboundAction of(long principalId, ActionType type, String content) {
        return new OutboundAction(principalId, type, content, List.of());
    }
}
