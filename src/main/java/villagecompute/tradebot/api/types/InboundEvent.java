/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.Optional;

/**
 * Transport-agnostic input to the conversation core.
 *
 * <p>
 * For {@link InputKind#MEDIA} the raw payload is the storage reference of the photo; the core never loads the file.
 */
public record InboundEvent(@JsonProperty("principal_id") long principalId,

        @JsonProperty("kind") InputKind kind,

        @JsonProperty("raw") String raw) {

    public InboundEvent {
        Objects.requireNonNull(kind, "kind is required");
    }

    public static InboundEvent text(long principalId, String text) {
        return new InboundEvent(principalId, InputKind.TEXT, text);
    }

    public static InboundEvent selection(long principalId, String data) {
        return new InboundEvent(principalId, InputKind.SELECTION, data);
    }

    public static InboundEvent media(long principalId, String reference) {
        return new InboundEvent(principalId, InputKind.MEDIA, reference);
    }

    public boolean isText() {
        return kind == InputKind.TEXT;
    }

    public boolean isMedia() {
        return kind == InputKind.MEDIA;
    }

    /**
     * Trimmed text for {@link InputKind#TEXT} events, empty otherwise.
     */
    public Optional<String> text() {
        if (kind != InputKind.TEXT || raw == null) {
            return Optional.empty();
        }
        return Optional.of(raw.trim());
    }

    /**
     * Parsed selection for {@link InputKind#SELECTION} events, empty when not a selection or malformed.
     */
    public Optional<Selection> selection() {
        if (kind != InputKind.SELECTION) {
            return Optional.empty();
        }
        return Selection.tryParse(raw);
    }
}
