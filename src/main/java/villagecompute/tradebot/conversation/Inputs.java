/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.conversation;

import villagecompute.tradebot.api.types.InboundEvent;
import villagecompute.tradebot.api.types.Selection;

import java.util.Locale;
import java.util.Optional;

/**
 * Helpers for reading answers that may arrive either as typed text or as a button selection.
 */
public final class Inputs {

    public static final String SKIP = "skip";
    public static final String DONE = "done";
    public static final String YES = "yes";
    public static final String NO = "no";

    private Inputs() {
    }

    public static Optional<String> text(InboundEvent event) {
        return event.text();
    }

    /**
     * Value of a {@code tag:<value>} selection, or the lower-cased text.
     */
    public static Optional<String> choice(InboundEvent event, String tag) {
        Optional<Selection> selection = event.selection();
        if (selection.isPresent()) {
            Selection s = selection.get();
            return s.is(tag) && s.arity() == 1 ? Optional.of(s.param(0)) : Optional.empty();
        }
        return event.text().map(text -> text.toLowerCase(Locale.ROOT));
    }

    public static boolean isSkip(InboundEvent event) {
        if (event.selection().map(s -> s.is(SKIP) && s.arity() == 0).orElse(false)) {
            return true;
        }
        return event.text().map(SKIP::equalsIgnoreCase).orElse(false);
    }

    /**
     * Reads a yes/no answer from {@code yes}, {@code no} or {@code confirm:yes|no}.
     */
    public static Optional<Boolean> yesNo(InboundEvent event) {
        return choice(event, "confirm").flatMap(answer -> switch (answer) {
            case YES, "y" -> Optional.of(Boolean.TRUE);
            case NO, "n" -> Optional.of(Boolean.FALSE);
            default -> Optional.empty();
        });
    }

    /**
     * Parses a positive id from text such as {@code 123} or {@code #123}.
     */
    public static Optional<Long> id(InboundEvent event) {
        return event.text().map(text -> text.startsWith("#") ? text.substring(1) : text).flatMap(text -> {
            try {
                long value = Long.parseLong(text);
                return value > 0 ? Optional.of(value) : Optional.empty();
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        });
    }

    public static Validation confirm(InboundEvent event) {
        return yesNo(event).map(yes -> yes ? Validation.accept(Boolean.TRUE) : Validation.discard())
                .orElseGet(() -> Validation.reject("Please answer yes or no."));
    }

    /**
     * Text of bounded length.
     */
    public static Validation boundedText(InboundEvent event, String field, int min, int max) {
        Optional<String> text = event.text();
        if (text.isEmpty() || text.get().isEmpty()) {
            return Validation.reject("Please send the " + field + " as text.");
        }
        int length = text.get().length();
        if (length < min) {
            return Validation.reject("The " + field + " must be at least " + min + " characters.");
        }
        if (length > max) {
            return Validation.reject("The " + field + " must be at most " + max + " characters.");
        }
        return Validation.accept(text.get());
    }
}
