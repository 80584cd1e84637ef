/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.conversation;

/**
 * Result of validating one input against a state rule.
 *
 * @param outcome
 *            accepted, rejected or discarded
 * @param value
 *            accepted value handed to the payload applier and successor, may be null for "skip"
 * @param message
 *            user-facing reason for a rejection
 */
public record Validation(Outcome outcome, Object value, String message) {

    public enum Outcome {
        ACCEPTED, REJECTED, DISCARDED
    }

    private static final Validation DISCARD = new Validation(Outcome.DISCARDED, null, null);

    public static Validation accept(Object value) {
        return new Validation(Outcome.ACCEPTED, value, null);
    }

    public static Validation reject(String message) {
        return new Validation(Outcome.REJECTED, null, message);
    }

    /**
     * The input ends the conversation without completing it (e.g. "no" at a confirmation).
     */
    public static Validation discard() {
        return DISCARD;
    }

    public boolean isAccepted() {
        return outcome == Outcome.ACCEPTED;
    }
}
