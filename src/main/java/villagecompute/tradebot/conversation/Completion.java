/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.conversation;

import villagecompute.tradebot.services.ModerationResult;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * What a terminal state does once its input is accepted.
 *
 * <p>
 * <b>Modes:</b>
 * <ul>
 * <li><b>COMMIT:</b> writes the payload to the data store directly; the controller runs the step under the store
 * timeout and keeps the session at the terminal state if it fails</li>
 * <li><b>QUERY:</b> read-only; the step performs its own lookups and returns a rendered result</li>
 * <li><b>MODERATION:</b> hands the payload to the moderation dispatcher and reports its result</li>
 * </ul>
 */
public final class Completion {

    public enum Mode {
        COMMIT, QUERY, MODERATION
    }

    @FunctionalInterface
    public interface CommitStep {

        /**
         * Persists the payload through {@link RuleContext#store()} and returns the confirmation text.
         */
        String commit(RuleContext context, Map<String, Object> payload);
    }

    @FunctionalInterface
    public interface QueryStep {

        String query(RuleContext context, Map<String, Object> payload);
    }

    @FunctionalInterface
    public interface ModerationStep {

        ModerationResult moderate(RuleContext context, Map<String, Object> payload);
    }

    private final Mode mode;
    private final CommitStep commitStep;
    private final QueryStep queryStep;
    private final ModerationStep moderationStep;
    private final Function<Map<String, Object>, String> appliedMessage;

    private Completion(Mode mode, CommitStep commitStep, QueryStep queryStep, ModerationStep moderationStep,
            Function<Map<String, Object>, String> appliedMessage) {
        this.mode = mode;
        this.commitStep = commitStep;
        this.queryStep = queryStep;
        this.moderationStep = moderationStep;
        this.appliedMessage = appliedMessage;
    }

    public static Completion commit(CommitStep step) {
        return new Completion(Mode.COMMIT, Objects.requireNonNull(step), null, null, null);
    }

    public static Completion query(QueryStep step) {
        return new Completion(Mode.QUERY, null, Objects.requireNonNull(step), null, null);
    }

    /**
     * @param appliedMessage
     *            confirmation text once the action has been applied
     */
    public static Completion moderation(ModerationStep step, Function<Map<String, Object>, String> appliedMessage) {
        return new Completion(Mode.MODERATION, null, null, Objects.requireNonNull(step),
                Objects.requireNonNull(appliedMessage));
    }

    public Mode mode() {
        return mode;
    }

    public String commit(RuleContext context, Map<String, Object> payload) {
        return commitStep.commit(context, payload);
    }

    public String query(RuleContext context, Map<String, Object> payload) {
        return queryStep.query(context, payload);
    }

    public ModerationResult moderate(RuleContext context, Map<String, Object> payload) {
        return moderationStep.moderate(context, payload);
    }

    public String appliedMessage(Map<String, Object> payload) {
        return appliedMessage.apply(payload);
    }
}
