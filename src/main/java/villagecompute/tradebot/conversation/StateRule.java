/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.conversation;

import villagecompute.tradebot.api.types.InboundEvent;
import villagecompute.tradebot.data.models.ConversationKind;
import villagecompute.tradebot.data.models.ConversationState;
import villagecompute.tradebot.data.models.Session;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Immutable rule for one {@code (kind, state)} pair.
 *
 * <p>
 * A rule validates the input, folds the accepted value into the payload and picks the next state. A rule with a
 * {@link Completion} is terminal: when its successor returns {@link Transition#terminal()} (the default) the
 * completion runs. Only terminal rules may skip waiting for input; such a state completes as soon as it is entered.
 *
 * <pre>
 * StateRule.input(ConversationKind.LISTING_CREATE, ConversationState.TITLE).prompt("Enter a title")
 *         .validate((ctx, event) -&gt; ListingFields.title(event)).storesAs("title").then(ConversationState.DESCRIPTION)
 *         .build();
 * </pre>
 */
public final class StateRule {

    private final ConversationKind kind;
    private final ConversationState state;
    private final Function<Session, String> prompt;
    private final List<String> suggestedInputs;
    private final InputValidator validator;
    private final PayloadApplier applier;
    private final Successor successor;
    private final Completion completion;
    private final boolean awaitsInput;

    private StateRule(Builder builder) {
        this.kind = builder.kind;
        this.state = builder.state;
        this.prompt = builder.prompt;
        this.suggestedInputs = List.copyOf(builder.suggestedInputs);
        this.validator = builder.validator;
        this.applier = builder.applier;
        this.successor = builder.successor;
        this.completion = builder.completion;
        this.awaitsInput = builder.awaitsInput;
    }

    public static Builder input(ConversationKind kind, ConversationState state) {
        return new Builder(kind, state, true);
    }

    /**
     * A terminal state entered and completed without input.
     */
    public static Builder automatic(ConversationKind kind, ConversationState state) {
        return new Builder(kind, state, false);
    }

    public ConversationKind kind() {
        return kind;
    }

    public ConversationState state() {
        return state;
    }

    public boolean awaitsInput() {
        return awaitsInput;
    }

    public boolean isTerminal() {
        return completion != null;
    }

    /**
     * Whether completing this rule writes to the store.
     */
    public boolean isMutating() {
        return completion != null && completion.mode() != Completion.Mode.QUERY;
    }

    public Completion completion() {
        return completion;
    }

    public String prompt(Session session) {
        return prompt.apply(session);
    }

    public List<String> suggestedInputs() {
        return suggestedInputs;
    }

    public Validation validate(RuleContext context, InboundEvent event) {
        return validator.validate(context, event);
    }

    public Map<String, Object> apply(Map<String, Object> payload, Object value) {
        return Collections.unmodifiableMap(applier.apply(payload, value));
    }

    public Transition next(Map<String, Object> payload, Object value) {
        return successor.next(payload, value);
    }

    public static final class Builder {

        private final ConversationKind kind;
        private final ConversationState state;
        private final boolean awaitsInput;
        private Function<Session, String> prompt = session -> "";
        private List<String> suggestedInputs = new ArrayList<>();
        private InputValidator validator;
        private PayloadApplier applier = (payload, value) -> payload;
        private Successor successor;
        private Completion completion;

        private Builder(ConversationKind kind, ConversationState state, boolean awaitsInput) {
            this.kind = Objects.requireNonNull(kind);
            this.state = Objects.requireNonNull(state);
            this.awaitsInput = awaitsInput;
        }

        public Builder prompt(String text) {
            this.prompt = session -> text;
            return this;
        }

        public Builder prompt(Function<Session, String> prompt) {
            this.prompt = prompt;
            return this;
        }

        public Builder suggest(String... inputs) {
            this.suggestedInputs.addAll(Arrays.asList(inputs));
            return this;
        }

        public Builder suggest(List<String> inputs) {
            this.suggestedInputs.addAll(inputs);
            return this;
        }

        public Builder validate(InputValidator validator) {
            this.validator = validator;
            return this;
        }

        /**
         * Stores the accepted value under {@code key}; a null value leaves the payload unchanged.
         */
        public Builder storesAs(String key) {
            this.applier = (payload, value) -> {
                if (value == null) {
                    return payload;
                }
                Map<String, Object> next = new LinkedHashMap<>(payload);
                next.put(key, value);
                return next;
            };
            return this;
        }

        public Builder applies(PayloadApplier applier) {
            this.applier = applier;
            return this;
        }

        public Builder then(ConversationState nextState) {
            this.successor = (payload, value) -> Transition.to(nextState);
            return this;
        }

        public Builder next(Successor successor) {
            this.successor = successor;
            return this;
        }

        public Builder completesWith(Completion completion) {
            this.completion = completion;
            return this;
        }

        public StateRule build() {
            if (!awaitsInput && completion == null) {
                throw new IllegalStateException("Automatic state " + kind + "/" + state + " must be terminal");
            }
            if (awaitsInput && validator == null) {
                throw new IllegalStateException("Input state " + kind + "/" + state + " needs a validator");
            }
            if (!awaitsInput) {
                validator = (context, event) -> Validation.accept(null);
            }
            if (successor == null) {
                if (completion == null) {
                    throw new IllegalStateException("Non-terminal state " + kind + "/" + state + " needs a successor");
                }
                successor = (payload, value) -> Transition.terminal();
            }
            return new StateRule(this);
        }
    }
}
