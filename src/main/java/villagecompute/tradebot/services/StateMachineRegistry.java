/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.services;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.tradebot.api.types.InboundEvent;
import villagecompute.tradebot.api.types.Selection;
import villagecompute.tradebot.conversation.ConversationDefinition;
import villagecompute.tradebot.conversation.SelectionSignature;
import villagecompute.tradebot.conversation.StateRule;
import villagecompute.tradebot.data.models.ConversationKind;
import villagecompute.tradebot.data.models.ConversationState;
import villagecompute.tradebot.exceptions.UnknownStateException;
import villagecompute.tradebot.exceptions.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Static table of conversation rules, built once at start-up from every {@link ConversationDefinition} bean.
 *
 * <p>
 * Start-up fails when two definitions claim the same kind, start tag or text alias, or when a kind declares two rules
 * for one state.
 */
@ApplicationScoped
public class StateMachineRegistry {

    private static final Logger LOG = Logger.getLogger(StateMachineRegistry.class);

    /**
     * A recognised start signal.
     *
     * @param definition
     *            the conversation to start
     * @param selection
     *            the start selection, null for a text alias
     */
    public record StartSignal(ConversationDefinition definition, Selection selection) {
    }

    @Inject
    Instance<ConversationDefinition> definitions;

    private final Map<ConversationKind, ConversationDefinition> byKind = new EnumMap<>(ConversationKind.class);
    private final Map<ConversationKind, Map<ConversationState, StateRule>> rules = new EnumMap<>(
            ConversationKind.class);
    private final Map<String, List<SelectionSignature>> signaturesByTag = new HashMap<>();
    private final Map<String, ConversationDefinition> definitionsByTag = new HashMap<>();
    private final Map<String, ConversationDefinition> aliases = new HashMap<>();

    @PostConstruct
    void init() {
        for (ConversationDefinition definition : definitions) {
            register(definition);
        }
        LOG.infof("Registered %d conversation kinds with %d start tags", byKind.size(), definitionsByTag.size());
    }

    void register(ConversationDefinition definition) {
        ConversationKind kind = definition.kind();
        if (byKind.putIfAbsent(kind, definition) != null) {
            throw new IllegalStateException("Duplicate conversation definition for " + kind);
        }

        Map<ConversationState, StateRule> kindRules = new EnumMap<>(ConversationState.class);
        for (StateRule rule : definition.rules()) {
            if (rule.kind() != kind) {
                throw new IllegalStateException("Rule " + rule.kind() + "/" + rule.state() + " declared by " + kind);
            }
            if (kindRules.put(rule.state(), rule) != null) {
                throw new IllegalStateException("Duplicate rule for " + kind + "/" + rule.state());
            }
        }
        rules.put(kind, Collections.unmodifiableMap(kindRules));

        for (SelectionSignature signature : definition.startSignatures()) {
            ConversationDefinition owner = definitionsByTag.putIfAbsent(signature.tag(), definition);
            if (owner != null && owner != definition) {
                throw new IllegalStateException("Start tag " + signature.tag() + " claimed by " + owner.kind()
                        + " and " + kind);
            }
            signaturesByTag.computeIfAbsent(signature.tag(), tag -> new ArrayList<>()).add(signature);
        }
        for (String alias : definition.textAliases()) {
            if (aliases.putIfAbsent(alias.toLowerCase(Locale.ROOT), definition) != null) {
                throw new IllegalStateException("Duplicate text alias " + alias);
            }
        }
    }

    /**
     * @throws UnknownStateException
     *             if no rule is declared for the pair
     */
    public StateRule rule(ConversationKind kind, ConversationState state) {
        StateRule rule = rules.getOrDefault(kind, Map.of()).get(state);
        if (rule == null) {
            throw new UnknownStateException(kind, state);
        }
        return rule;
    }

    public ConversationDefinition definition(ConversationKind kind) {
        ConversationDefinition definition = byKind.get(kind);
        if (definition == null) {
            throw new IllegalArgumentException("No conversation registered for " + kind);
        }
        return definition;
    }

    /**
     * Recognises a start signal: a text alias such as {@code /sell} or a selection whose tag starts a conversation.
     *
     * @return the signal, or empty when the event is ordinary conversation input
     * @throws ValidationException
     *             if the selection uses a start tag with the wrong parameters
     */
    public Optional<StartSignal> resolveStart(InboundEvent event) {
        Optional<String> text = event.text();
        if (text.isPresent()) {
            ConversationDefinition definition = aliases.get(text.get().toLowerCase(Locale.ROOT));
            return Optional.ofNullable(definition).map(found -> new StartSignal(found, null));
        }
        Optional<Selection> selection = event.selection();
        if (selection.isEmpty()) {
            return Optional.empty();
        }
        ConversationDefinition definition = definitionsByTag.get(selection.get().tag());
        if (definition == null) {
            return Optional.empty();
        }
        boolean matches = signaturesByTag.get(selection.get().tag()).stream()
                .anyMatch(signature -> signature.matches(selection.get()));
        if (!matches) {
            throw new ValidationException("Malformed selection: " + selection.get());
        }
        return Optional.of(new StartSignal(definition, selection.get()));
    }
}
