/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.tradebot.api.types.ActionType;
import villagecompute.tradebot.api.types.InboundEvent;
import villagecompute.tradebot.api.types.OutboundAction;
import villagecompute.tradebot.config.MarketplaceSettings;
import villagecompute.tradebot.conversation.Completion;
import villagecompute.tradebot.conversation.ConversationDefinition;
import villagecompute.tradebot.conversation.RuleContext;
import villagecompute.tradebot.conversation.StartPlan;
import villagecompute.tradebot.conversation.StateRule;
import villagecompute.tradebot.conversation.Transition;
import villagecompute.tradebot.conversation.Validation;
import villagecompute.tradebot.data.models.Principal;
import villagecompute.tradebot.data.models.Session;
import villagecompute.tradebot.data.store.MarketplaceDataStore;
import villagecompute.tradebot.exceptions.ForbiddenException;
import villagecompute.tradebot.exceptions.ResourceNotFoundException;
import villagecompute.tradebot.exceptions.SessionStoreException;
import villagecompute.tradebot.exceptions.StorageException;
import villagecompute.tradebot.exceptions.UnknownStateException;
import villagecompute.tradebot.exceptions.ValidationException;
import villagecompute.tradebot.observability.LoggingConfig;
import villagecompute.tradebot.observability.ObservabilityMetrics;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sole entry point of the conversation core: turns one inbound event into the outbound actions for it.
 *
 * <p>
 * <b>Handling Order:</b>
 * <ol>
 * <li>Resolve the principal; blocked principals get a notice and lose their session</li>
 * <li>Drop an expired session and tell the user</li>
 * <li>Cancel: delete the session and acknowledge</li>
 * <li>Start signal: discard any session, run the kind's entry checks, prompt for the first state</li>
 * <li>Otherwise validate the input against the current state's rule and advance</li>
 * </ol>
 *
 * <p>
 * <b>Thread Safety:</b> events of one principal are handled one at a time under that principal's lock; different
 * principals never contend.
 *
 * <p>
 * Validation and permission failures are returned as actions, never thrown. A failed commit keeps the session at
 * its terminal state with the accepted payload so only the last step needs to be repeated.
 */
@ApplicationScoped
public class ConversationController {

    private static final Logger LOG = Logger.getLogger(ConversationController.class);

    static final String CANCEL_TEXT = "/cancel";
    static final String CANCEL_TAG = "cancel";

    public static final String CANCELLED = "Operation cancelled.";
    static final String NOTHING_TO_CANCEL = "There is nothing to cancel.";
    static final String NO_ACTIVE_OPERATION = "There is no active operation. Use /sell to list an item or /search to "
            + "find one.";
    static final String TIMED_OUT = "Your previous operation timed out. Please start again.";
    static final String BLOCKED = "Your account has been blocked. Contact support if you think this is a mistake.";
    static final String FORBIDDEN = "You do not have permission to do that.";
    static final String UNAVAILABLE = "The marketplace is temporarily unavailable. Please try again shortly.";
    static final String SAVE_FAILED = "We could not save that right now. Please send your answer again.";
    static final String INVALID_OPTION = "That option is not valid.";
    static final String TARGET_GONE = "That item is no longer available.";
    static final String APOLOGY = "Something went wrong on our side and the operation was ended. Please start again.";

    @Inject
    SessionStore sessions;

    @Inject
    PrincipalLocks locks;

    @Inject
    PrincipalService principals;

    @Inject
    PermissionService permissions;

    @Inject
    StateMachineRegistry registry;

    @Inject
    MarketplaceDataStore store;

    @Inject
    BoundedStoreExecutor storeCalls;

    @Inject
    MarketplaceSettings settings;

    @Inject
    ObservabilityMetrics metrics;

    public List<OutboundAction> handle(InboundEvent event) {
        LoggingConfig.enrichWithTraceContext();
        LoggingConfig.setPrincipalId(event.principalId());
        ReentrantLock lock = locks.lockFor(event.principalId());
        lock.lock();
        try {
            return handleLocked(event);
        } catch (SessionStoreException e) {
            LOG.errorf(e, "Session store failure while handling event for principal %d", event.principalId());
            metrics.recordConversationEvent(null, "session_store_error");
            return List.of(action(event.principalId(), ActionType.ERROR, UNAVAILABLE));
        } catch (StorageException e) {
            LOG.errorf(e, "Store failure while handling event for principal %d", event.principalId());
            metrics.recordConversationEvent(null, "storage_error");
            return List.of(action(event.principalId(), ActionType.ERROR, UNAVAILABLE));
        } finally {
            lock.unlock();
            LoggingConfig.clearMDC();
        }
    }

    private List<OutboundAction> handleLocked(InboundEvent event) {
        long principalId = event.principalId();
        Principal principal = principals.resolve(principalId);
        if (!principal.active()) {
            sessions.delete(principalId);
            metrics.recordConversationEvent(null, "blocked");
            return List.of(action(principalId, ActionType.NOTICE, BLOCKED));
        }

        Instant now = Instant.now();
        Optional<Session> current = findSession(principalId);
        boolean expired = false;
        if (current.isPresent() && current.get().isExpired(now, settings.sessionTtl())) {
            LOG.infof("Session %s/%s of principal %d expired", current.get().kind().getKey(),
                    current.get().state(), principalId);
            sessions.delete(principalId);
            metrics.recordConversationEvent(current.get().kind().getKey(), "expired");
            current = Optional.empty();
            expired = true;
        }
        current.ifPresent(session -> LoggingConfig.setConversationKind(session.kind().getKey()));

        if (isCancel(event)) {
            if (current.isEmpty()) {
                return List.of(action(principalId, ActionType.NOTICE, expired ? TIMED_OUT : NOTHING_TO_CANCEL));
            }
            sessions.delete(principalId);
            metrics.recordConversationEvent(current.get().kind().getKey(), "cancelled");
            LOG.debugf("Principal %d cancelled %s at %s", principalId, current.get().kind().getKey(),
                    current.get().state());
            return List.of(action(principalId, ActionType.NOTICE, CANCELLED));
        }

        Optional<StateMachineRegistry.StartSignal> start;
        try {
            start = registry.resolveStart(event);
        } catch (ValidationException e) {
            LOG.warnf("Principal %d sent malformed selection: %s", principalId, e.getMessage());
            if (current.isPresent()) {
                return rejected(principal, current.get(), INVALID_OPTION);
            }
            return List.of(action(principalId, ActionType.NOTICE, INVALID_OPTION));
        }
        if (start.isPresent()) {
            return start(principal, current, start.get(), now);
        }

        if (current.isEmpty()) {
            metrics.recordConversationEvent(null, "no_session");
            return List.of(action(principalId, ActionType.NOTICE, expired ? TIMED_OUT : NO_ACTIVE_OPERATION));
        }
        return advance(principal, current.get(), event, now);
    }

    private Optional<Session> findSession(long principalId) {
        try {
            return sessions.find(principalId);
        } catch (SessionStoreException e) {
            LOG.warnf(e, "Session store unavailable for principal %d, treating as no session", principalId);
            return Optional.empty();
        }
    }

    private static boolean isCancel(InboundEvent event) {
        if (event.text().map(CANCEL_TEXT::equalsIgnoreCase).orElse(false)) {
            return true;
        }
        return event.selection().map(selection -> selection.is(CANCEL_TAG) && selection.arity() == 0)
                .orElse(false);
    }

    private List<OutboundAction> start(Principal principal, Optional<Session> current,
            StateMachineRegistry.StartSignal signal, Instant now) {
        ConversationDefinition definition = signal.definition();
        String kindKey = definition.kind().getKey();
        LoggingConfig.setConversationKind(kindKey);

        if (current.isPresent()) {
            sessions.delete(principal.id());
            LOG.debugf("Discarded %s session of principal %d to start %s", current.get().kind().getKey(),
                    principal.id(), kindKey);
        }

        if (definition.kind().isAdmin() && !mayStart(principal, definition)) {
            LOG.warnf("Principal %d (role=%s) denied start of %s", principal.id(), principal.role().getKey(),
                    kindKey);
            metrics.recordConversationEvent(kindKey, "forbidden");
            return List.of(action(principal.id(), ActionType.ERROR, FORBIDDEN));
        }

        StartPlan plan = definition.begin(new RuleContext(principal, null, store, storeCalls, now),
                signal.selection());
        if (plan.isRejected()) {
            metrics.recordConversationEvent(kindKey, "start_rejected");
            return List.of(action(principal.id(), ActionType.NOTICE, plan.rejection()));
        }

        Session session = Session.start(principal.id(), definition.kind(), plan.state(), plan.seed(), now);
        metrics.recordConversationEvent(kindKey, "started");
        if (plan.firstInput() != null) {
            sessions.put(session);
            return advance(principal, session, plan.firstInput(), now);
        }
        return enter(principal, session, now);
    }

    private boolean mayStart(Principal principal, ConversationDefinition definition) {
        if (!permissions.isAdmin(principal)) {
            return false;
        }
        return definition.requiredPermission().map(permission -> permissions.authorize(principal, permission))
                .orElse(true);
    }

    private List<OutboundAction> advance(Principal principal, Session session, InboundEvent event, Instant now) {
        StateRule rule;
        try {
            rule = registry.rule(session.kind(), session.state());
        } catch (UnknownStateException e) {
            return unknownState(principal, session, e);
        }

        if (!rule.awaitsInput()) {
            return complete(principal, rule, session, session.payload(), now);
        }

        Validation validation = rule.validate(new RuleContext(principal, session, store, storeCalls, now), event);
        switch (validation.outcome()) {
            case REJECTED:
                metrics.recordConversationEvent(session.kind().getKey(), "rejected");
                return rejected(principal, session, validation.message());
            case DISCARDED:
                sessions.delete(principal.id());
                metrics.recordConversationEvent(session.kind().getKey(), "discarded");
                return List.of(action(principal.id(), ActionType.NOTICE, CANCELLED));
            default:
                break;
        }

        Map<String, Object> payload = rule.apply(session.payload(), validation.value());
        Transition transition = rule.next(payload, validation.value());
        if (transition.isTerminal()) {
            return complete(principal, rule, session, payload, now);
        }
        metrics.recordConversationEvent(session.kind().getKey(), "advanced");
        return enter(principal, session.advance(transition.state(), payload, now), now);
    }

    /**
     * Stores the session at its new state and prompts, or completes a state that needs no input.
     */
    private List<OutboundAction> enter(Principal principal, Session session, Instant now) {
        StateRule rule;
        try {
            rule = registry.rule(session.kind(), session.state());
        } catch (UnknownStateException e) {
            return unknownState(principal, session, e);
        }
        if (!rule.awaitsInput()) {
            return complete(principal, rule, session, session.payload(), now);
        }
        sessions.put(session);
        return List.of(prompt(principal.id(), rule, session));
    }

    private List<OutboundAction> complete(Principal principal, StateRule rule, Session session,
            Map<String, Object> payload, Instant now) {
        Session terminal = session.advance(rule.state(), payload, now);
        RuleContext context = new RuleContext(principal, terminal, store, storeCalls, now);
        Completion completion = rule.completion();
        String kindKey = session.kind().getKey();

        switch (completion.mode()) {
            case QUERY:
                return completeQuery(principal, completion, context, payload, kindKey);
            case MODERATION:
                return completeModeration(principal, rule, session, terminal, completion, context, payload);
            default:
                break;
        }

        try {
            String confirmation = storeCalls.call("commit_" + kindKey, () -> completion.commit(context, payload));
            sessions.delete(principal.id());
            metrics.recordConversationEvent(kindKey, "completed");
            return List.of(action(principal.id(), ActionType.CONFIRMATION, confirmation));
        } catch (ResourceNotFoundException e) {
            LOG.warnf("Commit of %s for principal %d found its target gone: %s", kindKey, principal.id(),
                    e.getMessage());
            sessions.delete(principal.id());
            metrics.recordConversationEvent(kindKey, "target_missing");
            return List.of(action(principal.id(), ActionType.ERROR, TARGET_GONE));
        } catch (StorageException e) {
            LOG.errorf(e, "Commit of %s failed for principal %d, keeping session at %s", kindKey, principal.id(),
                    rule.state());
            sessions.put(terminal);
            metrics.recordConversationEvent(kindKey, "storage_error");
            return List.of(action(principal.id(), ActionType.ERROR, SAVE_FAILED), prompt(principal.id(), rule,
                    terminal));
        }
    }

    private List<OutboundAction> completeQuery(Principal principal, Completion completion, RuleContext context,
            Map<String, Object> payload, String kindKey) {
        sessions.delete(principal.id());
        try {
            String result = completion.query(context, payload);
            metrics.recordConversationEvent(kindKey, "completed");
            return List.of(action(principal.id(), ActionType.RESULT, result));
        } catch (ForbiddenException e) {
            metrics.recordConversationEvent(kindKey, "forbidden");
            return List.of(action(principal.id(), ActionType.ERROR, e.getMessage()));
        } catch (StorageException e) {
            LOG.errorf(e, "Query %s failed for principal %d", kindKey, principal.id());
            metrics.recordConversationEvent(kindKey, "storage_error");
            return List.of(action(principal.id(), ActionType.ERROR, UNAVAILABLE));
        }
    }

    private List<OutboundAction> completeModeration(Principal principal, StateRule rule, Session session,
            Session terminal, Completion completion, RuleContext context, Map<String, Object> payload) {
        String kindKey = session.kind().getKey();
        ModerationResult result;
        try {
            result = completion.moderate(context, payload);
        } catch (ResourceNotFoundException e) {
            LOG.warnf("Moderation %s for principal %d found its target gone: %s", kindKey, principal.id(),
                    e.getMessage());
            sessions.delete(principal.id());
            metrics.recordConversationEvent(kindKey, "target_missing");
            return List.of(action(principal.id(), ActionType.ERROR, TARGET_GONE));
        }
        metrics.recordConversationEvent(kindKey, result.status().name().toLowerCase(Locale.ROOT));
        switch (result.status()) {
            case APPLIED:
                sessions.delete(principal.id());
                return List.of(action(principal.id(), ActionType.CONFIRMATION, completion.appliedMessage(payload)));
            case AUDIT_FAILED:
                sessions.delete(principal.id());
                return List.of(action(principal.id(), ActionType.CONFIRMATION,
                        completion.appliedMessage(payload) + " " + result.message()));
            case FORBIDDEN:
                return List.of(action(principal.id(), ActionType.ERROR, result.message()));
            default:
                sessions.put(terminal);
                return List.of(action(principal.id(), ActionType.ERROR, result.message()),
                        prompt(principal.id(), rule, terminal));
        }
    }

    private List<OutboundAction> rejected(Principal principal, Session session, String message) {
        List<OutboundAction> actions = new ArrayList<>();
        actions.add(action(principal.id(), ActionType.ERROR, message));
        try {
            actions.add(prompt(principal.id(), registry.rule(session.kind(), session.state()), session));
        } catch (UnknownStateException e) {
            return unknownState(principal, session, e);
        }
        return actions;
    }

    private List<OutboundAction> unknownState(Principal principal, Session session, UnknownStateException e) {
        LOG.fatalf(e, "No rule for %s/%s (principal %d); session discarded", session.kind().getKey(),
                session.state(), principal.id());
        metrics.recordInternalFault("unknown_state");
        sessions.delete(principal.id());
        return List.of(action(principal.id(), ActionType.ERROR, APOLOGY));
    }

    private static OutboundAction prompt(long principalId, StateRule rule, Session session) {
        List<String> suggestions = new ArrayList<>(rule.suggestedInputs());
        suggestions.add(CANCEL_TAG);
        return new OutboundAction(principalId, ActionType.PROMPT, rule.prompt(session), suggestions);
    }

    private static OutboundAction action(long principalId, ActionType type, String content) {
        return OutboundAction.of(principalId, type, content);
    }
}
