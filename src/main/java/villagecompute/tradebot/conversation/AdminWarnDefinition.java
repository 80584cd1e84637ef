/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.conversation;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.tradebot.api.types.InboundEvent;
import villagecompute.tradebot.api.types.Selection;
import villagecompute.tradebot.conversation.SelectionSignature.ParamType;
import villagecompute.tradebot.data.models.ConversationKind;
import villagecompute.tradebot.data.models.Permission;
import villagecompute.tradebot.data.models.WarningSeverity;
import villagecompute.tradebot.services.ModerationService;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static villagecompute.tradebot.data.models.ConversationState.REASON;
import static villagecompute.tradebot.data.models.ConversationState.SEVERITY;
import static villagecompute.tradebot.data.models.ConversationState.TARGET_USER;

/**
 * Issues a warning: target, severity, reason.
 */
@ApplicationScoped
public class AdminWarnDefinition implements ConversationDefinition {

    private static final ConversationKind KIND = ConversationKind.ADMIN_WARN;

    static final String SEVERITY_KEY = "severity";

    @Inject
    ModerationService moderationService;

    @Override
    public ConversationKind kind() {
        return KIND;
    }

    @Override
    public List<SelectionSignature> startSignatures() {
        return List.of(SelectionSignature.of("admin_warn"), SelectionSignature.of("admin_warn", ParamType.NUMBER));
    }

    @Override
    public List<String> textAliases() {
        return List.of("/warn");
    }

    @Override
    public Optional<Permission> requiredPermission() {
        return Optional.of(Permission.WARN_USERS);
    }

    @Override
    public StartPlan begin(RuleContext context, Selection selection) {
        return AdminTargets.beginAt(context, selection, TARGET_USER);
    }

    @Override
    public List<StateRule> rules() {
        return List.of(
                StateRule.input(KIND, TARGET_USER).prompt("Which user should be warned? Send the user id.")
                        .validate(AdminTargets::user).storesAs(AdminTargets.TARGET_USER_ID).then(SEVERITY).build(),
                StateRule.input(KIND, SEVERITY).prompt("How severe is the warning?")
                        .suggest(Arrays.stream(WarningSeverity.values()).map(s -> SEVERITY_KEY + ":" + s.getKey())
                                .toList())
                        .validate((ctx, event) -> severity(event)).storesAs(SEVERITY_KEY).then(REASON).build(),
                StateRule.input(KIND, REASON).prompt("What is the reason for the warning? (3-500 characters)")
                        .validate((ctx, event) -> AdminTargets.reason(event)).storesAs(AdminTargets.REASON)
                        .completesWith(Completion.moderation(
                                (ctx, payload) -> moderationService.warnUser(ctx.principal(),
                                        AdminTargets.targetUser(payload), (WarningSeverity) payload.get(SEVERITY_KEY),
                                        (String) payload.get(AdminTargets.REASON)),
                                payload -> "A " + ((WarningSeverity) payload.get(SEVERITY_KEY)).getKey()
                                        + " severity warning was issued to user #"
                                        + payload.get(AdminTargets.TARGET_USER_ID) + "."))
                        .build());
    }

    static Validation severity(InboundEvent event) {
        return Inputs.choice(event, SEVERITY_KEY).flatMap(WarningSeverity::fromKey).map(Validation::accept)
                .orElseGet(() -> Validation.reject("Please choose low, medium or high."));
    }
}
