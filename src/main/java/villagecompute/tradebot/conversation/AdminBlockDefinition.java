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
import villagecompute.tradebot.data.models.MarketplaceUser;
import villagecompute.tradebot.data.models.Permission;
import villagecompute.tradebot.services.ModerationService;

import java.util.List;
import java.util.Optional;

import static villagecompute.tradebot.data.models.ConversationState.REASON;
import static villagecompute.tradebot.data.models.ConversationState.TARGET_USER;

/**
 * Blocks a user: target, then reason.
 */
@ApplicationScoped
public class AdminBlockDefinition implements ConversationDefinition {

    private static final ConversationKind KIND = ConversationKind.ADMIN_BLOCK;

    @Inject
    ModerationService moderationService;

    @Override
    public ConversationKind kind() {
        return KIND;
    }

    @Override
    public List<SelectionSignature> startSignatures() {
        return List.of(SelectionSignature.of("admin_block"), SelectionSignature.of("admin_block", ParamType.NUMBER));
    }

    @Override
    public List<String> textAliases() {
        return List.of("/block");
    }

    @Override
    public Optional<Permission> requiredPermission() {
        return Optional.of(Permission.MANAGE_USERS);
    }

    @Override
    public StartPlan begin(RuleContext context, Selection selection) {
        return AdminTargets.beginAt(context, selection, TARGET_USER);
    }

    @Override
    public List<StateRule> rules() {
        return List.of(
                StateRule.input(KIND, TARGET_USER).prompt("Which user should be blocked? Send the user id.")
                        .validate(this::target).storesAs(AdminTargets.TARGET_USER_ID).then(REASON).build(),
                StateRule.input(KIND, REASON)
                        .prompt(session -> "Why is user #" + session.get(AdminTargets.TARGET_USER_ID)
                                + " being blocked? (3-500 characters)")
                        .validate((ctx, event) -> AdminTargets.reason(event)).storesAs(AdminTargets.REASON)
                        .completesWith(Completion.moderation(
                                (ctx, payload) -> moderationService.blockUser(ctx.principal(),
                                        AdminTargets.targetUser(payload), (String) payload.get(AdminTargets.REASON)),
                                payload -> "User #" + payload.get(AdminTargets.TARGET_USER_ID) + " has been blocked."))
                        .build());
    }

    private Validation target(RuleContext context, InboundEvent event) {
        Validation target = AdminTargets.user(context, event);
        if (!target.isAccepted()) {
            return target;
        }
        long userId = (Long) target.value();
        Optional<MarketplaceUser> user = context.lookup("find_user", store -> store.findUser(userId));
        if (user.isPresent() && !user.get().active) {
            return Validation.reject("User #" + userId + " is already blocked.");
        }
        return target;
    }
}
