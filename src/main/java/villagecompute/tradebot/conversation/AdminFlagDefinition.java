/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.conversation;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.tradebot.api.types.Selection;
import villagecompute.tradebot.conversation.SelectionSignature.ParamType;
import villagecompute.tradebot.data.models.ConversationKind;
import villagecompute.tradebot.data.models.Permission;
import villagecompute.tradebot.services.ModerationService;

import java.util.List;
import java.util.Optional;

import static villagecompute.tradebot.data.models.ConversationState.REASON;
import static villagecompute.tradebot.data.models.ConversationState.TARGET_LISTING;

/**
 * Flags a listing for review: target listing, then reason.
 */
@ApplicationScoped
public class AdminFlagDefinition implements ConversationDefinition {

    private static final ConversationKind KIND = ConversationKind.ADMIN_FLAG;

    @Inject
    ModerationService moderationService;

    @Override
    public ConversationKind kind() {
        return KIND;
    }

    @Override
    public List<SelectionSignature> startSignatures() {
        return List.of(SelectionSignature.of("admin_flag"), SelectionSignature.of("admin_flag", ParamType.NUMBER));
    }

    @Override
    public List<String> textAliases() {
        return List.of("/flag");
    }

    @Override
    public Optional<Permission> requiredPermission() {
        return Optional.of(Permission.MANAGE_LISTINGS);
    }

    @Override
    public StartPlan begin(RuleContext context, Selection selection) {
        return AdminTargets.beginAt(context, selection, TARGET_LISTING);
    }

    @Override
    public List<StateRule> rules() {
        return List.of(
                StateRule.input(KIND, TARGET_LISTING).prompt("Which listing should be flagged? Send the listing id.")
                        .validate(AdminTargets::listing).storesAs(AdminTargets.TARGET_LISTING_ID).then(REASON).build(),
                StateRule.input(KIND, REASON)
                        .prompt(session -> "Why is listing #" + session.get(AdminTargets.TARGET_LISTING_ID)
                                + " being flagged? (3-500 characters)")
                        .validate((ctx, event) -> AdminTargets.reason(event)).storesAs(AdminTargets.REASON)
                        .completesWith(Completion.moderation(
                                (ctx, payload) -> moderationService.flagListing(ctx.principal(),
                                        AdminTargets.targetListing(payload), (String) payload.get(AdminTargets.REASON)),
                                payload -> "Listing #" + payload.get(AdminTargets.TARGET_LISTING_ID)
                                        + " has been flagged."))
                        .build());
    }
}
