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

import static villagecompute.tradebot.data.models.ConversationState.CONFIRM;
import static villagecompute.tradebot.data.models.ConversationState.REASON;
import static villagecompute.tradebot.data.models.ConversationState.TARGET_LISTING;

/**
 * Deletes a listing: target listing, reason, explicit confirmation. "no" at the confirmation discards.
 */
@ApplicationScoped
public class AdminDeleteDefinition implements ConversationDefinition {

    private static final ConversationKind KIND = ConversationKind.ADMIN_DELETE;

    @Inject
    ModerationService moderationService;

    @Override
    public ConversationKind kind() {
        return KIND;
    }

    @Override
    public List<SelectionSignature> startSignatures() {
        return List.of(SelectionSignature.of("admin_delete"),
                SelectionSignature.of("admin_delete", ParamType.NUMBER));
    }

    @Override
    public List<String> textAliases() {
        return List.of("/delete");
    }

    @Override
    public Optional<Permission> requiredPermission() {
        return Optional.of(Permission.DELETE_ANY_LISTING);
    }

    @Override
    public StartPlan begin(RuleContext context, Selection selection) {
        return AdminTargets.beginAt(context, selection, TARGET_LISTING);
    }

    @Override
    public List<StateRule> rules() {
        return List.of(
                StateRule.input(KIND, TARGET_LISTING).prompt("Which listing should be deleted? Send the listing id.")
                        .validate(AdminTargets::listing).storesAs(AdminTargets.TARGET_LISTING_ID).then(REASON).build(),
                StateRule.input(KIND, REASON).prompt("Why is this listing being deleted? (3-500 characters)")
                        .validate((ctx, event) -> AdminTargets.reason(event)).storesAs(AdminTargets.REASON)
                        .then(CONFIRM).build(),
                StateRule.input(KIND, CONFIRM)
                        .prompt(session -> "Delete listing #" + session.get(AdminTargets.TARGET_LISTING_ID)
                                + "? This cannot be undone.")
                        .suggest("confirm:yes", "confirm:no").validate((ctx, event) -> Inputs.confirm(event))
                        .completesWith(Completion.moderation(
                                (ctx, payload) -> moderationService.deleteListing(ctx.principal(),
                                        AdminTargets.targetListing(payload), (String) payload.get(AdminTargets.REASON)),
                                payload -> "Listing #" + payload.get(AdminTargets.TARGET_LISTING_ID)
                                        + " has been deleted."))
                        .build());
    }
}
