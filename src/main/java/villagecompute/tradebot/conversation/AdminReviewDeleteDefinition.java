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
import villagecompute.tradebot.data.models.Review;
import villagecompute.tradebot.exceptions.ResourceNotFoundException;
import villagecompute.tradebot.services.ModerationResult;
import villagecompute.tradebot.services.ModerationService;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static villagecompute.tradebot.data.models.ConversationState.CONFIRM;
import static villagecompute.tradebot.data.models.ConversationState.TARGET_REVIEW;

/**
 * Removes a seller review: target review, then explicit confirmation. "no" at the confirmation discards.
 */
@ApplicationScoped
public class AdminReviewDeleteDefinition implements ConversationDefinition {

    private static final ConversationKind KIND = ConversationKind.ADMIN_REVIEW_DELETE;

    @Inject
    ModerationService moderationService;

    @Override
    public ConversationKind kind() {
        return KIND;
    }

    @Override
    public List<SelectionSignature> startSignatures() {
        return List.of(SelectionSignature.of("admin_review_delete"),
                SelectionSignature.of("admin_review_delete", ParamType.NUMBER));
    }

    @Override
    public List<String> textAliases() {
        return List.of("/deletereview");
    }

    @Override
    public Optional<Permission> requiredPermission() {
        return Optional.of(Permission.MANAGE_LISTINGS);
    }

    @Override
    public StartPlan begin(RuleContext context, Selection selection) {
        return AdminTargets.beginAt(context, selection, TARGET_REVIEW);
    }

    @Override
    public List<StateRule> rules() {
        return List.of(
                StateRule.input(KIND, TARGET_REVIEW).prompt("Which review should be removed? Send the review id.")
                        .validate(AdminTargets::review).storesAs(AdminTargets.TARGET_REVIEW_ID).then(CONFIRM)
                        .build(),
                StateRule.input(KIND, CONFIRM)
                        .prompt(session -> "Remove review #" + session.get(AdminTargets.TARGET_REVIEW_ID)
                                + "? This cannot be undone.")
                        .suggest("confirm:yes", "confirm:no").validate((ctx, event) -> Inputs.confirm(event))
                        .completesWith(Completion.moderation(this::deleteReview,
                                payload -> "Review #" + payload.get(AdminTargets.TARGET_REVIEW_ID)
                                        + " has been removed."))
                        .build());
    }

    private ModerationResult deleteReview(RuleContext context, Map<String, Object> payload) {
        long reviewId = AdminTargets.targetReview(payload);
        Review review = context.lookup("find_review", store -> store.findReview(reviewId))
                .orElseThrow(() -> new ResourceNotFoundException("Review not found: " + reviewId));
        return moderationService.deleteReview(context.principal(), review);
    }
}
