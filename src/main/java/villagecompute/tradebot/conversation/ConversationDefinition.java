/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.conversation;

import villagecompute.tradebot.api.types.Selection;
import villagecompute.tradebot.data.models.ConversationKind;
import villagecompute.tradebot.data.models.Permission;

import java.util.List;
import java.util.Optional;

/**
 * One conversation kind: how it is started and the rules of each of its states.
 *
 * <p>
 * Implementations are CDI beans discovered by {@link villagecompute.tradebot.services.StateMachineRegistry} at
 * start-up.
 */
public interface ConversationDefinition {

    ConversationKind kind();

    /**
     * Selections that start this kind, e.g. {@code contact_seller:<listingId>}.
     */
    List<SelectionSignature> startSignatures();

    /**
     * Text commands that start this kind, e.g. {@code /sell}.
     */
    default List<String> textAliases() {
        return List.of();
    }

    /**
     * Permission checked before an admin conversation starts. Admin kinds without one only require an admin
     * principal.
     */
    default Optional<Permission> requiredPermission() {
        return Optional.empty();
    }

    /**
     * Entry checks and initial state.
     *
     * @param selection
     *            the start selection, null when started by a text alias
     */
    StartPlan begin(RuleContext context, Selection selection);

    List<StateRule> rules();
}
