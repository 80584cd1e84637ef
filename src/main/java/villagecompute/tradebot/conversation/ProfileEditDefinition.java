/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.conversation;

import jakarta.enterprise.context.ApplicationScoped;
import villagecompute.tradebot.api.types.InboundEvent;
import villagecompute.tradebot.api.types.Selection;
import villagecompute.tradebot.conversation.SelectionSignature.ParamType;
import villagecompute.tradebot.data.models.ConversationKind;
import villagecompute.tradebot.data.models.ConversationState;
import villagecompute.tradebot.data.models.MarketplaceUser;
import villagecompute.tradebot.exceptions.ResourceNotFoundException;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Edits one profile field, entered with {@code edit_profile:phone|location|bio}.
 */
@ApplicationScoped
public class ProfileEditDefinition implements ConversationDefinition {

    private static final ConversationKind KIND = ConversationKind.PROFILE_EDIT;

    static final String PHONE = "phone";
    static final String LOCATION = "location";
    static final String BIO = "bio";

    private static final Pattern PHONE_PATTERN = Pattern.compile("\\+?[0-9][0-9 \\-]{6,19}");

    private static final Map<String, ConversationState> FIELDS = Map.of(PHONE, ConversationState.PHONE, LOCATION,
            ConversationState.LOCATION, BIO, ConversationState.BIO);

    @Override
    public ConversationKind kind() {
        return KIND;
    }

    @Override
    public List<SelectionSignature> startSignatures() {
        return List.of(SelectionSignature.of("edit_profile", ParamType.WORD));
    }

    @Override
    public StartPlan begin(RuleContext context, Selection selection) {
        ConversationState state = FIELDS.get(selection.param(0));
        return state == null ? StartPlan.rejected("That profile field cannot be edited.") : StartPlan.at(state);
    }

    @Override
    public List<StateRule> rules() {
        return List.of(
                StateRule.input(KIND, ConversationState.PHONE)
                        .prompt("Send your phone number, e.g. +1 555 123 4567.")
                        .validate((ctx, event) -> phone(event)).storesAs(PHONE).completesWith(update(PHONE)).build(),
                StateRule.input(KIND, ConversationState.LOCATION).prompt("Send your location (up to 100 characters).")
                        .validate((ctx, event) -> Inputs.boundedText(event, "location", 1, 100)).storesAs(LOCATION)
                        .completesWith(update(LOCATION)).build(),
                StateRule.input(KIND, ConversationState.BIO).prompt("Tell buyers about yourself (up to 500 characters).")
                        .validate((ctx, event) -> Inputs.boundedText(event, "bio", 1, 500)).storesAs(BIO)
                        .completesWith(update(BIO)).build());
    }

    static Validation phone(InboundEvent event) {
        Optional<String> text = event.text();
        if (text.isEmpty() || !PHONE_PATTERN.matcher(text.get()).matches()) {
            return Validation.reject("Please send a phone number of 7-20 digits, spaces or dashes.");
        }
        return Validation.accept(text.get());
    }

    private static Completion update(String field) {
        return Completion.commit((context, payload) -> {
            long userId = context.principal().id();
            MarketplaceUser user = context.store().findUser(userId)
                    .orElseThrow(() -> new ResourceNotFoundException("User not found: " + userId));
            String value = (String) payload.get(field);
            switch (field) {
                case PHONE -> user.phone = value;
                case LOCATION -> user.location = value;
                case BIO -> user.bio = value;
                default -> throw new IllegalArgumentException("Unknown profile field: " + field);
            }
            context.store().saveUser(user);
            return "Your " + field + " has been updated.";
        });
    }
}
