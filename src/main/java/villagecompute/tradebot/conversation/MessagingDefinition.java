/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.conversation;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;
import villagecompute.tradebot.api.types.InboundEvent;
import villagecompute.tradebot.api.types.Selection;
import villagecompute.tradebot.conversation.SelectionSignature.ParamType;
import villagecompute.tradebot.data.models.ChatMessage;
import villagecompute.tradebot.data.models.ConversationKind;
import villagecompute.tradebot.data.models.Listing;
import villagecompute.tradebot.data.models.ListingStatus;
import villagecompute.tradebot.data.models.MarketplaceUser;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static villagecompute.tradebot.data.models.ConversationState.BODY;
import static villagecompute.tradebot.data.models.ConversationState.RECIPIENT_CONTEXT;

/**
 * Buyer to seller messaging about a listing, and seller replies.
 *
 * <p>
 * <b>Entry Points:</b>
 * <ul>
 * <li>{@code contact_seller:<listingId>} - the listing id is fed to the recipient step</li>
 * <li>{@code reply_to:<userId>:<listingId>} - the recipient is known, the body is asked for directly</li>
 * </ul>
 */
@ApplicationScoped
public class MessagingDefinition implements ConversationDefinition {

    private static final Logger LOG = Logger.getLogger(MessagingDefinition.class);

    private static final ConversationKind KIND = ConversationKind.MESSAGING;

    static final String RECIPIENT_ID = "recipient_id";
    static final String LISTING_TITLE = "listing_title";
    static final String BODY_KEY = "body";
    static final int BODY_MIN = 2;
    static final int BODY_MAX = 1000;

    @Override
    public ConversationKind kind() {
        return KIND;
    }

    @Override
    public List<SelectionSignature> startSignatures() {
        return List.of(SelectionSignature.of("contact_seller", ParamType.NUMBER),
                SelectionSignature.of("reply_to", ParamType.NUMBER, ParamType.NUMBER));
    }

    @Override
    public StartPlan begin(RuleContext context, Selection selection) {
        if (selection.is("contact_seller")) {
            return StartPlan.feeding(RECIPIENT_CONTEXT,
                    InboundEvent.text(context.principal().id(), selection.param(0)));
        }
        long recipientId = selection.number(0);
        long listingId = selection.number(1);
        if (recipientId == context.principal().id()) {
            return StartPlan.rejected("You cannot message yourself.");
        }
        Optional<MarketplaceUser> recipient = context.lookup("find_user", store -> store.findUser(recipientId));
        if (recipient.isEmpty() || !recipient.get().active) {
            return StartPlan.rejected("That user can no longer receive messages.");
        }
        Optional<Listing> listing = context.lookup("find_listing", store -> store.findListing(listingId));
        if (listing.isEmpty()) {
            return StartPlan.rejected("Listing #" + listingId + " was not found.");
        }
        Map<String, Object> seed = new LinkedHashMap<>();
        seed.put(RECIPIENT_ID, recipientId);
        seed.put(ListingFields.LISTING_ID, listingId);
        seed.put(LISTING_TITLE, listing.get().title);
        return StartPlan.at(BODY, seed);
    }

    @Override
    public List<StateRule> rules() {
        return List.of(
                StateRule.input(KIND, RECIPIENT_CONTEXT).prompt("Which listing is your message about? Send its id.")
                        .validate(this::recipient).applies(MessagingDefinition::storeRecipient).then(BODY).build(),
                StateRule.input(KIND, BODY)
                        .prompt(session -> "Write your message about \"" + session.get(LISTING_TITLE)
                                + "\" (2-1000 characters).")
                        .validate((ctx, event) -> Inputs.boundedText(event, "message", BODY_MIN, BODY_MAX))
                        .storesAs(BODY_KEY).completesWith(Completion.commit(this::send)).build());
    }

    private Validation recipient(RuleContext context, InboundEvent event) {
        Optional<Long> id = Inputs.id(event);
        if (id.isEmpty()) {
            return Validation.reject("Please send the numeric listing id.");
        }
        long listingId = id.get();
        Optional<Listing> listing = context.lookup("find_listing", store -> store.findListing(listingId));
        if (listing.isEmpty() || listing.get().status == ListingStatus.DELETED) {
            return Validation.reject("Listing #" + listingId + " was not found.");
        }
        if (listing.get().status != ListingStatus.ACTIVE) {
            return Validation.reject("This listing is no longer available.");
        }
        if (listing.get().isOwnedBy(context.principal().id())) {
            return Validation.reject("You cannot message yourself about your own listing.");
        }
        return Validation.accept(listing.get());
    }

    private static Map<String, Object> storeRecipient(Map<String, Object> payload, Object value) {
        Listing listing = (Listing) value;
        Map<String, Object> next = new LinkedHashMap<>(payload);
        next.put(RECIPIENT_ID, listing.sellerId);
        next.put(ListingFields.LISTING_ID, listing.id);
        next.put(LISTING_TITLE, listing.title);
        return next;
    }

    private String send(RuleContext context, Map<String, Object> payload) {
        ChatMessage message = new ChatMessage();
        message.senderId = context.principal().id();
        message.receiverId = (Long) payload.get(RECIPIENT_ID);
        message.listingId = (Long) payload.get(ListingFields.LISTING_ID);
        message.body = (String) payload.get(BODY_KEY);
        message.createdAt = context.now();
        ChatMessage stored = context.store().createMessage(message);
        LOG.infof("Message %d sent from %d to %d about listing %d", stored.id, stored.senderId, stored.receiverId,
                stored.listingId);
        return "Your message has been sent.";
    }
}
