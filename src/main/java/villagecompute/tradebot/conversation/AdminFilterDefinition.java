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
import villagecompute.tradebot.data.models.AuditEntry;
import villagecompute.tradebot.data.models.ConversationKind;
import villagecompute.tradebot.data.models.Listing;
import villagecompute.tradebot.data.models.ListingStatus;
import villagecompute.tradebot.data.models.MarketplaceUser;
import villagecompute.tradebot.data.models.Permission;
import villagecompute.tradebot.data.models.Session;
import villagecompute.tradebot.data.store.UserFilter;
import villagecompute.tradebot.services.AuditRecorder;
import villagecompute.tradebot.services.PermissionService;
import villagecompute.tradebot.util.Prices;
import villagecompute.tradebot.util.Texts;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import static villagecompute.tradebot.data.models.ConversationState.CRITERIA;
import static villagecompute.tradebot.data.models.ConversationState.SCOPE;

/**
 * Read-only admin views over users, listings and the audit log.
 *
 * <p>
 * <b>Scopes and Criteria:</b>
 * <ul>
 * <li><b>users</b> ({@code manage_users}): all, active, blocked</li>
 * <li><b>listings</b> ({@code manage_listings}): all, active, sold, flagged, deleted</li>
 * <li><b>audit</b> ({@code view_audit_log}): all, mine, or an action tag such as {@code block_user}</li>
 * </ul>
 *
 * <p>
 * Filtering writes nothing and is not audited.
 */
@ApplicationScoped
public class AdminFilterDefinition implements ConversationDefinition {

    private static final ConversationKind KIND = ConversationKind.ADMIN_FILTER;

    static final String SCOPE_KEY = "scope";
    static final String CRITERIA_KEY = "criteria";
    static final String USERS = "users";
    static final String LISTINGS = "listings";
    static final String AUDIT = "audit";
    static final int RESULT_LIMIT = 20;

    private static final Map<String, Permission> SCOPES = Map.of(USERS, Permission.MANAGE_USERS, LISTINGS,
            Permission.MANAGE_LISTINGS, AUDIT, Permission.VIEW_AUDIT_LOG);
    private static final Pattern ACTION_TAG = Pattern.compile("[a-z][a-z_:]{2,40}");

    @Inject
    PermissionService permissions;

    @Inject
    AuditRecorder auditRecorder;

    @Override
    public ConversationKind kind() {
        return KIND;
    }

    @Override
    public List<SelectionSignature> startSignatures() {
        return List.of(SelectionSignature.of("admin_filter"));
    }

    @Override
    public List<String> textAliases() {
        return List.of("/filter");
    }

    @Override
    public StartPlan begin(RuleContext context, Selection selection) {
        return StartPlan.at(SCOPE);
    }

    @Override
    public List<StateRule> rules() {
        return List.of(
                StateRule.input(KIND, SCOPE).prompt("What do you want to view?")
                        .suggest(SCOPE_KEY + ":" + USERS, SCOPE_KEY + ":" + LISTINGS, SCOPE_KEY + ":" + AUDIT)
                        .validate(this::scope).storesAs(SCOPE_KEY).then(CRITERIA).build(),
                StateRule.input(KIND, CRITERIA).prompt(AdminFilterDefinition::criteriaPrompt)
                        .suggest("filter:all").validate((ctx, event) -> criteria(ctx.payload(), event))
                        .storesAs(CRITERIA_KEY).completesWith(Completion.query(this::run)).build());
    }

    private Validation scope(RuleContext context, InboundEvent event) {
        Optional<String> choice = Inputs.choice(event, SCOPE_KEY);
        if (choice.isEmpty() || !SCOPES.containsKey(choice.get())) {
            return Validation.reject("Please choose users, listings or audit.");
        }
        if (!permissions.authorize(context.principal(), SCOPES.get(choice.get()))) {
            return Validation.reject("You do not have permission to view " + choice.get() + ".");
        }
        return Validation.accept(choice.get());
    }

    private static String criteriaPrompt(Session session) {
        return switch ((String) session.payload().get(SCOPE_KEY)) {
            case USERS -> "Which users? all, active or blocked.";
            case LISTINGS -> "Which listings? all, active, sold, flagged or deleted.";
            default -> "Which entries? all, mine, or an action such as block_user.";
        };
    }

    static Validation criteria(Map<String, Object> payload, InboundEvent event) {
        Optional<String> choice = Inputs.choice(event, "filter");
        if (choice.isEmpty()) {
            return Validation.reject("Please send a filter.");
        }
        String value = choice.get();
        boolean valid = switch ((String) payload.get(SCOPE_KEY)) {
            case USERS -> UserFilter.fromKey(value).isPresent();
            case LISTINGS -> "all".equals(value) || ListingStatus.fromKey(value).isPresent();
            default -> "all".equals(value) || "mine".equals(value) || ACTION_TAG.matcher(value).matches();
        };
        return valid ? Validation.accept(value) : Validation.reject("That filter is not available here.");
    }

    private String run(RuleContext context, Map<String, Object> payload) {
        String criteria = (String) payload.get(CRITERIA_KEY);
        return switch ((String) payload.get(SCOPE_KEY)) {
            case USERS -> users(context, criteria);
            case LISTINGS -> listings(context, criteria);
            default -> audit(context, criteria);
        };
    }

    private String users(RuleContext context, String criteria) {
        UserFilter filter = UserFilter.fromKey(criteria).orElse(UserFilter.ALL);
        List<MarketplaceUser> users = context.lookup("list_users", store -> store.listUsers(filter, RESULT_LIMIT));
        if (users.isEmpty()) {
            return "No users match.";
        }
        StringBuilder text = new StringBuilder("Users (" + criteria + "):\n");
        for (MarketplaceUser user : users) {
            text.append('#').append(user.id).append(' ').append(user.role.getKey())
                    .append(user.active ? "" : " BLOCKED").append(", warnings: ").append(user.warningCount)
                    .append('\n');
        }
        return text.toString().trim();
    }

    private String listings(RuleContext context, String criteria) {
        ListingStatus status = "all".equals(criteria) ? null : ListingStatus.fromKey(criteria).orElse(null);
        List<Listing> listings = context.lookup("list_listings", store -> store.listListings(status, RESULT_LIMIT));
        if (listings.isEmpty()) {
            return "No listings match.";
        }
        StringBuilder text = new StringBuilder("Listings (" + criteria + "):\n");
        for (Listing listing : listings) {
            text.append('#').append(listing.id).append(' ').append(Texts.truncate(listing.title, 40)).append(" - ")
                    .append(Prices.format(listing.price)).append(" [").append(listing.status.getKey()).append(']');
            if (listing.flagReason != null) {
                text.append(" flagged: ").append(Texts.truncate(listing.flagReason, 60));
            }
            text.append('\n');
        }
        return text.toString().trim();
    }

    private String audit(RuleContext context, String criteria) {
        Long actorId = "mine".equals(criteria) ? context.principal().id() : null;
        String action = "all".equals(criteria) || "mine".equals(criteria) ? null : criteria;
        List<AuditEntry> entries = auditRecorder.recent(context.principal(), RESULT_LIMIT, actorId, action);
        if (entries.isEmpty()) {
            return "No audit entries match.";
        }
        StringBuilder text = new StringBuilder("Audit log (" + criteria + "):\n");
        entries.forEach(entry -> text.append(auditRecorder.describe(entry)).append('\n'));
        return text.toString().trim();
    }
}
