/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.tradebot.data.models.Listing;
import villagecompute.tradebot.data.models.MarketplaceUser;
import villagecompute.tradebot.data.models.Principal;
import villagecompute.tradebot.data.models.Review;
import villagecompute.tradebot.data.models.Role;
import villagecompute.tradebot.data.models.Warning;
import villagecompute.tradebot.data.models.WarningSeverity;
import villagecompute.tradebot.data.store.MarketplaceDataStore;
import villagecompute.tradebot.exceptions.ResourceNotFoundException;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Moderation actions on users, listings and reviews.
 *
 * <p>
 * Each method builds a {@link ModerationCommand} plus the matching store mutation and hands both to the
 * {@link ModerationDispatcher}; none of them writes to the store directly.
 *
 * <p>
 * <b>Warning Lifetime:</b> {@code tradebot.moderation.warning-ttl.low|medium|high} set the expiry of new warnings
 * per severity. A severity without a configured lifetime produces a warning that never expires.
 */
@ApplicationScoped
public class ModerationService {

    private static final Logger LOG = Logger.getLogger(ModerationService.class);

    @Inject
    ModerationDispatcher dispatcher;

    @Inject
    SessionStore sessionStore;

    @Inject
    PrincipalLocks locks;

    @ConfigProperty(
            name = "tradebot.moderation.session-lock-wait",
            defaultValue = "PT2S")
    Duration sessionLockWait;

    @ConfigProperty(
            name = "tradebot.moderation.warning-ttl.low")
    Optional<Duration> lowWarningTtl;

    @ConfigProperty(
            name = "tradebot.moderation.warning-ttl.medium")
    Optional<Duration> mediumWarningTtl;

    @ConfigProperty(
            name = "tradebot.moderation.warning-ttl.high")
    Optional<Duration> highWarningTtl;

    /**
     * Blocks a user. A blocked user's live conversation is discarded.
     */
    public ModerationResult blockUser(Principal actor, long userId, String reason) {
        ModerationCommand command = new ModerationCommand(actor, ModerationActions.BLOCK_USER,
                ModerationActions.TARGET_USER, userId, Map.of("reason", reason));
        ModerationResult result = dispatcher.dispatch(command, store -> {
            MarketplaceUser user = requireUser(store, userId);
            user.block(reason);
            store.saveUser(user);
        });
        if (result.mutated()) {
            discardSession(userId);
            LOG.infof("User %d blocked by %d", userId, actor.id());
        }
        return result;
    }

    public ModerationResult unblockUser(Principal actor, long userId) {
        ModerationCommand command = new ModerationCommand(actor, ModerationActions.UNBLOCK_USER,
                ModerationActions.TARGET_USER, userId, Map.of());
        return dispatcher.dispatch(command, store -> {
            MarketplaceUser user = requireUser(store, userId);
            user.unblock();
            store.saveUser(user);
        });
    }

    public ModerationResult warnUser(Principal actor, long userId, WarningSeverity severity, String reason) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("severity", severity.getKey());
        detail.put("reason", reason);
        ModerationCommand command = new ModerationCommand(actor, ModerationActions.WARN_USER,
                ModerationActions.TARGET_USER, userId, detail);
        return dispatcher.dispatch(command, store -> {
            requireUser(store, userId);
            Instant now = Instant.now();
            Warning warning = new Warning();
            warning.userId = userId;
            warning.adminId = actor.id();
            warning.reason = reason;
            warning.severity = severity;
            warning.active = true;
            warning.createdAt = now;
            warning.expiresAt = warningTtl(severity).map(now::plus).orElse(null);
            store.createWarning(warning);
        });
    }

    public ModerationResult flagListing(Principal actor, long listingId, String reason) {
        ModerationCommand command = new ModerationCommand(actor, ModerationActions.FLAG_LISTING,
                ModerationActions.TARGET_LISTING, listingId, Map.of("reason", reason));
        return dispatcher.dispatch(command, store -> {
            Listing listing = requireListing(store, listingId);
            listing.flag(reason, Instant.now());
            store.updateListing(listing);
        });
    }

    public ModerationResult deleteListing(Principal actor, long listingId, String reason) {
        ModerationCommand command = new ModerationCommand(actor, ModerationActions.DELETE_LISTING,
                ModerationActions.TARGET_LISTING, listingId, Map.of("reason", reason));
        return dispatcher.dispatch(command, store -> {
            Listing listing = requireListing(store, listingId);
            listing.markDeleted(Instant.now());
            store.updateListing(listing);
        });
    }

    /**
     * Removes a review. The audit detail keeps the seller, reviewer and rating of the removed review.
     */
    public ModerationResult deleteReview(Principal actor, Review review) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("listing_id", review.listingId);
        detail.put("seller_id", review.sellerId);
        detail.put("reviewer_id", review.reviewerId);
        detail.put("rating", review.rating);
        long reviewId = review.id;
        ModerationCommand command = new ModerationCommand(actor, ModerationActions.DELETE_REVIEW,
                ModerationActions.TARGET_REVIEW, reviewId, detail);
        return dispatcher.dispatch(command, store -> {
            if (!store.deleteReview(reviewId)) {
                throw new ResourceNotFoundException("Review not found: " + reviewId);
            }
        });
    }

    /**
     * Changes a user's role. The new role only takes effect for principals on the admin allow-list.
     */
    public ModerationResult grantRole(Principal actor, long userId, Role role) {
        ModerationCommand command = new ModerationCommand(actor, ModerationActions.GRANT_ROLE,
                ModerationActions.TARGET_USER, userId, Map.of("role", role.getKey()));
        return dispatcher.dispatch(command, store -> {
            MarketplaceUser user = requireUser(store, userId);
            user.role = role;
            store.saveUser(user);
        });
    }

    Optional<Duration> warningTtl(WarningSeverity severity) {
        return switch (severity) {
            case LOW -> lowWarningTtl;
            case MEDIUM -> mediumWarningTtl;
            case HIGH -> highWarningTtl;
        };
    }

    /**
     * Deletes a principal's session under that principal's lock so an event already in flight cannot write it back.
     * The wait is bounded: two admins blocking each other at once each hold their own lock.
     */
    void discardSession(long userId) {
        ReentrantLock lock = locks.lockFor(userId);
        boolean locked = false;
        try {
            locked = lock.tryLock(sessionLockWait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        try {
            if (!locked) {
                LOG.warnf("Could not lock principal %d within %s; deleting its session unlocked", userId,
                        sessionLockWait);
            }
            sessionStore.delete(userId);
        } finally {
            if (locked) {
                lock.unlock();
            }
        }
    }

    private static MarketplaceUser requireUser(MarketplaceDataStore store, long userId) {
        return store.findUser(userId).orElseThrow(() -> new ResourceNotFoundException("User not found: " + userId));
    }

    private static Listing requireListing(MarketplaceDataStore store, long listingId) {
        return store.findListing(listingId)
                .orElseThrow(() -> new ResourceNotFoundException("Listing not found: " + listingId));
    }
}
