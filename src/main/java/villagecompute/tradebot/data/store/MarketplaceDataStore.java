/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.data.store;

import villagecompute.tradebot.data.models.AuditEntry;
import villagecompute.tradebot.data.models.ChatMessage;
import villagecompute.tradebot.data.models.Listing;
import villagecompute.tradebot.data.models.ListingStatus;
import villagecompute.tradebot.data.models.MarketplaceUser;
import villagecompute.tradebot.data.models.Review;
import villagecompute.tradebot.data.models.Warning;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Capability interface to the storage of marketplace entities.
 *
 * <p>
 * The conversation core never assumes a schema; it reads and writes entities only through this contract. Every call
 * is made through {@link villagecompute.tradebot.services.BoundedStoreExecutor} so an unresponsive store surfaces as
 * a {@link villagecompute.tradebot.exceptions.StorageException} instead of a blocked conversation.
 *
 * <p>
 * Implementations may throw any {@link RuntimeException} on failure; callers translate them.
 *
 * @see InMemoryMarketplaceDataStore for the reference implementation
 */
public interface MarketplaceDataStore {

    // users

    Optional<MarketplaceUser> findUser(long userId);

    MarketplaceUser saveUser(MarketplaceUser user);

    List<MarketplaceUser> listUsers(UserFilter filter, int limit);

    // listings

    Listing createListing(Listing listing);

    Optional<Listing> findListing(long listingId);

    Listing updateListing(Listing listing);

    /**
     * Lists listings for admin views.
     *
     * @param status
     *            status filter, null for every status
     * @param limit
     *            maximum number of rows
     */
    List<Listing> listListings(ListingStatus status, int limit);

    /**
     * Runs a buyer search over active listings.
     */
    ListingPage searchListings(ListingQuery query);

    // messages, reviews, warnings

    ChatMessage createMessage(ChatMessage message);

    Review createReview(Review review);

    Optional<Review> findReview(long reviewId);

    /**
     * Removes a review.
     *
     * @return false if no review had the id
     */
    boolean deleteReview(long reviewId);

    /**
     * Persists a warning and increments the target user's warning count.
     */
    Warning createWarning(Warning warning);

    long countActiveWarnings(long userId);

    // audit

    /**
     * Appends an audit entry. Entries are never updated or deleted.
     *
     * @return the stored entry with its assigned id
     */
    AuditEntry appendAudit(AuditEntry entry);

    /**
     * Most recent audit entries first.
     *
     * @param actorId
     *            optional actor filter
     * @param action
     *            optional action tag filter
     */
    List<AuditEntry> recentAudit(int limit, Long actorId, String action);

    List<AuditEntry> searchAudit(String targetType, Long targetId, int limit, int offset);

    // transactions

    /**
     * Whether {@link #inTransaction(Supplier)} provides atomic commit/rollback. When true the moderation dispatcher
     * wraps mutation and audit write in one transaction.
     */
    default boolean supportsTransactions() {
        return false;
    }

    default <T> T inTransaction(Supplier<T> work) {
        return work.get();
    }
}
