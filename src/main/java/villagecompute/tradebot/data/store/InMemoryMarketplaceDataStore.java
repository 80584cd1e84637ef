/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.data.store;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;
import villagecompute.tradebot.data.models.AuditEntry;
import villagecompute.tradebot.data.models.ChatMessage;
import villagecompute.tradebot.data.models.Listing;
import villagecompute.tradebot.data.models.ListingStatus;
import villagecompute.tradebot.data.models.MarketplaceUser;
import villagecompute.tradebot.data.models.Review;
import villagecompute.tradebot.data.models.Warning;
import villagecompute.tradebot.exceptions.ResourceNotFoundException;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

/**
 * Process-local {@link MarketplaceDataStore} used by default wiring and tests.
 *
 * <p>
 * Entities are copied on the way in and out so callers never alias stored state. The audit log is an append-only
 * list. No transactional support: {@link #supportsTransactions()} stays false.
 */
@ApplicationScoped
public class InMemoryMarketplaceDataStore implements MarketplaceDataStore {

    private static final Logger LOG = Logger.getLogger(InMemoryMarketplaceDataStore.class);

    private final Map<Long, MarketplaceUser> users = new ConcurrentHashMap<>();
    private final Map<Long, Listing> listings = new ConcurrentHashMap<>();
    private final List<ChatMessage> messages = new CopyOnWriteArrayList<>();
    private final List<Review> reviews = new CopyOnWriteArrayList<>();
    private final List<Warning> warnings = new CopyOnWriteArrayList<>();
    private final List<AuditEntry> auditLog = new CopyOnWriteArrayList<>();

    private final AtomicLong listingIds = new AtomicLong();
    private final AtomicLong messageIds = new AtomicLong();
    private final AtomicLong reviewIds = new AtomicLong();
    private final AtomicLong warningIds = new AtomicLong();
    private final AtomicLong auditIds = new AtomicLong();

    @Override
    public Optional<MarketplaceUser> findUser(long userId) {
        return Optional.ofNullable(users.get(userId)).map(MarketplaceUser::copy);
    }

    @Override
    public MarketplaceUser saveUser(MarketplaceUser user) {
        Objects.requireNonNull(user, "user is required");
        users.put(user.id, user.copy());
        return user;
    }

    @Override
    public List<MarketplaceUser> listUsers(UserFilter filter, int limit) {
        Stream<MarketplaceUser> stream = users.values().stream();
        if (filter == UserFilter.ACTIVE) {
            stream = stream.filter(user -> user.active);
        } else if (filter == UserFilter.BLOCKED) {
            stream = stream.filter(user -> !user.active);
        }
        return stream.sorted(Comparator.comparingLong(user -> user.id)).limit(limit).map(MarketplaceUser::copy)
                .toList();
    }

    @Override
    public Listing createListing(Listing listing) {
        Objects.requireNonNull(listing, "listing is required");
        Listing stored = listing.copy();
        stored.id = listingIds.incrementAndGet();
        Instant now = Instant.now();
        stored.createdAt = stored.createdAt != null ? stored.createdAt : now;
        stored.updatedAt = now;
        listings.put(stored.id, stored);
        LOG.debugf("Stored listing %d for seller %d", stored.id.longValue(), stored.sellerId);
        return stored.copy();
    }

    @Override
    public Optional<Listing> findListing(long listingId) {
        return Optional.ofNullable(listings.get(listingId)).map(Listing::copy);
    }

    @Override
    public Listing updateListing(Listing listing) {
        Objects.requireNonNull(listing, "listing is required");
        if (listing.id == null || !listings.containsKey(listing.id)) {
            throw new ResourceNotFoundException("Listing not found: " + listing.id);
        }
        Listing stored = listing.copy();
        stored.updatedAt = Instant.now();
        listings.put(stored.id, stored);
        return stored.copy();
    }

    @Override
    public List<Listing> listListings(ListingStatus status, int limit) {
        return listings.values().stream().filter(listing -> status == null || listing.status == status)
                .sorted(Comparator.comparingLong((Listing listing) -> listing.id).reversed()).limit(limit)
                .map(Listing::copy).toList();
    }

    @Override
    public ListingPage searchListings(ListingQuery query) {
        String keyword = query.keyword() == null ? null : query.keyword().toLowerCase(Locale.ROOT);
        List<Listing> matches = listings.values().stream().filter(listing -> listing.status == ListingStatus.ACTIVE)
                .filter(listing -> keyword == null || contains(listing.title, keyword)
                        || contains(listing.description, keyword))
                .filter(listing -> query.category() == null || query.category().equals(listing.category))
                .filter(listing -> query.minPrice() == null || listing.price.compareTo(query.minPrice()) >= 0)
                .filter(listing -> query.maxPrice() == null || listing.price.compareTo(query.maxPrice()) <= 0)
                .sorted(Comparator.comparingLong((Listing listing) -> listing.id).reversed()).toList();

        List<Listing> page = matches.stream().skip(query.offset()).limit(query.pageSize()).map(Listing::copy).toList();
        return new ListingPage(page, matches.size(), query.page(), query.pageSize());
    }

    @Override
    public ChatMessage createMessage(ChatMessage message) {
        Objects.requireNonNull(message, "message is required");
        message.id = messageIds.incrementAndGet();
        message.createdAt = message.createdAt != null ? message.createdAt : Instant.now();
        messages.add(message);
        return message;
    }

    @Override
    public Review createReview(Review review) {
        Objects.requireNonNull(review, "review is required");
        review.id = reviewIds.incrementAndGet();
        review.createdAt = review.createdAt != null ? review.createdAt : Instant.now();
        reviews.add(review);
        return review;
    }

    @Override
    public Optional<Review> findReview(long reviewId) {
        return reviews.stream().filter(review -> review.id == reviewId).findFirst();
    }

    @Override
    public boolean deleteReview(long reviewId) {
        boolean removed = reviews.removeIf(review -> review.id == reviewId);
        if (removed) {
            LOG.debugf("Review %d removed", reviewId);
        }
        return removed;
    }

    @Override
    public Warning createWarning(Warning warning) {
        Objects.requireNonNull(warning, "warning is required");
        MarketplaceUser user = users.get(warning.userId);
        if (user == null) {
            throw new ResourceNotFoundException("User not found: " + warning.userId);
        }
        warning.id = warningIds.incrementAndGet();
        warnings.add(warning);
        user.warningCount++;
        return warning;
    }

    @Override
    public long countActiveWarnings(long userId) {
        Instant now = Instant.now();
        return warnings.stream().filter(warning -> warning.userId == userId && warning.isActiveAt(now)).count();
    }

    @Override
    public AuditEntry appendAudit(AuditEntry entry) {
        Objects.requireNonNull(entry, "entry is required");
        AuditEntry stored = entry.withId(auditIds.incrementAndGet());
        auditLog.add(stored);
        return stored;
    }

    @Override
    public List<AuditEntry> recentAudit(int limit, Long actorId, String action) {
        return auditLog.stream().filter(entry -> actorId == null || entry.actorId() == actorId)
                .filter(entry -> action == null || action.equals(entry.action()))
                .sorted(Comparator.comparingLong(AuditEntry::id).reversed()).limit(limit).toList();
    }

    @Override
    public List<AuditEntry> searchAudit(String targetType, Long targetId, int limit, int offset) {
        return auditLog.stream().filter(entry -> targetType == null || targetType.equals(entry.targetType()))
                .filter(entry -> targetId == null || targetId.equals(entry.targetId()))
                .sorted(Comparator.comparingLong(AuditEntry::id).reversed()).skip(offset).limit(limit).toList();
    }

    /**
     * Messages stored so far, oldest first.
     */
    public List<ChatMessage> messages() {
        return List.copyOf(messages);
    }

    public List<Review> reviews() {
        return List.copyOf(reviews);
    }

    public List<Warning> warnings() {
        return List.copyOf(warnings);
    }

    /**
     * Drops every stored entity. Intended for test isolation.
     */
    public void clear() {
        users.clear();
        listings.clear();
        messages.clear();
        reviews.clear();
        warnings.clear();
        auditLog.clear();
        listingIds.set(0);
        messageIds.set(0);
        reviewIds.set(0);
        warningIds.set(0);
        auditIds.set(0);
    }

    private static boolean contains(String haystack, String needle) {
        return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(needle);
    }
}
