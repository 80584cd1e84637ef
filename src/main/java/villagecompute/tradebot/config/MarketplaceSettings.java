/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.config;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

/**
 * Limits applied by the conversation rules.
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code tradebot.listing.min-price} - lowest accepted listing price (default: 0.01)</li>
 * <li>{@code tradebot.listing.max-price} - highest accepted listing price (default: 1000000.00)</li>
 * <li>{@code tradebot.listing.max-photos} - photos per listing (default: 5)</li>
 * <li>{@code tradebot.listing.categories} - category ids accepted by listing and search flows</li>
 * <li>{@code tradebot.search.page-size} - results per search page (default: 5)</li>
 * <li>{@code tradebot.session.ttl} - idle time after which a session is abandoned (default: 30m)</li>
 * </ul>
 */
@ApplicationScoped
public class MarketplaceSettings {

    private static final Logger LOG = Logger.getLogger(MarketplaceSettings.class);

    @ConfigProperty(
            name = "tradebot.listing.min-price",
            defaultValue = "0.01")
    BigDecimal minPrice;

    @ConfigProperty(
            name = "tradebot.listing.max-price",
            defaultValue = "1000000.00")
    BigDecimal maxPrice;

    @ConfigProperty(
            name = "tradebot.listing.max-photos",
            defaultValue = "5")
    int maxPhotos;

    @ConfigProperty(
            name = "tradebot.listing.categories",
            defaultValue = "electronics,clothing,home,vehicles,services,jobs,pets,sports,books,other")
    List<String> categories;

    @ConfigProperty(
            name = "tradebot.search.page-size",
            defaultValue = "5")
    int searchPageSize;

    @ConfigProperty(
            name = "tradebot.session.ttl",
            defaultValue = "30m")
    Duration sessionTtl;

    @PostConstruct
    void validate() {
        if (minPrice.signum() <= 0 || minPrice.compareTo(maxPrice) > 0) {
            throw new IllegalStateException(
                    "tradebot.listing.min-price must be positive and not above max-price: " + minPrice);
        }
        if (maxPhotos < 0 || searchPageSize < 1) {
            throw new IllegalStateException("tradebot.listing.max-photos and tradebot.search.page-size invalid");
        }
        LOG.infof("Listing limits: price %s..%s, %d photos, %d categories, session ttl %s", minPrice, maxPrice,
                maxPhotos, categories.size(), sessionTtl);
    }

    public BigDecimal minPrice() {
        return minPrice;
    }

    public BigDecimal maxPrice() {
        return maxPrice;
    }

    public int maxPhotos() {
        return maxPhotos;
    }

    public List<String> categories() {
        return categories;
    }

    public boolean isCategory(String id) {
        return id != null && categories.contains(id);
    }

    public int searchPageSize() {
        return searchPageSize;
    }

    public Duration sessionTtl() {
        return sessionTtl;
    }
}
