/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.conversation;

import villagecompute.tradebot.api.types.InboundEvent;
import villagecompute.tradebot.config.MarketplaceSettings;
import villagecompute.tradebot.data.models.Listing;
import villagecompute.tradebot.exceptions.ValidationException;
import villagecompute.tradebot.util.Prices;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Field rules shared by listing creation and listing edits.
 */
public final class ListingFields {

    public static final String TITLE = "title";
    public static final String DESCRIPTION = "description";
    public static final String PRICE = "price";
    public static final String CATEGORY = "category";
    public static final String PHOTOS = "photos";
    public static final String LOCATION = "location";
    public static final String LISTING_ID = "listing_id";

    static final int TITLE_MIN = 3;
    static final int TITLE_MAX = 100;
    static final int DESCRIPTION_MAX = 2000;
    static final int LOCATION_MAX = 100;

    /**
     * A photo input: a media reference to append, or the end of the photo step when {@code reference} is null.
     */
    public record PhotoInput(String reference) {

        static final PhotoInput DONE = new PhotoInput(null);

        public boolean isDone() {
            return reference == null;
        }
    }

    private ListingFields() {
    }

    public static Validation title(InboundEvent event) {
        return Inputs.boundedText(event, "title", TITLE_MIN, TITLE_MAX);
    }

    /**
     * {@code skip} stores an empty description.
     */
    public static Validation description(InboundEvent event) {
        if (Inputs.isSkip(event)) {
            return Validation.accept("");
        }
        return Inputs.boundedText(event, "description", 1, DESCRIPTION_MAX);
    }

    public static Validation price(InboundEvent event, MarketplaceSettings settings) {
        return price(event, settings.minPrice(), settings.maxPrice());
    }

    public static Validation price(InboundEvent event, BigDecimal min, BigDecimal max) {
        Optional<String> text = event.text();
        if (text.isEmpty()) {
            return Validation.reject("Please type the price as a number, e.g. 49.99.");
        }
        try {
            return Validation.accept(Prices.parse(text.get(), min, max));
        } catch (ValidationException e) {
            return Validation.reject(e.getMessage());
        }
    }

    public static Validation category(InboundEvent event, MarketplaceSettings settings) {
        Optional<String> choice = Inputs.choice(event, CATEGORY);
        if (choice.isEmpty() || !settings.isCategory(choice.get())) {
            return Validation.reject("Please choose one of: " + String.join(", ", settings.categories()) + ".");
        }
        return Validation.accept(choice.get());
    }

    /**
     * Media appends a photo until {@code maxPhotos} is reached; any other input ends the step.
     */
    public static Validation photo(InboundEvent event, Map<String, Object> payload, int maxPhotos) {
        if (!event.isMedia()) {
            return Validation.accept(PhotoInput.DONE);
        }
        if (event.raw() == null || event.raw().isBlank()) {
            return Validation.reject("That photo could not be read. Please send it again.");
        }
        if (photos(payload).size() >= maxPhotos) {
            return Validation.reject("You can add at most " + maxPhotos + " photos. Send \"done\" to continue.");
        }
        return Validation.accept(new PhotoInput(event.raw()));
    }

    /**
     * Appends an accepted photo to the payload's photo list.
     */
    public static Map<String, Object> appendPhoto(Map<String, Object> payload, Object value) {
        PhotoInput input = (PhotoInput) value;
        if (input.isDone()) {
            return payload;
        }
        List<String> photos = new ArrayList<>(photos(payload));
        photos.add(input.reference());
        Map<String, Object> next = new LinkedHashMap<>(payload);
        next.put(PHOTOS, List.copyOf(photos));
        return next;
    }

    /**
     * {@code skip} leaves the location unset.
     */
    public static Validation location(InboundEvent event) {
        if (Inputs.isSkip(event)) {
            return Validation.accept(null);
        }
        return Inputs.boundedText(event, "location", 1, LOCATION_MAX);
    }

    @SuppressWarnings("unchecked")
    public static List<String> photos(Map<String, Object> payload) {
        Object photos = payload.get(PHOTOS);
        return photos == null ? List.of() : (List<String>) photos;
    }

    /**
     * Copies one collected field onto a listing.
     */
    public static void applyField(Listing listing, String field, Map<String, Object> payload) {
        switch (field) {
            case TITLE -> listing.title = (String) payload.get(TITLE);
            case DESCRIPTION -> listing.description = (String) payload.get(DESCRIPTION);
            case PRICE -> listing.price = (BigDecimal) payload.get(PRICE);
            case CATEGORY -> listing.category = (String) payload.get(CATEGORY);
            case PHOTOS -> listing.photos = new ArrayList<>(photos(payload));
            case LOCATION -> listing.location = (String) payload.get(LOCATION);
            default -> throw new IllegalArgumentException("Unknown listing field: " + field);
        }
    }
}
