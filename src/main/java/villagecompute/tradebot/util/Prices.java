/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.util;

import villagecompute.tradebot.exceptions.ValidationException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Price parsing and formatting for chat input.
 */
public final class Prices {

    // digits with an optional fraction; exponent notation is not a price
    private static final Pattern PLAIN_NUMBER = Pattern.compile("-?[0-9]{1,15}(\\.[0-9]{1,10})?|-?\\.[0-9]{1,10}");

    private Prices() {
    }

    /**
     * Parses user-typed price text. Currency symbol, thousands separators and spaces are ignored; the result is
     * rounded half-up to cents.
     *
     * @param raw
     *            user text, e.g. {@code "$1,299.50"}
     * @param min
     *            lowest accepted value (inclusive)
     * @param max
     *            highest accepted value (inclusive)
     * @throws ValidationException
     *             if the text is not a number or the value is out of range
     */
    public static BigDecimal parse(String raw, BigDecimal min, BigDecimal max) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException("Please enter a price.");
        }
        String cleaned = raw.trim().replace("$", "").replace(",", "").replace(" ", "");
        if (!PLAIN_NUMBER.matcher(cleaned).matches()) {
            throw new ValidationException("Please enter a valid number for the price.");
        }
        BigDecimal value = new BigDecimal(cleaned);
        if (value.signum() < 0) {
            throw new ValidationException("Price cannot be negative.");
        }
        if (value.compareTo(max) > 0) {
            throw new ValidationException("Price cannot exceed " + format(max) + ".");
        }
        value = value.setScale(2, RoundingMode.HALF_UP);
        if (value.compareTo(min) < 0) {
            throw new ValidationException("Price must be at least " + format(min) + ".");
        }
        if (value.compareTo(max) > 0) {
            throw new ValidationException("Price cannot exceed " + format(max) + ".");
        }
        return value;
    }

    /**
     * Formats a price as {@code $1,299.50}.
     */
    public static String format(BigDecimal price) {
        DecimalFormat format = new DecimalFormat("$#,##0.00", DecimalFormatSymbols.getInstance(Locale.US));
        return format.format(price);
    }
}
