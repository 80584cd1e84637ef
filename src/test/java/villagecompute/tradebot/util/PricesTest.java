/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

import java.math.BigDecimal;
import java.time.Duration;

import org.junit.jupiter.api.Test;

import villagecompute.tradebot.exceptions.ValidationException;

class PricesTest {

    private static final BigDecimal MIN = new BigDecimal("0.01");
    private static final BigDecimal MAX = new BigDecimal("1000000.00");

    @Test
    void testStripsCurrencyAndSeparators() {
        assertEquals(new BigDecimal("1299.50"), Prices.parse("$1,299.50", MIN, MAX));
        assertEquals(new BigDecimal("49.99"), Prices.parse(" 49.99 ", MIN, MAX));
        assertEquals(new BigDecimal("1000.00"), Prices.parse("1 000", MIN, MAX));
    }

    @Test
    void testRoundsHalfUpToCents() {
        assertEquals(new BigDecimal("10.01"), Prices.parse("10.005", MIN, MAX));
        assertEquals(new BigDecimal("10.00"), Prices.parse("10.004", MIN, MAX));
    }

    @Test
    void testRejectsInvalidPrices() {
        assertThrows(ValidationException.class, () -> Prices.parse("-5", MIN, MAX));
        assertThrows(ValidationException.class, () -> Prices.parse("abc", MIN, MAX));
        assertThrows(ValidationException.class, () -> Prices.parse("", MIN, MAX));
        assertThrows(ValidationException.class, () -> Prices.parse("0", MIN, MAX));
        assertThrows(ValidationException.class, () -> Prices.parse("1000000.01", MIN, MAX));
    }

    @Test
    void testRejectsExponentNotationQuickly() {
        assertTimeoutPreemptively(Duration.ofSeconds(1), () -> {
            assertThrows(ValidationException.class, () -> Prices.parse("1e999999999", MIN, MAX));
            assertThrows(ValidationException.class, () -> Prices.parse("1e30000000", MIN, MAX));
            assertThrows(ValidationException.class, () -> Prices.parse("5E2", MIN, MAX));
            assertThrows(ValidationException.class, () -> Prices.parse("1e-999999999", MIN, MAX));
        });
    }

    @Test
    void testRejectsOverlongDigitRuns() {
        assertThrows(ValidationException.class, () -> Prices.parse("9".repeat(5000), MIN, MAX));
        assertThrows(ValidationException.class, () -> Prices.parse("1.", MIN, MAX));
    }

    @Test
    void testLeadingDecimalPoint() {
        assertEquals(new BigDecimal("0.50"), Prices.parse(".5", MIN, MAX));
    }

    @Test
    void testBoundsAreInclusive() {
        assertEquals(new BigDecimal("0.01"), Prices.parse("0.01", MIN, MAX));
        assertEquals(new BigDecimal("1000000.00"), Prices.parse("1,000,000", MIN, MAX));
    }

    @Test
    void testFormat() {
        assertEquals("$1,299.50", Prices.format(new BigDecimal("1299.5")));
    }
}
