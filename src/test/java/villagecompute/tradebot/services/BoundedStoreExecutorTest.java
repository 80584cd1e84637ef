/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import villagecompute.tradebot.exceptions.ResourceNotFoundException;
import villagecompute.tradebot.exceptions.StorageException;

class BoundedStoreExecutorTest {

    private BoundedStoreExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new BoundedStoreExecutor();
        executor.timeout = Duration.ofMillis(200);
        executor.init();
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void testReturnsResult() {
        int answer = executor.call("answer", () -> 42);

        assertEquals(42, answer);
    }

    @Test
    void testTimeoutBecomesStorageException() {
        StorageException e = assertThrows(StorageException.class, () -> executor.call("slow", () -> {
            Thread.sleep(2_000);
            return 1;
        }));
        assertTrue(e.getMessage().contains("timed out"));
    }

    @Test
    void testStoreFailureIsWrapped() {
        IllegalStateException failure = new IllegalStateException("connection refused");

        StorageException e = assertThrows(StorageException.class, () -> executor.run("broken", () -> {
            throw failure;
        }));
        assertSame(failure, e.getCause());
    }

    @Test
    void testNotFoundPassesThrough() {
        assertThrows(ResourceNotFoundException.class, () -> executor.run("lookup", () -> {
            throw new ResourceNotFoundException("Listing not found: 9");
        }));
    }
}
