/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.services;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.tradebot.exceptions.ResourceNotFoundException;
import villagecompute.tradebot.exceptions.StorageException;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs data store calls with an upper time bound.
 *
 * <p>
 * A call that does not finish within {@code tradebot.store.timeout} is cancelled and reported as a
 * {@link StorageException}, as is any runtime failure raised by the store. A {@link ResourceNotFoundException} passes
 * through unchanged since it reports missing data, not an unhealthy store.
 */
@ApplicationScoped
public class BoundedStoreExecutor {

    private static final Logger LOG = Logger.getLogger(BoundedStoreExecutor.class);

    @ConfigProperty(
            name = "tradebot.store.timeout",
            defaultValue = "5s")
    Duration timeout;

    private ExecutorService executor;

    @PostConstruct
    void init() {
        AtomicInteger counter = new AtomicInteger();
        executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "tradebot-store-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }

    /**
     * Runs a store call and returns its result.
     *
     * @param operation
     *            short name for logs, e.g. {@code "create_listing"}
     * @throws StorageException
     *             on timeout, interruption or store failure
     * @throws ResourceNotFoundException
     *             if the store reports a missing entity
     */
    public <T> T call(String operation, Callable<T> work) {
        Future<T> future = executor.submit(work);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            LOG.errorf("Store operation %s timed out after %s", operation, timeout);
            throw new StorageException("Store operation " + operation + " timed out", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new StorageException("Interrupted during store operation " + operation, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof StorageException || cause instanceof ResourceNotFoundException) {
                throw (RuntimeException) cause;
            }
            LOG.errorf(cause, "Store operation %s failed", operation);
            throw new StorageException("Store operation " + operation + " failed: " + cause.getMessage(), cause);
        }
    }

    public void run(String operation, Runnable work) {
        call(operation, () -> {
            work.run();
            return null;
        });
    }
}
