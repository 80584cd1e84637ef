/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.exceptions;

/**
 * Exception thrown when the data store fails or does not answer within the configured timeout.
 *
 * <p>
 * When raised before a mutation took effect the conversation session is preserved so the user can retry the step.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
