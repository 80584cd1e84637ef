/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.exceptions;

/**
 * Exception thrown when an audit entry cannot be written after its mutation already committed.
 *
 * <p>
 * High severity: the action happened but left no record. Always logged at FATAL.
 */
public class AuditWriteException extends RuntimeException {

    public AuditWriteException(String message) {
        super(message);
    }

    public AuditWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
