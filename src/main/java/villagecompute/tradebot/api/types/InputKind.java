/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.api.types;

/**
 * What an inbound event carries: free text, a structured selection ({@code tag[:param...]}) or a media reference.
 */
public enum InputKind {
    TEXT, SELECTION, MEDIA
}
