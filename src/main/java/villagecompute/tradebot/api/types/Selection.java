/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.api.types;

import villagecompute.tradebot.exceptions.ValidationException;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parsed selection data in the {@code tag}, {@code tag:id}, {@code tag:page} or {@code tag:p1:p2} form.
 *
 * <p>
 * Parsing only splits; the parameter count and shape for a tag are checked against its
 * {@link villagecompute.tradebot.conversation.SelectionSignature} before use.
 */
public record Selection(String tag, List<String> params) {

    private static final Pattern TAG = Pattern.compile("[a-z][a-z0-9_]*");
    private static final int MAX_LENGTH = 64;

    public Selection {
        params = List.copyOf(params);
    }

    public static Selection of(String tag, String... params) {
        return new Selection(tag, Arrays.asList(params));
    }

    /**
     * Parses raw selection data.
     *
     * @throws ValidationException
     *             if the data is empty, too long, has an invalid tag or an empty parameter
     */
    public static Selection parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException("Empty selection");
        }
        if (raw.length() > MAX_LENGTH) {
            throw new ValidationException("Selection too long");
        }
        String[] parts = raw.trim().split(":", -1);
        if (!TAG.matcher(parts[0]).matches()) {
            throw new ValidationException("Invalid selection tag: " + parts[0]);
        }
        List<String> params = Arrays.asList(parts).subList(1, parts.length);
        if (params.stream().anyMatch(String::isBlank)) {
            throw new ValidationException("Empty selection parameter in: " + raw);
        }
        return new Selection(parts[0], params);
    }

    public static Optional<Selection> tryParse(String raw) {
        try {
            return Optional.of(parse(raw));
        } catch (ValidationException e) {
            return Optional.empty();
        }
    }

    public boolean is(String candidateTag) {
        return tag.equals(candidateTag);
    }

    public int arity() {
        return params.size();
    }

    public String param(int index) {
        return params.get(index);
    }

    /**
     * Parameter as a positive number (ids and page numbers).
     *
     * @throws ValidationException
     *             if missing or not a positive integer
     */
    public long number(int index) {
        if (index >= params.size()) {
            throw new ValidationException("Missing parameter " + index + " for " + tag);
        }
        try {
            long value = Long.parseLong(params.get(index));
            if (value < 1) {
                throw new ValidationException("Parameter must be positive: " + params.get(index));
            }
            return value;
        } catch (NumberFormatException e) {
            throw new ValidationException("Parameter is not a number: " + params.get(index), e);
        }
    }

    @Override
    public String toString() {
        return params.isEmpty() ? tag : tag + ":" + String.join(":", params);
    }
}
