/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.tradebot.conversation;

import villagecompute.tradebot.api.types.Selection;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Declared shape of a selection tag: how many parameters it carries and what each looks like.
 */
public record SelectionSignature(String tag, List<ParamType> params) {

    public enum ParamType {
        /** Positive integer: an entity id or a page number. */
        NUMBER(Pattern.compile("[1-9][0-9]{0,17}")),
        /** Lower-case word such as a field or category name. */
        WORD(Pattern.compile("[a-z][a-z0-9_]{0,31}"));

        private final Pattern pattern;

        ParamType(Pattern pattern) {
            this.pattern = pattern;
        }

        boolean accepts(String value) {
            return pattern.matcher(value).matches();
        }
    }

    public SelectionSignature {
        params = List.copyOf(params);
    }

    public static SelectionSignature of(String tag, ParamType... params) {
        return new SelectionSignature(tag, Arrays.asList(params));
    }

    public boolean matches(Selection selection) {
        if (!selection.is(tag) || selection.arity() != params.size()) {
            return false;
        }
        for (int i = 0; i < params.size(); i++) {
            if (!params.get(i).accepts(selection.param(i))) {
                return false;
            }
        }
        return true;
    }
}
