package com.largomodo.boxpicker.core.domain;

import java.util.List;

/**
 * Placement rule deciding whether a group of items may share one box.
 * <p>
 * Both the single-box search and the multi-box greedy loop ask the same question
 * through this interface, so switching rules changes grouping without touching the
 * search order.
 */
public interface FitStrategy {
    /**
     * @param items candidate contents of the box (may be empty)
     * @param box   box under consideration
     * @return true if the rule accepts all items together in {@code box}
     */
    boolean fits(List<Item> items, BoxDefinition box);
}
