package com.largomodo.boxpicker.core.domain;

import java.util.List;

/**
 * One box of a packing result together with the skus placed in it.
 * <p>
 * Produced by {@link BoxPacker}; skus are listed in request order.
 *
 * @param box  the catalog box chosen for this group
 * @param skus skus of the items in the box (unmodifiable, never empty)
 */
public record BoxAssignment(BoxDefinition box, List<String> skus) {

    public BoxAssignment {
        if (box == null) {
            throw new IllegalArgumentException("box must not be null");
        }
        skus = List.copyOf(skus);
        if (skus.isEmpty()) {
            throw new IllegalArgumentException("Box assignment for " + box.id() + " must contain at least one item");
        }
    }
}
