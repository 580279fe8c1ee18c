package com.largomodo.boxpicker.core.domain;

import java.util.List;

/**
 * Strategy interface for assigning items to catalog boxes.
 * <p>
 * Implementations are stateless between calls: each invocation works on its own item
 * list, so one instance may serve concurrent requests.
 */
public interface BoxPacker {
    /**
     * Assigns every item to exactly one box.
     *
     * @param items validated items in request order, must not be null
     * @return packed assignments, or a structured failure
     * @throws IllegalArgumentException if items is null
     */
    PackingResult pack(List<Item> items);
}
