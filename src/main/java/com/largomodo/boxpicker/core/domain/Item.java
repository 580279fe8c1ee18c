package com.largomodo.boxpicker.core.domain;

/**
 * Immutable item to be packed, built from one validated request line.
 *
 * @param sku        identifier, unique within one request
 * @param dimensions outer dimensions of the item
 * @param ordinal    zero-based position in the request, used for stable ordering
 */
public record Item(String sku, Dimensions dimensions, int ordinal) {

    public Item {
        if (sku == null || sku.isEmpty()) {
            throw new IllegalArgumentException("sku must not be null or empty");
        }
        if (dimensions == null) {
            throw new IllegalArgumentException("dimensions must not be null");
        }
    }

    public Item(String sku, int length, int width, int height, int ordinal) {
        this(sku, new Dimensions(length, width, height), ordinal);
    }

    public long volume() {
        return dimensions.volume();
    }
}
