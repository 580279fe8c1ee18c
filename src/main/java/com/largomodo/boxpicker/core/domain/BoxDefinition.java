package com.largomodo.boxpicker.core.domain;

/**
 * Standard box size offered by the catalog.
 *
 * @param id    catalog-unique identifier, e.g. {@code BX-M}
 * @param inner inner dimensions available to items
 */
public record BoxDefinition(String id, Dimensions inner) {

    public BoxDefinition {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (inner == null) {
            throw new IllegalArgumentException("inner dimensions must not be null");
        }
    }

    public BoxDefinition(String id, int length, int width, int height) {
        this(id, new Dimensions(length, width, height));
    }

    public long volume() {
        return inner.volume();
    }

    /**
     * Rotation-aware test of a single item against this box's interior.
     */
    public boolean accepts(Item item) {
        return item.dimensions().fitsWithin(inner);
    }
}
