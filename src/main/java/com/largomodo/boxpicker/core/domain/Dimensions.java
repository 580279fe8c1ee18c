package com.largomodo.boxpicker.core.domain;

import java.util.Arrays;

/**
 * Unit-less length/width/height triple shared by items and box interiors.
 * <p>
 * Rotation-aware comparisons go through {@link #sorted()}: two triples describe the
 * same shape under axis-aligned rotation iff their ascending forms are equal, and one
 * shape fits inside another iff its ascending form is component-wise smaller or equal.
 * <p>
 * The record does not reject non-positive values. Request validation happens before
 * items are built, and {@link #fitsWithin(Dimensions)} applies the same sorted comparison
 * regardless of sign.
 *
 * @param length first axis
 * @param width  second axis
 * @param height third axis
 */
public record Dimensions(int length, int width, int height) {

    /**
     * Product of the three axes. Widened to long so 24x20x20-scale boxes and
     * large rejected items never overflow.
     */
    public long volume() {
        return (long) length * width * height;
    }

    /**
     * Ascending copy of the triple, e.g. (8, 6, 4) becomes [4, 6, 8].
     */
    public int[] sorted() {
        int[] axes = {length, width, height};
        Arrays.sort(axes);
        return axes;
    }

    /**
     * Longest of the three axes.
     */
    public int longestSide() {
        return Math.max(length, Math.max(width, height));
    }

    /**
     * Rotation-aware containment test.
     * <p>
     * Sorting both triples replaces enumerating the six orientations: the smallest item
     * axis must fit the smallest box axis, and so on. Bounds are inclusive, so a shape
     * always fits a box of identical (or permuted) dimensions.
     *
     * @param box inner dimensions of the container
     * @return true if some orientation of this shape fits inside {@code box}
     */
    public boolean fitsWithin(Dimensions box) {
        int[] mine = sorted();
        int[] theirs = box.sorted();
        for (int i = 0; i < 3; i++) {
            if (mine[i] > theirs[i]) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return length + "x" + width + "x" + height;
    }
}
