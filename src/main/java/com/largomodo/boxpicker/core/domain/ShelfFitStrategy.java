package com.largomodo.boxpicker.core.domain;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Opt-in placement rule that simulates a simple shelf layout inside the box.
 * <p>
 * On top of the per-item test, items are laid out with a cursor that fills a row along
 * the box length, then opens a new row along the width, then a new layer along the height.
 * Each item takes the first orientation (largest base first) that fits at the cursor.
 * The layout is never backtracked, so a rejection does not prove the items cannot share
 * the box; it only means this heuristic did not find an arrangement.
 * <p>
 * Orientation order is fixed (permutation order, then stable sort by base area and height)
 * so identical input always yields an identical layout.
 */
public class ShelfFitStrategy implements FitStrategy {

    private static final Comparator<Item> PLACEMENT_ORDER = Comparator
            .comparingLong(Item::volume)
            .thenComparingInt(item -> item.dimensions().longestSide())
            .reversed();

    private static final Comparator<Dimensions> ORIENTATION_ORDER = Comparator
            .comparingLong((Dimensions d) -> (long) d.length() * d.width())
            .thenComparingInt(Dimensions::height)
            .reversed();

    private final PerItemFitStrategy perItem = new PerItemFitStrategy();

    @Override
    public boolean fits(List<Item> items, BoxDefinition box) {
        if (!perItem.fits(items, box)) {
            return false;
        }

        List<Item> ordered = new ArrayList<>(items);
        ordered.sort(PLACEMENT_ORDER);

        Cursor cursor = new Cursor(box.inner());
        for (Item item : ordered) {
            List<Dimensions> orientations = orientations(item.dimensions());

            if (cursor.tryPlace(orientations)) {
                continue;
            }
            cursor.newRow();
            if (cursor.tryPlace(orientations)) {
                continue;
            }
            cursor.newLayer();
            if (!cursor.tryPlace(orientations)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Distinct axis-aligned orientations, largest base area first, taller first on ties.
     */
    static List<Dimensions> orientations(Dimensions d) {
        int a = d.length();
        int b = d.width();
        int c = d.height();
        Set<Dimensions> unique = new LinkedHashSet<>(List.of(
                new Dimensions(a, b, c), new Dimensions(a, c, b),
                new Dimensions(b, a, c), new Dimensions(b, c, a),
                new Dimensions(c, a, b), new Dimensions(c, b, a)
        ));
        List<Dimensions> result = new ArrayList<>(unique);
        result.sort(ORIENTATION_ORDER);
        return result;
    }

    /**
     * Row/layer cursor over the box interior. Local to one {@link #fits} call.
     */
    private static final class Cursor {
        private final Dimensions box;
        private int x;
        private int y;
        private int z;
        private int rowDepth;
        private int layerHeight;

        Cursor(Dimensions box) {
            this.box = box;
        }

        boolean tryPlace(List<Dimensions> orientations) {
            for (Dimensions o : orientations) {
                if (x + o.length() <= box.length()
                        && y + o.width() <= box.width()
                        && z + o.height() <= box.height()) {
                    x += o.length();
                    rowDepth = Math.max(rowDepth, o.width());
                    layerHeight = Math.max(layerHeight, o.height());
                    return true;
                }
            }
            return false;
        }

        void newRow() {
            x = 0;
            y += rowDepth;
            rowDepth = 0;
        }

        void newLayer() {
            x = 0;
            y = 0;
            z += layerHeight;
            rowDepth = 0;
            layerHeight = 0;
        }
    }
}
