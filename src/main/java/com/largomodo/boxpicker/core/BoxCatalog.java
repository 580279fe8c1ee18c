package com.largomodo.boxpicker.core;

import com.largomodo.boxpicker.core.domain.BoxDefinition;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Fixed, volume-ordered set of box sizes available for packing.
 * <p>
 * The catalog is configuration, not state: it is built once, never mutated, and passed
 * to the packer as a constructor argument, so any number of concurrent requests can share
 * one instance without locking. Every search relies on the ascending order exposed by
 * {@link #listAscendingByVolume()} to prefer smaller boxes.
 * <p>
 * Standard sizes (inner dimensions):
 * <pre>
 *   BX-S     8 x  6 x  4   =  192
 *   BX-M    12 x 10 x  6   =  720
 *   BX-L    16 x 12 x  8   = 1536
 *   BX-XL   20 x 16 x 12   = 3840
 *   BX-XXL  24 x 20 x 20   = 9600
 * </pre>
 */
public final class BoxCatalog {

    // Ties on volume fall back to the individual axes so the order never depends on input order
    private static final Comparator<BoxDefinition> VOLUME_ORDER = Comparator
            .comparingLong(BoxDefinition::volume)
            .thenComparingInt(b -> b.inner().length())
            .thenComparingInt(b -> b.inner().width())
            .thenComparingInt(b -> b.inner().height());

    private static final BoxCatalog STANDARD = new BoxCatalog(List.of(
            new BoxDefinition("BX-S", 8, 6, 4),
            new BoxDefinition("BX-M", 12, 10, 6),
            new BoxDefinition("BX-L", 16, 12, 8),
            new BoxDefinition("BX-XL", 20, 16, 12),
            new BoxDefinition("BX-XXL", 24, 20, 20)
    ));

    private final List<BoxDefinition> boxes;

    /**
     * Builds a catalog from arbitrary definitions, sorted by ascending volume.
     *
     * @param definitions box sizes, at least one, identifiers unique
     * @throws IllegalArgumentException if definitions is empty or contains duplicate ids
     */
    public BoxCatalog(List<BoxDefinition> definitions) {
        if (definitions == null || definitions.isEmpty()) {
            throw new IllegalArgumentException("Box catalog must contain at least one box");
        }
        Set<String> ids = new HashSet<>();
        for (BoxDefinition definition : definitions) {
            if (!ids.add(definition.id())) {
                throw new IllegalArgumentException("Duplicate box id in catalog: " + definition.id());
            }
        }
        List<BoxDefinition> sorted = new ArrayList<>(definitions);
        sorted.sort(VOLUME_ORDER);
        this.boxes = List.copyOf(sorted);
    }

    /**
     * The five standard box sizes. Shared instance.
     */
    public static BoxCatalog standard() {
        return STANDARD;
    }

    /**
     * @return all boxes, smallest volume first (unmodifiable)
     */
    public List<BoxDefinition> listAscendingByVolume() {
        return boxes;
    }

    /**
     * @return the maximum-volume box, used as the oversize threshold
     */
    public BoxDefinition largest() {
        return boxes.get(boxes.size() - 1);
    }

    public Optional<BoxDefinition> find(String id) {
        return boxes.stream()
                .filter(box -> box.id().equals(id))
                .findFirst();
    }

    /**
     * Position of a box in ascending-volume order, or -1 if not part of this catalog.
     */
    public int rankOf(BoxDefinition box) {
        return boxes.indexOf(box);
    }
}
