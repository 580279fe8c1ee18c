package com.largomodo.boxpicker.core.domain;

import com.largomodo.boxpicker.core.BoxCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Box packer using single-box search with a first-fit decreasing fallback.
 * <p>
 * Pipeline for one request:
 * 1. Oversize check: every item against the largest catalog box (all offenders reported)
 * 2. Single-box search: first catalog box, smallest first, that the fit strategy accepts for all items
 * 3. Multi-box greedy: items by descending volume into the smallest open box that still accepts
 *    them, opening the smallest fitting catalog box otherwise
 * <p>
 * Objective priority is fewest boxes, then least total volume, then smaller boxes. The greedy
 * approximates it rather than proving it: O(n * b) fit checks for n items over b open boxes,
 * versus exponential search for an exact answer.
 * <p>
 * Holds no per-request state; safe to share between threads.
 */
public class GreedyBoxPacker implements BoxPacker {

    private static final Logger log = LoggerFactory.getLogger(GreedyBoxPacker.class);

    // List.sort is stable: equal volumes keep request order
    private static final Comparator<Item> DESCENDING_VOLUME =
            Comparator.comparingLong(Item::volume).reversed();

    private static final Comparator<Item> REQUEST_ORDER = Comparator.comparingInt(Item::ordinal);

    private final BoxCatalog catalog;
    private final FitStrategy fitStrategy;

    public GreedyBoxPacker(BoxCatalog catalog, FitStrategy fitStrategy) {
        if (catalog == null) {
            throw new IllegalArgumentException("catalog must not be null");
        }
        if (fitStrategy == null) {
            throw new IllegalArgumentException("fitStrategy must not be null");
        }
        this.catalog = catalog;
        this.fitStrategy = fitStrategy;
    }

    @Override
    public PackingResult pack(List<Item> items) {
        if (items == null) {
            throw new IllegalArgumentException("Items list cannot be null");
        }

        // Requests are validated non-empty upstream; an empty list simply needs no boxes
        if (items.isEmpty()) {
            return PackingResult.packed(List.of());
        }

        // Fail-fast: nothing is packed while any item exceeds the largest box
        List<OversizedItem> oversized = findOversizedItems(items);
        if (!oversized.isEmpty()) {
            log.debug("Rejecting request: {} item(s) exceed {}", oversized.size(), catalog.largest().id());
            return PackingResult.itemTooLarge(oversized);
        }

        Optional<BoxDefinition> single = findSmallestSingleBox(items);
        if (single.isPresent()) {
            log.debug("All {} item(s) fit in {}", items.size(), single.get().id());
            return PackingResult.packed(List.of(toAssignment(single.get(), items)));
        }

        return packIntoBoxes(items);
    }

    /**
     * Collects every item that does not fit the largest box even alone.
     * Uses the plain rotation-aware test regardless of the configured strategy.
     */
    List<OversizedItem> findOversizedItems(List<Item> items) {
        BoxDefinition largest = catalog.largest();
        List<OversizedItem> oversized = new ArrayList<>();
        for (Item item : items) {
            if (!largest.accepts(item)) {
                oversized.add(new OversizedItem(item.sku(), item.dimensions(), largest.inner()));
            }
        }
        return oversized;
    }

    /**
     * First box in ascending-volume order that accepts all items at once.
     * Because the catalog is volume-ordered, the first hit is also the smallest.
     */
    Optional<BoxDefinition> findSmallestSingleBox(List<Item> items) {
        for (BoxDefinition box : catalog.listAscendingByVolume()) {
            if (fitStrategy.fits(items, box)) {
                return Optional.of(box);
            }
        }
        return Optional.empty();
    }

    /**
     * First-fit decreasing across multiple boxes.
     * <p>
     * Open boxes are tried smallest catalog size first; boxes of the same size in the order
     * they were opened. Assignments are emitted in opening order.
     */
    PackingResult packIntoBoxes(List<Item> items) {
        List<Item> sorted = new ArrayList<>(items);
        sorted.sort(DESCENDING_VOLUME);

        List<OpenBox> openBoxes = new ArrayList<>();

        for (Item item : sorted) {
            OpenBox target = findOpenBox(openBoxes, item);
            if (target == null) {
                Optional<BoxDefinition> fresh = smallestBoxFor(item);
                if (fresh.isEmpty()) {
                    // Unreachable after the oversize check; kept so the result is always well-formed
                    return PackingResult.packingError(
                            "Item '" + item.sku() + "' does not fit in any available box.");
                }
                target = new OpenBox(fresh.get(), catalog.rankOf(fresh.get()), openBoxes.size());
                openBoxes.add(target);
                log.debug("Opened {} #{} for {}", target.box.id(), target.openedAt + 1, item.sku());
            }
            target.contents.add(item);
        }

        List<BoxAssignment> assignments = new ArrayList<>(openBoxes.size());
        for (OpenBox open : openBoxes) {
            assignments.add(toAssignment(open.box, open.contents));
        }
        return PackingResult.packed(assignments);
    }

    private OpenBox findOpenBox(List<OpenBox> openBoxes, Item item) {
        List<OpenBox> candidates = new ArrayList<>(openBoxes);
        candidates.sort(Comparator.comparingInt((OpenBox o) -> o.rank).thenComparingInt(o -> o.openedAt));

        for (OpenBox candidate : candidates) {
            List<Item> trial = new ArrayList<>(candidate.contents);
            trial.add(item);
            if (fitStrategy.fits(trial, candidate.box)) {
                return candidate;
            }
        }
        return null;
    }

    private Optional<BoxDefinition> smallestBoxFor(Item item) {
        return findSmallestSingleBox(List.of(item));
    }

    private static BoxAssignment toAssignment(BoxDefinition box, List<Item> contents) {
        List<String> skus = contents.stream()
                .sorted(REQUEST_ORDER)
                .map(Item::sku)
                .toList();
        return new BoxAssignment(box, skus);
    }

    /**
     * Mutable accumulator for one box during the greedy pass. Never escapes {@link #packIntoBoxes}.
     */
    private static final class OpenBox {
        private final BoxDefinition box;
        private final int rank;
        private final int openedAt;
        private final List<Item> contents = new ArrayList<>();

        OpenBox(BoxDefinition box, int rank, int openedAt) {
            this.box = box;
            this.rank = rank;
            this.openedAt = openedAt;
        }
    }
}
