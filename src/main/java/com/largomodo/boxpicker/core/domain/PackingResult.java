package com.largomodo.boxpicker.core.domain;

import java.util.List;

/**
 * Outcome of one packing request.
 * <p>
 * Geometric infeasibility is reported as data rather than thrown, so callers can always
 * render a well-formed response. Exactly one payload is populated per outcome:
 * <ul>
 *   <li>{@link Outcome#PACKED}: {@code assignments}, in the order boxes were opened</li>
 *   <li>{@link Outcome#ITEM_TOO_LARGE}: {@code oversizedItems}, every offender listed</li>
 *   <li>{@link Outcome#PACKING_ERROR}: {@code failureMessage}</li>
 * </ul>
 *
 * @param outcome        which of the three cases applies
 * @param assignments    box assignments (empty unless PACKED)
 * @param oversizedItems oversized diagnostics (empty unless ITEM_TOO_LARGE)
 * @param failureMessage reason for PACKING_ERROR, null otherwise
 */
public record PackingResult(Outcome outcome,
                            List<BoxAssignment> assignments,
                            List<OversizedItem> oversizedItems,
                            String failureMessage) {

    public enum Outcome {
        PACKED,
        ITEM_TOO_LARGE,
        PACKING_ERROR
    }

    public PackingResult {
        assignments = List.copyOf(assignments);
        oversizedItems = List.copyOf(oversizedItems);
    }

    public static PackingResult packed(List<BoxAssignment> assignments) {
        return new PackingResult(Outcome.PACKED, assignments, List.of(), null);
    }

    public static PackingResult itemTooLarge(List<OversizedItem> oversizedItems) {
        return new PackingResult(Outcome.ITEM_TOO_LARGE, List.of(), oversizedItems, null);
    }

    public static PackingResult packingError(String message) {
        return new PackingResult(Outcome.PACKING_ERROR, List.of(), List.of(), message);
    }

    public boolean isPacked() {
        return outcome == Outcome.PACKED;
    }

    public int boxCount() {
        return assignments.size();
    }
}
