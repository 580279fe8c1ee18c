package com.largomodo.boxpicker.core.request;

import com.largomodo.boxpicker.core.domain.Dimensions;
import com.largomodo.boxpicker.core.domain.Item;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Converts a decoded {@link PackRequest} into packer input, rejecting anything the core
 * assumes away: empty item lists, empty skus, missing or non-positive dimensions and
 * duplicate skus.
 * <p>
 * All violations are collected before failing so a caller can fix a request in one pass.
 * Stateless; safe for concurrent use.
 */
public class PackRequestValidator {

    static final String DUPLICATE_SKUS = "Duplicate sku values are not allowed.";

    /**
     * @param request decoded request, may be null
     * @return items in request order, ordinals assigned from position
     * @throws InvalidRequestException if any violation is found
     */
    public List<Item> validate(PackRequest request) {
        List<Violation> violations = new ArrayList<>();

        if (request == null || request.items() == null) {
            violations.add(new Violation(List.of("items"), "Field required"));
            throw new InvalidRequestException(violations);
        }

        List<PackRequest.ItemRequest> lines = request.items();
        if (lines.isEmpty()) {
            violations.add(new Violation(List.of("items"), "List should have at least 1 item"));
            throw new InvalidRequestException(violations);
        }

        List<Item> items = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            Item item = validateLine(lines.get(i), i, violations);
            if (item != null) {
                items.add(item);
            }
        }

        Set<String> seen = new HashSet<>();
        for (PackRequest.ItemRequest line : lines) {
            if (line != null && line.sku() != null && !seen.add(line.sku())) {
                violations.add(new Violation(List.of("items"), DUPLICATE_SKUS));
                break;
            }
        }

        if (!violations.isEmpty()) {
            throw new InvalidRequestException(violations);
        }
        return items;
    }

    private Item validateLine(PackRequest.ItemRequest line, int index, List<Violation> violations) {
        if (line == null) {
            violations.add(new Violation(List.of("items", index), "Item must not be null"));
            return null;
        }

        int before = violations.size();

        if (line.sku() == null) {
            violations.add(new Violation(List.of("items", index, "sku"), "Field required"));
        } else if (line.sku().isEmpty()) {
            violations.add(new Violation(List.of("items", index, "sku"), "String should have at least 1 character"));
        }

        PackRequest.DimensionsRequest dims = line.dimensions();
        if (dims == null) {
            violations.add(new Violation(List.of("items", index, "dimensions"), "Field required"));
        } else {
            checkAxis(dims.length(), "length", index, violations);
            checkAxis(dims.width(), "width", index, violations);
            checkAxis(dims.height(), "height", index, violations);
        }

        if (violations.size() > before) {
            return null;
        }
        return new Item(line.sku(), new Dimensions(dims.length(), dims.width(), dims.height()), index);
    }

    private void checkAxis(Integer value, String axis, int index, List<Violation> violations) {
        List<Object> loc = List.of("items", index, "dimensions", axis);
        if (value == null) {
            violations.add(new Violation(loc, "Field required"));
        } else if (value <= 0) {
            violations.add(new Violation(loc, "Input should be greater than 0"));
        }
    }
}
