package com.largomodo.boxpicker.core.request;

import java.util.List;

/**
 * One validation failure.
 *
 * @param loc path to the offending value, e.g. {@code ["items", 2, "dimensions", "width"]}
 * @param msg human-readable reason
 */
public record Violation(List<Object> loc, String msg) {

    public Violation {
        loc = List.copyOf(loc);
    }
}
