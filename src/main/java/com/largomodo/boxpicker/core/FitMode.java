package com.largomodo.boxpicker.core;

import com.largomodo.boxpicker.core.domain.FitStrategy;
import com.largomodo.boxpicker.core.domain.PerItemFitStrategy;
import com.largomodo.boxpicker.core.domain.ShelfFitStrategy;

/**
 * Placement rules selectable from the command line.
 */
public enum FitMode {
    PER_ITEM,   // each item checked alone against the box (default)
    SHELF;      // per-item check plus a row/layer layout simulation

    public static FitMode fromCliArgument(String arg) {
        if (arg == null) {
            throw new IllegalArgumentException("Fit mode argument cannot be null. Supported: PER_ITEM, SHELF");
        }
        try {
            return valueOf(arg.toUpperCase().replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid fit mode: " + arg + ". Supported: PER_ITEM, SHELF");
        }
    }

    public FitStrategy createStrategy() {
        return switch (this) {
            case PER_ITEM -> new PerItemFitStrategy();
            case SHELF -> new ShelfFitStrategy();
        };
    }
}
