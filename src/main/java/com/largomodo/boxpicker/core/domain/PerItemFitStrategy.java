package com.largomodo.boxpicker.core.domain;

import java.util.List;

/**
 * Default placement rule: a group fits when every item fits the box on its own.
 * <p>
 * No joint arrangement or volume accumulation is checked. Three 20x15x10 items therefore
 * share one 20x16x12 box even though they could not physically be arranged inside it.
 * This is the accepted approximation, not an oversight.
 */
public class PerItemFitStrategy implements FitStrategy {

    @Override
    public boolean fits(List<Item> items, BoxDefinition box) {
        for (Item item : items) {
            if (!box.accepts(item)) {
                return false;
            }
        }
        return true;
    }
}
