package com.largomodo.boxpicker.core.request;

import java.util.List;

/**
 * Raw pack request as decoded from JSON, before validation.
 * <p>
 * Every field is nullable: missing or malformed values are reported by
 * {@link PackRequestValidator}, not by the decoder.
 *
 * @param items requested items, in caller order
 */
public record PackRequest(List<ItemRequest> items) {

    /**
     * @param sku        caller-supplied identifier
     * @param dimensions outer dimensions
     */
    public record ItemRequest(String sku, DimensionsRequest dimensions) {
    }

    public record DimensionsRequest(Integer length, Integer width, Integer height) {
    }
}
