package com.largomodo.boxpicker.core.domain;

/**
 * Diagnostic for an item that does not fit even the largest catalog box.
 *
 * @param sku             offending item
 * @param dimensions      the item's dimensions as requested
 * @param maxBoxDimensions inner dimensions of the largest catalog box
 */
public record OversizedItem(String sku, Dimensions dimensions, Dimensions maxBoxDimensions) {
}
