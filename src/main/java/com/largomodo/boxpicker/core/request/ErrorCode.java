package com.largomodo.boxpicker.core.request;

import com.largomodo.boxpicker.core.domain.PackingResult;

/**
 * Error codes written to the {@code error} field of a rejected response.
 */
public enum ErrorCode {
    INVALID_JSON("invalid_json"),
    VALIDATION_ERROR("validation_error"),
    ITEM_TOO_LARGE("item_too_large"),
    PACKING_ERROR("packing_error");

    private final String code;

    ErrorCode(String code) {
        this.code = code;
    }

    /**
     * Maps a failed packing outcome to its wire code.
     *
     * @throws IllegalArgumentException if the result was packed successfully
     */
    public static ErrorCode forOutcome(PackingResult.Outcome outcome) {
        return switch (outcome) {
            case ITEM_TOO_LARGE -> ITEM_TOO_LARGE;
            case PACKING_ERROR -> PACKING_ERROR;
            case PACKED -> throw new IllegalArgumentException("PACKED is not an error outcome");
        };
    }

    public String getCode() {
        return code;
    }
}
