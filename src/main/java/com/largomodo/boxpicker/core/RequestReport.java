package com.largomodo.boxpicker.core;

import com.largomodo.boxpicker.core.request.ErrorCode;

/**
 * Summary of one processed request, returned alongside the written response.
 *
 * @param errorCode null when the request was packed
 * @param boxCount  number of boxes used (0 when rejected)
 */
public record RequestReport(ErrorCode errorCode, int boxCount) {

    public static RequestReport packed(int boxCount) {
        return new RequestReport(null, boxCount);
    }

    public static RequestReport rejected(ErrorCode errorCode) {
        return new RequestReport(errorCode, 0);
    }

    public boolean isPacked() {
        return errorCode == null;
    }
}
