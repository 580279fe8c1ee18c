package com.largomodo.boxpicker.core;

import com.largomodo.boxpicker.core.request.ErrorCode;

import java.nio.file.Path;

/**
 * Observer interface for request processing lifecycle events.
 * <p>
 * All methods have default no-op implementations, allowing consumers to override only
 * the events they care about. Batch mode calls these from worker threads, so
 * implementations must be thread-safe.
 *
 * @see RequestProcessor
 */
public interface PackingObserver {

    /**
     * Called when a request file is picked up.
     *
     * @param request the request file being processed
     */
    default void onStart(Path request) {}

    /**
     * Called when every item of the request was assigned to a box.
     *
     * @param request  the request file
     * @param boxCount number of boxes in the response
     */
    default void onPacked(Path request, int boxCount) {}

    /**
     * Called when the request was answered with an error document.
     *
     * @param request the request file
     * @param code    error code written to the response
     */
    default void onRejected(Path request, ErrorCode code) {}

    /**
     * Called when no response could be written (I/O failure or unexpected error).
     *
     * @param request the request file
     * @param e       the exception that caused the failure
     */
    default void onFailure(Path request, Exception e) {}
}
