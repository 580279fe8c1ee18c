package com.largomodo.boxpicker.util;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Pack request file detection for batch mode.
 * <p>
 * A request is any regular {@code .json} file that is not itself a response written by a
 * previous run ({@code .packed.json}), so re-running a batch over its own output directory
 * never feeds responses back in as requests.
 * <p>
 * Stateless utility performing filesystem checks. Safe for concurrent use.
 */
public class RequestFileMatcher {

    public static final String RESPONSE_SUFFIX = ".packed.json";

    private static final String REQUEST_SUFFIX = ".json";

    private RequestFileMatcher() {
        // Static utility class - prevent instantiation
    }

    /**
     * @param path file path to check (can be null)
     * @return true if path is a regular file holding a pack request
     */
    public static boolean isRequest(Path path) {
        if (path == null) {
            return false;  // Safe filter predicate semantics (prevents NPE in stream filters)
        }
        if (!Files.isRegularFile(path)) {
            return false;
        }
        String filename = path.getFileName().toString().toLowerCase();
        return filename.endsWith(REQUEST_SUFFIX) && !filename.endsWith(RESPONSE_SUFFIX);
    }

    /**
     * Response file name for a request: {@code order-17.json} becomes {@code order-17.packed.json}.
     */
    public static String responseNameFor(Path request) {
        String filename = request.getFileName().toString();
        int dotIndex = filename.lastIndexOf('.');
        String baseName = dotIndex > 0 ? filename.substring(0, dotIndex) : filename;
        return baseName + RESPONSE_SUFFIX;
    }
}
