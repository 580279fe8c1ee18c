package com.largomodo.boxpicker.core;

import com.largomodo.boxpicker.core.domain.PackingResult;
import com.largomodo.boxpicker.core.request.InvalidRequestException;
import com.largomodo.boxpicker.core.request.PackRequest;

import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;

/**
 * Wire format abstraction for pack requests and responses.
 * <p>
 * Core package depends on this interface, the service package provides the JSON
 * implementation. Keeps {@link RequestProcessor} independent of the serialization library.
 */
public interface RequestCodec {

    /**
     * Decode a request body.
     *
     * @param in request body, not closed by this method
     * @return decoded, not yet validated, request
     * @throws InvalidRequestException if the body is not well-formed or has the wrong shape
     * @throws IOException             if reading the stream fails
     */
    PackRequest readRequest(InputStream in) throws IOException;

    /**
     * Encode a packing result: the box list when packed, an error document otherwise.
     */
    void writeResult(Writer out, PackingResult result) throws IOException;

    /**
     * Encode a rejected request as an error document.
     */
    void writeRejection(Writer out, InvalidRequestException rejection) throws IOException;
}
