package com.largomodo.boxpicker.core;

import com.largomodo.boxpicker.core.domain.BoxPacker;
import com.largomodo.boxpicker.core.domain.Item;
import com.largomodo.boxpicker.core.domain.PackingResult;
import com.largomodo.boxpicker.core.request.ErrorCode;
import com.largomodo.boxpicker.core.request.InvalidRequestException;
import com.largomodo.boxpicker.core.request.PackRequest;
import com.largomodo.boxpicker.core.request.PackRequestValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Pack request pipeline orchestrator.
 * <p>
 * Coordinates one request end to end:
 * 1. Decode the body (codec)
 * 2. Validate and build items (validator)
 * 3. Pack (packer)
 * 4. Encode the boxes or the error document (codec)
 * <p>
 * Every outcome, including rejected input and infeasible packing, produces a response
 * document. Only I/O failures propagate as exceptions.
 * <p>
 * Holds no per-request state: one instance serves all workers in batch mode.
 */
public class RequestProcessor {

    private static final Logger log = LoggerFactory.getLogger(RequestProcessor.class);

    private final RequestCodec codec;
    private final PackRequestValidator validator;
    private final BoxPacker packer;

    public RequestProcessor(RequestCodec codec, PackRequestValidator validator, BoxPacker packer) {
        if (codec == null || validator == null || packer == null) {
            throw new IllegalArgumentException("All dependencies must not be null");
        }
        this.codec = codec;
        this.validator = validator;
        this.packer = packer;
    }

    /**
     * Process one request body and write the response.
     *
     * @param in  request body (not closed)
     * @param out response sink (flushed, not closed)
     * @return summary of what was written
     * @throws IOException if reading the request or writing the response fails
     */
    public RequestReport process(InputStream in, Writer out) throws IOException {
        RequestReport report;
        try {
            PackRequest request = codec.readRequest(in);
            List<Item> items = validator.validate(request);
            log.debug("Packing {} item(s)", items.size());

            PackingResult result = packer.pack(items);
            codec.writeResult(out, result);

            if (result.isPacked()) {
                log.info("Packed {} item(s) into {} box(es)", items.size(), result.boxCount());
                report = RequestReport.packed(result.boxCount());
            } else {
                ErrorCode code = ErrorCode.forOutcome(result.outcome());
                log.warn("Packing failed: {}", code.getCode());
                report = RequestReport.rejected(code);
            }
        } catch (InvalidRequestException e) {
            log.warn("Rejected request ({}): {}", e.getErrorCode().getCode(), e.getMessage());
            codec.writeRejection(out, e);
            report = RequestReport.rejected(e.getErrorCode());
        }
        out.flush();
        return report;
    }

    /**
     * Process a request file into a response file.
     * <p>
     * The response is written to a temporary sibling and moved into place, so a failed write
     * never leaves a truncated response behind.
     *
     * @param requestFile  JSON request
     * @param responseFile destination; parent directories are created
     * @return summary of what was written
     * @throws IOException if the request cannot be read or the response cannot be written
     */
    public RequestReport processFile(Path requestFile, Path responseFile) throws IOException {
        Path parent = responseFile.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path partial = parent.resolve(responseFile.getFileName() + ".part");

        log.info("Processing: {}", requestFile.getFileName());
        RequestReport report;
        try (InputStream in = Files.newInputStream(requestFile);
             Writer out = Files.newBufferedWriter(partial, StandardCharsets.UTF_8)) {
            report = process(in, out);
        } catch (IOException | RuntimeException e) {
            Files.deleteIfExists(partial);
            throw e;
        }
        Files.move(partial, responseFile, StandardCopyOption.REPLACE_EXISTING);
        return report;
    }
}
