package com.largomodo.boxpicker.service;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.exc.InputCoercionException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.type.LogicalType;
import com.largomodo.boxpicker.core.RequestCodec;
import com.largomodo.boxpicker.core.domain.PackingResult;
import com.largomodo.boxpicker.core.request.ErrorCode;
import com.largomodo.boxpicker.core.request.InvalidRequestException;
import com.largomodo.boxpicker.core.request.PackRequest;
import com.largomodo.boxpicker.core.request.Violation;

import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Jackson implementation of the pack request/response wire format.
 * <p>
 * Decoding is strict: unknown properties, trailing content, fractional numbers and numeric
 * strings are all rejected. Malformed JSON becomes {@code invalid_json}; well-formed JSON of
 * the wrong shape becomes {@code validation_error} with the offending path as {@code loc}.
 * An empty body decodes as an empty request, which validation then reports as missing items.
 * Integers outside the {@code int} range are reported against the bound they cross.
 * <p>
 * The mapper is configured once and shared; Jackson mappers are thread-safe after setup.
 */
public class JsonRequestCodec implements RequestCodec {

    private final JsonMapper mapper;
    private final ObjectWriter writer;

    public JsonRequestCodec() {
        this(false);
    }

    /**
     * @param pretty indent output for human readers
     */
    public JsonRequestCodec(boolean pretty) {
        this.mapper = JsonMapper.builder()
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
                .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                .build();
        // "6" is not a dimension
        mapper.coercionConfigFor(LogicalType.Integer)
                .setCoercion(CoercionInputShape.String, CoercionAction.Fail);

        ObjectWriter base = mapper.writer();
        this.writer = pretty ? base.with(SerializationFeature.INDENT_OUTPUT) : base;
    }

    @Override
    public PackRequest readRequest(InputStream in) throws IOException {
        byte[] body = in.readAllBytes();
        if (new String(body, StandardCharsets.UTF_8).isBlank()) {
            return new PackRequest(null);
        }

        try {
            return mapper.readValue(body, PackRequest.class);
        } catch (JsonMappingException e) {
            throw new InvalidRequestException(List.of(new Violation(locationOf(e), messageOf(e))));
        } catch (JsonProcessingException e) {
            throw new InvalidRequestException(e.getOriginalMessage(), e);
        }
    }

    @Override
    public void writeResult(Writer out, PackingResult result) throws IOException {
        Object document = switch (result.outcome()) {
            case PACKED -> JsonDocuments.PackResponse.from(result.assignments());
            case ITEM_TOO_LARGE -> new JsonDocuments.ErrorResponse(
                    ErrorCode.ITEM_TOO_LARGE.getCode(),
                    result.oversizedItems().stream().map(JsonDocuments.OversizedItemDetail::from).toList());
            case PACKING_ERROR -> new JsonDocuments.ErrorResponse(
                    ErrorCode.PACKING_ERROR.getCode(), result.failureMessage());
        };
        write(out, document);
    }

    @Override
    public void writeRejection(Writer out, InvalidRequestException rejection) throws IOException {
        Object details = rejection.getErrorCode() == ErrorCode.INVALID_JSON
                ? rejection.getMessage()
                : rejection.getViolations().stream().map(JsonDocuments.ViolationDetail::from).toList();
        write(out, new JsonDocuments.ErrorResponse(rejection.getErrorCode().getCode(), details));
    }

    private void write(Writer out, Object document) throws IOException {
        writer.writeValue(out, document);
        out.write(System.lineSeparator());
    }

    private static String messageOf(JsonMappingException e) {
        if (e.getCause() instanceof InputCoercionException) {
            InputCoercionException coercion = (InputCoercionException) e.getCause();
            if (coercion.getTargetType() == Integer.TYPE) {
                // "Numeric value (-99999999999) out of range of int ..."
                return coercion.getOriginalMessage().startsWith("Numeric value (-")
                        ? "Input should be greater than 0"
                        : "Input should be less than or equal to " + Integer.MAX_VALUE;
            }
        }
        return e.getOriginalMessage();
    }

    /**
     * Translates Jackson's reference path into the {@code ["items", 0, "sku"]} form used by
     * validation errors.
     */
    private static List<Object> locationOf(JsonMappingException e) {
        List<Object> loc = new ArrayList<>();
        for (JsonMappingException.Reference ref : e.getPath()) {
            if (ref.getFieldName() != null) {
                loc.add(ref.getFieldName());
            } else if (ref.getIndex() >= 0) {
                loc.add(ref.getIndex());
            }
        }
        return loc;
    }
}
