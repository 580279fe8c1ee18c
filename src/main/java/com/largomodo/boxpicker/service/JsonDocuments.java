package com.largomodo.boxpicker.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.largomodo.boxpicker.core.domain.BoxAssignment;
import com.largomodo.boxpicker.core.domain.Dimensions;
import com.largomodo.boxpicker.core.domain.OversizedItem;
import com.largomodo.boxpicker.core.request.Violation;

import java.util.List;

/**
 * Response shapes written by {@link JsonRequestCodec}.
 * <p>
 * Field names follow the snake_case wire format; domain records stay free of
 * serialization annotations.
 */
public final class JsonDocuments {

    private JsonDocuments() {
        // Holder for nested records - prevent instantiation
    }

    public record PackResponse(List<PackedBox> boxes,
                               @JsonProperty("total_boxes") int totalBoxes) {

        static PackResponse from(List<BoxAssignment> assignments) {
            List<PackedBox> boxes = assignments.stream()
                    .map(PackedBox::from)
                    .toList();
            return new PackResponse(boxes, boxes.size());
        }
    }

    public record PackedBox(@JsonProperty("box_id") String boxId,
                            DimensionsDocument dimensions,
                            List<String> items) {

        static PackedBox from(BoxAssignment assignment) {
            return new PackedBox(assignment.box().id(),
                    DimensionsDocument.from(assignment.box().inner()),
                    assignment.skus());
        }
    }

    public record DimensionsDocument(int length, int width, int height) {

        static DimensionsDocument from(Dimensions d) {
            return new DimensionsDocument(d.length(), d.width(), d.height());
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ErrorResponse(String error, Object details) {
    }

    public record OversizedItemDetail(String sku,
                                      DimensionsDocument dimensions,
                                      @JsonProperty("max_box_inner_dimensions") DimensionsDocument maxBoxInnerDimensions) {

        static OversizedItemDetail from(OversizedItem item) {
            return new OversizedItemDetail(item.sku(),
                    DimensionsDocument.from(item.dimensions()),
                    DimensionsDocument.from(item.maxBoxDimensions()));
        }
    }

    public record ViolationDetail(List<Object> loc, String msg) {

        static ViolationDetail from(Violation violation) {
            return new ViolationDetail(violation.loc(), violation.msg());
        }
    }
}
