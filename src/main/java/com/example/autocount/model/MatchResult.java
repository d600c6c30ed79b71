package com.example.autocount.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "One located symbol occurrence")
public record MatchResult(
        @Schema(description = "Position of the match in the returned list", example = "0") int id,
        @Schema(description = "Correlation score between 0 and 1", example = "0.97") double confidence,
        @Schema(description = "Footprint normalized to the page dimensions") NormalizedBox boundingBox,
        @Schema(description = "Footprint in page pixels") BoundingBox pdfCoordinates,
        @Schema(description = "Template rotation in degrees, counter-clockwise", example = "90") int rotation,
        @Schema(description = "Page the match was found on", example = "1") int pageNumber) {

    public MatchResult withId(int newId) {
        return new MatchResult(newId, confidence, boundingBox, pdfCoordinates, rotation, pageNumber);
    }
}
