package com.example.autocount.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Active search defaults")
public record HealthResponse(
        @Schema(description = "Service status", example = "UP") String status,
        @Schema(description = "Threshold used when a request omits one", example = "0.7") double defaultThreshold,
        @Schema(description = "Method used when a request omits one", example = "NORMALIZED_CORRELATION") String defaultMethod,
        @Schema(description = "Orientations searched, in degrees") List<Integer> orientations,
        @Schema(description = "Cap on raw detections per search", example = "1000") int maxRawDetections,
        @Schema(description = "Default cap on returned matches", example = "10000") int maxMatches) {
}
