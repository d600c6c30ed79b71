package com.example.autocount.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@Schema(description = "Search one rasterized page for occurrences of a symbol template")
public record SearchRequest(
        @Schema(description = "Path of the rendered page image", example = "/data/pages/page-1.png")
        @NotBlank String imagePath,
        @Schema(description = "Path of the cropped symbol template", example = "/data/templates/door-tag.png")
        @NotBlank String templatePath,
        @Schema(description = "Minimum score a window must reach, between 0 and 1. Defaults to the configured threshold", example = "0.8")
        Double confidenceThreshold,
        @Schema(description = "NORMALIZED_CORRELATION or NORMALIZED_SQUARED_DIFFERENCE; the OpenCV names are also accepted", example = "NORMALIZED_CORRELATION")
        String method,
        @Schema(description = "Page number stamped on every match", example = "1")
        Integer pageNumber,
        @Schema(description = "Upper bound on returned matches", example = "500")
        Integer maxMatches) {
}
