package com.example.autocount.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

@Schema(description = "Search every page of a rendered document for one symbol template")
public record DocumentSearchRequest(
        @Schema(description = "Path of the cropped symbol template", example = "/data/templates/door-tag.png")
        @NotBlank String templatePath,
        @Schema(description = "Rendered page images in page order; the first entry is page 1")
        @NotEmpty List<@NotBlank String> pageImagePaths,
        @Schema(description = "Minimum score a window must reach, between 0 and 1", example = "0.8")
        Double confidenceThreshold,
        @Schema(description = "Correlation method", example = "NORMALIZED_CORRELATION")
        String method,
        @Schema(description = "Upper bound on matches across all pages", example = "10000")
        Integer maxMatches) {
}
