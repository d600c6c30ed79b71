package com.example.autocount.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Rectangle expressed as fractions of the page width and height")
public record NormalizedBox(
        @Schema(description = "Left edge as a fraction of the page width", example = "0.1") double x,
        @Schema(description = "Top edge as a fraction of the page height", example = "0.125") double y,
        @Schema(description = "Width as a fraction of the page width", example = "0.05") double width,
        @Schema(description = "Height as a fraction of the page height", example = "0.0625") double height) {
}
