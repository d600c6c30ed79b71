package com.example.autocount.model;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Axis-aligned rectangle on the rasterized page, in pixels, with the origin located in the
 * top-left corner.
 */
@Schema(description = "Axis-aligned rectangle describing a match footprint in page pixels")
public record BoundingBox(
        @Schema(description = "X coordinate of the top-left corner", example = "100") int x,
        @Schema(description = "Y coordinate of the top-left corner", example = "100") int y,
        @Schema(description = "Width in pixels", example = "50") int width,
        @Schema(description = "Height in pixels", example = "50") int height) {

    public BoundingBox {
        if (width <= 0) {
            throw new IllegalArgumentException("Bounding box width must be positive");
        }
        if (height <= 0) {
            throw new IllegalArgumentException("Bounding box height must be positive");
        }
    }

    public NormalizedBox normalize(int imageWidth, int imageHeight) {
        return new NormalizedBox(
                x / (double) imageWidth,
                y / (double) imageHeight,
                width / (double) imageWidth,
                height / (double) imageHeight);
    }
}
