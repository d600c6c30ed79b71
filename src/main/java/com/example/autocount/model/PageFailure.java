package com.example.autocount.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "A page that was skipped during a document search")
public record PageFailure(
        @Schema(description = "Page number", example = "3") int pageNumber,
        @Schema(description = "Failure category", example = "TEMPLATE_TOO_LARGE") String errorType,
        @Schema(description = "Failure message") String error) {
}
