package com.example.autocount.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Outcome of a single page search")
public record SearchResponse(
        @Schema(description = "Whether the search completed") boolean success,
        @Schema(description = "Matches ordered by descending confidence") List<MatchResult> matches,
        @Schema(description = "Number of returned matches") int totalMatches,
        @Schema(description = "Page width in pixels") Integer imageWidth,
        @Schema(description = "Page height in pixels") Integer imageHeight,
        @Schema(description = "Template width in pixels") Integer templateWidth,
        @Schema(description = "Template height in pixels") Integer templateHeight,
        @Schema(description = "Wall-clock search time in milliseconds") Long processingTimeMs,
        @Schema(description = "Threshold the search ran with") Double threshold,
        @Schema(description = "Correlation method the search ran with") String method,
        @Schema(description = "Failure category when success is false") String errorType,
        @Schema(description = "Failure message when success is false") String error) {

    public static SearchResponse failure(String errorType, String error) {
        return new SearchResponse(false, List.of(), 0, null, null, null, null, null, null, null, errorType, error);
    }
}
