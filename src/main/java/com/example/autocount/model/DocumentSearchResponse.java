package com.example.autocount.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Merged outcome of a document search")
public record DocumentSearchResponse(
        @Schema(description = "Whether the search completed") boolean success,
        @Schema(description = "Matches from all pages ordered by descending confidence") List<MatchResult> matches,
        @Schema(description = "Number of returned matches") int totalMatches,
        @Schema(description = "Pages searched successfully") int pagesSearched,
        @Schema(description = "Pages skipped because their search failed") List<PageFailure> pagesFailed,
        @Schema(description = "Wall-clock search time in milliseconds") long processingTimeMs,
        @Schema(description = "Threshold the search ran with") double threshold) {
}
