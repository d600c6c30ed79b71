package com.example.autocount.service;

import com.example.autocount.config.VisualSearchProperties;
import com.example.autocount.exception.InvalidInputException;
import com.example.autocount.service.matching.MatchMethod;

/**
 * Request parameters after defaults have been applied and ranges checked.
 */
public record SearchOptions(double threshold, MatchMethod method, int pageNumber, int maxMatches) {

    public static SearchOptions resolve(VisualSearchProperties properties, Double threshold, String method,
                                        Integer pageNumber, Integer maxMatches) {
        double resolvedThreshold = threshold != null ? threshold : properties.getDefaultThreshold();
        if (Double.isNaN(resolvedThreshold) || resolvedThreshold < 0.0 || resolvedThreshold > 1.0) {
            throw new InvalidInputException("Confidence threshold must be between 0 and 1, got " + resolvedThreshold);
        }
        MatchMethod resolvedMethod = MatchMethod.parse(method != null && !method.isBlank() ? method : properties.getDefaultMethod());
        int resolvedPage = pageNumber != null ? pageNumber : 1;
        if (resolvedPage < 1) {
            throw new InvalidInputException("Page number must be at least 1");
        }
        int resolvedMax = maxMatches != null ? maxMatches : properties.getMaxMatches();
        if (resolvedMax < 1) {
            throw new InvalidInputException("Max matches must be at least 1");
        }
        return new SearchOptions(resolvedThreshold, resolvedMethod, resolvedPage, resolvedMax);
    }

    public SearchOptions forPage(int page) {
        return new SearchOptions(threshold, method, page, maxMatches);
    }
}
