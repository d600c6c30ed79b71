package com.example.autocount.service;

import com.example.autocount.config.VisualSearchProperties;
import com.example.autocount.model.MatchResult;
import com.example.autocount.model.SearchRequest;
import com.example.autocount.model.SearchResponse;
import com.example.autocount.service.matching.Match;
import com.example.autocount.service.matching.Orientation;
import com.example.autocount.service.matching.ScanCancellation;
import com.example.autocount.service.matching.SearchResult;
import com.example.autocount.service.matching.VisualSearchEngine;
import com.example.autocount.util.ImageUtils;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Service
public class VisualSearchService {

    private static final Logger log = LoggerFactory.getLogger(VisualSearchService.class);

    private final VisualSearchEngine engine;
    private final VisualSearchProperties properties;

    public VisualSearchService(VisualSearchEngine engine, VisualSearchProperties properties) {
        this.engine = engine;
        this.properties = properties;
    }

    public SearchResponse search(SearchRequest request) {
        SearchOptions options = SearchOptions.resolve(properties, request.confidenceThreshold(), request.method(),
                request.pageNumber(), request.maxMatches());
        Mat target = ImageUtils.readGrayscale(request.imagePath());
        try {
            Mat template = ImageUtils.readGrayscale(request.templatePath());
            try {
                return search(target, template, options);
            } finally {
                template.close();
            }
        } finally {
            target.close();
        }
    }

    public SearchResponse search(byte[] image, byte[] template, SearchOptions options) {
        Mat target = ImageUtils.decodeGrayscale(image, "image");
        try {
            Mat templateImage = ImageUtils.decodeGrayscale(template, "template");
            try {
                return search(target, templateImage, options);
            } finally {
                templateImage.close();
            }
        } finally {
            target.close();
        }
    }

    /**
     * Searches images that are already loaded as grayscale. The caller keeps ownership of both.
     */
    public SearchResponse search(Mat target, Mat template, SearchOptions options) {
        long start = System.nanoTime();
        SearchResult result = engine.search(target, template, options.threshold(), options.method(),
                ScanCancellation.withTimeout(properties.getScanTimeout()));
        List<MatchResult> matches = toMatchResults(result.matches(), options);
        long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();
        log.info("Page {} search found {} matches ({} raw) at threshold {} in {} ms", options.pageNumber(),
                matches.size(), result.rawDetections(), options.threshold(), elapsedMs);
        return new SearchResponse(true, matches, matches.size(), result.imageWidth(), result.imageHeight(),
                result.templateWidth(), result.templateHeight(), elapsedMs, options.threshold(),
                options.method().name(), null, null);
    }

    public SearchOptions resolveOptions(Double threshold, String method, Integer pageNumber, Integer maxMatches) {
        return SearchOptions.resolve(properties, threshold, method, pageNumber, maxMatches);
    }

    public List<Orientation> orientations() {
        return engine.orientations();
    }

    private List<MatchResult> toMatchResults(List<Match> matches, SearchOptions options) {
        int limit = Math.min(matches.size(), options.maxMatches());
        List<MatchResult> results = new ArrayList<>(limit);
        for (Match match : matches.subList(0, limit)) {
            results.add(new MatchResult(match.id(), match.confidence(), match.boundingBox(), match.pixelBoundingBox(),
                    match.orientation().degrees(), options.pageNumber()));
        }
        return results;
    }
}
