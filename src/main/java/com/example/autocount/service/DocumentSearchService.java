package com.example.autocount.service;

import com.example.autocount.exception.VisualSearchException;
import com.example.autocount.model.DocumentSearchRequest;
import com.example.autocount.model.DocumentSearchResponse;
import com.example.autocount.model.MatchResult;
import com.example.autocount.model.PageFailure;
import com.example.autocount.model.SearchResponse;
import com.example.autocount.util.ImageUtils;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Searches one template across every page of a rendered document. A page whose search fails is
 * reported and skipped; the remaining pages still contribute matches.
 */
@Service
public class DocumentSearchService {

    private static final Logger log = LoggerFactory.getLogger(DocumentSearchService.class);

    private final VisualSearchService visualSearchService;

    public DocumentSearchService(VisualSearchService visualSearchService) {
        this.visualSearchService = visualSearchService;
    }

    public DocumentSearchResponse search(DocumentSearchRequest request) {
        SearchOptions options = visualSearchService.resolveOptions(request.confidenceThreshold(), request.method(),
                1, request.maxMatches());
        long start = System.nanoTime();
        Mat template = ImageUtils.readGrayscale(request.templatePath());
        List<MatchResult> merged = new ArrayList<>();
        List<PageFailure> failures = new ArrayList<>();
        int pagesSearched = 0;
        try {
            List<String> pages = request.pageImagePaths();
            for (int i = 0; i < pages.size(); i++) {
                int pageNumber = i + 1;
                try {
                    merged.addAll(searchPage(pages.get(i), template, options.forPage(pageNumber)).matches());
                    pagesSearched++;
                } catch (VisualSearchException ex) {
                    log.warn("Search on page {} failed, continuing with remaining pages: {}", pageNumber, ex.getMessage());
                    failures.add(new PageFailure(pageNumber, ex.getErrorType().name(), ex.getMessage()));
                }
            }
        } finally {
            template.close();
        }

        merged.sort(Comparator.comparingDouble(MatchResult::confidence).reversed());
        int limit = Math.min(merged.size(), options.maxMatches());
        List<MatchResult> matches = new ArrayList<>(limit);
        for (int i = 0; i < limit; i++) {
            matches.add(merged.get(i).withId(i));
        }
        long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();
        log.info("Document search over {} pages found {} matches ({} pages failed) in {} ms",
                request.pageImagePaths().size(), matches.size(), failures.size(), elapsedMs);
        return new DocumentSearchResponse(true, matches, matches.size(), pagesSearched, failures, elapsedMs,
                options.threshold());
    }

    private SearchResponse searchPage(String pagePath, Mat template, SearchOptions options) {
        Mat page = ImageUtils.readGrayscale(pagePath);
        try {
            return visualSearchService.search(page, template, options);
        } finally {
            page.close();
        }
    }
}
