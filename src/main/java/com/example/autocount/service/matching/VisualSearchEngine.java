package com.example.autocount.service.matching;

import com.example.autocount.exception.InvalidInputException;
import com.example.autocount.exception.ScanFailureException;
import com.example.autocount.exception.TemplateTooLargeException;
import com.example.autocount.exception.VisualSearchException;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs the full search for one target and template: rotate, scan every orientation in parallel,
 * pool the best raw detections and reduce them to the final match list.
 */
public class VisualSearchEngine {

    private static final Logger log = LoggerFactory.getLogger(VisualSearchEngine.class);

    private final TemplateRotator rotator;
    private final CorrelationScanner scanner;
    private final CandidateReducer reducer;
    private final Executor scanExecutor;
    private final List<Orientation> orientations;
    private final int maxRawDetections;

    public VisualSearchEngine(TemplateRotator rotator, CorrelationScanner scanner, CandidateReducer reducer,
                              Executor scanExecutor, List<Orientation> orientations, int maxRawDetections) {
        if (orientations == null || orientations.isEmpty()) {
            throw new IllegalArgumentException("At least one orientation must be configured");
        }
        if (maxRawDetections <= 0) {
            throw new IllegalArgumentException("Raw detection cap must be positive");
        }
        this.rotator = rotator;
        this.scanner = scanner;
        this.reducer = reducer;
        this.scanExecutor = scanExecutor;
        this.orientations = List.copyOf(orientations);
        this.maxRawDetections = maxRawDetections;
    }

    public List<Orientation> orientations() {
        return orientations;
    }

    public SearchResult search(Mat target, Mat template, double threshold, MatchMethod method,
                               ScanCancellation cancellation) {
        CorrelationScanner.validateThreshold(threshold);
        if (method == null) {
            throw new InvalidInputException("Match method is required");
        }
        if (target == null || target.empty()) {
            throw new InvalidInputException("Target image is empty");
        }
        if (template == null || template.empty()) {
            throw new InvalidInputException("Template image is empty");
        }
        requireFits(target, template);

        long start = System.nanoTime();
        List<OrientedTemplate> oriented = rotator.orient(template, orientations);
        try {
            List<Detection> pooled = scanAll(target, oriented, threshold, method, cancellation);
            List<Match> matches = reducer.reduce(pooled, target.cols(), target.rows());
            log.debug("Search over {}x{} page with {}x{} template produced {} matches from {} raw detections in {} ms",
                    target.cols(), target.rows(), template.cols(), template.rows(), matches.size(), pooled.size(),
                    Duration.ofNanos(System.nanoTime() - start).toMillis());
            return new SearchResult(matches, target.cols(), target.rows(), template.cols(), template.rows(), pooled.size());
        } finally {
            oriented.forEach(OrientedTemplate::close);
        }
    }

    private List<Detection> scanAll(Mat target, List<OrientedTemplate> oriented, double threshold,
                                    MatchMethod method, ScanCancellation cancellation) {
        AtomicReference<Throwable> firstFailure = new AtomicReference<>();
        List<CompletableFuture<List<Detection>>> scans = new ArrayList<>(oriented.size());
        for (int i = 0; i < oriented.size(); i++) {
            int orientationIndex = i;
            OrientedTemplate template = oriented.get(i);
            CompletableFuture<List<Detection>> scan = CompletableFuture.supplyAsync(() -> scanner.scan(target, template,
                    threshold, method, orientationIndex, maxRawDetections, cancellation), scanExecutor);
            // a failed scan stops its siblings at their next checkpoint
            scans.add(scan.whenComplete((detections, ex) -> {
                if (ex != null && firstFailure.compareAndSet(null, ex)) {
                    cancellation.cancel();
                }
            }));
        }

        // every scan must finish before the templates are released
        TopDetections pooled = new TopDetections(maxRawDetections);
        for (CompletableFuture<List<Detection>> scan : scans) {
            try {
                pooled.offerAll(scan.join());
            } catch (CompletionException ex) {
                log.debug("Orientation scan ended with {}", ex.getCause() != null ? ex.getCause() : ex);
            }
        }
        Throwable failure = firstFailure.get();
        if (failure != null) {
            throw unwrap(failure);
        }
        return pooled.toRankedList();
    }

    private void requireFits(Mat target, Mat template) {
        for (Orientation orientation : orientations) {
            TemplateRotator.Canvas canvas = TemplateRotator.canvasFor(template.cols(), template.rows(), orientation.degrees());
            if (canvas.width() > target.cols() || canvas.height() > target.rows()) {
                throw new TemplateTooLargeException(canvas.width(), canvas.height(), target.cols(), target.rows());
            }
        }
    }

    private static RuntimeException unwrap(Throwable failure) {
        Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                ? failure.getCause() : failure;
        if (cause instanceof VisualSearchException) {
            return (VisualSearchException) cause;
        }
        return new ScanFailureException("Orientation scan failed: " + cause.getMessage(), cause);
    }
}
