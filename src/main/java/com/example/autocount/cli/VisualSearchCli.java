package com.example.autocount.cli;

import com.example.autocount.config.VisualSearchProperties;
import com.example.autocount.exception.ErrorType;
import com.example.autocount.exception.VisualSearchException;
import com.example.autocount.model.SearchRequest;
import com.example.autocount.model.SearchResponse;
import com.example.autocount.service.VisualSearchService;
import com.example.autocount.service.matching.CandidateReducer;
import com.example.autocount.service.matching.CorrelationScanner;
import com.example.autocount.service.matching.Orientation;
import com.example.autocount.service.matching.TemplateRotator;
import com.example.autocount.service.matching.VisualSearchEngine;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Command line entry point that runs a single page search without starting the web server.
 *
 * <pre>
 * VisualSearchCli &lt;image_path&gt; &lt;template_path&gt; &lt;confidence_threshold&gt; [method]
 * </pre>
 *
 * The JSON result is printed to standard output. The process exits with 0 when the search
 * succeeded and 1 otherwise.
 */
public final class VisualSearchCli {

    private static final Logger log = LoggerFactory.getLogger(VisualSearchCli.class);

    static final String USAGE = "Usage: VisualSearchCli <image_path> <template_path> <confidence_threshold> [method]";

    private VisualSearchCli() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    static int run(String[] args, PrintStream out) {
        SearchResponse response = execute(args);
        out.println(toJson(response));
        return response.success() ? 0 : 1;
    }

    static SearchResponse execute(String[] args) {
        if (args.length < 3 || args.length > 4) {
            return SearchResponse.failure(ErrorType.INVALID_INPUT.name(), USAGE);
        }
        double threshold;
        try {
            threshold = Double.parseDouble(args[2]);
        } catch (NumberFormatException ex) {
            return SearchResponse.failure(ErrorType.INVALID_INPUT.name(), "Confidence threshold is not a number: " + args[2]);
        }
        String method = args.length == 4 ? args[3] : null;

        VisualSearchProperties properties = new VisualSearchProperties();
        List<Orientation> orientations = List.of(Orientation.values());
        ExecutorService executor = Executors.newFixedThreadPool(orientations.size());
        try {
            VisualSearchEngine engine = new VisualSearchEngine(
                    new TemplateRotator(),
                    new CorrelationScanner(properties.getScanBandRows()),
                    new CandidateReducer(properties.getClusterDistanceFactor(), properties.getOverlapThreshold()),
                    executor,
                    orientations,
                    properties.getMaxRawDetections());
            VisualSearchService service = new VisualSearchService(engine, properties);
            return service.search(new SearchRequest(args[0], args[1], threshold, method, 1, null));
        } catch (VisualSearchException ex) {
            log.warn("Visual search failed: {}", ex.getMessage());
            return SearchResponse.failure(ex.getErrorType().name(), ex.getMessage());
        } catch (RuntimeException ex) {
            log.error("Unexpected visual search failure", ex);
            return SearchResponse.failure(ErrorType.INTERNAL_SCAN_FAILURE.name(), String.valueOf(ex.getMessage()));
        } finally {
            executor.shutdownNow();
        }
    }

    private static String toJson(SearchResponse response) {
        try {
            return new ObjectMapper().writerWithDefaultPrettyPrinter().writeValueAsString(response);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialise search response", ex);
        }
    }
}
